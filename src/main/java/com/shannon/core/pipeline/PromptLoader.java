package com.shannon.core.pipeline;

import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.RunOptions;

import java.nio.file.Path;

/**
 * Produces the prompt an agent is started with.
 */
public interface PromptLoader {

    String load(AgentDefinition agent, String targetRef, Path workspace, RunOptions options);
}
