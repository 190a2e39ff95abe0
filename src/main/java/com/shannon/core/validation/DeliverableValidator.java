package com.shannon.core.validation;

import com.shannon.core.model.AgentDefinition;

import java.nio.file.Path;

/**
 * Decides whether an agent left acceptable deliverables in the workspace. Must not modify the workspace.
 */
@FunctionalInterface
public interface DeliverableValidator {

    boolean validate(AgentDefinition agent, Path workspace) throws Exception;
}
