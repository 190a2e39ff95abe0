package com.shannon.core.pipeline;

import com.shannon.config.ShannonProperties;
import com.shannon.core.error.ShannonException;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Loads {@code <promptName>.txt} from the configured prompts directory, falling back to the templates
 * bundled under {@code prompts/} on the classpath, and fills in {@code {{WEB_URL}}} and {@code {{REPO_PATH}}}.
 * Pipeline-testing runs prefer the {@code pipeline-testing/} variant of a template.
 */
@Component
public class FilePromptLoader implements PromptLoader {

    private static final Logger log = LoggerFactory.getLogger(FilePromptLoader.class);

    private static final String CLASSPATH_ROOT = "prompts/";
    private static final String TESTING_DIR = "pipeline-testing/";

    private final Path promptsDir;

    @Autowired
    public FilePromptLoader(ShannonProperties properties) {
        this(Path.of(properties.getPromptsDir()));
    }

    FilePromptLoader(Path promptsDir) {
        this.promptsDir = promptsDir;
    }

    @Override
    public String load(AgentDefinition agent, String targetRef, Path workspace, RunOptions options) {
        String fileName = agent.promptName() + ".txt";
        Optional<String> template = Optional.empty();
        if (options.pipelineTesting()) {
            template = find(TESTING_DIR + fileName);
        }
        if (template.isEmpty()) {
            template = find(fileName);
        }
        String text = template.orElseThrow(() -> new ShannonException(
                "Prompt template '" + fileName + "' not found in " + promptsDir + " or on the classpath"));
        return substitute(text, Map.of(
                "WEB_URL", targetRef,
                "REPO_PATH", workspace.toAbsolutePath().toString()));
    }

    static String substitute(String template, Map<String, String> variables) {
        String result = template;
        for (var entry : variables.entrySet()) {
            result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return result;
    }

    private Optional<String> find(String relative) {
        Path file = promptsDir.resolve(relative);
        try {
            if (Files.isRegularFile(file)) {
                log.debug("Loaded prompt {}", file);
                return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
            }
            try (InputStream in = getClass().getClassLoader().getResourceAsStream(CLASSPATH_ROOT + relative)) {
                if (in != null) {
                    return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                }
            }
        } catch (IOException e) {
            throw new ShannonException("Failed to read prompt template " + relative, e);
        }
        return Optional.empty();
    }
}
