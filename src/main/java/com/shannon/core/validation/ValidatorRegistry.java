package com.shannon.core.validation;

import com.shannon.config.ShannonProperties;
import com.shannon.core.checkpoint.CheckpointStore;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.RunOptions;
import com.shannon.core.model.ValidatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Judges an agent's workspace output by the {@link ValidatorKind} in its catalog entry.
 * <p>
 * Every kind has an entry; {@link ValidatorKind#NONE} accepts unconditionally and is only consulted after the
 * attempt itself reported success. An exception thrown by a validator counts as a rejection.
 */
@Service
public class ValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<ValidatorKind, DeliverableValidator> validators = new EnumMap<>(ValidatorKind.class);
    private final CheckpointStore checkpointStore;
    private final Set<String> relaxedAgents;

    @Autowired
    public ValidatorRegistry(DeliverableStore store, CheckpointStore checkpointStore, ShannonProperties properties) {
        this(store, checkpointStore, Set.copyOf(properties.getRelaxedAgents()));
    }

    ValidatorRegistry(DeliverableStore store, CheckpointStore checkpointStore, Set<String> relaxedAgents) {
        this.checkpointStore = checkpointStore;
        this.relaxedAgents = relaxedAgents;

        validators.put(ValidatorKind.CODE_ANALYSIS,
                (agent, ws) -> store.exists(ws, Deliverables.CODE_ANALYSIS));
        validators.put(ValidatorKind.RECONNAISSANCE,
                (agent, ws) -> store.exists(ws, Deliverables.RECON));
        validators.put(ValidatorKind.VULNERABILITY_ANALYSIS,
                (agent, ws) -> store.exists(ws, Deliverables.analysis(agent.vulnerabilityClass()))
                        && store.readQueue(ws, agent.vulnerabilityClass()).isPresent());
        validators.put(ValidatorKind.EXPLOITATION,
                (agent, ws) -> store.exists(ws, Deliverables.exploitationEvidence(agent.vulnerabilityClass())));
        validators.put(ValidatorKind.REPORT,
                (agent, ws) -> store.exists(ws, Deliverables.FINAL_REPORT));
        validators.put(ValidatorKind.NONE, (agent, ws) -> true);
    }

    public boolean validate(AgentDefinition agent, Path workspace, RunOptions options) {
        if (options.relaxValidation() && options.textOnly() && relaxedAgents.contains(agent.name())) {
            log.warn("Relaxed validation: accepting {} output without checking deliverables", agent.name());
            return true;
        }

        DeliverableValidator validator = validators.get(agent.validatorKind());
        try {
            boolean valid = checkpointStore.read(workspace, () -> {
                try {
                    return validator.validate(agent, workspace);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            log.info("Validation of {} ({}): {}", agent.name(), agent.validatorKind(), valid ? "passed" : "failed");
            return valid;
        } catch (RuntimeException e) {
            log.warn("Validator for {} threw, treating as failed validation: {}", agent.name(), e.getMessage());
            return false;
        }
    }
}
