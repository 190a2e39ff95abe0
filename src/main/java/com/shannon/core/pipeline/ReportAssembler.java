package com.shannon.core.pipeline;

import com.shannon.core.model.AgentCatalog;
import com.shannon.core.model.AgentDefinition;
import com.shannon.core.model.Phase;
import com.shannon.core.validation.DeliverableStore;
import com.shannon.core.validation.Deliverables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Concatenates the exploitation evidence files into the draft final report that the report agent then edits.
 */
@Component
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    static final String SEPARATOR = "\n\n---\n\n";

    private final DeliverableStore store;

    public ReportAssembler(DeliverableStore store) {
        this.store = store;
    }

    /**
     * @return the number of evidence files included
     */
    public int assemble(Path workspace) {
        var sections = new ArrayList<String>();
        for (AgentDefinition agent : AgentCatalog.inPhase(Phase.EXPLOITATION)) {
            String file = Deliverables.exploitationEvidence(agent.vulnerabilityClass());
            Optional<String> evidence = store.read(workspace, file);
            if (evidence.isPresent() && !evidence.get().isBlank()) {
                sections.add(evidence.get().strip());
                log.info("Added {} to final report", file);
            } else {
                log.info("No evidence file {}, skipping", file);
            }
        }
        String report = sections.isEmpty()
                ? "# Security Assessment Report\n\nNo exploitation evidence was produced.\n"
                : String.join(SEPARATOR, sections) + "\n";
        store.write(workspace, Deliverables.FINAL_REPORT, report);
        return sections.size();
    }
}
