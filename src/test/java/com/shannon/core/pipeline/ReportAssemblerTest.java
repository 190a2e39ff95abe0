package com.shannon.core.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shannon.core.validation.DeliverableStore;
import com.shannon.core.validation.Deliverables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReportAssemblerTest {

    @TempDir
    Path workspace;

    private final DeliverableStore store = new DeliverableStore(new ObjectMapper());
    private final ReportAssembler assembler = new ReportAssembler(store);

    @Test
    void concatenatesEvidenceInCatalogOrder() {
        store.write(workspace, Deliverables.exploitationEvidence("xss"), "# XSS\nreflected in /search\n");
        store.write(workspace, Deliverables.exploitationEvidence("injection"), "# SQLi\nunion-based\n");

        int sections = assembler.assemble(workspace);

        assertEquals(2, sections);
        String report = store.read(workspace, Deliverables.FINAL_REPORT).orElseThrow();
        assertEquals("# SQLi\nunion-based" + ReportAssembler.SEPARATOR + "# XSS\nreflected in /search\n", report);
    }

    @Test
    void blankEvidenceIsSkipped() {
        store.write(workspace, Deliverables.exploitationEvidence("auth"), "   \n");
        store.write(workspace, Deliverables.exploitationEvidence("ssrf"), "# SSRF");

        assertEquals(1, assembler.assemble(workspace));
    }

    @Test
    void writesPlaceholderWithoutEvidence() {
        assertEquals(0, assembler.assemble(workspace));

        assertTrue(store.read(workspace, Deliverables.FINAL_REPORT).orElseThrow()
                .contains("No exploitation evidence was produced."));
    }
}
