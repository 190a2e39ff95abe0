package com.shannon.core.validation;

import com.shannon.core.model.AgentDefinition;

/**
 * File names of the artifacts agents are expected to leave under {@code deliverables/}.
 */
public final class Deliverables {

    public static final String DIRECTORY = "deliverables";

    public static final String CODE_ANALYSIS = "code_analysis_deliverable.md";
    public static final String PRE_RECON = "pre_recon_deliverable.md";
    public static final String RECON = "recon_deliverable.md";
    public static final String FINAL_REPORT = "comprehensive_security_assessment_report.md";

    private Deliverables() {}

    public static String analysis(String vulnerabilityClass) {
        return vulnerabilityClass + "_analysis_deliverable.md";
    }

    public static String exploitationQueue(String vulnerabilityClass) {
        return vulnerabilityClass + "_exploitation_queue.json";
    }

    public static String exploitationEvidence(String vulnerabilityClass) {
        return vulnerabilityClass + "_exploitation_evidence.md";
    }

    /**
     * The main markdown artifact an agent produces; text-only invokers write the model's answer here.
     */
    public static String primary(AgentDefinition agent) {
        return switch (agent.validatorKind()) {
            case CODE_ANALYSIS -> CODE_ANALYSIS;
            case RECONNAISSANCE -> RECON;
            case VULNERABILITY_ANALYSIS -> analysis(agent.vulnerabilityClass());
            case EXPLOITATION -> exploitationEvidence(agent.vulnerabilityClass());
            case REPORT -> FINAL_REPORT;
            case NONE -> agent.name() + "_deliverable.md";
        };
    }
}
