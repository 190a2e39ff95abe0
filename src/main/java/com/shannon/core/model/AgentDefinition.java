package com.shannon.core.model;

/**
 * Immutable catalog entry describing one pipeline agent.
 *
 * @param name               stable identifier used in sessions and audit paths (e.g. "injection-vuln")
 * @param displayName        human readable name for console output
 * @param phase              the phase this agent belongs to
 * @param validatorKind      which deliverable check decides whether a run was good enough
 * @param vulnerabilityClass vulnerability class for analysis and exploit agents (nullable)
 * @param promptName         prompt template file name without extension
 */
public record AgentDefinition(
    String name,
    String displayName,
    Phase phase,
    ValidatorKind validatorKind,
    String vulnerabilityClass,
    String promptName
) {

    public boolean isExploit() {
        return phase == Phase.EXPLOITATION;
    }

    public boolean hasVulnerabilityClass() {
        return vulnerabilityClass != null && !vulnerabilityClass.isBlank();
    }
}
