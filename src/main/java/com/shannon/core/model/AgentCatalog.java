package com.shannon.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The fixed, ordered list of pipeline agents. Catalog order is the resume order.
 */
public final class AgentCatalog {

    public static final String PRE_RECON = "pre-recon";
    public static final String RECON = "recon";
    public static final String REPORT = "report";

    private static final List<String> VULNERABILITY_CLASSES = List.of("injection", "xss", "auth", "ssrf", "authz");

    private static final List<AgentDefinition> AGENTS = build();

    private AgentCatalog() {}

    private static List<AgentDefinition> build() {
        var agents = new ArrayList<AgentDefinition>();
        agents.add(new AgentDefinition(PRE_RECON, "Pre-recon agent", Phase.PRE_RECON,
                ValidatorKind.CODE_ANALYSIS, null, "pre-recon-code"));
        agents.add(new AgentDefinition(RECON, "Recon agent", Phase.RECON,
                ValidatorKind.RECONNAISSANCE, null, "recon"));
        for (String type : VULNERABILITY_CLASSES) {
            agents.add(new AgentDefinition(type + "-vuln", capitalize(type) + " vuln agent",
                    Phase.VULNERABILITY_ANALYSIS, ValidatorKind.VULNERABILITY_ANALYSIS, type, "vuln-" + type));
        }
        for (String type : VULNERABILITY_CLASSES) {
            agents.add(new AgentDefinition(type + "-exploit", capitalize(type) + " exploit agent",
                    Phase.EXPLOITATION, ValidatorKind.EXPLOITATION, type, "exploit-" + type));
        }
        agents.add(new AgentDefinition(REPORT, "Report agent", Phase.REPORTING,
                ValidatorKind.REPORT, null, "report-executive"));
        return List.copyOf(agents);
    }

    public static List<AgentDefinition> all() {
        return AGENTS;
    }

    public static Optional<AgentDefinition> find(String name) {
        return AGENTS.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    /**
     * @throws IllegalArgumentException when no agent has the given name
     */
    public static AgentDefinition require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown agent '" + name + "'. Valid agents: " + names()));
    }

    public static List<AgentDefinition> inPhase(Phase phase) {
        return AGENTS.stream().filter(a -> a.phase() == phase).toList();
    }

    public static List<String> names() {
        return AGENTS.stream().map(AgentDefinition::name).toList();
    }

    /** Position of the agent in catalog order, or -1 if unknown. */
    public static int indexOf(String name) {
        for (int i = 0; i < AGENTS.size(); i++) {
            if (AGENTS.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
