package com.shannon.core.model;

/**
 * Pipeline phases in execution order.
 * <p>
 * Agents inside a parallel phase run concurrently; every other phase runs its agents one at a time.
 */
public enum Phase {
    PRE_RECON(1, "pre-reconnaissance", false),
    RECON(2, "reconnaissance", false),
    VULNERABILITY_ANALYSIS(3, "vulnerability-analysis", true),
    EXPLOITATION(4, "exploitation", true),
    REPORTING(5, "reporting", false);

    private final int number;
    private final String label;
    private final boolean parallel;

    Phase(int number, String label, boolean parallel) {
        this.number = number;
        this.label = label;
        this.parallel = parallel;
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    public boolean isParallel() {
        return parallel;
    }
}
