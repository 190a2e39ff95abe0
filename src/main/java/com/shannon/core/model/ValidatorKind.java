package com.shannon.core.model;

/**
 * Closed set of deliverable checks an agent can be judged by.
 * {@link #NONE} is the explicit "trust the agent's own success flag" policy.
 */
public enum ValidatorKind {
    CODE_ANALYSIS,
    RECONNAISSANCE,
    VULNERABILITY_ANALYSIS,
    EXPLOITATION,
    REPORT,
    NONE
}
