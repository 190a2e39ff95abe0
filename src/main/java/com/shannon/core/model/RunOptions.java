package com.shannon.core.model;

/**
 * Run-wide switches, passed explicitly to every component that needs them.
 *
 * @param blackbox        no source repository analysis; the code-analysis wave member is dropped
 * @param pipelineTesting use minimal prompts and skip external tools
 * @param relaxValidation accept recon-type deliverables unconditionally in text-only mode
 * @param textOnly        the configured model cannot write files or call tools
 * @param skipMcpPhases   stop after pre-recon (phases that need browser tooling are unavailable)
 */
public record RunOptions(
    boolean blackbox,
    boolean pipelineTesting,
    boolean relaxValidation,
    boolean textOnly,
    boolean skipMcpPhases
) {

    public static RunOptions defaults() {
        return new RunOptions(false, false, false, false, false);
    }
}
