package com.shannon.core.wave;

/**
 * Raw outcome of running an external command (or anything shaped like one).
 */
public record ToolRunResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    public static ToolRunResult ok(String stdout) {
        return new ToolRunResult(0, stdout, "", false);
    }

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    /** Short description of why the run failed, for the wave's result map. */
    public String failureSummary() {
        if (timedOut) {
            return "Timed out";
        }
        String detail = stderr != null && !stderr.isBlank() ? stderr.strip() : (stdout == null ? "" : stdout.strip());
        if (detail.length() > 500) {
            detail = detail.substring(0, 500) + "...";
        }
        return "Exit code " + exitCode + (detail.isEmpty() ? "" : ": " + detail);
    }
}
