package com.shannon.core.model;

/**
 * Outcome of one wave member.
 *
 * @param toolName   the member's name in the wave
 * @param output     captured output on success, error summary on failure, reason when skipped
 * @param status     terminal status
 * @param durationMs wall-clock time spent running the member (0 when skipped)
 * @param error      the throwable behind a failure, if any (not persisted)
 */
public record ToolScanResult(
    String toolName,
    String output,
    ToolStatus status,
    long durationMs,
    Throwable error
) {

    public static ToolScanResult success(String toolName, String output, long durationMs) {
        return new ToolScanResult(toolName, output, ToolStatus.SUCCESS, durationMs, null);
    }

    public static ToolScanResult failed(String toolName, String summary, long durationMs, Throwable error) {
        return new ToolScanResult(toolName, summary, ToolStatus.FAILED, durationMs, error);
    }

    public static ToolScanResult skipped(String toolName, String reason) {
        return new ToolScanResult(toolName, reason, ToolStatus.SKIPPED, 0L, null);
    }

    public boolean succeeded() {
        return status == ToolStatus.SUCCESS;
    }
}
