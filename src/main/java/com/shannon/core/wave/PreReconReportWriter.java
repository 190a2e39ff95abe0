package com.shannon.core.wave;

import com.shannon.core.model.ToolScanResult;
import com.shannon.core.model.ToolStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Stitches the named wave results into the pre-reconnaissance markdown report.
 * Sections are looked up by member name, never by position.
 */
public final class PreReconReportWriter {

    private PreReconReportWriter() {}

    public static String render(Map<String, ToolScanResult> initial, Map<String, ToolScanResult> additional,
                                String codeAnalysis) {
        var sb = new StringBuilder();
        sb.append("# Pre-Reconnaissance Report\n\n");

        section(sb, "Port Discovery (naabu)", initial.get("naabu"));
        section(sb, "Network Scanning (nmap)", initial.get("nmap"));
        section(sb, "Subdomain Discovery (subfinder)", initial.get("subfinder"));
        section(sb, "Technology Detection (whatweb)", initial.get("whatweb"));

        sb.append("## Code Analysis\n");
        sb.append(codeAnalysis == null || codeAnalysis.isBlank() ? "No analysis available" : codeAnalysis.strip());
        sb.append("\n\n");

        if (!additional.isEmpty()) {
            sb.append("## Additional DAST Scans\n\n");
            for (var entry : additional.entrySet()) {
                sb.append("### ").append(entry.getKey()).append('\n');
                sb.append(body(entry.getValue())).append("\n\n");
            }
        }
        sb.append("---\nReport generated at: ").append(Instant.now()).append('\n');
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, ToolScanResult result) {
        sb.append("## ").append(title).append('\n');
        sb.append(body(result)).append("\n\n");
    }

    private static String body(ToolScanResult result) {
        if (result == null) {
            return "Not run";
        }
        if (result.status() == ToolStatus.SKIPPED) {
            return "Skipped: " + result.output();
        }
        if (result.status() == ToolStatus.FAILED) {
            return "Failed: " + result.output();
        }
        String output = result.output() == null ? "" : result.output().strip();
        return output.isEmpty() ? "No output" : output;
    }
}
