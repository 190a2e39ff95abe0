package com.shannon.core.wave;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Command lines for the external scanners.
 */
public final class ScanCommands {

    private ScanCommands() {}

    public static List<String> nmap(String host) {
        return List.of("nmap", "-sV", "-sC", host);
    }

    public static List<String> subfinder(String host) {
        return List.of("subfinder", "-d", host);
    }

    public static List<String> whatweb(String url) {
        return List.of("whatweb", "--open-timeout", "30", "--read-timeout", "60", url);
    }

    public static List<String> naabu(String host) {
        return List.of("naabu", "-host", host);
    }

    public static List<String> schemathesis(Path schema, String url) {
        return List.of("schemathesis", "run", schema.toString(), "-u", url, "--max-failures=5");
    }

    public static List<String> httpx(String url) {
        return List.of("httpx", "-u", url, "-status-code", "-title", "-tech-detect", "-follow-redirects", "-nc");
    }

    public static List<String> nuclei(String url) {
        return List.of("nuclei", "-u", url, "-severity", "medium,high,critical", "-silent");
    }

    public static List<String> sqlmap(String url) {
        return List.of("sqlmap", "-u", url, "--batch", "--crawl=1", "--level=1", "--risk=1",
                "--random-agent", "--flush-session");
    }

    /** Host part of a target URL; the input itself when it has none. */
    public static String hostOf(String target) {
        try {
            String host = URI.create(target).getHost();
            return host != null ? host : target;
        } catch (IllegalArgumentException e) {
            return target;
        }
    }
}
