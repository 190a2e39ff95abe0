package com.shannon.core.wave;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up which external scanners are on the PATH, once per process.
 */
@Component
public class ToolAvailabilityChecker {

    private static final Logger log = LoggerFactory.getLogger(ToolAvailabilityChecker.class);

    public static final List<String> TOOLS =
            List.of("nmap", "subfinder", "whatweb", "schemathesis", "naabu", "httpx", "nuclei", "sqlmap");

    private static final Map<String, String> INSTALL_HINTS = Map.of(
            "nmap", "brew install nmap / apt install nmap",
            "subfinder", "go install -v github.com/projectdiscovery/subfinder/v2/cmd/subfinder@latest",
            "whatweb", "brew install whatweb / apt install whatweb",
            "schemathesis", "pip install schemathesis",
            "naabu", "go install -v github.com/projectdiscovery/naabu/v2/cmd/naabu@latest",
            "httpx", "go install -v github.com/projectdiscovery/httpx/cmd/httpx@latest",
            "nuclei", "go install -v github.com/projectdiscovery/nuclei/v3/cmd/nuclei@latest",
            "sqlmap", "pip install sqlmap / apt install sqlmap");

    private final ToolRunner toolRunner;
    private volatile Map<String, Boolean> availability;

    public ToolAvailabilityChecker(ToolRunner toolRunner) {
        this.toolRunner = toolRunner;
    }

    public Map<String, Boolean> check() {
        Map<String, Boolean> result = availability;
        if (result != null) {
            return result;
        }
        synchronized (this) {
            if (availability == null) {
                var found = new LinkedHashMap<String, Boolean>();
                for (String tool : TOOLS) {
                    found.put(tool, onPath(tool));
                }
                availability = Collections.unmodifiableMap(found);
                log.info("Tool availability: {}", availability);
            }
            return availability;
        }
    }

    public boolean isAvailable(String tool) {
        return check().getOrDefault(tool, false);
    }

    public List<String> missingTools() {
        return check().entrySet().stream().filter(e -> !e.getValue()).map(Map.Entry::getKey).toList();
    }

    public static String installHint(String tool) {
        return INSTALL_HINTS.getOrDefault(tool, "see the tool's documentation");
    }

    private boolean onPath(String tool) {
        try {
            return toolRunner.run(List.of("sh", "-c", "command -v " + tool), null, Duration.ofSeconds(10))
                    .succeeded();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.debug("Lookup of {} failed: {}", tool, e.getMessage());
            return false;
        }
    }
}
