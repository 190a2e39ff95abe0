package com.shannon.core.wave;

import com.shannon.config.ShannonProperties;
import com.shannon.core.events.EventBus;
import com.shannon.core.events.ShannonEvent;
import com.shannon.core.logging.MdcContext;
import com.shannon.core.metrics.ShannonMetrics;
import com.shannon.core.model.ToolScanResult;
import com.shannon.core.model.ToolStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the members of a wave concurrently and returns one result per member name.
 * <p>
 * Each member is isolated: an exception or a non-zero exit becomes a {@link ToolStatus#FAILED} entry and
 * never disturbs its siblings. Results are keyed by the name the member was scheduled under, so the
 * returned map does not depend on completion order. {@link #runWave} itself never throws.
 */
@Service
public class WaveScheduler {

    private static final Logger log = LoggerFactory.getLogger(WaveScheduler.class);

    static final String NOT_AVAILABLE = "Tool not available";

    private final int maxParallel;
    private final EventBus eventBus;
    private final ShannonMetrics metrics;

    @Autowired
    public WaveScheduler(ShannonProperties properties, EventBus eventBus,
                         @Autowired(required = false) ShannonMetrics metrics) {
        this(properties.getToolsMaxParallel(), eventBus, metrics);
    }

    WaveScheduler(int maxParallel) {
        this(maxParallel, new EventBus(), null);
    }

    WaveScheduler(int maxParallel, EventBus eventBus, ShannonMetrics metrics) {
        this.maxParallel = Math.max(1, maxParallel);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @param sessionId  owning session, for events and log context
     * @param waveName   label used in logs and metrics
     * @param operations members in declaration order
     * @return exactly the keys of {@code operations}, in the same order
     */
    public Map<String, ToolScanResult> runWave(String sessionId, String waveName,
                                               Map<String, WaveOperation> operations) {
        var results = new LinkedHashMap<String, ToolScanResult>();
        var futures = new LinkedHashMap<String, CompletableFuture<ToolScanResult>>();

        long scheduled = operations.values().stream().filter(WaveOperation::available).count();
        log.info("Wave '{}': {} members, {} scheduled, max parallel {}",
                waveName, operations.size(), scheduled, maxParallel);

        if (scheduled > 0) {
            var semaphore = new Semaphore(maxParallel);
            var threadIndex = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool((int) Math.min(scheduled, maxParallel), r -> {
                Thread t = new Thread(r, "wave-" + waveName + "-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            try {
                for (var entry : operations.entrySet()) {
                    String name = entry.getKey();
                    WaveOperation operation = entry.getValue();
                    if (!operation.available()) {
                        continue;
                    }
                    futures.put(name, CompletableFuture.supplyAsync(
                            () -> runMember(sessionId, waveName, name, operation, semaphore), executor));
                }
                CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();
            } finally {
                executor.shutdown();
            }
        }

        int failed = 0;
        for (var entry : operations.entrySet()) {
            String name = entry.getKey();
            var future = futures.get(name);
            ToolScanResult result = future == null
                    ? ToolScanResult.skipped(name, NOT_AVAILABLE)
                    : future.join();
            if (result.status() == ToolStatus.FAILED) {
                failed++;
            }
            results.put(name, result);
        }
        log.info("Wave '{}' complete: {} succeeded, {} failed, {} skipped", waveName,
                results.values().stream().filter(ToolScanResult::succeeded).count(), failed,
                operations.size() - scheduled);
        return results;
    }

    private ToolScanResult runMember(String sessionId, String waveName, String name,
                                     WaveOperation operation, Semaphore semaphore) {
        MdcContext.setWave(sessionId, waveName);
        long start = System.currentTimeMillis();
        ToolScanResult result;
        try {
            semaphore.acquire();
            try {
                eventBus.publish(ShannonEvent.of("wave.member.started", sessionId, name, Map.of("wave", waveName)));
                ToolRunResult run = operation.call();
                long elapsed = System.currentTimeMillis() - start;
                result = run.succeeded()
                        ? ToolScanResult.success(name, run.stdout(), elapsed)
                        : ToolScanResult.failed(name, run.failureSummary(), elapsed, null);
            } finally {
                semaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ToolScanResult.failed(name, "Interrupted", System.currentTimeMillis() - start, e);
        } catch (Exception e) {
            log.warn("Wave member {} failed: {}", name, e.getMessage());
            result = ToolScanResult.failed(name, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    System.currentTimeMillis() - start, e);
        } finally {
            MdcContext.clear();
        }

        log.info("Wave member {} finished: {} in {}ms", name, result.status(), result.durationMs());
        eventBus.publish(ShannonEvent.of("wave.member.completed", sessionId, name,
                Map.of("wave", waveName, "status", result.status().name(), "durationMs", result.durationMs())));
        if (metrics != null) {
            metrics.recordWaveMember(waveName, name, result.status().name(), result.durationMs());
        }
        return result;
    }
}
