package com.codemend.core.diagnostics;

import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.cancel.PollClock;
import com.codemend.core.issue.RawDiagnostic;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.DoubleSupplier;

/**
 * Waits until the diagnostics reported for a file stop changing.
 *
 * Diagnostic providers re-analyse a file asynchronously after every edit, so
 * the first sample taken after a write is usually stale. The monitor samples
 * repeatedly, compares each sample with the previous one in a canonical,
 * order-independent form, and returns once {@code requiredStableChecks}
 * consecutive samples were identical.
 *
 * Polling backs off while the set keeps changing:
 * <pre>
 *   delay = min(base * 1.2^unstableStreak, base + maxBackoffCap) + jitter
 *   jitter in [0, 0.2 * base]
 * </pre>
 * The timeout is a soft deadline. Reaching it is not an error.
 */
@Component
public class DiagnosticStabilizationMonitor {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticStabilizationMonitor.class);

    static final double BACKOFF_FACTOR = 1.2;
    static final double JITTER_RATIO   = 0.2;

    private static final Comparator<RawDiagnostic> CANONICAL_ORDER =
            Comparator.comparing(RawDiagnostic::getSeverity)
                      .thenComparingInt(RawDiagnostic::getLine)
                      .thenComparingInt(RawDiagnostic::getColumn)
                      .thenComparing(RawDiagnostic::getMessage);

    private final DiagnosticProvider provider;
    private final ObjectMapper       mapper = new ObjectMapper();
    private final PollClock          clock;
    private final DoubleSupplier     jitterSource;

    private final long defaultTimeoutMs;
    private final long defaultBaseIntervalMs;
    private final int  defaultRequiredStableChecks;
    private final long maxBackoffCapMs;

    @Autowired
    public DiagnosticStabilizationMonitor(
            DiagnosticProvider provider,
            @Value("${codemend.diagnostics.timeout-ms:5000}") long defaultTimeoutMs,
            @Value("${codemend.diagnostics.base-interval-ms:100}") long defaultBaseIntervalMs,
            @Value("${codemend.diagnostics.required-stable-checks:3}") int defaultRequiredStableChecks,
            @Value("${codemend.diagnostics.max-backoff-cap-ms:1000}") long maxBackoffCapMs
    ) {
        this(provider, PollClock.SYSTEM, new Random()::nextDouble,
             defaultTimeoutMs, defaultBaseIntervalMs, defaultRequiredStableChecks, maxBackoffCapMs);
    }

    public DiagnosticStabilizationMonitor(
            DiagnosticProvider provider,
            PollClock clock,
            DoubleSupplier jitterSource,
            long defaultTimeoutMs,
            long defaultBaseIntervalMs,
            int defaultRequiredStableChecks,
            long maxBackoffCapMs
    ) {
        this.provider                    = provider;
        this.clock                       = clock;
        this.jitterSource                = jitterSource;
        this.defaultTimeoutMs            = defaultTimeoutMs;
        this.defaultBaseIntervalMs       = defaultBaseIntervalMs;
        this.defaultRequiredStableChecks = defaultRequiredStableChecks;
        this.maxBackoffCapMs             = maxBackoffCapMs;
    }

    public StabilizationOutcome waitForStable(String target, CancellationToken token) {
        return waitForStable(target, defaultTimeoutMs, defaultBaseIntervalMs,
                defaultRequiredStableChecks, token);
    }

    public StabilizationOutcome waitForStable(String target,
                                              long timeoutMs,
                                              long baseIntervalMs,
                                              int requiredStableChecks,
                                              CancellationToken token) {

        long   start          = clock.nowMillis();
        String previous       = null;
        int    stableCount    = 0;
        int    unstableStreak = 0;
        int    samples        = 0;

        while (true) {
            if (token.isCancellationRequested()) {
                log.info("[Stabilization] Cancelled while waiting on {}", target);
                return StabilizationOutcome.CANCELLED;
            }

            String current = canonicalize(provider.getDiagnostics(target));
            samples++;

            if (previous != null) {
                if (current.equals(previous)) {
                    stableCount++;
                } else {
                    stableCount = 0;
                    unstableStreak++;
                }
            }
            previous = current;

            if (stableCount >= requiredStableChecks) {
                log.debug("[Stabilization] {} stable after {} samples ({} ms)",
                        target, samples, clock.nowMillis() - start);
                return StabilizationOutcome.STABLE;
            }

            long elapsed = clock.nowMillis() - start;
            if (elapsed >= timeoutMs) {
                log.warn("[Stabilization] Timed out on {} after {} ms ({} samples); diagnostics may be stale",
                        target, elapsed, samples);
                return StabilizationOutcome.TIMED_OUT;
            }

            long delay = Math.min(nextDelay(baseIntervalMs, unstableStreak), timeoutMs - elapsed);
            if (!clock.sleep(Math.max(1, delay), token)) {
                log.info("[Stabilization] Cancelled while waiting on {}", target);
                return StabilizationOutcome.CANCELLED;
            }
        }
    }

    long nextDelay(long baseIntervalMs, int unstableStreak) {
        double grown  = baseIntervalMs * Math.pow(BACKOFF_FACTOR, unstableStreak);
        double capped = Math.min(grown, baseIntervalMs + maxBackoffCapMs);
        double jitter = jitterSource.getAsDouble() * JITTER_RATIO * baseIntervalMs;
        return Math.round(capped + jitter);
    }

    /**
     * Order-independent serialization of a diagnostic set, used only for
     * equality between consecutive samples.
     */
    String canonicalize(List<RawDiagnostic> diagnostics) {
        List<RawDiagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(CANONICAL_ORDER);

        ArrayNode array = mapper.createArrayNode();
        for (RawDiagnostic d : sorted) {
            ObjectNode node = array.addObject();
            node.put("severity", d.getSeverity().name());
            node.put("line", d.getLine());
            node.put("column", d.getColumn());
            node.put("message", d.getMessage());
            if (d.getCode() != null) node.put("code", d.getCode());
        }
        try {
            return mapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            // ArrayNode of primitives cannot fail to serialize
            throw new IllegalStateException("Failed to serialize diagnostics", e);
        }
    }
}
