package com.codemend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunables of the correction loop.
 */
@Component
public class CorrectionSettings {

    private final int  maxIterations;
    private final long stabilizationTimeoutMs;
    private final long stabilizationIntervalMs;
    private final int  requiredStableChecks;

    public CorrectionSettings(
            @Value("${codemend.correction.max-iterations:5}") int maxIterations,
            @Value("${codemend.diagnostics.timeout-ms:5000}") long stabilizationTimeoutMs,
            @Value("${codemend.diagnostics.base-interval-ms:100}") long stabilizationIntervalMs,
            @Value("${codemend.diagnostics.required-stable-checks:3}") int requiredStableChecks
    ) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("codemend.correction.max-iterations must be at least 1");
        }
        this.maxIterations           = maxIterations;
        this.stabilizationTimeoutMs  = stabilizationTimeoutMs;
        this.stabilizationIntervalMs = stabilizationIntervalMs;
        this.requiredStableChecks    = requiredStableChecks;
    }

    public int  getMaxIterations()           { return maxIterations; }
    public long getStabilizationTimeoutMs()  { return stabilizationTimeoutMs; }
    public long getStabilizationIntervalMs() { return stabilizationIntervalMs; }
    public int  getRequiredStableChecks()    { return requiredStableChecks; }
}
