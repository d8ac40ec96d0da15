package com.codemend.core.diagnostics;

/**
 * How a stabilization wait ended. Informational only: callers classify
 * whatever diagnostics are reported afterwards regardless of the outcome.
 */
public enum StabilizationOutcome {
    /** The diagnostic set was unchanged for the required number of checks. */
    STABLE,
    /** The soft deadline passed first; diagnostics may be stale. */
    TIMED_OUT,
    /** Cancellation was observed before the set stabilized. */
    CANCELLED
}
