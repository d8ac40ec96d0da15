package com.codemend.orchestrator;

public enum CorrectionStatus {
    /** No issues remain. */
    SUCCESS,
    /** Iteration budget spent with issues remaining, or the generated output was unusable. */
    PARTIAL,
    /** Stopped by the caller; carries the last validated content. */
    CANCELLED
}
