package com.codemend.core.event;

public enum ProgressStage {
    GENERATING,
    VALIDATING,
    PLANNING,
    EXECUTING_STEP,
    COMMAND_OUTPUT,
    REVALIDATING,
    CLASSIFIED,
    COMPLETED,
    CANCELLED
}
