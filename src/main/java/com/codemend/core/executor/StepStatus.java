package com.codemend.core.executor;

public enum StepStatus {
    /** The step changed something or ran its command. */
    COMPLETED,
    /** A command the confirmation declined. */
    SKIPPED,
    /** Nothing to do: directory existed or content was identical. */
    NO_OP
}
