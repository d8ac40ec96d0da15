package com.codemend.core.executor;

/**
 * A plan step failed for a reason that is not transient, or still failed
 * after the retry budget was spent.
 */
public class StepExecutionException extends RuntimeException {

    private final int    stepIndex;
    private final String stepDescription;

    public StepExecutionException(int stepIndex, String stepDescription, Throwable cause) {
        super("Step " + stepIndex + " failed (" + stepDescription + "): " + describe(cause), cause);
        this.stepIndex       = stepIndex;
        this.stepDescription = stepDescription;
    }

    /** 1-based. */
    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepDescription() {
        return stepDescription;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
