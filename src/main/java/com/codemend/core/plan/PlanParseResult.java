package com.codemend.core.plan;

/**
 * Either a plan or the reason the text could not be turned into one.
 */
public final class PlanParseResult {

    private final ExecutionPlan plan;   // null on failure
    private final String        error;  // null on success

    private PlanParseResult(ExecutionPlan plan, String error) {
        this.plan  = plan;
        this.error = error;
    }

    public static PlanParseResult success(ExecutionPlan plan) {
        return new PlanParseResult(plan, null);
    }

    public static PlanParseResult failure(String error) {
        return new PlanParseResult(null, error);
    }

    public boolean       isSuccess() { return plan != null; }
    public ExecutionPlan getPlan()   { return plan; }
    public String        getError()  { return error; }

    @Override
    public String toString() {
        return isSuccess() ? "PlanParseResult{" + plan + "}" : "PlanParseResult{error='" + error + "'}";
    }
}
