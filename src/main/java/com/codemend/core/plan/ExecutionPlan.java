package com.codemend.core.plan;

import java.util.List;

/**
 * Parsed correction plan. Consumed once by the plan executor.
 */
public final class ExecutionPlan {

    private final String         planDescription;
    private final List<PlanStep> steps;

    public ExecutionPlan(String planDescription, List<PlanStep> steps) {
        this.planDescription = planDescription != null ? planDescription : "";
        this.steps           = steps != null ? List.copyOf(steps) : List.of();
    }

    public String         getPlanDescription() { return planDescription; }
    public List<PlanStep> getSteps()           { return steps; }
    public int            size()               { return steps.size(); }
    public boolean        isEmpty()            { return steps.isEmpty(); }

    @Override
    public String toString() {
        return "ExecutionPlan{steps=" + steps.size() + ", '" + planDescription + "'}";
    }
}
