package com.codemend.core.executor;

import com.codemend.core.plan.PlanStepAction;

public final class StepReport {

    private final int            stepNumber;
    private final PlanStepAction action;
    private final String         description;
    private final StepStatus     status;
    private final int            retries;

    public StepReport(int stepNumber, PlanStepAction action, String description, StepStatus status, int retries) {
        this.stepNumber  = stepNumber;
        this.action      = action;
        this.description = description;
        this.status      = status;
        this.retries     = retries;
    }

    public int            getStepNumber()  { return stepNumber; }
    public PlanStepAction getAction()      { return action; }
    public String         getDescription() { return description; }
    public StepStatus     getStatus()      { return status; }
    public int            getRetries()     { return retries; }

    @Override
    public String toString() {
        return "StepReport{" + stepNumber + " " + action + " " + status + (retries > 0 ? " retries=" + retries : "") + "}";
    }
}
