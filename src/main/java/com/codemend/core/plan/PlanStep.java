package com.codemend.core.plan;

/**
 * One step of an {@link ExecutionPlan}. Subclasses carry the fields their
 * action needs; instances are only built by {@link PlanParser}, so they are
 * always structurally valid.
 */
public abstract class PlanStep {

    private final int            number;
    private final PlanStepAction action;
    private final String         description;

    protected PlanStep(int number, PlanStepAction action, String description) {
        this.number      = number;
        this.action      = action;
        this.description = description != null ? description : "";
    }

    /** 1-based position in the plan. */
    public int            getNumber()      { return number; }
    public PlanStepAction getAction()      { return action; }
    public String         getDescription() { return description; }

    /** Same step at a different position. */
    abstract PlanStep renumbered(int newNumber);

    /**
     * Description synthesized from the step's fields, used when the plan
     * gave none.
     */
    public abstract String defaultDescription();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{#" + number + ", " + defaultDescription() + "}";
    }
}
