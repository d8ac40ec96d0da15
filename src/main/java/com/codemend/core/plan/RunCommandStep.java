package com.codemend.core.plan;

public final class RunCommandStep extends PlanStep {

    private final String command;

    public RunCommandStep(int number, String description, String command) {
        super(number, PlanStepAction.RUN_COMMAND, description);
        this.command = command;
    }

    public String getCommand() { return command; }

    @Override
    PlanStep renumbered(int newNumber) {
        return new RunCommandStep(newNumber, getDescription(), command);
    }

    @Override
    public String defaultDescription() {
        return "Running command: `" + command + "`";
    }
}
