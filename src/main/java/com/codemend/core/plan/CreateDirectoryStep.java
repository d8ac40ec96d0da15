package com.codemend.core.plan;

public final class CreateDirectoryStep extends PlanStep {

    private final String path;

    public CreateDirectoryStep(int number, String description, String path) {
        super(number, PlanStepAction.CREATE_DIRECTORY, description);
        this.path = path;
    }

    public String getPath() { return path; }

    @Override
    PlanStep renumbered(int newNumber) {
        return new CreateDirectoryStep(newNumber, getDescription(), path);
    }

    @Override
    public String defaultDescription() {
        return "Creating directory: `" + path + "`";
    }
}
