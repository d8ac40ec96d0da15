package com.codemend.core.plan;

public final class ModifyFileStep extends PlanStep {

    /** Separator between instructions of consolidated steps for the same file. */
    public static final String INSTRUCTION_SEPARATOR = "\n\n---\n\n";

    private final String path;
    private final String modificationPrompt;

    public ModifyFileStep(int number, String description, String path, String modificationPrompt) {
        super(number, PlanStepAction.MODIFY_FILE, description);
        this.path               = path;
        this.modificationPrompt = modificationPrompt;
    }

    public String getPath()               { return path; }
    public String getModificationPrompt() { return modificationPrompt; }

    ModifyFileStep mergedWith(ModifyFileStep later) {
        return new ModifyFileStep(getNumber(), getDescription(), path,
                modificationPrompt + INSTRUCTION_SEPARATOR + later.modificationPrompt);
    }

    @Override
    PlanStep renumbered(int newNumber) {
        return new ModifyFileStep(newNumber, getDescription(), path, modificationPrompt);
    }

    @Override
    public String defaultDescription() {
        return "Modifying file: `" + path + "`";
    }
}
