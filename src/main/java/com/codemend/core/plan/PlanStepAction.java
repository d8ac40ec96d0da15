package com.codemend.core.plan;

import java.util.Optional;

public enum PlanStepAction {
    CREATE_DIRECTORY("create_directory"),
    CREATE_FILE("create_file"),
    MODIFY_FILE("modify_file"),
    RUN_COMMAND("run_command");

    private final String wireName;

    PlanStepAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean requiresPath() {
        return this != RUN_COMMAND;
    }

    public static Optional<PlanStepAction> fromWireName(String name) {
        for (PlanStepAction action : values()) {
            if (action.wireName.equals(name)) return Optional.of(action);
        }
        return Optional.empty();
    }
}
