package com.codemend.core.executor;

/**
 * A plan command ran but did not succeed.
 */
public class CommandFailedException extends RuntimeException {

    private final CommandResult result;

    public CommandFailedException(String message, CommandResult result) {
        super(message);
        this.result = result;
    }

    public CommandResult getResult() {
        return result;
    }
}
