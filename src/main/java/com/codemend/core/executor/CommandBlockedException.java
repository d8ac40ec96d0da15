package com.codemend.core.executor;

/**
 * The security policy refused a plan command. Never retried.
 */
public class CommandBlockedException extends RuntimeException {
    public CommandBlockedException(String message) {
        super("Command blocked: " + message);
    }
}
