package com.codemend.core.cancel;

/**
 * Raised at a suspension point once the request's {@link CancellationToken}
 * has been cancelled. Never wrapped in step or generation errors.
 */
public class OperationCancelledException extends RuntimeException {

    public static final String MESSAGE = "Operation cancelled by user.";

    public OperationCancelledException() {
        super(MESSAGE);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
