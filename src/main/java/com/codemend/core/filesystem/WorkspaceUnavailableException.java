package com.codemend.core.filesystem;

/**
 * Hard workspace failure (permissions, missing root, I/O error) that a
 * correction request cannot recover from. Propagates to the caller instead
 * of becoming an attempt outcome.
 */
public class WorkspaceUnavailableException extends RuntimeException {
    public WorkspaceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
