package com.codemend.core.filesystem;

/**
 * The path resolved inside the workspace but nothing exists there. Callers
 * use this to tell "create" apart from "modify".
 */
public class FileNotFoundInWorkspaceException extends FileSystemException {
    public FileNotFoundInWorkspaceException(String relativePath, Throwable cause) {
        super("File not found: " + relativePath, cause);
    }
}
