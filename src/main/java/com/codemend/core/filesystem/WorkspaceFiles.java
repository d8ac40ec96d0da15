package com.codemend.core.filesystem;

import java.nio.file.Path;

/**
 * File operations the correction engine performs on the workspace. All paths
 * are relative to {@link #getRoot()}.
 */
public interface WorkspaceFiles {

    Path getRoot();

    boolean exists(String relativePath);

    String readFile(String relativePath) throws FileSystemException;

    /**
     * Current content of the file: the open buffer if one exists, otherwise
     * the content on disk.
     */
    String readCurrent(String relativePath) throws FileSystemException;

    void writeFile(String relativePath, String content) throws FileSystemException;

    /** Replaces the whole document, in the open buffer and on disk. */
    void applyEdit(String relativePath, String content) throws FileSystemException;

    /** Idempotent. */
    void createDirectory(String relativePath) throws FileSystemException;
}
