package com.codemend.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

@Component
public class FileSystemManager implements WorkspaceFiles {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path               workspaceRoot;
    private final OpenBufferRegistry buffers;

    public FileSystemManager(
            @Value("${codemend.workspace.path}") String workspacePath,
            OpenBufferRegistry buffers
    ) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        this.buffers       = buffers;
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[FileSystem] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new WorkspaceUnavailableException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[FileSystem] Workspace initialized: {}", workspaceRoot);
    }

    @Override
    public Path getRoot() {
        return workspaceRoot;
    }

    // ================================================================
    // File Operations
    // ================================================================

    @Override
    public boolean exists(String relativePath) {
        try { return Files.exists(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    @Override
    public String readFile(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.debug("[FileSystem] Reading file: {}", relativePath);
        try {
            long fileSize = Files.size(targetPath);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + fileSize + " bytes");
            return Files.readString(targetPath, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new FileNotFoundInWorkspaceException(relativePath, e);
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    @Override
    public String readCurrent(String relativePath) throws FileSystemException {
        resolveSafePath(relativePath);
        Optional<String> buffered = buffers.get(relativePath);
        if (buffered.isPresent()) {
            log.debug("[FileSystem] Using open buffer for {}", relativePath);
            return buffered.get();
        }
        return readFile(relativePath);
    }

    @Override
    public void writeFile(String relativePath, String content) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[FileSystem] Writing {} bytes to {}", content.length(), relativePath);
        try {
            Path parent = targetPath.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.writeString(targetPath, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        }
    }

    @Override
    public void applyEdit(String relativePath, String content) throws FileSystemException {
        writeFile(relativePath, content);
        if (buffers.replaceIfOpen(relativePath, content)) {
            log.debug("[FileSystem] Updated open buffer for {}", relativePath);
        }
    }

    @Override
    public void createDirectory(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        if (Files.isDirectory(targetPath)) {
            log.debug("[FileSystem] Directory already exists: {}", relativePath);
            return;
        }
        try {
            Files.createDirectories(targetPath);
            log.info("[FileSystem] Created directory: {}", relativePath);
        } catch (IOException e) {
            throw new FileSystemException("Failed to create directory: " + relativePath, e);
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }
}
