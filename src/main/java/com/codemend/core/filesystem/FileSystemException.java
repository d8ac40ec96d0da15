package com.codemend.core.filesystem;

public class FileSystemException extends Exception {
    public FileSystemException(String message)                  { super(message); }
    public FileSystemException(String message, Throwable cause) { super(message, cause); }
}
