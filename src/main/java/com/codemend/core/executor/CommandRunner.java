package com.codemend.core.executor;

import com.codemend.core.cancel.CancellationToken;

import java.nio.file.Path;

public interface CommandRunner {

    /**
     * Runs the command with {@code workingDirectory} as its working
     * directory. Never throws for a failing command; the exit code, timeout
     * and cancellation are reported in the result.
     */
    CommandResult run(CommandLine command, Path workingDirectory, CancellationToken token);
}
