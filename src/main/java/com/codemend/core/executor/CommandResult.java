package com.codemend.core.executor;

/**
 * CommandResult - Result of running a single command.
 */
public class CommandResult {

    /** Exit code reported when the process could not be started. */
    public static final int START_FAILED = -2;

    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final long durationMs;
    private final boolean timedOut;
    private final boolean cancelled;

    public CommandResult(
            int exitCode,
            String stdout,
            String stderr,
            long durationMs,
            boolean timedOut,
            boolean cancelled
    ) {
        this.exitCode = exitCode;
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
        this.durationMs = durationMs;
        this.timedOut = timedOut;
        this.cancelled = cancelled;
    }

    public static CommandResult completed(int exitCode, String stdout, String stderr, long durationMs) {
        return new CommandResult(exitCode, stdout, stderr, durationMs, false, false);
    }

    /**
     * Create an error CommandResult.
     * Used when the process could not be started.
     */
    public static CommandResult error(String errorMessage) {
        return new CommandResult(START_FAILED, "", errorMessage, 0, false, false);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut && !cancelled;
    }

    @Override
    public String toString() {
        return String.format(
            "CommandResult{exitCode=%d, durationMs=%d, timedOut=%s, cancelled=%s}",
            exitCode,
            durationMs,
            timedOut,
            cancelled
        );
    }
}
