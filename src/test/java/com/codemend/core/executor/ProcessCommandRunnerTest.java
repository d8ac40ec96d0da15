package com.codemend.core.executor;

import com.codemend.core.cancel.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    @TempDir
    Path tempDir;

    private final ProcessCommandRunner runner = new ProcessCommandRunner(5);

    @Test
    void testCapturesOutputAndExitCode() {
        CommandResult result = runner.run(CommandLine.parse("echo hello world"), tempDir, CancellationToken.none());

        assertTrue(result.isSuccess());
        assertEquals(0, result.getExitCode());
        assertEquals("hello world\n", result.getStdout());
    }

    @Test
    void testRunsInWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "x");

        CommandResult result = runner.run(CommandLine.parse("ls"), tempDir, CancellationToken.none());

        assertTrue(result.getStdout().contains("marker.txt"));
    }

    @Test
    void testNonZeroExit() {
        CommandResult result = runner.run(CommandLine.parse("ls no-such-entry"), tempDir, CancellationToken.none());

        assertFalse(result.isSuccess());
        assertNotEquals(0, result.getExitCode());
        assertFalse(result.getStderr().isBlank());
    }

    @Test
    void testMissingExecutable() {
        CommandResult result = runner.run(CommandLine.parse("definitely-not-a-command-xyz"), tempDir,
                CancellationToken.none());

        assertEquals(CommandResult.START_FAILED, result.getExitCode());
        assertFalse(result.isSuccess());
    }

    @Test
    void testTimeout() {
        ProcessCommandRunner quick = new ProcessCommandRunner(1);

        CommandResult result = quick.run(CommandLine.parse("sleep 10"), tempDir, CancellationToken.none());

        assertTrue(result.isTimedOut());
        assertTrue(result.getStderr().contains("timed out"));
    }

    @Test
    void testCancelledTokenKillsProcess() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        CommandResult result = runner.run(CommandLine.parse("sleep 10"), tempDir, token);

        assertTrue(result.isCancelled());
        assertTrue(result.getDurationMs() < 5000);
    }
}
