package com.codemend.core.executor;

import com.codemend.core.cancel.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands as child processes without a shell. Arguments are passed
 * as-is, so the command line is never re-interpreted.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final int timeoutSeconds;

    public ProcessCommandRunner(
            @Value("${codemend.commands.timeout-seconds:120}") int timeoutSeconds
    ) {
        this.timeoutSeconds = timeoutSeconds;
        log.info("[CommandRunner] Timeout: {}s", timeoutSeconds);
    }

    @Override
    public CommandResult run(CommandLine command, Path workingDirectory, CancellationToken token) {

        long startTime = System.currentTimeMillis();
        log.info("[CommandRunner] Executing: {} (cwd={})", command.toDisplayString(), workingDirectory);

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command.toArgv());
            builder.directory(workingDirectory.toFile());
            process = builder.start();
        } catch (IOException e) {
            log.error("[CommandRunner] Failed to start {}: {}", command.getExecutable(), e.getMessage());
            return CommandResult.error("Failed to start command: " + e.getMessage());
        }

        Runnable killer = process::destroyForcibly;
        token.onCancellationRequested(killer);

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outThread = drain(process.getInputStream(), stdout, "stdout");
        Thread errThread = drain(process.getErrorStream(), stderr, "stderr");

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                outThread.join(1000);
                errThread.join(1000);
                log.warn("[CommandRunner] Process timed out after {} seconds", timeoutSeconds);
                return new CommandResult(-1, stdout.toString(),
                        stderr + "Command timed out after " + timeoutSeconds + " seconds",
                        System.currentTimeMillis() - startTime, true, false);
            }

            outThread.join(1000);
            errThread.join(1000);

            if (token.isCancellationRequested()) {
                log.info("[CommandRunner] Process killed by cancellation");
                return new CommandResult(process.exitValue(), stdout.toString(), stderr.toString(),
                        System.currentTimeMillis() - startTime, false, true);
            }

            int exitCode = process.exitValue();
            log.info("[CommandRunner] Exit code: {}, stdout {} chars, stderr {} chars",
                    exitCode, stdout.length(), stderr.length());
            return CommandResult.completed(exitCode, stdout.toString(), stderr.toString(),
                    System.currentTimeMillis() - startTime);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CommandResult(-1, stdout.toString(), stderr.toString(),
                    System.currentTimeMillis() - startTime, false, true);
        } finally {
            token.removeListener(killer);
        }
    }

    private static Thread drain(InputStream stream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader =
                         new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append("\n");
                    }
                }
            } catch (IOException e) {
                log.warn("[CommandRunner] Error reading {}: {}", name, e.getMessage());
            }
        }, "command-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
