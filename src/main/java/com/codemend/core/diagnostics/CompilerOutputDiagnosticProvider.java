package com.codemend.core.diagnostics;

import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.executor.CommandLine;
import com.codemend.core.executor.CommandResult;
import com.codemend.core.executor.CommandRunner;
import com.codemend.core.filesystem.FileSystemException;
import com.codemend.core.filesystem.WorkspaceFiles;
import com.codemend.core.issue.RawDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Diagnostics from a compiler or linter run as a child process.
 *
 * The command template in {@code codemend.diagnostics.compiler-command}
 * gets the target path substituted for {@code {file}}. Output lines of the
 * form {@code file:line[:column]: severity: message} become diagnostics;
 * anything else is ignored. Results are cached per file content, so
 * repeated polls of an unchanged file do not re-run the command.
 */
@Component
@ConditionalOnProperty(name = "codemend.diagnostics.provider", havingValue = "compiler")
public class CompilerOutputDiagnosticProvider implements DiagnosticProvider {

    private static final Logger log = LoggerFactory.getLogger(CompilerOutputDiagnosticProvider.class);

    static final String SOURCE = "compiler";

    private static final Pattern DIAGNOSTIC_LINE = Pattern.compile(
            "^(.+?):(\\d+)(?::(\\d+))?:\\s*(error|warning|info|note|hint)\\s*:?\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);

    private final CommandRunner  commandRunner;
    private final WorkspaceFiles workspace;
    private final String         commandTemplate;

    private final Map<String, CachedRun> cache = new ConcurrentHashMap<>();

    public CompilerOutputDiagnosticProvider(
            CommandRunner commandRunner,
            WorkspaceFiles workspace,
            @Value("${codemend.diagnostics.compiler-command}") String commandTemplate
    ) {
        if (!commandTemplate.contains("{file}")) {
            throw new IllegalArgumentException("codemend.diagnostics.compiler-command must contain {file}");
        }
        this.commandRunner   = commandRunner;
        this.workspace       = workspace;
        this.commandTemplate = commandTemplate;
    }

    @Override
    public List<RawDiagnostic> getDiagnostics(String target) {
        String content;
        try {
            content = workspace.readCurrent(target);
        } catch (FileSystemException e) {
            log.warn("[Diagnostics] Cannot read {}: {}", target, e.getMessage());
            return List.of();
        }

        CachedRun cached = cache.get(target);
        if (cached != null && cached.content.equals(content)) {
            return cached.diagnostics;
        }

        CommandLine command = CommandLine.parse(commandTemplate.replace("{file}", target));
        CommandResult result = commandRunner.run(command, workspace.getRoot(), CancellationToken.none());
        if (result.getExitCode() == CommandResult.START_FAILED) {
            log.error("[Diagnostics] Check command could not run: {}", result.getStderr());
            return List.of();
        }

        List<RawDiagnostic> diagnostics = parse(result.getStdout() + "\n" + result.getStderr());
        cache.put(target, new CachedRun(content, diagnostics));
        log.debug("[Diagnostics] {} reported {} diagnostics for {}", command.getExecutable(),
                diagnostics.size(), target);
        return diagnostics;
    }

    static List<RawDiagnostic> parse(String output) {
        List<RawDiagnostic> diagnostics = new ArrayList<>();
        for (String line : output.split("\\R")) {
            Matcher m = DIAGNOSTIC_LINE.matcher(line.trim());
            if (!m.matches()) continue;

            int lineNumber = Integer.parseInt(m.group(2));
            int column     = m.group(3) != null ? Integer.parseInt(m.group(3)) : 1;
            diagnostics.add(new RawDiagnostic(severityOf(m.group(4)), lineNumber, column,
                    m.group(5).trim(), null, SOURCE, RawDiagnostic.LineBase.ONE));
        }
        return List.copyOf(diagnostics);
    }

    private static RawDiagnostic.Severity severityOf(String label) {
        switch (label.toLowerCase(Locale.ROOT)) {
            case "error":   return RawDiagnostic.Severity.ERROR;
            case "warning": return RawDiagnostic.Severity.WARNING;
            case "hint":    return RawDiagnostic.Severity.HINT;
            default:        return RawDiagnostic.Severity.INFORMATION;
        }
    }

    private static final class CachedRun {
        final String              content;
        final List<RawDiagnostic> diagnostics;

        CachedRun(String content, List<RawDiagnostic> diagnostics) {
            this.content     = content;
            this.diagnostics = diagnostics;
        }
    }
}
