package com.codemend.core.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A command line split into executable and arguments. Quoting follows the
 * simple shell rules plans use: double or single quotes group words, there
 * is no escaping and no expansion.
 */
public final class CommandLine {

    private static final Pattern TOKEN = Pattern.compile("\"([^\"]*)\"|'([^']*)'|[^\\s\"']+");

    private final String       original;
    private final String       executable;
    private final List<String> arguments;

    private CommandLine(String original, String executable, List<String> arguments) {
        this.original   = original;
        this.executable = executable;
        this.arguments  = List.copyOf(arguments);
    }

    public static CommandLine parse(String commandLine) {
        String trimmed = commandLine != null ? commandLine.trim() : "";
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(trimmed);
        while (m.find()) {
            if (m.group(1) != null)      tokens.add(m.group(1));
            else if (m.group(2) != null) tokens.add(m.group(2));
            else                         tokens.add(m.group());
        }
        String executable = tokens.isEmpty() ? "" : tokens.get(0);
        List<String> args = tokens.size() > 1 ? tokens.subList(1, tokens.size()) : List.of();
        return new CommandLine(trimmed, executable, args);
    }

    public String       getOriginal()   { return original; }
    public String       getExecutable() { return executable; }
    public List<String> getArguments()  { return arguments; }

    /** Executable followed by arguments, as passed to the process. */
    public List<String> toArgv() {
        List<String> argv = new ArrayList<>(arguments.size() + 1);
        argv.add(executable);
        argv.addAll(arguments);
        return argv;
    }

    /** Human-readable form: arguments with spaces or quotes are single-quoted. */
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder(executable);
        for (String arg : arguments) {
            sb.append(' ').append(displayArgument(arg));
        }
        return sb.toString();
    }

    static String displayArgument(String arg) {
        if (arg.contains(" ") || arg.contains("'") || arg.contains("\"")) {
            return "'" + arg.replace("'", "'\\''") + "'";
        }
        return arg;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
