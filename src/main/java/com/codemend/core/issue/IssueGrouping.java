package com.codemend.core.issue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orders and groups issues by kind for rendering into correction
 * instructions, each group with a short fix strategy and a numbered code
 * snippet around every issue.
 */
public final class IssueGrouping {

    static final int SNIPPET_CONTEXT_LINES = 2;

    private static final Comparator<Issue> ORDER =
            Comparator.comparing(Issue::getKind)
                      .thenComparing(Issue::getSeverity)
                      .thenComparingInt(Issue::getLine);

    private IssueGrouping() {}

    public static List<Issue> sorted(List<Issue> issues) {
        List<Issue> copy = new ArrayList<>(issues);
        copy.sort(ORDER);
        return copy;
    }

    public static Map<IssueKind, List<Issue>> group(List<Issue> issues) {
        Map<IssueKind, List<Issue>> groups = new EnumMap<>(IssueKind.class);
        for (Issue issue : sorted(issues)) {
            groups.computeIfAbsent(issue.getKind(), k -> new ArrayList<>()).add(issue);
        }
        return groups;
    }

    public static String strategyFor(IssueKind kind) {
        switch (kind) {
            case SYNTAX:        return "Fix syntax and compilation errors first; later fixes depend on code that parses.";
            case UNUSED_IMPORT: return "Remove imports that are never referenced.";
            case SECURITY:      return "Replace unsafe constructs with a safe equivalent without changing behavior.";
            case BEST_PRACTICE: return "Apply the conventional idiom the diagnostic names.";
            case FORMAT_ERROR:  return "Return only the file content, without commentary or markdown.";
            default:            return "Address each diagnostic at the reported line.";
        }
    }

    /**
     * Renders grouped issues with snippets taken from {@code content}.
     */
    public static String render(List<Issue> issues, String content) {
        if (issues.isEmpty()) return "No outstanding issues.\n";

        String[] lines = content != null ? content.split("\n", -1) : new String[0];
        StringBuilder sb = new StringBuilder();

        for (Map.Entry<IssueKind, List<Issue>> group : group(issues).entrySet()) {
            sb.append("### ").append(group.getKey().getWireName())
              .append(" (").append(group.getValue().size()).append(")\n");
            sb.append("Strategy: ").append(strategyFor(group.getKey())).append("\n");
            for (Issue issue : group.getValue()) {
                sb.append("- line ").append(issue.getLine())
                  .append(" [").append(issue.getSeverity().getWireName()).append("] ")
                  .append(issue.getMessage()).append("\n");
                String snippet = snippet(lines, issue.getLine());
                if (!snippet.isEmpty()) {
                    sb.append(snippet);
                }
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    /** Lines {@code line-2 .. line+2}, numbered, the reported line marked. */
    static String snippet(String[] lines, int line) {
        if (lines.length == 0 || line < 1 || line > lines.length) return "";
        int from = Math.max(1, line - SNIPPET_CONTEXT_LINES);
        int to   = Math.min(lines.length, line + SNIPPET_CONTEXT_LINES);
        StringBuilder sb = new StringBuilder();
        for (int n = from; n <= to; n++) {
            sb.append(n == line ? "  > " : "    ")
              .append(n).append(": ").append(lines[n - 1]).append("\n");
        }
        return sb.toString();
    }
}
