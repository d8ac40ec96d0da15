package com.codemend.core.issue;

import java.util.Objects;

/**
 * One normalized problem reported for a file.
 *
 * Produced fresh on every validation pass and never mutated. Two passes are
 * compared with {@link IssueMatcher}, not with {@link #equals(Object)}.
 */
public final class Issue {

    private final IssueKind     kind;
    private final IssueSeverity severity;
    private final int           line;       // 1-indexed
    private final String        message;
    private final String        code;       // nullable
    private final String        source;     // nullable

    public Issue(IssueKind kind, IssueSeverity severity, int line, String message,
                 String code, String source) {
        this.kind     = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.line     = Math.max(1, line);
        this.message  = message != null ? message : "";
        this.code     = code;
        this.source   = source;
    }

    public Issue(IssueKind kind, IssueSeverity severity, int line, String message) {
        this(kind, severity, line, message, null, null);
    }

    /** Informational marker attached to results of a cancelled request. */
    public static Issue cancelled() {
        return new Issue(IssueKind.OTHER, IssueSeverity.INFO, 1,
                "Operation cancelled by user.", null, "CodeMend");
    }

    public IssueKind     getKind()     { return kind; }
    public IssueSeverity getSeverity() { return severity; }
    public int           getLine()     { return line; }
    public String        getMessage()  { return message; }
    public String        getCode()     { return code; }
    public String        getSource()   { return source; }

    public boolean isError() {
        return severity == IssueSeverity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Issue)) return false;
        Issue other = (Issue) o;
        return line == other.line
                && kind == other.kind
                && severity == other.severity
                && message.equals(other.message)
                && Objects.equals(code, other.code)
                && Objects.equals(source, other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, line, message, code, source);
    }

    @Override
    public String toString() {
        return String.format("%s/%s@%d: %s", kind.getWireName(), severity.getWireName(), line, message);
    }
}
