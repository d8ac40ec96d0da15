package com.codemend.core.issue;

/**
 * A diagnostic exactly as a provider reports it, before normalization.
 *
 * Providers disagree on line indexing; {@link LineBase} records which
 * convention {@code line} and {@code column} use so that the classifier can
 * convert once.
 */
public final class RawDiagnostic {

    public enum Severity { ERROR, WARNING, INFORMATION, HINT }

    public enum LineBase { ZERO, ONE }

    private final Severity severity;
    private final int      line;
    private final int      column;
    private final String   message;
    private final String   code;
    private final String   source;
    private final LineBase lineBase;

    public RawDiagnostic(Severity severity, int line, int column, String message,
                         String code, String source, LineBase lineBase) {
        this.severity = severity != null ? severity : Severity.INFORMATION;
        this.line     = line;
        this.column   = column;
        this.message  = message != null ? message : "";
        this.code     = code;
        this.source   = source;
        this.lineBase = lineBase != null ? lineBase : LineBase.ONE;
    }

    public static RawDiagnostic zeroBased(Severity severity, int line, String message) {
        return new RawDiagnostic(severity, line, 0, message, null, null, LineBase.ZERO);
    }

    public static RawDiagnostic oneBased(Severity severity, int line, String message) {
        return new RawDiagnostic(severity, line, 1, message, null, null, LineBase.ONE);
    }

    public Severity getSeverity() { return severity; }
    public int      getLine()     { return line; }
    public int      getColumn()   { return column; }
    public String   getMessage()  { return message; }
    public String   getCode()     { return code; }
    public String   getSource()   { return source; }
    public LineBase getLineBase() { return lineBase; }

    @Override
    public String toString() {
        return "RawDiagnostic{" + severity + " " + lineBase + ":" + line + ":" + column + " '" + message + "'}";
    }
}
