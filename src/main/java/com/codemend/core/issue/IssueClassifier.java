package com.codemend.core.issue;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps provider diagnostics onto normalized {@link Issue}s.
 *
 * Kind is chosen by the first matching rule:
 * <ol>
 *   <li>"unused import" in the message: UNUSED_IMPORT</li>
 *   <li>error or warning severity, or a syntax/compile/lint mention: SYNTAX</li>
 *   <li>"security" in the message: SECURITY</li>
 *   <li>"best practice" in the message: BEST_PRACTICE</li>
 *   <li>anything else: OTHER</li>
 * </ol>
 *
 * This is the only place where provider line numbers are converted to the
 * 1-indexed convention used everywhere else.
 */
@Component
public class IssueClassifier {

    static final String SUGGESTION_CLEAN =
            "Code appears to be well-structured and follows best practices";
    static final String SUGGESTION_HAS_ISSUES =
            "Consider addressing the identified issues for better code quality";

    public Issue classify(RawDiagnostic raw) {
        IssueSeverity severity = mapSeverity(raw.getSeverity());
        IssueKind     kind     = mapKind(raw.getMessage(), severity);
        int           line     = toOneBased(raw.getLine(), raw.getLineBase());
        return new Issue(kind, severity, line, raw.getMessage(), raw.getCode(), raw.getSource());
    }

    public List<Issue> classifyAll(List<RawDiagnostic> diagnostics) {
        List<Issue> issues = new ArrayList<>(diagnostics.size());
        for (RawDiagnostic raw : diagnostics) {
            issues.add(classify(raw));
        }
        return issues;
    }

    /**
     * Builds the validation snapshot for {@code content} from the diagnostics
     * currently reported for it.
     */
    public ValidationResult validate(String content, List<RawDiagnostic> diagnostics) {
        List<Issue> issues = classifyAll(diagnostics);
        String suggestion = issues.isEmpty() ? SUGGESTION_CLEAN : SUGGESTION_HAS_ISSUES;
        return new ValidationResult(content, issues, List.of(suggestion));
    }

    // ================================================================
    // Mapping rules
    // ================================================================

    static IssueSeverity mapSeverity(RawDiagnostic.Severity severity) {
        switch (severity) {
            case ERROR:   return IssueSeverity.ERROR;
            case WARNING: return IssueSeverity.WARNING;
            default:      return IssueSeverity.INFO;
        }
    }

    static IssueKind mapKind(String message, IssueSeverity severity) {
        String lower = message.toLowerCase(Locale.ROOT);

        if (lower.contains("unused import")) {
            return IssueKind.UNUSED_IMPORT;
        }
        if (severity == IssueSeverity.ERROR
                || severity == IssueSeverity.WARNING
                || lower.contains("syntax")
                || lower.contains("compil")
                || lower.contains("lint")) {
            return IssueKind.SYNTAX;
        }
        if (lower.contains("security")) {
            return IssueKind.SECURITY;
        }
        if (lower.contains("best practice")) {
            return IssueKind.BEST_PRACTICE;
        }
        return IssueKind.OTHER;
    }

    static int toOneBased(int line, RawDiagnostic.LineBase base) {
        int converted = base == RawDiagnostic.LineBase.ZERO ? line + 1 : line;
        return Math.max(1, converted);
    }
}
