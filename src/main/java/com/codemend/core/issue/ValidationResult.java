package com.codemend.core.issue;

import java.util.List;

/**
 * Immutable snapshot of one validation pass over a candidate file content.
 */
public final class ValidationResult {

    private final boolean     valid;
    private final String      content;
    private final List<Issue> issues;
    private final List<String> suggestions;

    public ValidationResult(String content, List<Issue> issues, List<String> suggestions) {
        this.content     = content != null ? content : "";
        this.issues      = issues != null ? List.copyOf(issues) : List.of();
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        this.valid       = this.issues.stream().noneMatch(Issue::isError);
    }

    /** True iff no issue has severity error. */
    public boolean      isValid()        { return valid; }
    public String       getContent()     { return content; }
    public List<Issue>  getIssues()      { return issues; }
    public List<String> getSuggestions() { return suggestions; }

    public boolean hasNoIssues() {
        return issues.isEmpty();
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", issues=" + issues.size() + "}";
    }
}
