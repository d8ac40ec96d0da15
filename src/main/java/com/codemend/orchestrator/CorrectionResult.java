package com.codemend.orchestrator;

import com.codemend.core.issue.Issue;
import com.codemend.core.outcome.CorrectionAttemptOutcome;

import java.util.List;

/**
 * What a correction request produced. Always the best content reached, with
 * its issues; "could not fix" is a PARTIAL result, not an error.
 */
public class CorrectionResult {

    private final String                         requestId;
    private final CorrectionStatus               status;
    private final String                         content;
    private final List<Issue>                    issues;
    private final List<String>                   suggestions;
    private final int                            iterations;
    private final int                            totalIssues;
    private final int                            resolvedIssues;
    private final List<CorrectionAttemptOutcome> history;

    public CorrectionResult(
            String requestId,
            CorrectionStatus status,
            String content,
            List<Issue> issues,
            List<String> suggestions,
            int iterations,
            int totalIssues,
            List<CorrectionAttemptOutcome> history
    ) {
        this.requestId      = requestId;
        this.status         = status;
        this.content        = content != null ? content : "";
        this.issues         = List.copyOf(issues);
        this.suggestions    = List.copyOf(suggestions);
        this.iterations     = iterations;
        this.totalIssues    = totalIssues;
        this.resolvedIssues = Math.max(0, totalIssues - (int) issues.stream().filter(i -> !isCancellation(i)).count());
        this.history        = List.copyOf(history);
    }

    private static boolean isCancellation(Issue issue) {
        return Issue.cancelled().equals(issue);
    }

    public String getRequestId() {
        return requestId;
    }

    public CorrectionStatus getStatus() {
        return status;
    }

    public String getContent() {
        return content;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    /** Correction iterations performed; 0 when the first validation was clean. */
    public int getIterations() {
        return iterations;
    }

    /** Issues found by the first validation. */
    public int getTotalIssues() {
        return totalIssues;
    }

    public int getResolvedIssues() {
        return resolvedIssues;
    }

    public List<CorrectionAttemptOutcome> getHistory() {
        return history;
    }

    public boolean isSuccess() {
        return status == CorrectionStatus.SUCCESS;
    }

    @Override
    public String toString() {
        return "CorrectionResult{" + status + ", iterations=" + iterations + ", issues=" + issues.size()
                + "/" + totalIssues + "}";
    }
}
