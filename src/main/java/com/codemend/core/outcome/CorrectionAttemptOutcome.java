package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;

import java.util.List;

/**
 * Immutable record of one correction loop iteration.
 *
 * Appended only after plan execution and revalidation both finished, or
 * after the iteration was short-circuited by a parse or step failure.
 * {@code failureKind} is null when the attempt reached zero issues or
 * reduced the count without introducing anything new.
 */
public final class CorrectionAttemptOutcome {

    private final int                iteration;
    private final int                issuesBeforeCount;
    private final int                issuesAfterCount;
    private final List<Issue>        issuesRemaining;
    private final List<Issue>        issuesIntroduced;
    private final String             diffSummary;
    private final FailureKind        failureKind;
    private final CorrectionFeedback feedback;

    private CorrectionAttemptOutcome(Builder b) {
        this.iteration         = b.iteration;
        this.issuesBeforeCount = b.issuesBeforeCount;
        this.issuesAfterCount  = b.issuesRemaining.size();
        this.issuesRemaining   = List.copyOf(b.issuesRemaining);
        this.issuesIntroduced  = List.copyOf(b.issuesIntroduced);
        this.diffSummary       = b.diffSummary != null ? b.diffSummary : "";
        this.failureKind       = b.failureKind;
        this.feedback          = b.feedback;
    }

    /** Zero issues remain. */
    public boolean isSuccess() {
        return failureKind == null && issuesRemaining.isEmpty();
    }

    /** Issues remain but fewer than before, with nothing new. */
    public boolean isImprovement() {
        return failureKind == null && !issuesRemaining.isEmpty();
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public int                getIteration()         { return iteration; }
    public int                getIssuesBeforeCount() { return issuesBeforeCount; }
    public int                getIssuesAfterCount()  { return issuesAfterCount; }
    public List<Issue>        getIssuesRemaining()   { return issuesRemaining; }
    public List<Issue>        getIssuesIntroduced()  { return issuesIntroduced; }
    public String             getDiffSummary()       { return diffSummary; }
    public FailureKind        getFailureKind()       { return failureKind; }
    public CorrectionFeedback getFeedback()          { return feedback; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int iteration) {
        return new Builder(iteration);
    }

    public static final class Builder {
        private final int          iteration;
        private int                issuesBeforeCount = 0;
        private List<Issue>        issuesRemaining   = List.of();
        private List<Issue>        issuesIntroduced  = List.of();
        private String             diffSummary       = null;
        private FailureKind        failureKind       = null;
        private CorrectionFeedback feedback          = null;

        private Builder(int iteration) {
            this.iteration = iteration;
        }

        public Builder issuesBeforeCount(int v)            { this.issuesBeforeCount = v; return this; }
        public Builder issuesRemaining(List<Issue> v)      { this.issuesRemaining = v != null ? v : List.of();  return this; }
        public Builder issuesIntroduced(List<Issue> v)     { this.issuesIntroduced = v != null ? v : List.of(); return this; }
        public Builder diffSummary(String v)               { this.diffSummary = v;       return this; }
        public Builder failureKind(FailureKind v)          { this.failureKind = v;       return this; }
        public Builder feedback(CorrectionFeedback v)      { this.feedback = v;          return this; }

        public CorrectionAttemptOutcome build() { return new CorrectionAttemptOutcome(this); }
    }

    @Override
    public String toString() {
        String kind = failureKind != null ? failureKind.getWireName() : (isSuccess() ? "success" : "improved");
        return "CorrectionAttemptOutcome{#" + iteration + ", " + kind + ", "
                + issuesBeforeCount + "->" + issuesAfterCount + "}";
    }
}
