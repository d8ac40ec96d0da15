package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;

import java.util.List;

/**
 * Result of comparing the issues before and after an attempt.
 */
public final class OutcomeClassification {

    private final boolean     success;
    private final FailureKind failureKind;   // null on success or improvement
    private final List<Issue> introduced;

    OutcomeClassification(boolean success, FailureKind failureKind, List<Issue> introduced) {
        this.success     = success;
        this.failureKind = failureKind;
        this.introduced  = List.copyOf(introduced);
    }

    public boolean     isSuccess()      { return success; }
    public FailureKind getFailureKind() { return failureKind; }
    public List<Issue> getIntroduced()  { return introduced; }

    public boolean isImprovement() {
        return !success && failureKind == null;
    }

    @Override
    public String toString() {
        return "OutcomeClassification{success=" + success + ", failureKind=" + failureKind
                + ", introduced=" + introduced.size() + "}";
    }
}
