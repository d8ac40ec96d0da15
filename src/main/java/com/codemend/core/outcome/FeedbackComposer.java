package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;

import java.util.List;

/**
 * Builds the {@link CorrectionFeedback} attached to each outcome kind.
 */
public final class FeedbackComposer {

    private FeedbackComposer() {}

    public static CorrectionFeedback forComparison(FailureKind kind, List<Issue> before,
                                                   List<Issue> after, List<Issue> introduced,
                                                   String diff) {
        String message;
        if (kind == null) {
            message = "Issues reduced from " + before.size() + " to " + after.size()
                    + " with no new issues.";
        } else {
            switch (kind) {
                case NEW_ERRORS_INTRODUCED:
                    message = introduced.size() + " new issue(s) introduced; "
                            + after.size() + " issue(s) remain (was " + before.size() + ").";
                    break;
                case OSCILLATION_DETECTED:
                    message = "Oscillation detected: recent attempts resulted in similar unresolved issues ("
                            + after.size() + " remaining).";
                    break;
                default:
                    message = "No improvement: " + after.size() + " issue(s) remain (was "
                            + before.size() + ").";
                    break;
            }
        }
        return new CorrectionFeedback(kind, message, after, introduced, diff, null, null);
    }

    public static CorrectionFeedback parsingFailed(String error, String failedText, List<Issue> remaining) {
        String message = error != null && !error.isBlank()
                ? error
                : "Failed to parse the correction plan.";
        return new CorrectionFeedback(FailureKind.PARSING_FAILED, message, remaining, List.of(),
                null, error, failedText);
    }

    public static CorrectionFeedback commandFailed(String message, List<Issue> remaining) {
        return new CorrectionFeedback(FailureKind.COMMAND_FAILED, message, remaining, List.of(),
                null, null, null);
    }

    public static CorrectionFeedback unknown(String message, List<Issue> remaining) {
        return new CorrectionFeedback(FailureKind.UNKNOWN, message, remaining, List.of(),
                null, null, null);
    }
}
