package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;

import java.util.List;

/**
 * What the next generation call is told about the previous attempt.
 *
 * {@code kind} is null when the previous attempt improved things without
 * finishing; the feedback then only reports progress.
 */
public final class CorrectionFeedback {

    private static final int FAILED_TEXT_PREVIEW_LINES = 15;

    private final FailureKind kind;
    private final String      message;
    private final List<Issue> issuesRemaining;
    private final List<Issue> issuesIntroduced;
    private final String      relevantDiff;     // nullable
    private final String      parsingError;     // nullable
    private final String      failedPlanText;   // nullable

    CorrectionFeedback(FailureKind kind, String message, List<Issue> issuesRemaining,
                       List<Issue> issuesIntroduced, String relevantDiff,
                       String parsingError, String failedPlanText) {
        this.kind             = kind;
        this.message          = message != null ? message : "";
        this.issuesRemaining  = issuesRemaining != null ? List.copyOf(issuesRemaining) : List.of();
        this.issuesIntroduced = issuesIntroduced != null ? List.copyOf(issuesIntroduced) : List.of();
        this.relevantDiff     = relevantDiff;
        this.parsingError     = parsingError;
        this.failedPlanText   = failedPlanText;
    }

    // ----------------------------------------------------------------
    // Prompt rendering
    // ----------------------------------------------------------------

    /**
     * Plain-text block for the correction instructions.
     */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("Previous attempt\n");
        sb.append("  Outcome     : ").append(kind != null ? kind.getWireName() : "improved").append("\n");
        sb.append("  Summary     : ").append(message).append("\n");

        if (kind == null) {
            sb.append("  Hint        : Keep the approach; resolve the remaining issues.\n");
            return sb.toString();
        }

        switch (kind) {
            case NO_IMPROVEMENT:
                sb.append("  Hint        : The last plan did not reduce the issues. Try a different fix.\n");
                break;

            case NEW_ERRORS_INTRODUCED:
                sb.append("  Hint        : The last plan introduced new problems. Fix them without undoing earlier fixes.\n");
                for (Issue issue : issuesIntroduced) {
                    sb.append("  New issue   : line ").append(issue.getLine())
                      .append(" ").append(issue.getMessage()).append("\n");
                }
                break;

            case OSCILLATION_DETECTED:
                sb.append("  Hint        : Consecutive attempts left the same issues. Break the pattern:\n");
                sb.append("                choose a fundamentally different strategy than before.\n");
                break;

            case PARSING_FAILED:
                sb.append("  Hint        : Your plan was not valid. Return ONLY the JSON plan object.\n");
                if (parsingError != null && !parsingError.isBlank()) {
                    sb.append("  Parse error : ").append(parsingError).append("\n");
                }
                if (failedPlanText != null && !failedPlanText.isBlank()) {
                    sb.append("  Bad output  : |\n");
                    for (String line : firstNLines(failedPlanText, FAILED_TEXT_PREVIEW_LINES).split("\n")) {
                        sb.append("                ").append(line).append("\n");
                    }
                }
                break;

            case COMMAND_FAILED:
                sb.append("  Hint        : A plan step failed. Avoid the failing step or make it valid.\n");
                break;

            default:
                sb.append("  Hint        : The attempt failed unexpectedly. Produce a simple, targeted fix.\n");
                break;
        }

        if (relevantDiff != null && !relevantDiff.isBlank()) {
            sb.append("  Diff        : |\n");
            for (String line : relevantDiff.split("\n")) {
                sb.append("                ").append(line).append("\n");
            }
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public FailureKind getKind()             { return kind; }
    public String      getMessage()          { return message; }
    public List<Issue> getIssuesRemaining()  { return issuesRemaining; }
    public List<Issue> getIssuesIntroduced() { return issuesIntroduced; }
    public String      getRelevantDiff()     { return relevantDiff; }
    public String      getParsingError()     { return parsingError; }
    public String      getFailedPlanText()   { return failedPlanText; }

    private static String firstNLines(String text, int n) {
        String[] lines = text.split("\n");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(n, lines.length); i++) {
            if (i > 0) sb.append("\n");
            sb.append(lines[i]);
        }
        if (lines.length > n) sb.append("\n[+" + (lines.length - n) + " more lines]");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "CorrectionFeedback{" + (kind != null ? kind : "improved") + ", '" + message + "'}";
    }
}
