package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;
import com.codemend.core.issue.IssueMatcher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Judges a correction attempt by the issues before and after it.
 *
 * Rules in order:
 * <ol>
 *   <li>nothing after: success</li>
 *   <li>anything after without a counterpart before: NEW_ERRORS_INTRODUCED,
 *       even if the total went down</li>
 *   <li>fewer issues after: improvement, no failure kind</li>
 *   <li>oscillation flagged for this attempt: OSCILLATION_DETECTED</li>
 *   <li>otherwise: NO_IMPROVEMENT</li>
 * </ol>
 * PARSING_FAILED and COMMAND_FAILED are assigned by the orchestrator before
 * this comparison runs.
 */
@Component
public class OutcomeClassifier {

    public OutcomeClassification classify(List<Issue> before, List<Issue> after, boolean oscillating) {
        List<Issue> introduced = IssueMatcher.introduced(before, after);

        if (after.isEmpty()) {
            return new OutcomeClassification(true, null, introduced);
        }
        if (!introduced.isEmpty()) {
            return new OutcomeClassification(false, FailureKind.NEW_ERRORS_INTRODUCED, introduced);
        }
        if (after.size() < before.size()) {
            return new OutcomeClassification(false, null, introduced);
        }
        if (oscillating) {
            return new OutcomeClassification(false, FailureKind.OSCILLATION_DETECTED, introduced);
        }
        return new OutcomeClassification(false, FailureKind.NO_IMPROVEMENT, introduced);
    }
}
