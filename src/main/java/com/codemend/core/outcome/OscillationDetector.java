package com.codemend.core.outcome;

import com.codemend.core.issue.IssueMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags an attempt as oscillating when the two most recent outcomes both
 * failed and left structurally the same issues behind.
 *
 * Only the last two outcomes are compared; slower cycles (A, B, A) are not
 * detected.
 */
@Component
public class OscillationDetector {

    private static final Logger log = LoggerFactory.getLogger(OscillationDetector.class);

    static final int WINDOW = 2;

    public boolean detect(List<CorrectionAttemptOutcome> recentOutcomes) {
        if (recentOutcomes.size() < WINDOW) return false;

        CorrectionAttemptOutcome last       = recentOutcomes.get(recentOutcomes.size() - 1);
        CorrectionAttemptOutcome secondLast = recentOutcomes.get(recentOutcomes.size() - 2);

        if (!last.isFailure() || !secondLast.isFailure()) return false;

        boolean oscillating = IssueMatcher.sameIssueSet(
                last.getIssuesRemaining(), secondLast.getIssuesRemaining());
        if (oscillating) {
            log.info("[Oscillation] Attempts {} and {} left the same {} issues",
                    secondLast.getIteration(), last.getIteration(), last.getIssuesAfterCount());
        }
        return oscillating;
    }
}
