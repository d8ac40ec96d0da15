package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;
import com.codemend.core.issue.IssueKind;
import com.codemend.core.issue.IssueSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OscillationDetectorTest {

    private final OscillationDetector detector = new OscillationDetector();

    private static final Issue SEMICOLON = new Issue(IssueKind.SYNTAX, IssueSeverity.ERROR, 3, "Missing semicolon");
    private static final Issue TOKEN     = new Issue(IssueKind.SYNTAX, IssueSeverity.ERROR, 9, "Unexpected token '}'");

    private static CorrectionAttemptOutcome outcome(int iteration, FailureKind kind, Issue... remaining) {
        return CorrectionAttemptOutcome.builder(iteration)
                .issuesBeforeCount(remaining.length)
                .issuesRemaining(List.of(remaining))
                .failureKind(kind)
                .build();
    }

    @Test
    void testNeedsTwoOutcomes() {
        assertFalse(detector.detect(List.of()));
        assertFalse(detector.detect(List.of(outcome(1, FailureKind.NO_IMPROVEMENT, SEMICOLON))));
    }

    @Test
    void testTwoFailuresWithSameIssues() {
        Issue shifted = new Issue(IssueKind.SYNTAX, IssueSeverity.ERROR, 4, "missing semicolon!");

        assertTrue(detector.detect(List.of(
                outcome(1, FailureKind.NO_IMPROVEMENT, SEMICOLON),
                outcome(2, FailureKind.PARSING_FAILED, shifted))));
    }

    @Test
    void testDifferentIssuesAreNotOscillation() {
        assertFalse(detector.detect(List.of(
                outcome(1, FailureKind.NO_IMPROVEMENT, SEMICOLON),
                outcome(2, FailureKind.NO_IMPROVEMENT, TOKEN))));
        assertFalse(detector.detect(List.of(
                outcome(1, FailureKind.NO_IMPROVEMENT, SEMICOLON),
                outcome(2, FailureKind.NO_IMPROVEMENT, SEMICOLON, TOKEN))));
    }

    @Test
    void testImprovementBreaksTheChain() {
        assertFalse(detector.detect(List.of(
                outcome(1, FailureKind.NO_IMPROVEMENT, SEMICOLON),
                outcome(2, null, SEMICOLON))));
    }

    @Test
    void testOnlyLastTwoAreCompared() {
        assertTrue(detector.detect(List.of(
                outcome(1, FailureKind.NO_IMPROVEMENT, TOKEN),
                outcome(2, FailureKind.NO_IMPROVEMENT, SEMICOLON),
                outcome(3, FailureKind.NO_IMPROVEMENT, SEMICOLON))));
        assertFalse(detector.detect(List.of(
                outcome(1, FailureKind.NO_IMPROVEMENT, SEMICOLON),
                outcome(2, FailureKind.NO_IMPROVEMENT, TOKEN),
                outcome(3, FailureKind.NO_IMPROVEMENT, SEMICOLON))), "A, B, A is not detected");
    }
}
