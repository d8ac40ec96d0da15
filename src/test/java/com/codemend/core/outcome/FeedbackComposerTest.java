package com.codemend.core.outcome;

import com.codemend.core.issue.Issue;
import com.codemend.core.issue.IssueKind;
import com.codemend.core.issue.IssueSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackComposerTest {

    private static final Issue A = new Issue(IssueKind.SYNTAX, IssueSeverity.ERROR, 3, "Missing semicolon");
    private static final Issue B = new Issue(IssueKind.SECURITY, IssueSeverity.ERROR, 8, "Use of eval");

    @Test
    void testImprovementFeedback() {
        CorrectionFeedback f = FeedbackComposer.forComparison(null, List.of(A, B), List.of(B), List.of(), "");

        assertNull(f.getKind());
        assertEquals("Issues reduced from 2 to 1 with no new issues.", f.getMessage());
        assertTrue(f.toPromptSection().contains("Outcome     : improved"));
    }

    @Test
    void testNewIssuesAreListed() {
        CorrectionFeedback f = FeedbackComposer.forComparison(
                FailureKind.NEW_ERRORS_INTRODUCED, List.of(A), List.of(B), List.of(B), "+eval(x)");

        assertEquals("1 new issue(s) introduced; 1 issue(s) remain (was 1).", f.getMessage());
        String section = f.toPromptSection();
        assertTrue(section.contains("new_errors_introduced"));
        assertTrue(section.contains("New issue   : line 8 Use of eval"));
        assertTrue(section.contains("+eval(x)"));
    }

    @Test
    void testOscillationAsksForDifferentStrategy() {
        CorrectionFeedback f = FeedbackComposer.forComparison(
                FailureKind.OSCILLATION_DETECTED, List.of(A), List.of(A), List.of(), null);

        assertTrue(f.getMessage().startsWith("Oscillation detected"));
        assertTrue(f.toPromptSection().contains("fundamentally different strategy"));
    }

    @Test
    void testParsingFailureShowsBoundedPreview() {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i <= 20; i++) text.append("line ").append(i).append("\n");

        CorrectionFeedback f = FeedbackComposer.parsingFailed("Unexpected character", text.toString(), List.of(A));

        String section = f.toPromptSection();
        assertEquals(FailureKind.PARSING_FAILED, f.getKind());
        assertTrue(section.contains("Parse error : Unexpected character"));
        assertTrue(section.contains("line 15"));
        assertFalse(section.contains("line 16"));
        assertTrue(section.contains("[+5 more lines]"));
        assertEquals(List.of(A), f.getIssuesRemaining());
    }

    @Test
    void testBlankParsingErrorGetsDefaultMessage() {
        assertEquals("Failed to parse the correction plan.",
                FeedbackComposer.parsingFailed(" ", "x", List.of()).getMessage());
    }

    @Test
    void testCommandAndUnknownKinds() {
        assertEquals(FailureKind.COMMAND_FAILED, FeedbackComposer.commandFailed("Step 1 failed", List.of()).getKind());
        assertEquals(FailureKind.UNKNOWN, FeedbackComposer.unknown("boom", List.of()).getKind());
    }
}
