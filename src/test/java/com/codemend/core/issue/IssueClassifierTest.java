package com.codemend.core.issue;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.codemend.core.issue.RawDiagnostic.Severity.ERROR;
import static com.codemend.core.issue.RawDiagnostic.Severity.HINT;
import static com.codemend.core.issue.RawDiagnostic.Severity.INFORMATION;
import static com.codemend.core.issue.RawDiagnostic.Severity.WARNING;
import static org.junit.jupiter.api.Assertions.*;

class IssueClassifierTest {

    private final IssueClassifier classifier = new IssueClassifier();

    @Test
    void testUnusedImportWinsOverSeverity() {
        Issue issue = classifier.classify(RawDiagnostic.oneBased(WARNING, 2, "Unused import 'java.util.List'"));

        assertEquals(IssueKind.UNUSED_IMPORT, issue.getKind());
        assertEquals(IssueSeverity.WARNING, issue.getSeverity());
    }

    @Test
    void testErrorsAndWarningsAreSyntax() {
        assertEquals(IssueKind.SYNTAX, classifier.classify(RawDiagnostic.oneBased(ERROR, 1, "security hole")).getKind());
        assertEquals(IssueKind.SYNTAX, classifier.classify(RawDiagnostic.oneBased(WARNING, 1, "whatever")).getKind());
        assertEquals(IssueKind.SYNTAX,
                classifier.classify(RawDiagnostic.oneBased(INFORMATION, 1, "Lint: prefer const")).getKind());
    }

    @Test
    void testInformationalKinds() {
        assertEquals(IssueKind.SECURITY,
                classifier.classify(RawDiagnostic.oneBased(INFORMATION, 1, "Security: eval is unsafe")).getKind());
        assertEquals(IssueKind.BEST_PRACTICE,
                classifier.classify(RawDiagnostic.oneBased(HINT, 1, "Best practice: use ===")).getKind());
        assertEquals(IssueKind.OTHER,
                classifier.classify(RawDiagnostic.oneBased(HINT, 1, "Consider renaming")).getKind());
        assertEquals(IssueSeverity.INFO, classifier.classify(RawDiagnostic.oneBased(HINT, 1, "x")).getSeverity());
    }

    @Test
    void testLinesAreConvertedToOneBased() {
        assertEquals(1, classifier.classify(RawDiagnostic.zeroBased(ERROR, 0, "x")).getLine());
        assertEquals(8, classifier.classify(RawDiagnostic.zeroBased(ERROR, 7, "x")).getLine());
        assertEquals(7, classifier.classify(RawDiagnostic.oneBased(ERROR, 7, "x")).getLine());
        assertEquals(1, classifier.classify(RawDiagnostic.oneBased(ERROR, 0, "x")).getLine());
        assertEquals(1, classifier.classify(RawDiagnostic.zeroBased(ERROR, -5, "x")).getLine());
    }

    @Test
    void testValidateBuildsSuggestions() {
        ValidationResult clean = classifier.validate("ok", List.of());
        assertTrue(clean.isValid());
        assertTrue(clean.hasNoIssues());
        assertEquals(List.of(IssueClassifier.SUGGESTION_CLEAN), clean.getSuggestions());

        ValidationResult warned = classifier.validate("x", List.of(RawDiagnostic.oneBased(WARNING, 1, "w")));
        assertTrue(warned.isValid(), "warnings alone do not invalidate");
        assertFalse(warned.hasNoIssues());
        assertEquals(List.of(IssueClassifier.SUGGESTION_HAS_ISSUES), warned.getSuggestions());

        ValidationResult broken = classifier.validate("x", List.of(RawDiagnostic.oneBased(ERROR, 1, "e")));
        assertFalse(broken.isValid());
        assertEquals("x", broken.getContent());
    }
}
