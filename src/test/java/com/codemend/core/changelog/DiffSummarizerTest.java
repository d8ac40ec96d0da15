package com.codemend.core.changelog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffSummarizerTest {

    @Test
    void testModification() {
        DiffSummarizer.FileChangeSummary summary = DiffSummarizer.summarize(
                "const a = 1\nconst b = 2\n", "const a = 1;\nconst b = 2\n", "src/a.js");

        assertTrue(summary.hasChanges());
        assertEquals(1, summary.getAddedLines());
        assertEquals(1, summary.getRemovedLines());
        assertEquals("Modified `src/a.js`: +1 -1 lines", summary.getSummary());
        assertTrue(summary.getDiff().contains("--- a/src/a.js"));
        assertTrue(summary.getDiff().contains("-const a = 1\n"));
        assertTrue(summary.getDiff().contains("+const a = 1;"));
    }

    @Test
    void testCreation() {
        DiffSummarizer.FileChangeSummary summary = DiffSummarizer.summarize(null, "a\nb", "new.js");

        assertEquals("Created `new.js` (2 lines)", summary.getSummary());
        assertEquals(0, summary.getRemovedLines());
    }

    @Test
    void testNoChanges() {
        DiffSummarizer.FileChangeSummary summary = DiffSummarizer.summarize("same", "same", "a.js");

        assertFalse(summary.hasChanges());
        assertEquals("", summary.getDiff());
        assertEquals("No changes to `a.js`", summary.getSummary());
    }
}
