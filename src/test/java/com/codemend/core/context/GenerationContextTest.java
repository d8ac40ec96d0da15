package com.codemend.core.context;

import com.codemend.core.outcome.CorrectionAttemptOutcome;
import com.codemend.core.outcome.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenerationContextTest {

    private static CorrectionAttemptOutcome failed(int iteration) {
        return CorrectionAttemptOutcome.builder(iteration)
                .failureKind(FailureKind.NO_IMPROVEMENT)
                .build();
    }

    @Test
    void testInitialContext() {
        GenerationContext context = GenerationContext.initial(null, "snippet");

        assertEquals(0, context.getVersion());
        assertEquals("", context.getProjectContext());
        assertEquals("snippet", context.getRelevantSnippets());
        assertTrue(context.getRecentOutcomes().isEmpty());
        assertNull(context.getLastOutcome());
        assertFalse(context.isOscillating());
        assertSame(FileStructureAnalysis.EMPTY, context.getFileStructure());
    }

    @Test
    void testReducersReturnNewVersions() {
        GenerationContext v0 = GenerationContext.initial("p", "s");
        GenerationContext v1 = v0.withOutcome(failed(1));
        GenerationContext v2 = v1.withOscillating(true);

        assertEquals(1, v1.getVersion());
        assertEquals(2, v2.getVersion());
        assertTrue(v0.getRecentOutcomes().isEmpty(), "earlier versions are untouched");
        assertFalse(v1.isOscillating());
        assertTrue(v2.isOscillating());
        assertEquals(1, v2.getLastOutcome().getIteration());
    }

    @Test
    void testOutcomeHistoryIsBounded() {
        GenerationContext context = GenerationContext.initial("", "");
        for (int i = 1; i <= 7; i++) {
            context = context.withOutcome(failed(i));
        }

        List<CorrectionAttemptOutcome> recent = context.getRecentOutcomes();
        assertEquals(GenerationContext.MAX_RECENT_OUTCOMES, recent.size());
        assertEquals(3, recent.get(0).getIteration());
        assertEquals(7, recent.get(recent.size() - 1).getIteration());
    }

    @Test
    void testClearedDropsHistoryButKeepsRequestData() {
        GenerationContext context = GenerationContext.initial("project", "snips")
                .withSuccessfulChangeHistory("history")
                .withOutcome(failed(1))
                .withOscillating(true)
                .cleared();

        assertTrue(context.getRecentOutcomes().isEmpty());
        assertNull(context.getLastOutcome());
        assertFalse(context.isOscillating());
        assertEquals("project", context.getProjectContext());
        assertEquals("history", context.getSuccessfulChangeHistory());
    }
}
