package com.codemend.core.context;

import com.codemend.core.outcome.CorrectionAttemptOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * State carried between correction iterations of one request.
 *
 * Immutable: every change returns a new instance with {@link #getVersion()}
 * incremented, so collaborators that receive a context cannot alter the
 * orchestrator's copy. {@link #withOutcome} is the reducer applied once per
 * iteration.
 */
public final class GenerationContext {

    public static final int MAX_RECENT_OUTCOMES = 5;

    private final int                            version;
    private final String                         projectContext;
    private final String                         relevantSnippets;
    private final FileStructureAnalysis          fileStructure;
    private final String                         successfulChangeHistory;
    private final List<CorrectionAttemptOutcome> recentOutcomes;
    private final boolean                        oscillating;
    private final CorrectionAttemptOutcome       lastOutcome;     // nullable

    private GenerationContext(int version, String projectContext, String relevantSnippets,
                              FileStructureAnalysis fileStructure, String successfulChangeHistory,
                              List<CorrectionAttemptOutcome> recentOutcomes, boolean oscillating,
                              CorrectionAttemptOutcome lastOutcome) {
        this.version                 = version;
        this.projectContext          = projectContext != null ? projectContext : "";
        this.relevantSnippets        = relevantSnippets != null ? relevantSnippets : "";
        this.fileStructure           = fileStructure != null ? fileStructure : FileStructureAnalysis.EMPTY;
        this.successfulChangeHistory = successfulChangeHistory != null ? successfulChangeHistory : "";
        this.recentOutcomes          = List.copyOf(recentOutcomes);
        this.oscillating             = oscillating;
        this.lastOutcome             = lastOutcome;
    }

    public static GenerationContext initial(String projectContext, String relevantSnippets) {
        return new GenerationContext(0, projectContext, relevantSnippets, null, null,
                List.of(), false, null);
    }

    // ================================================================
    // Reducers
    // ================================================================

    /** Appends the outcome, keeping only the most recent {@value #MAX_RECENT_OUTCOMES}. */
    public GenerationContext withOutcome(CorrectionAttemptOutcome outcome) {
        List<CorrectionAttemptOutcome> outcomes = new ArrayList<>(recentOutcomes);
        outcomes.add(outcome);
        while (outcomes.size() > MAX_RECENT_OUTCOMES) {
            outcomes.remove(0);
        }
        return new GenerationContext(version + 1, projectContext, relevantSnippets, fileStructure,
                successfulChangeHistory, outcomes, oscillating, outcome);
    }

    public GenerationContext withOscillating(boolean value) {
        return new GenerationContext(version + 1, projectContext, relevantSnippets, fileStructure,
                successfulChangeHistory, recentOutcomes, value, lastOutcome);
    }

    public GenerationContext withStructure(FileStructureAnalysis analysis) {
        return new GenerationContext(version + 1, projectContext, relevantSnippets, analysis,
                successfulChangeHistory, recentOutcomes, oscillating, lastOutcome);
    }

    public GenerationContext withSuccessfulChangeHistory(String history) {
        return new GenerationContext(version + 1, projectContext, relevantSnippets, fileStructure,
                history, recentOutcomes, oscillating, lastOutcome);
    }

    /** Drops outcome history and the oscillation flag. */
    public GenerationContext cleared() {
        return new GenerationContext(version + 1, projectContext, relevantSnippets, fileStructure,
                successfulChangeHistory, List.of(), false, null);
    }

    // ================================================================
    // Accessors
    // ================================================================

    public int                            getVersion()                 { return version; }
    public String                         getProjectContext()          { return projectContext; }
    public String                         getRelevantSnippets()        { return relevantSnippets; }
    public FileStructureAnalysis          getFileStructure()           { return fileStructure; }
    public String                         getSuccessfulChangeHistory() { return successfulChangeHistory; }
    public List<CorrectionAttemptOutcome> getRecentOutcomes()          { return recentOutcomes; }
    public boolean                        isOscillating()              { return oscillating; }
    public CorrectionAttemptOutcome       getLastOutcome()             { return lastOutcome; }

    @Override
    public String toString() {
        return "GenerationContext{v" + version + ", outcomes=" + recentOutcomes.size()
                + ", oscillating=" + oscillating + "}";
    }
}
