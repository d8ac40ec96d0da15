package com.codemend.orchestrator;

import com.codemend.communication.ProgressEventBus;
import com.codemend.config.CorrectionSettings;
import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.cancel.OperationCancelledException;
import com.codemend.core.changelog.ChangeLog;
import com.codemend.core.changelog.DiffSummarizer;
import com.codemend.core.context.FileStructureAnalyzer;
import com.codemend.core.context.GenerationContext;
import com.codemend.core.diagnostics.DiagnosticProvider;
import com.codemend.core.diagnostics.DiagnosticStabilizationMonitor;
import com.codemend.core.diagnostics.StabilizationOutcome;
import com.codemend.core.event.ProgressEvent;
import com.codemend.core.event.ProgressStage;
import com.codemend.core.executor.PlanExecutionReport;
import com.codemend.core.executor.PlanExecutor;
import com.codemend.core.executor.StepExecutionException;
import com.codemend.core.filesystem.FileNotFoundInWorkspaceException;
import com.codemend.core.filesystem.FileSystemException;
import com.codemend.core.filesystem.WorkspaceFiles;
import com.codemend.core.filesystem.WorkspaceUnavailableException;
import com.codemend.core.issue.Issue;
import com.codemend.core.issue.IssueClassifier;
import com.codemend.core.issue.IssueKind;
import com.codemend.core.issue.IssueSeverity;
import com.codemend.core.issue.ValidationResult;
import com.codemend.core.outcome.CorrectionAttemptOutcome;
import com.codemend.core.outcome.CorrectionFeedback;
import com.codemend.core.outcome.FailureKind;
import com.codemend.core.outcome.FeedbackComposer;
import com.codemend.core.outcome.OscillationDetector;
import com.codemend.core.outcome.OutcomeClassification;
import com.codemend.core.outcome.OutcomeClassifier;
import com.codemend.core.plan.ExecutionPlan;
import com.codemend.core.plan.PlanParseResult;
import com.codemend.core.plan.PlanParser;
import com.codemend.llm.CorrectionPromptBuilder;
import com.codemend.llm.GeneratedContentInspector;
import com.codemend.llm.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * CorrectionOrchestrator: top-level controller for one generate or modify
 * request.
 *
 * Phase flow (see {@link CorrectionPhase}):
 *   GENERATE_INITIAL → VALIDATE_INITIAL → [PLAN_GENERATE → PLAN_EXECUTE → REVALIDATE → CLASSIFY]*
 *
 * The loop runs at most {@code codemend.correction.max-iterations} times.
 * Every iteration records exactly one {@link CorrectionAttemptOutcome}; its
 * feedback is the only thing the next plan request learns about it.
 *
 * Never throws for "could not fix". Cancellation returns a CANCELLED result.
 * Workspace failures propagate as {@link WorkspaceUnavailableException}.
 */
@Component
public class CorrectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CorrectionOrchestrator.class);

    static final String NO_OP_PLAN_MESSAGE =
            "No improvement: the plan made no changes to the workspace.";
    static final String UNUSABLE_OUTPUT_MESSAGE =
            "Generated output looks like an error message rather than file content.";

    private final GenerationClient               generationClient;
    private final CorrectionPromptBuilder        promptBuilder;
    private final GeneratedContentInspector      inspector;
    private final PlanParser                     planParser;
    private final PlanExecutor                   planExecutor;
    private final WorkspaceFiles                 workspace;
    private final DiagnosticProvider             diagnosticProvider;
    private final DiagnosticStabilizationMonitor stabilizationMonitor;
    private final IssueClassifier                issueClassifier;
    private final OutcomeClassifier              outcomeClassifier;
    private final OscillationDetector            oscillationDetector;
    private final FileStructureAnalyzer          structureAnalyzer;
    private final ChangeLog                      changeLog;
    private final ProgressEventBus               eventBus;
    private final CorrectionSettings             settings;

    public CorrectionOrchestrator(
            GenerationClient               generationClient,
            CorrectionPromptBuilder        promptBuilder,
            GeneratedContentInspector      inspector,
            PlanParser                     planParser,
            PlanExecutor                   planExecutor,
            WorkspaceFiles                 workspace,
            DiagnosticProvider             diagnosticProvider,
            DiagnosticStabilizationMonitor stabilizationMonitor,
            IssueClassifier                issueClassifier,
            OutcomeClassifier              outcomeClassifier,
            OscillationDetector            oscillationDetector,
            FileStructureAnalyzer          structureAnalyzer,
            ChangeLog                      changeLog,
            ProgressEventBus               eventBus,
            CorrectionSettings             settings
    ) {
        this.generationClient     = generationClient;
        this.promptBuilder        = promptBuilder;
        this.inspector            = inspector;
        this.planParser           = planParser;
        this.planExecutor         = planExecutor;
        this.workspace            = workspace;
        this.diagnosticProvider   = diagnosticProvider;
        this.stabilizationMonitor = stabilizationMonitor;
        this.issueClassifier      = issueClassifier;
        this.outcomeClassifier    = outcomeClassifier;
        this.oscillationDetector  = oscillationDetector;
        this.structureAnalyzer    = structureAnalyzer;
        this.changeLog            = changeLog;
        this.eventBus             = eventBus;
        this.settings             = settings;
    }

    // =========================================================================
    // ENTRY POINTS
    // =========================================================================

    /** Creates the target file from the instruction, then corrects it. */
    public CorrectionResult generateFile(CorrectionRequest request, CancellationToken token) {
        RequestState state = new RequestState(request);
        log.info("========== CODEMEND GENERATE {} ==========", request.getTargetPath());

        try {
            state.enter(CorrectionPhase.GENERATE_INITIAL);
            token.throwIfCancelled();
            publish(state, ProgressStage.GENERATING, "Generating `" + request.getTargetPath() + "`", 5);

            String raw = generationClient.generate(
                    promptBuilder.initialGeneration(request.getTargetPath(), request.getInstruction(), state.context),
                    state.context, chunk -> { }, token);
            String content = inspector.clean(raw);

            if (inspector.looksLikeErrorMessage(content)) {
                return unusableOutput(state, "");
            }
            write(request.getTargetPath(), content);
            return validateAndCorrect(state, content, token);

        } catch (OperationCancelledException e) {
            return cancelled(state);
        }
    }

    /** Applies the instruction to the existing target file, then corrects it. */
    public CorrectionResult modifyFile(CorrectionRequest request, CancellationToken token) {
        RequestState state = new RequestState(request);
        log.info("========== CODEMEND MODIFY {} ==========", request.getTargetPath());

        String original;
        try {
            original = workspace.readCurrent(request.getTargetPath());
        } catch (FileNotFoundInWorkspaceException e) {
            throw new IllegalArgumentException("Target file not found: " + request.getTargetPath(), e);
        } catch (FileSystemException e) {
            throw new WorkspaceUnavailableException(e.getMessage(), e);
        }

        try {
            state.enter(CorrectionPhase.GENERATE_INITIAL);
            token.throwIfCancelled();
            publish(state, ProgressStage.GENERATING, "Modifying `" + request.getTargetPath() + "`", 5);

            String raw = generationClient.generate(
                    promptBuilder.modification(request.getTargetPath(), request.getInstruction(), original,
                            state.context),
                    state.context, chunk -> { }, token);
            String content = inspector.clean(raw);

            if (inspector.looksLikeErrorMessage(content)) {
                return unusableOutput(state, original);
            }
            if (!content.equals(original)) {
                applyEdit(request.getTargetPath(), content);
            }
            return validateAndCorrect(state, content, token);

        } catch (OperationCancelledException e) {
            return cancelled(state);
        }
    }

    // =========================================================================
    // VALIDATE_INITIAL + CORRECTION LOOP
    // =========================================================================

    private CorrectionResult validateAndCorrect(RequestState state, String content, CancellationToken token) {

        String target = state.request.getTargetPath();

        state.enter(CorrectionPhase.VALIDATE_INITIAL);
        ValidationResult validation = validate(target, content, token);
        state.lastValidated = validation;
        state.totalIssues   = validation.getIssues().size();
        publish(state, ProgressStage.VALIDATING, state.totalIssues + " issue(s) after generation",
                validation, 15);

        if (validation.hasNoIssues()) {
            return done(state, CorrectionStatus.SUCCESS);
        }

        int maxIterations = settings.getMaxIterations();
        List<Issue> before = validation.getIssues();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {

            if (token.isCancellationRequested()) {
                return cancelled(state);
            }
            state.iterations = iteration;
            int percent = 15 + (iteration - 1) * 80 / maxIterations;

            // -----------------------------------------------------------------
            // Context refresh and oscillation check
            // -----------------------------------------------------------------
            String currentContent = state.lastValidated.getContent();
            state.context = state.context
                    .withStructure(structureAnalyzer.analyze(currentContent))
                    .withSuccessfulChangeHistory(changeLog.recentSuccessfulChanges());
            boolean oscillating = oscillationDetector.detect(state.context.getRecentOutcomes());
            state.context = state.context.withOscillating(oscillating);

            // -----------------------------------------------------------------
            // PLAN_GENERATE
            // -----------------------------------------------------------------
            state.enter(CorrectionPhase.PLAN_GENERATE);
            publish(state, ProgressStage.PLANNING, "Correction attempt " + iteration + "/" + maxIterations
                    + " (" + before.size() + " issue(s))", percent);

            String planText;
            try {
                planText = generationClient.generatePlan(
                        promptBuilder.correctionPlan(target, currentContent, before, state.context,
                                iteration, maxIterations),
                        state.context, chunk -> { }, token);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] Plan generation failed: {}", e.getMessage());
                record(state, shortCircuit(iteration, before, FailureKind.UNKNOWN,
                        FeedbackComposer.unknown("Plan generation failed: " + e.getMessage(), before)));
                continue;
            }

            PlanParseResult parsed = planParser.parse(planText);
            if (!parsed.isSuccess()) {
                log.warn("[Orchestrator] Plan rejected: {}", parsed.getError());
                record(state, shortCircuit(iteration, before, FailureKind.PARSING_FAILED,
                        FeedbackComposer.parsingFailed(parsed.getError(), planText, before)));
                continue;
            }
            ExecutionPlan plan = parsed.getPlan();

            // -----------------------------------------------------------------
            // PLAN_EXECUTE
            // -----------------------------------------------------------------
            state.enter(CorrectionPhase.PLAN_EXECUTE);
            PlanExecutionReport report;
            try {
                report = planExecutor.execute(plan, state.context, state.request.getRequestId(), token);
            } catch (StepExecutionException e) {
                // Earlier steps of the plan may already have rewritten the target.
                ValidationResult current = revalidateIfChanged(state, target, percent, token);
                List<Issue> remaining = current.getIssues();
                record(state, CorrectionAttemptOutcome.builder(iteration)
                        .issuesBeforeCount(before.size())
                        .issuesRemaining(remaining)
                        .diffSummary(current == state.lastValidated ? null
                                : DiffSummarizer.summarize(currentContent, current.getContent(), target).getDiff())
                        .failureKind(FailureKind.COMMAND_FAILED)
                        .feedback(FeedbackComposer.commandFailed(e.getMessage(), remaining))
                        .build());
                state.lastValidated = current;
                before = remaining;
                continue;
            }
            if (report.isNoOp()) {
                log.info("[Orchestrator] Plan '{}' changed nothing", plan.getPlanDescription());
                record(state, shortCircuit(iteration, before, FailureKind.COMMAND_FAILED,
                        FeedbackComposer.commandFailed(NO_OP_PLAN_MESSAGE, before)));
                continue;
            }

            // -----------------------------------------------------------------
            // REVALIDATE
            // -----------------------------------------------------------------
            state.enter(CorrectionPhase.REVALIDATE);
            String updated = readCurrent(target);
            publish(state, ProgressStage.REVALIDATING, "Re-validating `" + target + "`", percent);
            ValidationResult revalidation = validate(target, updated, token);
            List<Issue> after = revalidation.getIssues();

            // -----------------------------------------------------------------
            // CLASSIFY
            // -----------------------------------------------------------------
            state.enter(CorrectionPhase.CLASSIFY);
            OutcomeClassification classification = outcomeClassifier.classify(before, after, oscillating);
            String diff = DiffSummarizer.summarize(currentContent, updated, target).getDiff();

            CorrectionAttemptOutcome outcome = CorrectionAttemptOutcome.builder(iteration)
                    .issuesBeforeCount(before.size())
                    .issuesRemaining(after)
                    .issuesIntroduced(classification.getIntroduced())
                    .diffSummary(diff)
                    .failureKind(classification.getFailureKind())
                    .feedback(FeedbackComposer.forComparison(classification.getFailureKind(), before, after,
                            classification.getIntroduced(), diff))
                    .build();
            state.lastValidated = revalidation;
            record(state, outcome);

            if (classification.isSuccess()) {
                state.context = state.context.cleared();
                return done(state, CorrectionStatus.SUCCESS);
            }
            before = after;
        }

        log.warn("[Orchestrator] Budget of {} iterations spent, {} issue(s) remain",
                maxIterations, state.lastValidated.getIssues().size());
        return done(state, CorrectionStatus.PARTIAL);
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private ValidationResult validate(String target, String content, CancellationToken token) {
        StabilizationOutcome stabilization = stabilizationMonitor.waitForStable(target,
                settings.getStabilizationTimeoutMs(), settings.getStabilizationIntervalMs(),
                settings.getRequiredStableChecks(), token);
        if (stabilization == StabilizationOutcome.CANCELLED) {
            throw new OperationCancelledException();
        }
        return issueClassifier.validate(content, diagnosticProvider.getDiagnostics(target));
    }

    private ValidationResult revalidateIfChanged(RequestState state, String target, int percent,
                                                 CancellationToken token) {
        String onDisk = readCurrent(target);
        if (onDisk.equals(state.lastValidated.getContent())) {
            return state.lastValidated;
        }
        state.enter(CorrectionPhase.REVALIDATE);
        publish(state, ProgressStage.REVALIDATING, "Re-validating `" + target + "` after a failed plan", percent);
        return validate(target, onDisk, token);
    }

    private static CorrectionAttemptOutcome shortCircuit(int iteration, List<Issue> before, FailureKind kind,
                                                         CorrectionFeedback feedback) {
        return CorrectionAttemptOutcome.builder(iteration)
                .issuesBeforeCount(before.size())
                .issuesRemaining(before)
                .failureKind(kind)
                .feedback(feedback)
                .build();
    }

    private void record(RequestState state, CorrectionAttemptOutcome outcome) {
        state.history.add(outcome);
        state.context = state.context.withOutcome(outcome);
        log.info("[Orchestrator] {}", outcome);
        publish(state, ProgressStage.CLASSIFIED,
                outcome.getFeedback() != null ? outcome.getFeedback().getMessage() : outcome.toString(),
                outcome.getIssuesRemaining(), -1);
    }

    private CorrectionResult done(RequestState state, CorrectionStatus status) {
        state.enter(CorrectionPhase.DONE);
        ValidationResult last = state.lastValidated;
        CorrectionResult result = new CorrectionResult(state.request.getRequestId(), status,
                last.getContent(), last.getIssues(), last.getSuggestions(),
                state.iterations, state.totalIssues, state.history);
        log.info("========== CODEMEND {} ({} iterations, {} issue(s) remain) ==========",
                status, state.iterations, last.getIssues().size());
        publish(state, ProgressStage.COMPLETED, status + ": " + last.getIssues().size() + " issue(s) remain",
                last, 100);
        return result;
    }

    private CorrectionResult cancelled(RequestState state) {
        log.info("[Orchestrator] Request {} cancelled during {}", state.request.getRequestId(), state.phase);
        ValidationResult last = state.lastValidated;
        List<Issue> issues = new ArrayList<>();
        String content = "";
        List<String> suggestions = List.of();
        if (last != null) {
            last = currentWithoutWaiting(state.request.getTargetPath(), last);
            issues.addAll(last.getIssues());
            content     = last.getContent();
            suggestions = last.getSuggestions();
        }
        issues.add(Issue.cancelled());
        state.enter(CorrectionPhase.DONE);
        publish(state, ProgressStage.CANCELLED, OperationCancelledException.MESSAGE, issues, -1);
        return new CorrectionResult(state.request.getRequestId(), CorrectionStatus.CANCELLED, content, issues,
                suggestions, state.iterations, state.totalIssues, state.history);
    }

    /** No stabilization wait here: the token is already cancelled. */
    private ValidationResult currentWithoutWaiting(String target, ValidationResult last) {
        String onDisk = readCurrent(target);
        if (onDisk.equals(last.getContent())) {
            return last;
        }
        return issueClassifier.validate(onDisk, diagnosticProvider.getDiagnostics(target));
    }

    private CorrectionResult unusableOutput(RequestState state, String content) {
        log.warn("[Orchestrator] {}", UNUSABLE_OUTPUT_MESSAGE);
        Issue issue = new Issue(IssueKind.FORMAT_ERROR, IssueSeverity.ERROR, 1, UNUSABLE_OUTPUT_MESSAGE,
                null, "CodeMend");
        state.lastValidated = new ValidationResult(content, List.of(issue),
                List.of("Retry the request or rephrase the instruction."));
        state.totalIssues   = 1;
        return done(state, CorrectionStatus.PARTIAL);
    }

    private void write(String target, String content) {
        try {
            if (workspace.exists(target)) {
                workspace.applyEdit(target, content);
            } else {
                workspace.writeFile(target, content);
            }
        } catch (FileSystemException e) {
            throw new WorkspaceUnavailableException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    private void applyEdit(String target, String content) {
        try {
            workspace.applyEdit(target, content);
        } catch (FileSystemException e) {
            throw new WorkspaceUnavailableException("Cannot edit " + target + ": " + e.getMessage(), e);
        }
    }

    private String readCurrent(String target) {
        try {
            return workspace.readCurrent(target);
        } catch (FileSystemException e) {
            throw new WorkspaceUnavailableException("Cannot read " + target + ": " + e.getMessage(), e);
        }
    }

    private void publish(RequestState state, ProgressStage stage, String message, int percent) {
        eventBus.publish(new ProgressEvent(state.request.getRequestId(), stage, message, null, null, percent));
    }

    private void publish(RequestState state, ProgressStage stage, String message,
                         ValidationResult validation, int percent) {
        eventBus.publish(new ProgressEvent(state.request.getRequestId(), stage, message,
                validation.getIssues(), validation.getSuggestions(), percent));
    }

    private void publish(RequestState state, ProgressStage stage, String message, List<Issue> issues, int percent) {
        eventBus.publish(new ProgressEvent(state.request.getRequestId(), stage, message, issues, null, percent));
    }

    /** Mutable per-request bookkeeping; never shared between requests. */
    private static final class RequestState {
        final CorrectionRequest              request;
        final List<CorrectionAttemptOutcome> history = new ArrayList<>();
        GenerationContext                    context;
        ValidationResult                     lastValidated;
        CorrectionPhase                      phase = CorrectionPhase.INIT;
        int                                  iterations;
        int                                  totalIssues;

        RequestState(CorrectionRequest request) {
            this.request = request;
            this.context = GenerationContext.initial(request.getProjectContext(), request.getRelevantSnippets());
        }

        void enter(CorrectionPhase next) {
            log.debug("[Orchestrator] {} → {}", phase, next);
            phase = next;
        }
    }
}
