package com.codemend.core.executor;

import com.codemend.communication.ProgressEventBus;
import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.cancel.OperationCancelledException;
import com.codemend.core.cancel.PollClock;
import com.codemend.core.changelog.ChangeLog;
import com.codemend.core.changelog.ChangeRecord;
import com.codemend.core.changelog.ChangeType;
import com.codemend.core.changelog.DiffSummarizer;
import com.codemend.core.context.GenerationContext;
import com.codemend.core.event.ProgressEvent;
import com.codemend.core.event.ProgressStage;
import com.codemend.core.filesystem.FileSystemException;
import com.codemend.core.filesystem.WorkspaceFiles;
import com.codemend.core.filesystem.WorkspaceUnavailableException;
import com.codemend.core.plan.CreateDirectoryStep;
import com.codemend.core.plan.CreateFileStep;
import com.codemend.core.plan.ExecutionPlan;
import com.codemend.core.plan.ModifyFileStep;
import com.codemend.core.plan.PlanStep;
import com.codemend.core.plan.RunCommandStep;
import com.codemend.llm.CorrectionPromptBuilder;
import com.codemend.llm.GeneratedContentInspector;
import com.codemend.llm.GenerationClient;
import com.codemend.llm.UnusableContentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.AccessDeniedException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PlanExecutor: applies a correction plan to the workspace, one step at a
 * time, in declared order.
 *
 * Failure handling per step:
 *   transient (rate limit, timeout, network) → retried up to the budget
 *                                              with a growing, cancellable delay
 *   anything else                            → StepExecutionException
 *   cancellation                             → OperationCancelledException, unwrapped
 *   workspace permission failure             → WorkspaceUnavailableException
 *
 * Steps that already ran are not rolled back.
 */
@Component
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final WorkspaceFiles             workspace;
    private final GenerationClient           generationClient;
    private final CorrectionPromptBuilder    promptBuilder;
    private final GeneratedContentInspector  inspector;
    private final ChangeLog                  changeLog;
    private final CommandSecurityPolicy      securityPolicy;
    private final CommandConfirmation        confirmation;
    private final CommandRunner              commandRunner;
    private final TransientFailureClassifier transientClassifier;
    private final ProgressEventBus           eventBus;
    private final PollClock                  clock;

    private final int  maxTransientRetries;
    private final long retryBaseDelayMs;
    private final long retryStepDelayMs;

    @Autowired
    public PlanExecutor(
            WorkspaceFiles workspace,
            GenerationClient generationClient,
            CorrectionPromptBuilder promptBuilder,
            GeneratedContentInspector inspector,
            ChangeLog changeLog,
            CommandSecurityPolicy securityPolicy,
            CommandConfirmation confirmation,
            CommandRunner commandRunner,
            TransientFailureClassifier transientClassifier,
            ProgressEventBus eventBus,
            @Value("${codemend.executor.max-transient-retries:3}") int maxTransientRetries,
            @Value("${codemend.executor.retry-base-delay-ms:10000}") long retryBaseDelayMs,
            @Value("${codemend.executor.retry-step-delay-ms:5000}") long retryStepDelayMs
    ) {
        this(workspace, generationClient, promptBuilder, inspector, changeLog, securityPolicy,
             confirmation, commandRunner, transientClassifier, eventBus, PollClock.SYSTEM,
             maxTransientRetries, retryBaseDelayMs, retryStepDelayMs);
    }

    public PlanExecutor(
            WorkspaceFiles workspace,
            GenerationClient generationClient,
            CorrectionPromptBuilder promptBuilder,
            GeneratedContentInspector inspector,
            ChangeLog changeLog,
            CommandSecurityPolicy securityPolicy,
            CommandConfirmation confirmation,
            CommandRunner commandRunner,
            TransientFailureClassifier transientClassifier,
            ProgressEventBus eventBus,
            PollClock clock,
            int maxTransientRetries,
            long retryBaseDelayMs,
            long retryStepDelayMs
    ) {
        this.workspace           = workspace;
        this.generationClient    = generationClient;
        this.promptBuilder       = promptBuilder;
        this.inspector           = inspector;
        this.changeLog           = changeLog;
        this.securityPolicy      = securityPolicy;
        this.confirmation        = confirmation;
        this.commandRunner       = commandRunner;
        this.transientClassifier = transientClassifier;
        this.eventBus            = eventBus;
        this.clock               = clock;
        this.maxTransientRetries = maxTransientRetries;
        this.retryBaseDelayMs    = retryBaseDelayMs;
        this.retryStepDelayMs    = retryStepDelayMs;
    }

    /**
     * Executes every step of the plan.
     *
     * @throws StepExecutionException       a step failed and was not retried, or ran out of retries
     * @throws OperationCancelledException  the token was cancelled
     * @throws WorkspaceUnavailableException the workspace refused access
     */
    public PlanExecutionReport execute(ExecutionPlan plan, GenerationContext context,
                                       String requestId, CancellationToken token) {

        List<PlanStep> steps = plan.getSteps();
        int total = steps.size();
        Set<String> affectedPaths = new LinkedHashSet<>();
        List<StepReport> reports = new ArrayList<>();

        log.info("[PlanExecutor] Executing plan '{}' ({} steps)", plan.getPlanDescription(), total);

        try {
            for (int i = 0; i < total; i++) {
                token.throwIfCancelled();
                PlanStep step = steps.get(i);
                reports.add(executeWithRetry(step, i, total, context, requestId, token, affectedPaths));
            }
        } catch (RuntimeException e) {
            changeLog.discardPending();
            throw e;
        }

        changeLog.completeChangeSet(plan.getPlanDescription());
        PlanExecutionReport report = new PlanExecutionReport(affectedPaths, reports);
        log.info("[PlanExecutor] Plan finished: {} completed, {} skipped, {} no-op",
                report.countWithStatus(StepStatus.COMPLETED),
                report.countWithStatus(StepStatus.SKIPPED),
                report.countWithStatus(StepStatus.NO_OP));
        return report;
    }

    private StepReport executeWithRetry(PlanStep step, int index, int total, GenerationContext context,
                                        String requestId, CancellationToken token, Set<String> affectedPaths) {
        int attempt = 0;
        while (true) {
            String description = describe(step, index, total, attempt, maxTransientRetries);
            eventBus.publish(new ProgressEvent(requestId, ProgressStage.EXECUTING_STEP, description,
                    null, null, index * 100 / total));

            try {
                StepStatus status = executeStep(step, context, requestId, token, affectedPaths);
                log.info("[PlanExecutor] {} -> {}", description, status);
                return new StepReport(step.getNumber(), step.getAction(), description, status, attempt);

            } catch (OperationCancelledException | WorkspaceUnavailableException e) {
                throw e;

            } catch (Exception e) {
                if (e instanceof FileSystemException && e.getCause() instanceof AccessDeniedException) {
                    throw new WorkspaceUnavailableException(e.getMessage(), e);
                }

                if (attempt < maxTransientRetries && transientClassifier.isTransient(e)) {
                    attempt++;
                    long delay = retryBaseDelayMs + attempt * retryStepDelayMs;
                    log.warn("[PlanExecutor] Transient failure in step {}/{}: {}. Retrying in {}ms ({}/{})",
                            index + 1, total, e.getMessage(), delay, attempt, maxTransientRetries);
                    eventBus.publish(ProgressEvent.of(requestId, ProgressStage.EXECUTING_STEP,
                            "Step " + (index + 1) + " hit a transient error, retrying in "
                                    + (delay / 1000) + "s (" + attempt + "/" + maxTransientRetries + ")"));
                    if (!clock.sleep(delay, token)) {
                        throw new OperationCancelledException();
                    }
                    continue;
                }

                log.error("[PlanExecutor] {} failed: {}", description, e.getMessage());
                throw new StepExecutionException(index + 1, description, e);
            }
        }
    }

    static String describe(PlanStep step, int index, int total, int attempt, int maxRetries) {
        String base = step.getDescription() != null && !step.getDescription().isBlank()
                ? step.getDescription()
                : step.defaultDescription();
        String text = "Step " + (index + 1) + "/" + total + ": " + base;
        return attempt > 0 ? text + " (Auto-retry " + attempt + "/" + maxRetries + ")" : text;
    }

    // ================================================================
    // Step handlers
    // ================================================================

    private StepStatus executeStep(PlanStep step, GenerationContext context, String requestId,
                                   CancellationToken token, Set<String> affectedPaths) throws FileSystemException {
        if (step instanceof CreateDirectoryStep) {
            return createDirectory((CreateDirectoryStep) step);
        }
        if (step instanceof CreateFileStep) {
            return createFile((CreateFileStep) step, context, token, affectedPaths);
        }
        if (step instanceof ModifyFileStep) {
            return modifyFile((ModifyFileStep) step, context, token, affectedPaths);
        }
        if (step instanceof RunCommandStep) {
            return runCommand((RunCommandStep) step, requestId, token);
        }
        throw new IllegalArgumentException("Unsupported step action: " + step.getAction());
    }

    private StepStatus createDirectory(CreateDirectoryStep step) throws FileSystemException {
        if (workspace.exists(step.getPath())) {
            return StepStatus.NO_OP;
        }
        workspace.createDirectory(step.getPath());
        changeLog.logChange(new ChangeRecord(step.getPath(), ChangeType.CREATED,
                "Created directory `" + step.getPath() + "`", "", Instant.now()));
        return StepStatus.COMPLETED;
    }

    private StepStatus createFile(CreateFileStep step, GenerationContext context, CancellationToken token,
                                  Set<String> affectedPaths) throws FileSystemException {
        String path = step.getPath();
        String content;
        if (step.isGenerated()) {
            String raw = generationClient.generate(
                    promptBuilder.fileCreation(path, step.getGeneratePrompt(), context), context, token);
            content = checkedContent(raw, path);
        } else {
            content = step.getContent();
        }

        String existing = workspace.exists(path) ? workspace.readCurrent(path) : null;
        if (content.equals(existing)) {
            log.debug("[PlanExecutor] `{}` already has the requested content", path);
            return StepStatus.NO_OP;
        }

        if (existing != null) {
            workspace.applyEdit(path, content);
        } else {
            workspace.writeFile(path, content);
        }
        record(path, existing, content, existing == null ? ChangeType.CREATED : ChangeType.MODIFIED);
        affectedPaths.add(path);
        return StepStatus.COMPLETED;
    }

    private StepStatus modifyFile(ModifyFileStep step, GenerationContext context, CancellationToken token,
                                  Set<String> affectedPaths) throws FileSystemException {
        String path = step.getPath();
        String current = workspace.readCurrent(path);

        String raw = generationClient.generate(
                promptBuilder.modification(path, step.getModificationPrompt(), current, context), context, token);
        String updated = checkedContent(raw, path);

        if (updated.equals(current)) {
            log.debug("[PlanExecutor] Modification of `{}` produced identical content", path);
            return StepStatus.NO_OP;
        }

        workspace.applyEdit(path, updated);
        record(path, current, updated, ChangeType.MODIFIED);
        affectedPaths.add(path);
        return StepStatus.COMPLETED;
    }

    private StepStatus runCommand(RunCommandStep step, String requestId, CancellationToken token) {
        CommandLine command = CommandLine.parse(step.getCommand());
        ExecutableRule rule = securityPolicy.check(command);

        String display = command.toDisplayString();
        if (!confirmation.confirm(display, rule, token)) {
            log.info("[PlanExecutor] Command declined, skipping: {}", display);
            eventBus.publish(ProgressEvent.of(requestId, ProgressStage.COMMAND_OUTPUT,
                    "Skipped command: " + display));
            return StepStatus.SKIPPED;
        }

        CommandResult result = commandRunner.run(command, workspace.getRoot(), token);
        if (result.isCancelled()) {
            throw new OperationCancelledException();
        }
        if (!result.getStdout().isBlank()) {
            eventBus.publish(ProgressEvent.of(requestId, ProgressStage.COMMAND_OUTPUT, result.getStdout()));
        }
        if (!result.getStderr().isBlank()) {
            eventBus.publish(ProgressEvent.of(requestId, ProgressStage.COMMAND_OUTPUT, result.getStderr()));
        }

        if (result.isTimedOut()) {
            throw new CommandFailedException("Command `" + display + "` timed out", result);
        }
        if (!result.isSuccess()) {
            throw new CommandFailedException("Command `" + display + "` exited with code "
                    + result.getExitCode(), result);
        }
        return StepStatus.COMPLETED;
    }

    private String checkedContent(String raw, String path) {
        String content = inspector.clean(raw);
        if (inspector.looksLikeErrorMessage(content)) {
            throw new UnusableContentException("Generated output for `" + path + "` looks like a message, not file content");
        }
        return content;
    }

    private void record(String path, String before, String after, ChangeType type) {
        DiffSummarizer.FileChangeSummary summary = DiffSummarizer.summarize(before, after, path);
        changeLog.logChange(new ChangeRecord(path, type, summary.getSummary(), summary.getDiff(), Instant.now()));
    }
}
