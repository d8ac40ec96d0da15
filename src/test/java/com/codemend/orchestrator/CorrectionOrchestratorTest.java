package com.codemend.orchestrator;

import com.codemend.communication.InMemoryProgressEventBus;
import com.codemend.config.CorrectionSettings;
import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.cancel.ManualPollClock;
import com.codemend.core.cancel.OperationCancelledException;
import com.codemend.core.changelog.ChangeLog;
import com.codemend.core.context.FileStructureAnalyzer;
import com.codemend.core.diagnostics.DiagnosticProvider;
import com.codemend.core.diagnostics.DiagnosticStabilizationMonitor;
import com.codemend.core.event.ProgressStage;
import com.codemend.core.executor.CommandSecurityPolicy;
import com.codemend.core.executor.CommandResult;
import com.codemend.core.executor.PlanExecutor;
import com.codemend.core.executor.TransientFailureClassifier;
import com.codemend.core.filesystem.FileSystemException;
import com.codemend.core.filesystem.FileSystemManager;
import com.codemend.core.filesystem.OpenBufferRegistry;
import com.codemend.core.issue.Issue;
import com.codemend.core.issue.IssueClassifier;
import com.codemend.core.issue.IssueKind;
import com.codemend.core.issue.RawDiagnostic;
import com.codemend.core.outcome.CorrectionAttemptOutcome;
import com.codemend.core.outcome.FailureKind;
import com.codemend.core.outcome.OscillationDetector;
import com.codemend.core.outcome.OutcomeClassifier;
import com.codemend.core.plan.PlanParser;
import com.codemend.llm.CorrectionPromptBuilder;
import com.codemend.llm.GeneratedContentInspector;
import com.codemend.llm.GenerationException;
import com.codemend.llm.ScriptedGenerationClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the full generate/validate/correct loop against a real workspace.
 * Diagnostics come from markers in the file itself: a line containing
 * {@code ERR: msg} reports an error, {@code WARN: msg} a warning.
 */
class CorrectionOrchestratorTest {

    private static final String TARGET = "src/app.js";

    private static final String TWO_ERRORS_ONE_WARNING = String.join("\n",
            "import fs from 'fs' // WARN: 'fs' is declared but never used",
            "let total = 1 // ERR: Missing semicolon",
            "let name = 'x' // ERR: Unexpected token");
    private static final String ONE_WARNING =
            "import fs from 'fs' // WARN: 'fs' is declared but never used\nlet total = 1;\nlet name = 'x';";
    private static final String CLEAN = "let total = 1;\nlet name = 'x';";

    @TempDir
    Path tempDir;

    private FileSystemManager        workspace;
    private ScriptedGenerationClient generator;
    private InMemoryProgressEventBus bus;

    /** Reports one diagnostic per marker line of the current file content. */
    private final class MarkerDiagnostics implements DiagnosticProvider {
        @Override
        public List<RawDiagnostic> getDiagnostics(String target) {
            String content;
            try {
                content = workspace.readCurrent(target);
            } catch (FileSystemException e) {
                return List.of();
            }
            List<RawDiagnostic> diagnostics = new ArrayList<>();
            String[] lines = content.split("\n");
            for (int i = 0; i < lines.length; i++) {
                int err  = lines[i].indexOf("ERR: ");
                int warn = lines[i].indexOf("WARN: ");
                if (err >= 0) {
                    diagnostics.add(RawDiagnostic.oneBased(RawDiagnostic.Severity.ERROR, i + 1,
                            lines[i].substring(err + 5).trim()));
                } else if (warn >= 0) {
                    diagnostics.add(RawDiagnostic.oneBased(RawDiagnostic.Severity.WARNING, i + 1,
                            lines[i].substring(warn + 6).trim()));
                }
            }
            return diagnostics;
        }
    }

    private CorrectionOrchestrator orchestrator(int maxIterations) {
        workspace = new FileSystemManager(tempDir.toString(), new OpenBufferRegistry());
        generator = new ScriptedGenerationClient();
        bus       = new InMemoryProgressEventBus();

        ManualPollClock clock = new ManualPollClock();
        ChangeLog changeLog = new ChangeLog();
        CorrectionPromptBuilder prompts = new CorrectionPromptBuilder();
        GeneratedContentInspector inspector = new GeneratedContentInspector();
        DiagnosticProvider diagnostics = new MarkerDiagnostics();

        PlanExecutor executor = new PlanExecutor(workspace, generator, prompts, inspector, changeLog,
                new CommandSecurityPolicy(), (display, rule, token) -> true,
                (command, cwd, token) -> CommandResult.completed(0, "", "", 1),
                new TransientFailureClassifier(), bus, clock, 3, 10_000, 5_000);

        return new CorrectionOrchestrator(generator, prompts, inspector, new PlanParser(), executor, workspace,
                diagnostics,
                new DiagnosticStabilizationMonitor(diagnostics, clock, () -> 0.0, 1000, 10, 2, 100),
                new IssueClassifier(), new OutcomeClassifier(), new OscillationDetector(),
                new FileStructureAnalyzer(), changeLog, bus,
                new CorrectionSettings(maxIterations, 1000, 10, 2));
    }

    private static String modifyPlan() {
        return "{ \"planDescription\": \"Fix " + TARGET + "\", \"steps\": [ { \"step\": 1, "
                + "\"action\": \"modify_file\", \"description\": \"Fix the reported problems\", "
                + "\"path\": \"" + TARGET + "\", \"modification_prompt\": \"Resolve the listed problems\" } ] }";
    }

    private static CorrectionRequest request() {
        return CorrectionRequest.of(TARGET, "Create a counter module");
    }

    private static List<FailureKind> kinds(CorrectionResult result) {
        List<FailureKind> kinds = new ArrayList<>();
        for (CorrectionAttemptOutcome outcome : result.getHistory()) {
            kinds.add(outcome.getFailureKind());
        }
        return kinds;
    }

    // =========================================================================
    // Convergence
    // =========================================================================

    @Test
    void testCleanGenerationNeedsNoCorrection() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(3);
        generator.enqueueContent("```js\n" + CLEAN + "\n```");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.SUCCESS, result.getStatus());
        assertEquals(0, result.getIterations());
        assertEquals(CLEAN, workspace.readFile(TARGET));
        assertTrue(generator.getPlanCalls().isEmpty());
    }

    @Test
    void testImprovementThenSuccess() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(5);
        generator.enqueueContent(TWO_ERRORS_ONE_WARNING)
                 .enqueuePlan(modifyPlan()).enqueueContent(ONE_WARNING)
                 .enqueuePlan(modifyPlan()).enqueueContent(CLEAN);

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.SUCCESS, result.getStatus());
        assertTrue(result.isSuccess());
        assertEquals(2, result.getIterations());
        assertEquals(3, result.getTotalIssues());
        assertEquals(3, result.getResolvedIssues());
        assertTrue(result.getIssues().isEmpty());
        assertEquals(CLEAN, result.getContent());
        assertEquals(CLEAN, workspace.readFile(TARGET));

        assertEquals(2, result.getHistory().size());
        assertTrue(result.getHistory().get(0).isImprovement());
        assertEquals(3, result.getHistory().get(0).getIssuesBeforeCount());
        assertEquals(1, result.getHistory().get(0).getIssuesAfterCount());
        assertTrue(result.getHistory().get(1).isSuccess());

        String secondPlanRequest = generator.getPlanCalls().get(1).getInstructions();
        assertTrue(secondPlanRequest.contains("Outcome     : improved"));
    }

    @Test
    void testModifyExistingFile() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(3);
        workspace.writeFile(TARGET, "let total = 1");
        generator.enqueueContent(CLEAN);

        CorrectionResult result = orchestrator.modifyFile(
                CorrectionRequest.of(TARGET, "Add a name variable"), CancellationToken.none());

        assertEquals(CorrectionStatus.SUCCESS, result.getStatus());
        assertEquals(CLEAN, workspace.readFile(TARGET));
        assertTrue(generator.getCalls().get(0).getInstructions().contains("let total = 1"));
    }

    // =========================================================================
    // Failure kinds
    // =========================================================================

    @Test
    void testBudgetIsHonouredAndOscillationIsFlagged() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(3);
        String stuck = "let total = 1 // ERR: Missing semicolon";
        generator.enqueueContent(stuck);
        for (int i = 1; i <= 3; i++) {
            generator.enqueuePlan(modifyPlan()).enqueueContent(stuck + "\n// attempt " + i);
        }

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.PARTIAL, result.getStatus());
        assertEquals(3, result.getIterations());
        assertEquals(3, generator.getPlanCalls().size());
        assertEquals(List.of(FailureKind.NO_IMPROVEMENT, FailureKind.NO_IMPROVEMENT,
                FailureKind.OSCILLATION_DETECTED), kinds(result));

        assertFalse(generator.getPlanCalls().get(1).getContext().isOscillating());
        assertTrue(generator.getPlanCalls().get(2).getContext().isOscillating());
        assertTrue(generator.getPlanCalls().get(2).getInstructions().contains("take a different approach"));

        assertEquals(1, result.getIssues().size());
        assertEquals(stuck + "\n// attempt 3", result.getContent());
    }

    @Test
    void testRegressionIsReportedAsNewErrors() {
        CorrectionOrchestrator orchestrator = orchestrator(1);
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon\nlet name = 'x' // ERR: Unexpected token")
                 .enqueuePlan(modifyPlan())
                 .enqueueContent("let total = 1;\nlet name = 'x';\nhelper() // ERR: Cannot find name 'helper'");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.PARTIAL, result.getStatus());
        CorrectionAttemptOutcome outcome = result.getHistory().get(0);
        assertEquals(FailureKind.NEW_ERRORS_INTRODUCED, outcome.getFailureKind());
        assertEquals(1, outcome.getIssuesIntroduced().size());
        assertEquals(3, outcome.getIssuesIntroduced().get(0).getLine());
        assertEquals(1, result.getResolvedIssues());
    }

    @Test
    void testUnparseablePlanLeavesFileUntouched() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(2);
        String broken = "let total = 1 // ERR: Missing semicolon";
        generator.enqueueContent(broken)
                 .enqueuePlan("Here is my thought: just add the semicolon.")
                 .enqueuePlan(modifyPlan()).enqueueContent("let total = 1;");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.SUCCESS, result.getStatus());
        assertEquals(2, result.getIterations());
        CorrectionAttemptOutcome first = result.getHistory().get(0);
        assertEquals(FailureKind.PARSING_FAILED, first.getFailureKind());
        assertEquals(1, first.getIssuesAfterCount());
        assertTrue(generator.getPlanCalls().get(1).getInstructions().contains("parsing_failed"));
        assertEquals(4, generator.getCalls().size(), "no file generation for the rejected plan");
    }

    @Test
    void testPlanThatChangesNothingIsCommandFailed() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(1);
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon")
                 .enqueuePlan("{ \"planDescription\": \"noop\", \"steps\": [ { \"step\": 1, "
                         + "\"action\": \"create_directory\", \"description\": \"src\", \"path\": \"src\" } ] }");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.PARTIAL, result.getStatus());
        CorrectionAttemptOutcome outcome = result.getHistory().get(0);
        assertEquals(FailureKind.COMMAND_FAILED, outcome.getFailureKind());
        assertEquals(CorrectionOrchestrator.NO_OP_PLAN_MESSAGE, outcome.getFeedback().getMessage());
    }

    @Test
    void testFailingStepIsCommandFailed() {
        CorrectionOrchestrator orchestrator = orchestrator(1);
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon")
                 .enqueuePlan("{ \"planDescription\": \"run\", \"steps\": [ { \"step\": 1, "
                         + "\"action\": \"run_command\", \"description\": \"format\", \"command\": \"bash format.sh\" } ] }");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        CorrectionAttemptOutcome outcome = result.getHistory().get(0);
        assertEquals(FailureKind.COMMAND_FAILED, outcome.getFailureKind());
        assertTrue(outcome.getFeedback().getMessage().startsWith("Step 1 failed"));
    }

    @Test
    void testFailedPlanKeepsTargetChangesFromEarlierSteps() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(2);
        String partlyFixed = "let total = 1;\nlet name = 'x' // ERR: Unexpected token";
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon\nlet name = 'x' // ERR: Unexpected token")
                 .enqueuePlan("{ \"planDescription\": \"fix and format\", \"steps\": [ "
                         + "{ \"step\": 1, \"action\": \"modify_file\", \"description\": \"fix\", "
                         + "\"path\": \"" + TARGET + "\", \"modification_prompt\": \"Add the semicolon\" }, "
                         + "{ \"step\": 2, \"action\": \"run_command\", \"description\": \"format\", "
                         + "\"command\": \"bash format.sh\" } ] }")
                 .enqueueContent(partlyFixed)
                 .enqueuePlan("Here is my thought: nothing else to do.");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.PARTIAL, result.getStatus());
        assertEquals(partlyFixed, workspace.readFile(TARGET));
        assertEquals(partlyFixed, result.getContent());
        assertEquals(1, result.getIssues().size());
        assertEquals("Unexpected token", result.getIssues().get(0).getMessage());

        CorrectionAttemptOutcome first = result.getHistory().get(0);
        assertEquals(FailureKind.COMMAND_FAILED, first.getFailureKind());
        assertEquals(2, first.getIssuesBeforeCount());
        assertEquals(1, first.getIssuesAfterCount());
        assertEquals(1, result.getHistory().get(1).getIssuesBeforeCount());
        assertTrue(generator.getPlanCalls().get(1).getInstructions().contains("let total = 1;"));
    }

    @Test
    void testCancelMidPlanReportsContentOnDisk() throws Exception {
        CorrectionOrchestrator orchestrator = orchestrator(3);
        CancellationToken token = new CancellationToken();
        String partlyFixed = "let total = 1;\nlet name = 'x' // ERR: Unexpected token";
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon\nlet name = 'x' // ERR: Unexpected token")
                 .enqueuePlan("{ \"planDescription\": \"fix and add helper\", \"steps\": [ "
                         + "{ \"step\": 1, \"action\": \"modify_file\", \"description\": \"fix\", "
                         + "\"path\": \"" + TARGET + "\", \"modification_prompt\": \"Add the semicolon\" }, "
                         + "{ \"step\": 2, \"action\": \"create_file\", \"description\": \"helper\", "
                         + "\"path\": \"src/helper.js\", \"generate_prompt\": \"Write a helper\" } ] }")
                 .enqueueContent(partlyFixed)
                 .enqueueContent((instructions, context) -> {
                     token.cancel();
                     throw new OperationCancelledException();
                 });

        CorrectionResult result = orchestrator.generateFile(request(), token);

        assertEquals(CorrectionStatus.CANCELLED, result.getStatus());
        assertEquals(partlyFixed, result.getContent());
        assertEquals(2, result.getIssues().size());
        assertEquals("Unexpected token", result.getIssues().get(0).getMessage());
        assertEquals(Issue.cancelled(), result.getIssues().get(1));
    }

    @Test
    void testPlanGenerationErrorIsUnknown() {
        CorrectionOrchestrator orchestrator = orchestrator(1);
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon")
                 .enqueuePlan((instructions, context) -> { throw new GenerationException("model unavailable"); });

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.PARTIAL, result.getStatus());
        assertEquals(List.of(FailureKind.UNKNOWN), kinds(result));
    }

    // =========================================================================
    // Edge cases
    // =========================================================================

    @Test
    void testUnusableInitialOutput() {
        CorrectionOrchestrator orchestrator = orchestrator(3);
        generator.enqueueContent("I'm sorry, I can't help with that.");

        CorrectionResult result = orchestrator.generateFile(request(), CancellationToken.none());

        assertEquals(CorrectionStatus.PARTIAL, result.getStatus());
        assertEquals(1, result.getIssues().size());
        assertEquals(IssueKind.FORMAT_ERROR, result.getIssues().get(0).getKind());
        assertFalse(workspace.exists(TARGET));
        assertTrue(generator.getPlanCalls().isEmpty());
    }

    @Test
    void testModifyMissingTargetIsRejected() {
        CorrectionOrchestrator orchestrator = orchestrator(3);

        assertThrows(IllegalArgumentException.class, () -> orchestrator.modifyFile(
                CorrectionRequest.of("missing.js", "Add a function"), CancellationToken.none()));
        assertTrue(generator.getCalls().isEmpty());
    }

    @Test
    void testCancelBetweenIterations() {
        CorrectionOrchestrator orchestrator = orchestrator(5);
        CancellationToken token = new CancellationToken();
        bus.subscribe(event -> {
            if (event.getStage() == ProgressStage.CLASSIFIED) token.cancel();
        });
        String improved = "let total = 1;\nlet name = 'x' // ERR: Unexpected token";
        generator.enqueueContent("let total = 1 // ERR: Missing semicolon\nlet name = 'x' // ERR: Unexpected token")
                 .enqueuePlan(modifyPlan()).enqueueContent(improved);

        CorrectionResult result = orchestrator.generateFile(request(), token);

        assertEquals(CorrectionStatus.CANCELLED, result.getStatus());
        assertEquals(1, result.getIterations());
        assertEquals(improved, result.getContent());
        assertEquals(3, generator.getCalls().size());

        List<Issue> issues = result.getIssues();
        assertEquals(2, issues.size());
        assertEquals(Issue.cancelled(), issues.get(issues.size() - 1));
        assertEquals(1, result.getResolvedIssues());
    }

    @Test
    void testCancelledBeforeStart() {
        CorrectionOrchestrator orchestrator = orchestrator(3);
        CancellationToken token = new CancellationToken();
        token.cancel();

        CorrectionResult result = orchestrator.generateFile(request(), token);

        assertEquals(CorrectionStatus.CANCELLED, result.getStatus());
        assertEquals("", result.getContent());
        assertEquals(List.of(Issue.cancelled()), result.getIssues());
        assertTrue(generator.getCalls().isEmpty());
    }
}
