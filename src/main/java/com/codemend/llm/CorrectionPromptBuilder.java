package com.codemend.llm;

import com.codemend.core.context.GenerationContext;
import com.codemend.core.issue.Issue;
import com.codemend.core.issue.IssueGrouping;
import com.codemend.core.outcome.CorrectionAttemptOutcome;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Instructions sent to the {@link GenerationClient}.
 *
 * The correction plan prompt is the only place where earlier attempts reach
 * the model: the latest outcome's feedback and, when flagged, the
 * oscillation warning.
 */
@Component
public class CorrectionPromptBuilder {

    static final String PLAN_FORMAT = """
            Respond with ONLY this JSON object:
            {
              "planDescription": "<one sentence>",
              "steps": [
                { "step": 1, "action": "modify_file", "description": "<what and why>",
                  "path": "<relative path>", "modification_prompt": "<precise instruction>" }
              ]
            }
            Allowed actions: create_directory (path), create_file (path + content OR generate_prompt),
            modify_file (path + modification_prompt), run_command (command).
            Number steps from 1. Paths are relative to the workspace root and never contain "..".
            """;

    public String initialGeneration(String targetPath, String instruction, GenerationContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Create the file `").append(targetPath).append("`.\n\n");
        sb.append("Request:\n").append(instruction).append("\n");
        appendContext(sb, context);
        return sb.toString();
    }

    public String modification(String targetPath, String instruction, String currentContent,
                               GenerationContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Modify the file `").append(targetPath).append("`.\n\n");
        sb.append("Instruction:\n").append(instruction).append("\n\n");
        sb.append("Current content:\n```\n").append(currentContent).append("\n```\n");
        appendContext(sb, context);
        sb.append("\nReturn the complete updated file.\n");
        return sb.toString();
    }

    public String fileCreation(String targetPath, String generatePrompt, GenerationContext context) {
        return initialGeneration(targetPath, generatePrompt, context);
    }

    public String correctionPlan(String targetPath, String content, List<Issue> issues,
                                 GenerationContext context, int iteration, int maxIterations) {
        StringBuilder sb = new StringBuilder();
        sb.append("Correction attempt ").append(iteration).append(" of ").append(maxIterations)
          .append(" for `").append(targetPath).append("`.\n\n");

        sb.append("Outstanding issues (").append(issues.size()).append("):\n");
        sb.append(IssueGrouping.render(issues, content));

        sb.append("Current content:\n```\n").append(content).append("\n```\n");

        CorrectionAttemptOutcome last = context.getLastOutcome();
        if (last != null && last.getFeedback() != null) {
            sb.append("\n").append(last.getFeedback().toPromptSection());
        }
        if (context.isOscillating()) {
            sb.append("\nWARNING: the last two attempts left the same issues unresolved. ")
              .append("Do not repeat them; take a different approach.\n");
        }

        appendContext(sb, context);
        sb.append("\n").append(PLAN_FORMAT);
        return sb.toString();
    }

    private static void appendContext(StringBuilder sb, GenerationContext context) {
        if (!context.getProjectContext().isBlank()) {
            sb.append("\nProject context:\n").append(context.getProjectContext()).append("\n");
        }
        if (!context.getRelevantSnippets().isBlank()) {
            sb.append("\nRelevant snippets:\n").append(context.getRelevantSnippets()).append("\n");
        }
        String structure = context.getFileStructure().toPromptSection();
        if (!structure.isEmpty()) {
            sb.append("\n").append(structure);
        }
        if (!context.getSuccessfulChangeHistory().isBlank()) {
            sb.append("\n").append(context.getSuccessfulChangeHistory());
        }
    }
}
