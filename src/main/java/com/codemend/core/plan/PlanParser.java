package com.codemend.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw generation output into an {@link ExecutionPlan}.
 *
 * Expected shape:
 * <pre>
 * {
 *   "planDescription": "...",
 *   "steps": [
 *     { "step": 1, "action": "modify_file", "description": "...",
 *       "path": "src/app.ts", "modification_prompt": "..." },
 *     ...
 *   ]
 * }
 * </pre>
 *
 * Models wrap JSON in markdown fences, prepend prose, leave trailing commas
 * and emit raw newlines inside strings; all of that is tolerated. Anything
 * structurally wrong is reported through {@link PlanParseResult#failure}.
 * {@link #parse} never throws.
 */
@Component
public class PlanParser {

    private static final Logger log = LoggerFactory.getLogger(PlanParser.class);

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    /** Conversational or tool-call output that is never a plan. */
    private static final List<Pattern> UNWANTED_PATTERNS = List.of(
            Pattern.compile("<execute_bash>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthought\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*(true|false|null)\\b", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern FENCE = Pattern.compile("```(json|typescript)?");

    public PlanParseResult parse(String text) {
        if (text == null || text.isBlank()) {
            return fail("Plan response was empty.");
        }

        for (Pattern pattern : UNWANTED_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return fail("Response contained conversational or instructional content instead of a plan "
                        + "(detected pattern: " + pattern.pattern() + ").");
            }
        }

        String cleaned = FENCE.matcher(text).replaceAll("").trim();
        int first = cleaned.indexOf('{');
        int last  = cleaned.lastIndexOf('}');
        if (first == -1 || last == -1 || last < first) {
            return fail("Could not find a JSON object in the response.");
        }

        JsonNode root;
        try {
            root = LENIENT_MAPPER.readTree(cleaned.substring(first, last + 1));
        } catch (JsonProcessingException e) {
            return fail("Plan JSON is malformed: " + e.getOriginalMessage());
        }

        if (root == null || !root.isObject()
                || !root.path("planDescription").isTextual()
                || !root.path("steps").isArray()) {
            return fail("Plan must have a 'planDescription' (string) and 'steps' (array).");
        }
        JsonNode stepsNode = root.get("steps");
        if (stepsNode.size() == 0) {
            return fail("Plan contains an empty steps array; at least one step is required.");
        }

        List<PlanStep> parsed = new ArrayList<>();
        for (int i = 0; i < stepsNode.size(); i++) {
            JsonNode node = stepsNode.get(i);
            String error = validateStepShape(node, i + 1);
            if (error != null) return fail(error);

            PlanStepAction action = PlanStepAction.fromWireName(node.get("action").asText()).orElseThrow();
            String description = node.get("description").asText();

            String path = null;
            if (action.requiresPath()) {
                path = text(node, "path");
                if (path == null || path.isBlank()) {
                    return fail("Step " + (i + 1) + " (" + action.getWireName() + ") requires a non-empty 'path'.");
                }
                if (isAbsolute(path) || path.contains("..")) {
                    return fail("Path for step " + (i + 1) + " must be relative and cannot contain '..'.");
                }
            }

            switch (action) {
                case CREATE_DIRECTORY:
                    parsed.add(new CreateDirectoryStep(i + 1, description, path));
                    break;

                case CREATE_FILE: {
                    String content        = text(node, "content");
                    String generatePrompt = text(node, "generate_prompt");
                    if ((content == null) == (generatePrompt == null)) {
                        return fail("Step " + (i + 1) + " (create_file) must have exactly one of "
                                + "'content' or 'generate_prompt'.");
                    }
                    parsed.add(new CreateFileStep(i + 1, description, path, content, generatePrompt));
                    break;
                }

                case MODIFY_FILE: {
                    String prompt = text(node, "modification_prompt");
                    if (prompt == null || prompt.isBlank()) {
                        return fail("Step " + (i + 1) + " (modify_file) requires a non-empty 'modification_prompt'.");
                    }
                    parsed.add(new ModifyFileStep(i + 1, description, path, prompt));
                    break;
                }

                case RUN_COMMAND: {
                    String command = text(node, "command");
                    if (command == null || command.isBlank()) {
                        return fail("Step " + (i + 1) + " (run_command) requires a non-empty 'command'.");
                    }
                    parsed.add(new RunCommandStep(i + 1, description, command.trim()));
                    break;
                }
            }
        }

        List<PlanStep> steps = consolidateModifications(parsed);
        log.info("[PlanParser] Parsed plan with {} steps ({} before consolidation)", steps.size(), parsed.size());
        return PlanParseResult.success(new ExecutionPlan(root.get("planDescription").asText(), steps));
    }

    // ================================================================
    // Validation helpers
    // ================================================================

    private static String validateStepShape(JsonNode node, int expectedNumber) {
        if (node == null || !node.isObject()) {
            return "Step " + expectedNumber + " is not an object.";
        }
        JsonNode number = node.get("step");
        if (number == null || !number.isIntegralNumber() || number.asInt() != expectedNumber) {
            return "Step " + expectedNumber + " has an invalid structure or step number.";
        }
        JsonNode action = node.get("action");
        Optional<PlanStepAction> known = action != null && action.isTextual()
                ? PlanStepAction.fromWireName(action.asText())
                : Optional.empty();
        if (known.isEmpty()) {
            return "Step " + expectedNumber + " has an unknown action.";
        }
        if (!node.path("description").isTextual()) {
            return "Step " + expectedNumber + " is missing a 'description' string.";
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static boolean isAbsolute(String path) {
        if (path.startsWith("/") || path.startsWith("\\")) return true;
        if (path.length() > 1 && path.charAt(1) == ':') return true;
        try {
            return Paths.get(path).isAbsolute();
        } catch (RuntimeException e) {
            return true;
        }
    }

    /**
     * Folds every modify_file step for a path into the first one for that
     * path, then renumbers all steps from 1.
     */
    static List<PlanStep> consolidateModifications(List<PlanStep> steps) {
        Map<String, Integer> firstModifyIndex = new LinkedHashMap<>();
        List<PlanStep> result = new ArrayList<>();

        for (PlanStep step : steps) {
            if (step instanceof ModifyFileStep) {
                ModifyFileStep modify = (ModifyFileStep) step;
                Integer existing = firstModifyIndex.get(modify.getPath());
                if (existing != null) {
                    ModifyFileStep earlier = (ModifyFileStep) result.get(existing);
                    result.set(existing, earlier.mergedWith(modify));
                    continue;
                }
                firstModifyIndex.put(modify.getPath(), result.size());
            }
            result.add(step);
        }

        List<PlanStep> renumbered = new ArrayList<>(result.size());
        for (int i = 0; i < result.size(); i++) {
            PlanStep step = result.get(i);
            renumbered.add(step.getNumber() == i + 1 ? step : step.renumbered(i + 1));
        }
        return renumbered;
    }

    private static PlanParseResult fail(String error) {
        log.warn("[PlanParser] {}", error);
        return PlanParseResult.failure(error);
    }
}
