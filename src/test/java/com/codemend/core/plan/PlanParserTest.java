package com.codemend.core.plan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanParserTest {

    private final PlanParser parser = new PlanParser();

    @Test
    void testParsesFencedPlanWithAllActions() {
        String text = """
                Here is the plan:
                ```json
                {
                  "planDescription": "Fix the missing semicolon",
                  "steps": [
                    { "step": 1, "action": "create_directory", "description": "", "path": "src/util" },
                    { "step": 2, "action": "create_file", "description": "helper", "path": "src/util/h.js", "content": "export {}" },
                    { "step": 3, "action": "modify_file", "description": "fix", "path": "src/app.js", "modification_prompt": "Add the semicolon" },
                    { "step": 4, "action": "run_command", "description": "install", "command": "  npm install  " }
                  ]
                }
                ```
                """;

        PlanParseResult result = parser.parse(text);

        assertTrue(result.isSuccess(), result.getError());
        ExecutionPlan plan = result.getPlan();
        assertEquals("Fix the missing semicolon", plan.getPlanDescription());
        assertEquals(4, plan.size());
        assertTrue(plan.getSteps().get(0) instanceof CreateDirectoryStep);
        assertFalse(((CreateFileStep) plan.getSteps().get(1)).isGenerated());
        assertEquals("Add the semicolon", ((ModifyFileStep) plan.getSteps().get(2)).getModificationPrompt());
        assertEquals("npm install", ((RunCommandStep) plan.getSteps().get(3)).getCommand());
    }

    @Test
    void testLenientJson() {
        String text = """
                {
                  // trailing commas and single quotes
                  planDescription: 'Remove import',
                  'steps': [
                    { step: 1, action: 'modify_file', description: 'drop it', path: 'a.ts', modification_prompt: 'remove unused import', },
                  ],
                }
                """;

        PlanParseResult result = parser.parse(text);

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(1, result.getPlan().size());
    }

    @Test
    void testRejectsMalformedInput() {
        List<String> malformed = List.of(
                "",
                "I could not produce a plan.",
                "{ \"planDescription\": \"x\", \"steps\": [ }",
                "{ \"planDescription\": \"x\", \"steps\": [] }",
                "{ \"steps\": [ { \"step\": 1, \"action\": \"create_directory\", \"description\": \"d\", \"path\": \"a\" } ] }",
                "<execute_bash>ls</execute_bash>",
                "Thought: I should edit the file { \"planDescription\": \"x\", \"steps\": [] }",
                "null"
        );
        for (String text : malformed) {
            PlanParseResult result = parser.parse(text);
            assertFalse(result.isSuccess(), "should reject: " + text);
            assertNotNull(result.getError());
        }
    }

    @Test
    void testRejectsInvalidSteps() {
        assertInvalid("{ \"step\": 2, \"action\": \"create_directory\", \"description\": \"d\", \"path\": \"a\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"delete_file\", \"description\": \"d\", \"path\": \"a\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"create_directory\", \"path\": \"a\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"create_directory\", \"description\": \"d\", \"path\": \"../up\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"create_directory\", \"description\": \"d\", \"path\": \"/etc\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"create_file\", \"description\": \"d\", \"path\": \"a\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"create_file\", \"description\": \"d\", \"path\": \"a\", "
                + "\"content\": \"x\", \"generate_prompt\": \"y\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"modify_file\", \"description\": \"d\", \"path\": \"a\" }");
        assertInvalid("{ \"step\": 1, \"action\": \"run_command\", \"description\": \"d\", \"command\": \" \" }");
    }

    @Test
    void testConsolidatesModificationsOfSamePath() {
        String text = """
                { "planDescription": "p", "steps": [
                  { "step": 1, "action": "modify_file", "description": "one", "path": "a.js", "modification_prompt": "first" },
                  { "step": 2, "action": "run_command", "description": "ls", "command": "ls" },
                  { "step": 3, "action": "modify_file", "description": "two", "path": "a.js", "modification_prompt": "second" }
                ] }
                """;

        PlanParseResult result = parser.parse(text);

        assertTrue(result.isSuccess(), result.getError());
        List<PlanStep> steps = result.getPlan().getSteps();
        assertEquals(2, steps.size());
        ModifyFileStep merged = (ModifyFileStep) steps.get(0);
        assertEquals("first" + ModifyFileStep.INSTRUCTION_SEPARATOR + "second", merged.getModificationPrompt());
        assertEquals(1, steps.get(0).getNumber());
        assertEquals(2, steps.get(1).getNumber());
        assertEquals(PlanStepAction.RUN_COMMAND, steps.get(1).getAction());
    }

    private void assertInvalid(String step) {
        String text = "{ \"planDescription\": \"p\", \"steps\": [ " + step + " ] }";
        PlanParseResult result = parser.parse(text);
        assertFalse(result.isSuccess(), "should reject step: " + step);
    }
}
