package com.codemend.llm;

import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.context.GenerationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * GenerationClient that replays queued responses instead of calling a model.
 * Active under the {@code mock} profile and used directly by tests.
 *
 * A queued response is either literal text or a {@link Script} computed
 * from the call. When a queue is empty the default response is returned.
 * Every call is recorded with the context it was given.
 */
@Component
@Profile("mock")
public class ScriptedGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ScriptedGenerationClient.class);

    static final String DEFAULT_CONTENT = "// generated by scripted client\n";
    static final String DEFAULT_PLAN = """
            {
              "planDescription": "No-op plan from the scripted client",
              "steps": [
                { "step": 1, "action": "create_directory", "description": "Ensure src exists", "path": "src" }
              ]
            }
            """;

    @FunctionalInterface
    public interface Script {
        String respond(String instructions, GenerationContext context);
    }

    private final Deque<Script> contentScripts = new ArrayDeque<>();
    private final Deque<Script> planScripts    = new ArrayDeque<>();
    private final List<Call>    calls          = new ArrayList<>();

    // =========================================================================
    // Scripting
    // =========================================================================

    public synchronized ScriptedGenerationClient enqueueContent(String content) {
        contentScripts.addLast((i, c) -> content);
        return this;
    }

    public synchronized ScriptedGenerationClient enqueueContent(Script script) {
        contentScripts.addLast(script);
        return this;
    }

    public synchronized ScriptedGenerationClient enqueuePlan(String planText) {
        planScripts.addLast((i, c) -> planText);
        return this;
    }

    public synchronized ScriptedGenerationClient enqueuePlan(Script script) {
        planScripts.addLast(script);
        return this;
    }

    public synchronized List<Call> getCalls() {
        return List.copyOf(calls);
    }

    public synchronized List<Call> getPlanCalls() {
        List<Call> plans = new ArrayList<>();
        for (Call call : calls) {
            if (call.isPlan()) plans.add(call);
        }
        return plans;
    }

    // =========================================================================
    // GenerationClient contract
    // =========================================================================

    @Override
    public String generate(String instructions, GenerationContext context,
                           Consumer<String> onChunk, CancellationToken token) {
        return respond(false, contentScripts, DEFAULT_CONTENT, instructions, context, onChunk, token);
    }

    @Override
    public String generatePlan(String instructions, GenerationContext context,
                               Consumer<String> onChunk, CancellationToken token) {
        return respond(true, planScripts, DEFAULT_PLAN, instructions, context, onChunk, token);
    }

    private String respond(boolean plan, Deque<Script> queue, String fallback, String instructions,
                           GenerationContext context, Consumer<String> onChunk, CancellationToken token) {
        token.throwIfCancelled();
        Script script;
        synchronized (this) {
            calls.add(new Call(plan, instructions, context));
            script = queue.pollFirst();
        }
        String response = script != null ? script.respond(instructions, context) : fallback;
        log.debug("[Scripted] {} call -> {} chars", plan ? "plan" : "content", response.length());
        onChunk.accept(response);
        return response;
    }

    public static final class Call {
        private final boolean           plan;
        private final String            instructions;
        private final GenerationContext context;

        Call(boolean plan, String instructions, GenerationContext context) {
            this.plan         = plan;
            this.instructions = instructions;
            this.context      = context;
        }

        public boolean           isPlan()          { return plan; }
        public String            getInstructions() { return instructions; }
        public GenerationContext getContext()      { return context; }
    }
}
