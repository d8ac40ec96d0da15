package com.codemend.llm;

import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.context.GenerationContext;

import java.util.function.Consumer;

/**
 * GenerationClient: the model behind every generated file, edit and
 * correction plan.
 *
 * Two calls:
 *   generate(...): file content (initial file, create_file, modify_file)
 *   generatePlan(...): raw correction plan text, parsed by PlanParser
 *
 * Output may be delivered incrementally through {@code onChunk}; the
 * returned string is always the complete text. Implementations throw
 * {@link TransientGenerationException} for failures worth retrying,
 * {@link GenerationException} otherwise, and
 * {@link com.codemend.core.cancel.OperationCancelledException} when the
 * token is cancelled mid-call.
 */
public interface GenerationClient {

    String generate(String instructions, GenerationContext context,
                    Consumer<String> onChunk, CancellationToken token);

    String generatePlan(String instructions, GenerationContext context,
                        Consumer<String> onChunk, CancellationToken token);

    default String generate(String instructions, GenerationContext context, CancellationToken token) {
        return generate(instructions, context, chunk -> { }, token);
    }

    default String generatePlan(String instructions, GenerationContext context, CancellationToken token) {
        return generatePlan(instructions, context, chunk -> { }, token);
    }
}
