package com.codemend.llm;

/**
 * A generation failure likely to succeed if retried after a delay: rate
 * limiting, timeouts, an overloaded or briefly unavailable model server.
 */
public class TransientGenerationException extends GenerationException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
