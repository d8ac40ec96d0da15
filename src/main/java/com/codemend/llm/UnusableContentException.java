package com.codemend.llm;

/**
 * Generated output was rejected by {@link GeneratedContentInspector}. Never retried.
 */
public class UnusableContentException extends GenerationException {

    public UnusableContentException(String message) {
        super(message);
    }
}
