package com.codemend.llm;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sanity checks on raw model output before it is written to the workspace.
 *
 * {@link #clean(String)} strips a wrapping markdown fence.
 * {@link #looksLikeErrorMessage(String)} catches apologies and passed-through
 * API errors that a model sometimes returns instead of code.
 */
@Component
public class GeneratedContentInspector {

    private static final Pattern FENCE = Pattern.compile("^```(?:\\S+)?\\s*\\n?|\\n?```$", Pattern.MULTILINE);

    private static final Pattern MARKDOWN_ERROR = Pattern.compile(
            "```(?:[a-zA-Z0-9]+)?\\s*(error|fail|exception|apology|i am sorry)[\\s\\S]*?```",
            Pattern.CASE_INSENSITIVE);

    static final List<String> CONVERSATIONAL_PHRASES = List.of(
            "i am sorry",
            "i'm sorry",
            "i cannot fulfill this request",
            "i encountered an error",
            "i ran into an issue",
            "an error occurred",
            "i am unable to provide",
            "please try again",
            "i couldn't generate",
            "i'm having trouble",
            "error:",
            "failure:",
            "exception:",
            "i can't",
            "i am not able to",
            "as an ai model",
            "i lack the ability to",
            "insufficient information",
            "invalid request",
            "not enough context"
    );

    static final List<String> SYSTEM_ERROR_PHRASES = List.of(
            "access denied",
            "file not found",
            "permission denied",
            "timeout",
            "rate limit",
            "quota exceeded",
            "server error",
            "api error"
    );

    static final int SHORT_CONTENT_LENGTH = 200;
    static final int LEADING_LINES        = 5;

    public String clean(String raw) {
        if (raw == null) return "";
        return FENCE.matcher(raw.trim()).replaceAll("").trim();
    }

    /**
     * Conversational phrases only count near the top of the output, and
     * system error phrases only in short output; real code routinely
     * mentions "timeout" or "Error:" further down.
     */
    public boolean looksLikeErrorMessage(String content) {
        if (content == null || content.isBlank()) return false;

        String lower = content.toLowerCase(Locale.ROOT).trim();
        String head  = leadingLines(lower);
        for (String phrase : CONVERSATIONAL_PHRASES) {
            if (head.contains(phrase)) return true;
        }

        if (content.length() < SHORT_CONTENT_LENGTH) {
            for (String phrase : SYSTEM_ERROR_PHRASES) {
                if (lower.contains(phrase)) return true;
            }
            if (lower.contains("error") || lower.contains("fail") || lower.contains("issue")) {
                return true;
            }
        }

        return MARKDOWN_ERROR.matcher(content).find();
    }

    private static String leadingLines(String text) {
        StringBuilder sb = new StringBuilder();
        int taken = 0;
        for (String line : text.split("\\R")) {
            if (line.isBlank()) continue;
            sb.append(line).append('\n');
            if (++taken >= LEADING_LINES) break;
        }
        return sb.toString();
    }
}
