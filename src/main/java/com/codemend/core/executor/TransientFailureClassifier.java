package com.codemend.core.executor;

import com.codemend.llm.TransientGenerationException;
import com.codemend.llm.UnusableContentException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failed step is worth retrying.
 *
 * Typed checks run first over the whole cause chain; message patterns are
 * the fallback for errors that only say what went wrong in text. Failures
 * raised by the executor itself carry plan text (command lines, paths) in
 * their messages, so they are decided by type alone.
 */
@Component
public class TransientFailureClassifier {

    static final List<String> TRANSIENT_PATTERNS = List.of(
            "quota exceeded",
            "rate limit",
            "network",
            "service unavailable",
            "timed out",
            "timeout",
            "overloaded"
    );

    public boolean isTransient(Throwable error) {
        if (error == null
                || error instanceof CommandBlockedException
                || error instanceof UnusableContentException) {
            return false;
        }
        if (error instanceof CommandFailedException) {
            CommandResult result = ((CommandFailedException) error).getResult();
            return result != null && result.isTimedOut();
        }

        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TransientGenerationException
                    || t instanceof SocketTimeoutException
                    || t instanceof ConnectException
                    || t instanceof ResourceAccessException) {
                return true;
            }
            if (t instanceof HttpStatusCodeException) {
                int status = ((HttpStatusCodeException) t).getStatusCode().value();
                if (status == 429 || status == 502 || status == 503 || status == 504) return true;
            }
            if (t.getCause() == t) break;
        }

        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String pattern : TRANSIENT_PATTERNS) {
                    if (lower.contains(pattern)) return true;
                }
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
