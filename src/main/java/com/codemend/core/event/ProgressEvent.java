package com.codemend.core.event;

import com.codemend.core.issue.Issue;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Observational progress notification. Publishing never changes what the
 * engine does next.
 */
public class ProgressEvent {

    private final String        eventId;
    private final String        requestId;
    private final ProgressStage stage;
    private final String        message;
    private final List<Issue>   issues;
    private final List<String>  suggestions;
    private final int           progressPercent;   // 0..100, -1 when unknown
    private final Instant       timestamp;

    public ProgressEvent(String requestId, ProgressStage stage, String message,
                         List<Issue> issues, List<String> suggestions, int progressPercent) {
        this.eventId         = UUID.randomUUID().toString();
        this.requestId       = requestId;
        this.stage           = stage;
        this.message         = message != null ? message : "";
        this.issues          = issues != null ? List.copyOf(issues) : List.of();
        this.suggestions     = suggestions != null ? List.copyOf(suggestions) : List.of();
        this.progressPercent = Math.max(-1, Math.min(100, progressPercent));
        this.timestamp       = Instant.now();
    }

    public static ProgressEvent of(String requestId, ProgressStage stage, String message) {
        return new ProgressEvent(requestId, stage, message, null, null, -1);
    }

    public String getEventId() {
        return eventId;
    }

    public String getRequestId() {
        return requestId;
    }

    public ProgressStage getStage() {
        return stage;
    }

    public String getMessage() {
        return message;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public int getProgressPercent() {
        return progressPercent;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "ProgressEvent{" + requestId + " " + stage + " '" + message + "'}";
    }
}
