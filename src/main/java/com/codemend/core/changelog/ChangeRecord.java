package com.codemend.core.changelog;

import java.time.Instant;

/**
 * One applied workspace change.
 */
public final class ChangeRecord {

    private final String     path;
    private final ChangeType changeType;
    private final String     summary;
    private final String     diff;       // empty for directories
    private final Instant    timestamp;

    public ChangeRecord(String path, ChangeType changeType, String summary, String diff, Instant timestamp) {
        this.path       = path;
        this.changeType = changeType;
        this.summary    = summary != null ? summary : "";
        this.diff       = diff != null ? diff : "";
        this.timestamp  = timestamp != null ? timestamp : Instant.now();
    }

    public String     getPath()       { return path; }
    public ChangeType getChangeType() { return changeType; }
    public String     getSummary()    { return summary; }
    public String     getDiff()       { return diff; }
    public Instant    getTimestamp()  { return timestamp; }

    @Override
    public String toString() {
        return "ChangeRecord{" + changeType + " " + path + "}";
    }
}
