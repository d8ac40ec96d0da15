package com.codemend.core.changelog;

import java.time.Instant;
import java.util.List;

/**
 * Changes applied by one completed plan.
 */
public final class ChangeSet {

    private final String             id;
    private final String             planSummary;
    private final Instant            timestamp;
    private final List<ChangeRecord> changes;

    public ChangeSet(String id, String planSummary, Instant timestamp, List<ChangeRecord> changes) {
        this.id          = id;
        this.planSummary = planSummary != null ? planSummary : "";
        this.timestamp   = timestamp;
        this.changes     = List.copyOf(changes);
    }

    public String             getId()          { return id; }
    public String             getPlanSummary() { return planSummary; }
    public Instant            getTimestamp()   { return timestamp; }
    public List<ChangeRecord> getChanges()     { return changes; }
}
