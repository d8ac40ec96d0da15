package com.codemend.core.changelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only record of workspace changes.
 *
 * Changes accumulate as pending until the plan that produced them completes,
 * at which point they become a {@link ChangeSet}. Completed sets feed the
 * "recent successful changes" section of correction instructions.
 */
@Component
public class ChangeLog {

    private static final Logger log = LoggerFactory.getLogger(ChangeLog.class);

    static final int RECENT_SETS        = 3;
    static final int CHANGES_PER_SET    = 3;
    static final int MAX_COMPLETED_SETS = 50;

    private final List<ChangeRecord> pending   = new ArrayList<>();
    private final List<ChangeSet>    completed = new ArrayList<>();

    public synchronized void logChange(ChangeRecord record) {
        pending.add(record);
        log.debug("[ChangeLog] {} {}: {}", record.getChangeType(), record.getPath(), record.getSummary());
    }

    public synchronized List<ChangeRecord> pendingChanges() {
        return List.copyOf(pending);
    }

    /** Seals pending changes into a change set; no-op when nothing is pending. */
    public synchronized void completeChangeSet(String planSummary) {
        if (pending.isEmpty()) return;
        ChangeSet set = new ChangeSet(UUID.randomUUID().toString(), planSummary, Instant.now(), pending);
        completed.add(set);
        pending.clear();
        if (completed.size() > MAX_COMPLETED_SETS) {
            completed.remove(0);
        }
        log.info("[ChangeLog] Completed change set {} with {} changes", set.getId().substring(0, 8),
                set.getChanges().size());
    }

    /** Drops pending changes of a plan that did not complete. Applied files stay as written. */
    public synchronized void discardPending() {
        pending.clear();
    }

    public synchronized List<ChangeSet> completedChangeSets() {
        return List.copyOf(completed);
    }

    /**
     * Renders the last completed change sets for inclusion in instructions.
     * Empty string when nothing has completed yet.
     */
    public synchronized String recentSuccessfulChanges() {
        if (completed.isEmpty()) return "";

        List<ChangeSet> recent = completed.subList(Math.max(0, completed.size() - RECENT_SETS), completed.size());
        StringBuilder sb = new StringBuilder("--- Recent Successful Project Changes ---\n");
        for (ChangeSet set : recent) {
            sb.append("\nPlan executed at ").append(set.getTimestamp())
              .append(" (ID: ").append(set.getId(), 0, 8).append(")\n");
            if (!set.getPlanSummary().isBlank()) {
                sb.append("Summary: ").append(set.getPlanSummary()).append("\n");
            }
            sb.append("Changes:\n");
            List<ChangeRecord> changes = set.getChanges();
            for (ChangeRecord change : changes.subList(0, Math.min(CHANGES_PER_SET, changes.size()))) {
                sb.append("- ").append(change.getChangeType()).append(": `").append(change.getPath())
                  .append("` - ").append(change.getSummary().split("\n", 2)[0]).append("\n");
            }
            if (changes.size() > CHANGES_PER_SET) {
                sb.append("  ...and ").append(changes.size() - CHANGES_PER_SET).append(" more changes.\n");
            }
        }
        sb.append("\n--- End Recent Successful Project Changes ---\n");
        return sb.toString();
    }
}
