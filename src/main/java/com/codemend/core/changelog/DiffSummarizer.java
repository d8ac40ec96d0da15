package com.codemend.core.changelog;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.ChangeDelta;
import com.github.difflib.patch.DeleteDelta;
import com.github.difflib.patch.InsertDelta;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diff plus a one-line human summary between two versions of a file.
 */
public final class DiffSummarizer {

    private static final int CONTEXT_LINES = 2;

    private DiffSummarizer() {}

    public static FileChangeSummary summarize(String oldContent, String newContent, String path) {
        String before = oldContent != null ? oldContent : "";
        String after  = newContent != null ? newContent : "";

        List<String> oldLines = toLines(before);
        List<String> newLines = toLines(after);

        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return new FileChangeSummary("", "No changes to `" + path + "`", 0, 0);
        }

        int added   = 0;
        int removed = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            if (delta instanceof InsertDelta) {
                added += delta.getTarget().size();
            } else if (delta instanceof DeleteDelta) {
                removed += delta.getSource().size();
            } else if (delta instanceof ChangeDelta) {
                added   += delta.getTarget().size();
                removed += delta.getSource().size();
            }
        }

        List<String> diffLines = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + path, "b/" + path, oldLines, patch, CONTEXT_LINES);

        String summary = before.isEmpty()
                ? "Created `" + path + "` (" + added + " lines)"
                : "Modified `" + path + "`: +" + added + " -" + removed + " lines";

        return new FileChangeSummary(String.join("\n", diffLines), summary, added, removed);
    }

    private static List<String> toLines(String content) {
        if (content.isEmpty()) return List.of();
        return Arrays.asList(content.split("\\R", -1));
    }

    public static final class FileChangeSummary {
        private final String diff;
        private final String summary;
        private final int    addedLines;
        private final int    removedLines;

        FileChangeSummary(String diff, String summary, int addedLines, int removedLines) {
            this.diff         = diff;
            this.summary      = summary;
            this.addedLines   = addedLines;
            this.removedLines = removedLines;
        }

        public String getDiff()         { return diff; }
        public String getSummary()      { return summary; }
        public int    getAddedLines()   { return addedLines; }
        public int    getRemovedLines() { return removedLines; }

        public boolean hasChanges() {
            return addedLines > 0 || removedLines > 0;
        }
    }
}
