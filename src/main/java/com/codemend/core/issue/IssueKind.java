package com.codemend.core.issue;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized category of a diagnostic finding.
 *
 * Declaration order is the priority order used when issues are grouped
 * for correction instructions.
 */
public enum IssueKind {
    SYNTAX("syntax"),
    UNUSED_IMPORT("unused_import"),
    SECURITY("security"),
    BEST_PRACTICE("best_practice"),
    OTHER("other"),
    FORMAT_ERROR("format_error");

    private final String wireName;

    IssueKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
