package com.codemend.core.issue;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueSeverity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String wireName;

    IssueSeverity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Lower rank sorts first. */
    public int rank() {
        return ordinal();
    }
}
