package com.codemend.core.changelog;

public enum ChangeType {
    CREATED,
    MODIFIED
}
