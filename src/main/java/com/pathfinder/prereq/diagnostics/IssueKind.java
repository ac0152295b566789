package com.pathfinder.prereq.diagnostics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueKind {
    NO_PREREQ_TEXT,
    EMPTY_GROUPS,
    MISMATCH_LOW_CONF,
    UPDATED,
    WOULD_UPDATE,
    SKIPPED_LOCKED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
