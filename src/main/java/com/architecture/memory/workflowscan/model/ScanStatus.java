package com.architecture.memory.workflowscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScanStatus {
    QUEUED,
    DISCOVERING,
    SCANNING,
    ANALYZING,
    COMPLETED,
    CANCELLED,
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == ERROR;
    }
}
