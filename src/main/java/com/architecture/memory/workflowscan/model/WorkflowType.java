package com.architecture.memory.workflowscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of runtime operation a {@link WorkflowNode} represents.
 */
public enum WorkflowType {
    DATABASE_READ("database_read"),
    DATABASE_WRITE("database_write"),
    API_CALL("api_call"),
    FILE_READ("file_read"),
    FILE_WRITE("file_write"),
    MESSAGE_SEND("message_send"),
    MESSAGE_RECEIVE("message_receive"),
    DATA_TRANSFORM("data_transform"),
    CACHE_READ("cache_read"),
    CACHE_WRITE("cache_write");

    private final String value;

    WorkflowType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Get the enum value from its wire value or constant name, case-insensitive.
     */
    public static WorkflowType fromString(String value) {
        if (value == null) return null;
        for (WorkflowType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
