package com.architecture.memory.workflowscan.model;

/**
 * Where a table name came from. Higher priority wins when two schemas claim the same name.
 */
public enum SchemaSource {
    CLASS_NAME(1),
    DB_SET(2),
    TABLE_ATTRIBUTE(3);

    private final int priority;

    SchemaSource(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }
}
