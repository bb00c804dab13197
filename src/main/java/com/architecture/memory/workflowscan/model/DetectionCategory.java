package com.architecture.memory.workflowscan.model;

/**
 * Detection toggle a pattern group belongs to. {@link #ALWAYS} groups cannot be switched off
 * (storage access and UI triggers).
 */
public enum DetectionCategory {
    DATABASE,
    API_CALLS,
    FILE_IO,
    MESSAGE_QUEUES,
    DATA_TRANSFORMS,
    ALWAYS
}
