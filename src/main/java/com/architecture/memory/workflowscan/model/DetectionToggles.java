package com.architecture.memory.workflowscan.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-category detection switches. Everything is on by default.
 */
@Value
@Builder(toBuilder = true)
public class DetectionToggles {

    @Builder.Default
    boolean database = true;

    @Builder.Default
    boolean apiCalls = true;

    @Builder.Default
    boolean fileIo = true;

    @Builder.Default
    boolean messageQueues = true;

    @Builder.Default
    boolean dataTransforms = true;

    public static DetectionToggles allEnabled() {
        return DetectionToggles.builder().build();
    }

    public boolean isEnabled(DetectionCategory category) {
        if (category == null) return true;
        switch (category) {
            case DATABASE:
                return database;
            case API_CALLS:
                return apiCalls;
            case FILE_IO:
                return fileIo;
            case MESSAGE_QUEUES:
                return messageQueues;
            case DATA_TRANSFORMS:
                return dataTransforms;
            default:
                return true;
        }
    }
}
