package com.architecture.memory.workflowscan.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EdgeInferenceConfig {

    public static final int DEFAULT_MAX_LINE_DISTANCE = 20;
    public static final int DEFAULT_INGESTION_WINDOW = 50;
    public static final int DEFAULT_PROCESSING_WINDOW = 30;

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    boolean proximityEdges = true;

    @Builder.Default
    boolean dataFlowEdges = true;

    // proximity edge when successor is at most this many lines away
    @Builder.Default
    int maxLineDistance = DEFAULT_MAX_LINE_DISTANCE;

    // API call -> DB write when the write is strictly less than this many lines after the call
    @Builder.Default
    int ingestionWindow = DEFAULT_INGESTION_WINDOW;

    // DB read -> transform when the transform is strictly less than this many lines after the read
    @Builder.Default
    int processingWindow = DEFAULT_PROCESSING_WINDOW;

    public static EdgeInferenceConfig defaults() {
        return EdgeInferenceConfig.builder().build();
    }
}
