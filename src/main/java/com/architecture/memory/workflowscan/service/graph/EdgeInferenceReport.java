package com.architecture.memory.workflowscan.service.graph;

import lombok.Value;

/**
 * Edges added by one run of {@link EdgeInferenceEngine}, per pass.
 */
@Value
public class EdgeInferenceReport {
    int proximityEdges;
    int ingestionEdges;
    int processingEdges;

    public int total() {
        return proximityEdges + ingestionEdges + processingEdges;
    }
}
