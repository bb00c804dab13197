package com.architecture.memory.workflowscan.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Directed relationship between two nodes. Identity is the ordered (source, target) pair;
 * label and metadata do not take part in equality.
 */
@Value
@Builder
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WorkflowEdge {

    @EqualsAndHashCode.Include
    String source;

    @EqualsAndHashCode.Include
    String target;

    String label;

    @Singular("meta")
    Map<String, Object> metadata;

    public static WorkflowEdge of(String source, String target, String label) {
        return WorkflowEdge.builder().source(source).target(target).label(label).build();
    }
}
