package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.DetectionCategory;
import lombok.Value;

import java.util.List;

/**
 * Ordered patterns for one node category. At most one node per group is emitted for a line:
 * the first pattern that matches wins.
 *
 * <p>{@code category} is also the middle segment of the node id ({@code file:category:line}).
 */
@Value
public class PatternGroup {
    String category;
    DetectionCategory toggle;
    List<DetectionPattern> patterns;

    public static PatternGroup of(String category, DetectionCategory toggle, DetectionPattern... patterns) {
        return new PatternGroup(category, toggle, List.of(patterns));
    }
}
