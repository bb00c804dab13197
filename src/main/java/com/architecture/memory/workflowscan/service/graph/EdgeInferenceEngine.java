package com.architecture.memory.workflowscan.service.graph;

import com.architecture.memory.workflowscan.model.EdgeInferenceConfig;
import com.architecture.memory.workflowscan.model.WorkflowEdge;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds file-scoped edges to a finished graph.
 *
 * <ul>
 *   <li>Proximity: consecutive nodes of a file (by line) at most {@code maxLineDistance} lines apart.</li>
 *   <li>Ingestion: API call followed by a DB write fewer than {@code ingestionWindow} lines later.</li>
 *   <li>Processing: DB read followed by a transform fewer than {@code processingWindow} lines later.</li>
 * </ul>
 *
 * Edges whose (source, target) pair already exists are skipped, so the existing label wins and
 * running the engine again adds nothing.
 */
@Slf4j
public class EdgeInferenceEngine {

    static final String INGESTION_LABEL = "Data Ingestion";
    static final String PROCESSING_LABEL = "Data Processing";

    private static final Comparator<WorkflowNode> BY_LINE =
            Comparator.comparingInt(WorkflowNode::getLine).thenComparing(WorkflowNode::getId);

    private final EdgeInferenceConfig config;

    public EdgeInferenceEngine(EdgeInferenceConfig config) {
        this.config = config != null ? config : EdgeInferenceConfig.defaults();
    }

    public EdgeInferenceEngine() {
        this(EdgeInferenceConfig.defaults());
    }

    public EdgeInferenceReport infer(WorkflowGraph graph) {
        if (!config.isEnabled()) {
            log.info("Edge inference disabled");
            return new EdgeInferenceReport(0, 0, 0);
        }
        Map<String, List<WorkflowNode>> byFile = groupByFile(graph);

        int proximity = config.isProximityEdges() ? inferProximityEdges(graph, byFile) : 0;
        int ingestion = 0;
        int processing = 0;
        if (config.isDataFlowEdges()) {
            for (List<WorkflowNode> nodes : byFile.values()) {
                Map<WorkflowType, List<WorkflowNode>> byType = bucketByType(nodes);
                ingestion += connectWithinWindow(graph,
                        byType.getOrDefault(WorkflowType.API_CALL, List.of()),
                        byType.getOrDefault(WorkflowType.DATABASE_WRITE, List.of()),
                        config.getIngestionWindow(), INGESTION_LABEL, "api_to_db");
                processing += connectWithinWindow(graph,
                        byType.getOrDefault(WorkflowType.DATABASE_READ, List.of()),
                        byType.getOrDefault(WorkflowType.DATA_TRANSFORM, List.of()),
                        config.getProcessingWindow(), PROCESSING_LABEL, "db_to_transform");
            }
        }
        log.info("Edge inference added {} proximity, {} ingestion, {} processing edges",
                proximity, ingestion, processing);
        return new EdgeInferenceReport(proximity, ingestion, processing);
    }

    private int inferProximityEdges(WorkflowGraph graph, Map<String, List<WorkflowNode>> byFile) {
        int added = 0;
        for (List<WorkflowNode> nodes : byFile.values()) {
            for (int i = 0; i + 1 < nodes.size(); i++) {
                WorkflowNode current = nodes.get(i);
                WorkflowNode next = nodes.get(i + 1);
                int distance = next.getLine() - current.getLine();
                if (distance > config.getMaxLineDistance() || current.getId().equals(next.getId())) {
                    continue;
                }
                boolean isNew = graph.addEdge(WorkflowEdge.builder()
                        .source(current.getId())
                        .target(next.getId())
                        .label("Sequential (" + distance + " lines)")
                        .meta("distance", distance)
                        .build());
                if (isNew) added++;
            }
        }
        return added;
    }

    /**
     * Connect every source to the targets strictly after it and fewer than {@code window} lines
     * away. Both lists are sorted by line; the first candidate is found by lower-bound search and
     * the forward scan stops at the first target outside the window.
     */
    private int connectWithinWindow(WorkflowGraph graph, List<WorkflowNode> sources, List<WorkflowNode> targets,
                                    int window, String label, String pattern) {
        if (sources.isEmpty() || targets.isEmpty()) return 0;
        int added = 0;
        for (WorkflowNode source : sources) {
            int line = source.getLine();
            for (int i = lowerBound(targets, line + 1); i < targets.size(); i++) {
                WorkflowNode target = targets.get(i);
                if (target.getLine() - line >= window) break;
                if (graph.hasEdge(source.getId(), target.getId())) continue;
                graph.addEdge(WorkflowEdge.builder()
                        .source(source.getId())
                        .target(target.getId())
                        .label(label)
                        .meta("pattern", pattern)
                        .build());
                added++;
            }
        }
        return added;
    }

    /**
     * Index of the first node whose line is {@code >= line}, or {@code nodes.size()}.
     */
    static int lowerBound(List<WorkflowNode> nodes, int line) {
        int low = 0;
        int high = nodes.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (nodes.get(mid).getLine() < line) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static Map<String, List<WorkflowNode>> groupByFile(WorkflowGraph graph) {
        Map<String, List<WorkflowNode>> byFile = new LinkedHashMap<>();
        for (WorkflowNode node : graph.getNodes()) {
            byFile.computeIfAbsent(String.valueOf(node.getSourceFile()), k -> new ArrayList<>()).add(node);
        }
        byFile.values().forEach(nodes -> nodes.sort(BY_LINE));
        return byFile;
    }

    // input is already line-sorted, so every bucket is too
    private static Map<WorkflowType, List<WorkflowNode>> bucketByType(List<WorkflowNode> sortedNodes) {
        Map<WorkflowType, List<WorkflowNode>> byType = new EnumMap<>(WorkflowType.class);
        for (WorkflowNode node : sortedNodes) {
            if (node.getType() != null) {
                byType.computeIfAbsent(node.getType(), k -> new ArrayList<>()).add(node);
            }
        }
        return byType;
    }
}
