package com.architecture.memory.workflowscan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed graph of detected operations.
 *
 * <p>Nodes and edges keep insertion order. {@link #addNode} and {@link #addEdge} are set-adds:
 * a node equal to an existing one (full structural equality) or an edge with an existing
 * (source, target) pair is ignored. Lookups are served from id/type indexes.
 *
 * <p>Not thread-safe. Concurrent producers must funnel through a single merge point.
 */
public class WorkflowGraph {

    private final List<WorkflowNode> nodes = new ArrayList<>();
    private final List<WorkflowEdge> edges = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private final Set<WorkflowNode> nodeSet = new HashSet<>();
    private final Set<WorkflowEdge> edgeSet = new HashSet<>();
    private final Map<String, WorkflowNode> nodesById = new HashMap<>();
    private final Map<WorkflowType, List<WorkflowNode>> nodesByType = new HashMap<>();
    private final Map<String, List<WorkflowEdge>> outgoing = new HashMap<>();
    private final Map<String, List<WorkflowEdge>> incoming = new HashMap<>();

    /**
     * @return true if the node was added, false if an equal node was already present
     */
    public boolean addNode(WorkflowNode node) {
        if (node == null || !nodeSet.add(node)) {
            return false;
        }
        nodes.add(node);
        // first node registered under an id stays the one returned by getNode
        nodesById.putIfAbsent(node.getId(), node);
        if (node.getType() != null) {
            nodesByType.computeIfAbsent(node.getType(), k -> new ArrayList<>()).add(node);
        }
        return true;
    }

    /**
     * @return true if the edge was added, false if the (source, target) pair already existed
     */
    public boolean addEdge(WorkflowEdge edge) {
        if (edge == null || !edgeSet.add(edge)) {
            return false;
        }
        edges.add(edge);
        outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
        return true;
    }

    /**
     * Add every node and edge of {@code fragment} to this graph. Nodes are merged by reference.
     */
    public void merge(WorkflowGraph fragment) {
        if (fragment == null) return;
        for (WorkflowNode node : fragment.nodes) {
            addNode(node);
        }
        for (WorkflowEdge edge : fragment.edges) {
            addEdge(edge);
        }
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return Optional.ofNullable(nodesById.get(nodeId));
    }

    public List<WorkflowNode> getNodesByType(WorkflowType type) {
        return Collections.unmodifiableList(nodesByType.getOrDefault(type, List.of()));
    }

    public List<WorkflowEdge> getOutgoingEdges(String nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, List.of()));
    }

    public List<WorkflowEdge> getIncomingEdges(String nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, List.of()));
    }

    public boolean hasEdge(String source, String target) {
        return edgeSet.contains(WorkflowEdge.builder().source(source).target(target).build());
    }

    public List<WorkflowNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<WorkflowEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @JsonIgnore
    public int nodeCount() {
        return nodes.size();
    }

    @JsonIgnore
    public int edgeCount() {
        return edges.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }
}
