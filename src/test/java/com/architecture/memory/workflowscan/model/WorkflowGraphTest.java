package com.architecture.memory.workflowscan.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowGraphTest {

    private static WorkflowNode node(String id, WorkflowType type, String file, int line) {
        return WorkflowNode.builder()
                .id(id)
                .type(type)
                .name(id)
                .location(CodeLocation.of(file, line))
                .build();
    }

    @Test
    void addNode_ignoresStructurallyEqualDuplicate() {
        WorkflowGraph graph = new WorkflowGraph();

        assertThat(graph.addNode(node("a.cs:db_read:1", WorkflowType.DATABASE_READ, "a.cs", 1))).isTrue();
        assertThat(graph.addNode(node("a.cs:db_read:1", WorkflowType.DATABASE_READ, "a.cs", 1))).isFalse();

        assertThat(graph.nodeCount()).isEqualTo(1);
        assertThat(graph.getNodesByType(WorkflowType.DATABASE_READ)).hasSize(1);
    }

    @Test
    void getNode_returnsFirstNodeRegisteredUnderId() {
        WorkflowGraph graph = new WorkflowGraph();
        WorkflowNode first = node("a.cs:api:3", WorkflowType.API_CALL, "a.cs", 3);
        WorkflowNode second = first.toBuilder().name("other").build();

        graph.addNode(first);
        graph.addNode(second);

        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.getNode("a.cs:api:3")).containsSame(first);
        assertThat(graph.getNode("missing")).isEmpty();
    }

    @Test
    void addEdge_rejectsSamePairRegardlessOfLabel() {
        WorkflowGraph graph = new WorkflowGraph();

        assertThat(graph.addEdge(WorkflowEdge.of("a", "b", "first"))).isTrue();
        assertThat(graph.addEdge(WorkflowEdge.of("a", "b", "second"))).isFalse();
        assertThat(graph.addEdge(WorkflowEdge.of("b", "a", "reverse"))).isTrue();

        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.getOutgoingEdges("a")).extracting(WorkflowEdge::getLabel).containsExactly("first");
        assertThat(graph.getIncomingEdges("a")).extracting(WorkflowEdge::getSource).containsExactly("b");
        assertThat(graph.hasEdge("a", "b")).isTrue();
        assertThat(graph.hasEdge("a", "c")).isFalse();
    }

    @Test
    void merge_addsFragmentContentWithoutDuplicates() {
        WorkflowGraph graph = new WorkflowGraph();
        WorkflowNode shared = node("a.ts:api:1", WorkflowType.API_CALL, "a.ts", 1);
        graph.addNode(shared);

        WorkflowGraph fragment = new WorkflowGraph();
        fragment.addNode(shared);
        fragment.addNode(node("a.ts:cache:2", WorkflowType.CACHE_READ, "a.ts", 2));
        fragment.addEdge(WorkflowEdge.of("a.ts:api:1", "a.ts:cache:2", "Sequential (1 lines)"));

        graph.merge(fragment);
        graph.merge(fragment);

        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.isEmpty()).isFalse();
    }

    @Test
    void newGraphIsEmpty() {
        WorkflowGraph graph = new WorkflowGraph();

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.getNodesByType(WorkflowType.API_CALL)).isEmpty();
        assertThat(graph.getOutgoingEdges("x")).isEmpty();
    }
}
