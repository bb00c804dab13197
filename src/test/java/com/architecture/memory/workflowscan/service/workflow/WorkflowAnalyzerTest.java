package com.architecture.memory.workflowscan.service.workflow;

import com.architecture.memory.workflowscan.model.CodeLocation;
import com.architecture.memory.workflowscan.model.WorkflowEdge;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;
import com.architecture.memory.workflowscan.model.workflow.InteractionType;
import com.architecture.memory.workflowscan.model.workflow.UIInteraction;
import com.architecture.memory.workflowscan.model.workflow.UIWorkflow;
import com.architecture.memory.workflowscan.model.workflow.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowAnalyzerTest {

    private static final String FILE = "src/OrderForm.tsx";

    private final WorkflowAnalyzer analyzer = new WorkflowAnalyzer();

    private static WorkflowNode trigger(int line, String handler, String triggerType) {
        return WorkflowNode.builder()
                .id(FILE + ":ui_trigger:" + line)
                .type(WorkflowType.DATA_TRANSFORM)
                .name("UI: Click")
                .description("User interaction in OrderForm")
                .location(CodeLocation.of(FILE, line))
                .meta(WorkflowNode.META_UI_TRIGGER, true)
                .meta("handler", handler)
                .meta("trigger_type", triggerType)
                .meta("component", "OrderForm")
                .build();
    }

    private static WorkflowNode apiCall(int line) {
        return WorkflowNode.builder()
                .id(FILE + ":http:" + line)
                .type(WorkflowType.API_CALL)
                .name("HTTP POST")
                .method("POST")
                .endpoint("/api/order-items/{id}")
                .location(CodeLocation.of(FILE, line))
                .build();
    }

    private static WorkflowNode dbWrite(String file, int line) {
        return WorkflowNode.builder()
                .id(file + ":db_write:" + line)
                .type(WorkflowType.DATABASE_WRITE)
                .name("DB Write: orders")
                .tableName("orders")
                .location(CodeLocation.of(file, line))
                .build();
    }

    @Test
    void buildWorkflow_terminatesOnCycles() {
        WorkflowGraph graph = new WorkflowGraph();
        WorkflowNode trigger = trigger(30, "handleSaveOrder", "ui_click");
        WorkflowNode call = apiCall(12);
        WorkflowNode write = dbWrite("api/OrderController.cs", 40);
        graph.addNode(trigger);
        graph.addNode(call);
        graph.addNode(write);
        graph.addEdge(WorkflowEdge.of(trigger.getId(), call.getId(), "User Action → API Call"));
        graph.addEdge(WorkflowEdge.of(call.getId(), write.getId(), "A"));
        graph.addEdge(WorkflowEdge.of(write.getId(), call.getId(), "B"));

        List<UIWorkflow> workflows = analyzer.analyze(graph);

        assertThat(workflows).hasSize(1);
        UIWorkflow workflow = workflows.get(0);
        assertThat(workflow.getId()).isEqualTo("workflow_" + trigger.getId());
        assertThat(workflow.getName()).isEqualTo("Save Order");
        assertThat(workflow.getSteps()).extracting(WorkflowStep::getStepNumber).containsExactly(1, 2, 3);
        // ordered by (file, line)
        assertThat(workflow.getSteps()).extracting(WorkflowStep::getNodeId)
                .containsExactly(write.getId(), call.getId(), trigger.getId());
        assertThat(workflow.getSteps().get(0).getTitle()).isEqualTo("Save data to orders");
        assertThat(workflow.getSteps().get(1).getTitle()).isEqualTo("Call POST Api Order Items");
        assertThat(workflow.getSteps().get(2).getTitle()).isEqualTo("User triggers handleSaveOrder");
        assertThat(workflow.getSteps().get(2).getIcon()).isEqualTo("👆");
        assertThat(workflow.getSummary())
                .isEqualTo("This workflow calls 1 external service(s), then saves data to 1 database table(s).");
        assertThat(workflow.getOutcome()).isEqualTo("The action completes and the user sees the result.");
    }

    @Test
    void identifyInteractions_usesTriggerMetadata() {
        WorkflowGraph graph = new WorkflowGraph();
        graph.addNode(trigger(3, "onSubmit", "ui_submit"));
        graph.addNode(trigger(9, "refresh", "page_load"));
        graph.addNode(apiCall(20));
        graph.addNode(dbWrite("api/Repo.cs", 5));

        List<UIInteraction> interactions = analyzer.identifyInteractions(graph);

        assertThat(interactions).hasSize(2);
        UIInteraction submit = interactions.get(0);
        assertThat(submit.getName()).isEqualTo("Submit");
        assertThat(submit.getInteractionType()).isEqualTo(InteractionType.FORM_SUBMIT);
        assertThat(submit.getDescription()).isEqualTo("User submits Submit");
        assertThat(submit.getComponent()).isEqualTo("OrderForm");
        assertThat(submit.getLocation()).isEqualTo(FILE);
        assertThat(interactions.get(1).getInteractionType()).isEqualTo(InteractionType.PAGE_LOAD);
    }

    @Test
    void identifyInteractions_acceptsKeywordNamedNodes() {
        WorkflowGraph graph = new WorkflowGraph();
        graph.addNode(WorkflowNode.builder()
                .id("Views/Main.cs:api:4")
                .type(WorkflowType.API_CALL)
                .name("DeleteCommand handler")
                .location(CodeLocation.of("Views/Main.cs", 4))
                .build());

        List<UIInteraction> interactions = analyzer.identifyInteractions(graph);

        assertThat(interactions).hasSize(1);
        assertThat(interactions.get(0).getComponent()).isEqualTo("Main");
        assertThat(interactions.get(0).getInteractionType()).isEqualTo(InteractionType.BUTTON_CLICK);
    }

    @Test
    void buildWorkflow_missingTriggerNodeGivesTrivialWorkflow() {
        WorkflowNode orphan = trigger(1, "handleSave", "ui_click");
        UIInteraction interaction = analyzer.toInteraction(orphan);

        UIWorkflow workflow = analyzer.buildWorkflow(new WorkflowGraph(), interaction);

        assertThat(workflow.isTrivial()).isTrue();
        assertThat(workflow.getSummary()).isEqualTo("This workflow performs a simple operation.");
    }

    @Test
    void toStory_rendersMarkdownNarrative() {
        WorkflowGraph graph = new WorkflowGraph();
        WorkflowNode trigger = trigger(3, "handleCheckout", "ui_click");
        WorkflowNode write = dbWrite(FILE, 8);
        graph.addNode(trigger);
        graph.addNode(write);
        graph.addEdge(WorkflowEdge.of(trigger.getId(), write.getId(), "x"));

        String story = analyzer.analyze(graph).get(0).toStory();

        assertThat(story).startsWith("# Checkout\n");
        assertThat(story).contains("**What happens:** This workflow saves data to 1 database table(s).");
        assertThat(story).contains("## Workflow Steps:");
        assertThat(story).contains("💾 **Step 2: Save data to orders**");
        assertThat(story).contains("**Result:** The data is saved and the user sees a success confirmation.");
    }

    @Test
    void humanize_stripsHandlerPrefixAndSplitsCamelCase() {
        assertThat(WorkflowAnalyzer.humanize("handleSaveOrder")).isEqualTo("Save Order");
        assertThat(WorkflowAnalyzer.humanize("onSubmit")).isEqualTo("Submit");
        assertThat(WorkflowAnalyzer.humanize("online")).isEqualTo("Online");
        assertThat(WorkflowAnalyzer.humanize("loadOrders2Fast")).isEqualTo("Load Orders2 Fast");
        assertThat(WorkflowAnalyzer.humanize(null)).isEmpty();
    }

    @Test
    void humanizeEndpoint_usesLastLiteralSegments() {
        assertThat(WorkflowAnalyzer.humanizeEndpoint("/api/order-items/{id}")).isEqualTo("Api Order Items");
        assertThat(WorkflowAnalyzer.humanizeEndpoint("/")).isEqualTo("service");
        assertThat(WorkflowAnalyzer.humanizeEndpoint(null)).isEqualTo("service");
    }

    @Test
    void isEntryPoint_ignoresPlainOperations() {
        assertThat(WorkflowAnalyzer.isEntryPoint(dbWrite("a.cs", 1))).isFalse();
        assertThat(WorkflowAnalyzer.isEntryPoint(trigger(1, "go", "ui_click"))).isTrue();
    }
}
