package com.architecture.memory.workflowscan.service.workflow;

import com.architecture.memory.workflowscan.model.WorkflowEdge;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;
import com.architecture.memory.workflowscan.model.workflow.InteractionType;
import com.architecture.memory.workflowscan.model.workflow.UIInteraction;
import com.architecture.memory.workflowscan.model.workflow.UIWorkflow;
import com.architecture.memory.workflowscan.model.workflow.WorkflowStep;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a scanned graph into user-facing workflow stories: one per UI entry point, listing every
 * operation reachable from it.
 */
@Slf4j
public class WorkflowAnalyzer {

    private static final List<String> ENTRY_KEYWORDS = List.of(
            "click", "submit", "save", "load", "delete", "handler", "command", "action", "button");

    private static final Pattern HANDLER_PREFIX = Pattern.compile("^(?:handle|on)(?=[A-Z])");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");

    private static final Map<WorkflowType, String> ICONS = new EnumMap<>(WorkflowType.class);

    static {
        ICONS.put(WorkflowType.DATABASE_READ, "📖");
        ICONS.put(WorkflowType.DATABASE_WRITE, "💾");
        ICONS.put(WorkflowType.API_CALL, "🌐");
        ICONS.put(WorkflowType.FILE_READ, "📄");
        ICONS.put(WorkflowType.FILE_WRITE, "📝");
        ICONS.put(WorkflowType.MESSAGE_SEND, "📤");
        ICONS.put(WorkflowType.MESSAGE_RECEIVE, "📥");
        ICONS.put(WorkflowType.DATA_TRANSFORM, "⚙️");
        ICONS.put(WorkflowType.CACHE_READ, "🔍");
        ICONS.put(WorkflowType.CACHE_WRITE, "💿");
    }

    private static final String UI_TRIGGER_ICON = "👆";
    private static final String DEFAULT_ICON = "•";

    /**
     * Workflows with at least one step, in entry-point order.
     */
    public List<UIWorkflow> analyze(WorkflowGraph graph) {
        List<UIInteraction> interactions = identifyInteractions(graph);
        List<UIWorkflow> workflows = new ArrayList<>();
        for (UIInteraction interaction : interactions) {
            UIWorkflow workflow = buildWorkflow(graph, interaction);
            if (!workflow.isTrivial()) {
                workflows.add(workflow);
            }
        }
        log.info("Found {} UI interactions, built {} workflows", interactions.size(), workflows.size());
        return workflows;
    }

    public List<UIInteraction> identifyInteractions(WorkflowGraph graph) {
        return graph.getNodes().stream()
                .filter(WorkflowAnalyzer::isEntryPoint)
                .map(this::toInteraction)
                .collect(Collectors.toList());
    }

    static boolean isEntryPoint(WorkflowNode node) {
        if (node.isUiTrigger()) {
            return true;
        }
        String name = node.getName() != null ? node.getName().toLowerCase(Locale.ROOT) : "";
        return ENTRY_KEYWORDS.stream().anyMatch(name::contains);
    }

    UIInteraction toInteraction(WorkflowNode node) {
        Object handler = node.getMetadata().get("handler");
        String name = humanize(node.isUiTrigger() && handler != null ? handler.toString() : node.getName());
        String key = (node.getName() + " " + (handler != null ? handler : "")).toLowerCase(Locale.ROOT);
        Object triggerType = node.getMetadata().get("trigger_type");

        InteractionType type;
        String description;
        if (key.contains("submit") || "ui_submit".equals(triggerType)) {
            type = InteractionType.FORM_SUBMIT;
            description = "User submits " + name;
        } else if (key.contains("save") || key.contains("delete")) {
            type = InteractionType.BUTTON_CLICK;
            description = "User clicks " + name;
        } else if (key.contains("load") || "page_load".equals(triggerType)) {
            type = InteractionType.PAGE_LOAD;
            description = "User navigates to " + name;
        } else {
            type = InteractionType.BUTTON_CLICK;
            description = "User interacts with " + name;
        }

        return UIInteraction.builder()
                .id(node.getId())
                .name(name)
                .component(componentOf(node))
                .interactionType(type)
                .location(node.getSourceFile())
                .description(description)
                .node(node)
                .build();
    }

    /**
     * Steps for every node reachable from the interaction's node, ordered by (file, line). A trigger
     * whose node is no longer in the graph gives a workflow without steps.
     */
    public UIWorkflow buildWorkflow(WorkflowGraph graph, UIInteraction interaction) {
        List<WorkflowStep> steps = new ArrayList<>();
        if (graph.getNode(interaction.getId()).isPresent()) {
            List<WorkflowNode> reachable = reachableFrom(graph, interaction.getId());
            reachable.sort(Comparator.comparing((WorkflowNode n) -> String.valueOf(n.getSourceFile()))
                    .thenComparingInt(WorkflowNode::getLine));
            int number = 1;
            for (WorkflowNode node : reachable) {
                steps.add(toStep(node, number++));
            }
        }
        return UIWorkflow.builder()
                .id("workflow_" + interaction.getId())
                .name(interaction.getName())
                .trigger(interaction)
                .steps(steps)
                .summary(summarize(steps))
                .outcome(outcomeOf(steps))
                .build();
    }

    /**
     * Breadth-first walk over outgoing edges. Each node is visited once, so cycles terminate.
     */
    List<WorkflowNode> reachableFrom(WorkflowGraph graph, String startId) {
        List<WorkflowNode> reachable = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        visited.add(startId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            Optional<WorkflowNode> node = graph.getNode(id);
            if (node.isEmpty()) continue;
            reachable.add(node.get());
            for (WorkflowEdge edge : graph.getOutgoingEdges(id)) {
                if (visited.add(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        return reachable;
    }

    WorkflowStep toStep(WorkflowNode node, int number) {
        String table = node.getTableName() != null ? node.getTableName() : "database";
        String title;
        String description;
        String technical;
        String icon = ICONS.getOrDefault(node.getType(), DEFAULT_ICON);

        if (node.isUiTrigger()) {
            Object handler = node.getMetadata().get("handler");
            title = "User triggers " + handler;
            description = node.getDescription() != null ? node.getDescription() : "The user starts the workflow.";
            technical = node.getMetadata().get("trigger_type") + ": " + handler;
            icon = UI_TRIGGER_ICON;
        } else if (node.getType() == WorkflowType.DATABASE_WRITE) {
            title = "Save data to " + table;
            description = "The system saves the information to the " + table + " table.";
            technical = "Database INSERT/UPDATE: " + node.getTableName();
        } else if (node.getType() == WorkflowType.DATABASE_READ) {
            title = "Retrieve data from " + table;
            description = "The system looks up existing information from the " + table + " table.";
            technical = "Database SELECT: " + node.getTableName();
        } else if (node.getType() == WorkflowType.API_CALL) {
            title = "Call " + (node.getMethod() != null ? node.getMethod() : "API") + " "
                    + humanizeEndpoint(node.getEndpoint());
            description = "The system communicates with an external service at "
                    + (node.getEndpoint() != null ? node.getEndpoint() : "an external endpoint") + ".";
            technical = "API " + node.getMethod() + ": " + node.getEndpoint();
        } else if (node.getType() == WorkflowType.DATA_TRANSFORM) {
            title = "Process and transform data";
            description = "The system transforms the data into the required format.";
            technical = "Data transformation: " + node.getName();
        } else if (node.getType() == WorkflowType.FILE_WRITE) {
            title = "Write to file";
            description = "The system saves information to a file.";
            technical = "File write: " + (node.getFilePath() != null ? node.getFilePath() : "unknown");
        } else if (node.getType() == WorkflowType.FILE_READ) {
            title = "Read from file";
            description = "The system reads information from a file.";
            technical = "File read: " + (node.getFilePath() != null ? node.getFilePath() : "unknown");
        } else {
            title = humanize(node.getName());
            description = node.getDescription() != null ? node.getDescription() : "The system performs an operation.";
            technical = (node.getType() != null ? node.getType().getValue() : "operation") + ": " + node.getName();
        }

        return WorkflowStep.builder()
                .stepNumber(number)
                .title(title)
                .description(description)
                .technicalDetails(technical)
                .icon(icon)
                .node(node)
                .build();
    }

    static String summarize(List<WorkflowStep> steps) {
        if (steps.isEmpty()) {
            return "This workflow performs a simple operation.";
        }
        long reads = countOf(steps, WorkflowType.DATABASE_READ);
        long calls = countOf(steps, WorkflowType.API_CALL);
        long writes = countOf(steps, WorkflowType.DATABASE_WRITE);
        List<String> parts = new ArrayList<>();
        if (reads > 0) parts.add("retrieves data from " + reads + " database table(s)");
        if (calls > 0) parts.add("calls " + calls + " external service(s)");
        if (writes > 0) parts.add("saves data to " + writes + " database table(s)");
        if (parts.isEmpty()) {
            return "This workflow performs " + steps.size() + " operation(s).";
        }
        return "This workflow " + String.join(", then ", parts) + ".";
    }

    static String outcomeOf(List<WorkflowStep> steps) {
        if (steps.isEmpty()) {
            return "The action completes.";
        }
        WorkflowType last = steps.get(steps.size() - 1).getNode().getType();
        if (last == WorkflowType.DATABASE_WRITE) {
            return "The data is saved and the user sees a success confirmation.";
        }
        if (last == WorkflowType.DATABASE_READ) {
            return "The data is retrieved and displayed to the user.";
        }
        if (last == WorkflowType.API_CALL) {
            return "The external service responds and the result is shown to the user.";
        }
        return "The action completes and the user sees the result.";
    }

    private static long countOf(List<WorkflowStep> steps, WorkflowType type) {
        return steps.stream().filter(s -> s.getNode().getType() == type).count();
    }

    /**
     * "handleSaveOrder" becomes "Save Order", "onSubmit" becomes "Submit".
     */
    static String humanize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String stripped = HANDLER_PREFIX.matcher(name.trim()).replaceFirst("");
        String spaced = CAMEL_BOUNDARY.matcher(stripped).replaceAll(" ");
        return Arrays.stream(spaced.split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    /**
     * Last two literal path segments, e.g. "/api/order-items/{id}" becomes "Api Order Items".
     */
    static String humanizeEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return "service";
        }
        List<String> meaningful = Arrays.stream(endpoint.split("/"))
                .filter(part -> !part.isEmpty() && !part.startsWith("{"))
                .collect(Collectors.toList());
        if (meaningful.isEmpty()) {
            return "service";
        }
        String tail = String.join(" ", meaningful.subList(Math.max(0, meaningful.size() - 2), meaningful.size()));
        return Arrays.stream(tail.replace('-', ' ').split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String componentOf(WorkflowNode node) {
        Object component = node.getMetadata().get("component");
        if (component != null) {
            return component.toString();
        }
        String path = node.getSourceFile();
        if (path == null) return null;
        String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
