package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.exception.SourceReadException;
import com.architecture.memory.workflowscan.model.CodeLocation;
import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented scanner driven by ordered {@link PatternGroup} tables.
 *
 * <p>Lines are visited in order; for each line every enabled group is tried in table order and
 * the first matching pattern of a group produces at most one node. Subclasses supply the tables
 * and turn a match into a node.
 */
public abstract class AbstractPatternScanner implements LanguageScanner {

    protected static final String UI_TRIGGER = "ui_trigger";

    private static final Pattern HANDLER_NAME = Pattern.compile("^[\\w$.]+");
    private static final Pattern QUOTED = Pattern.compile("[\"'`]([^\"'`]+)[\"'`]");

    protected final DetectionToggles toggles;

    protected AbstractPatternScanner(DetectionToggles toggles) {
        this.toggles = toggles != null ? toggles : DetectionToggles.allEnabled();
    }

    protected abstract List<PatternGroup> patternGroups();

    /**
     * Build the node for a match, or return {@code null} to let the next pattern of the group try.
     */
    protected abstract WorkflowNode createNode(SourceFile file, PatternGroup group, DetectionPattern pattern,
                                               Matcher matcher, int lineNumber, SchemaRegistry registry);

    @Override
    public WorkflowGraph scanFile(Path file, SchemaRegistry registry) throws SourceReadException {
        SourceFile source = SourceFileReader.read(file);
        WorkflowGraph fragment = new WorkflowGraph();
        scanLines(source, patternGroups(), registry, fragment);
        return fragment;
    }

    /**
     * Run {@code groups} over every line of {@code file}, adding the produced nodes to {@code fragment}.
     *
     * @return the nodes produced by this pass, in line order
     */
    protected List<WorkflowNode> scanLines(SourceFile file, List<PatternGroup> groups,
                                           SchemaRegistry registry, WorkflowGraph fragment) {
        List<WorkflowNode> produced = new ArrayList<>();
        List<PatternGroup> enabled = new ArrayList<>();
        for (PatternGroup group : groups) {
            if (toggles.isEnabled(group.getToggle())) {
                enabled.add(group);
            }
        }
        if (enabled.isEmpty()) return produced;

        for (int lineNumber = 1; lineNumber <= file.lineCount(); lineNumber++) {
            String line = file.line(lineNumber);
            for (PatternGroup group : enabled) {
                for (DetectionPattern pattern : group.getPatterns()) {
                    Matcher matcher = pattern.getRegex().matcher(line);
                    if (!matcher.find()) continue;
                    WorkflowNode node = createNode(file, group, pattern, matcher, lineNumber, registry);
                    if (node != null) {
                        fragment.addNode(node);
                        produced.add(node);
                        break;
                    }
                }
            }
        }
        return produced;
    }

    protected static String nodeId(String path, String category, int lineNumber) {
        return path + ":" + category + ":" + lineNumber;
    }

    protected static WorkflowNode.WorkflowNodeBuilder baseNode(SourceFile file, String category, int lineNumber,
                                                               WorkflowType type, String name) {
        return WorkflowNode.builder()
                .id(nodeId(file.getPath(), category, lineNumber))
                .type(type)
                .name(name)
                .location(CodeLocation.of(file.getPath(), lineNumber))
                .codeSnippet(file.snippet(lineNumber));
    }

    /**
     * Trigger node shared by the UI scanners. Triggers are typed {@link WorkflowType#DATA_TRANSFORM}
     * and flagged with {@link WorkflowNode#META_UI_TRIGGER}.
     */
    protected static WorkflowNode uiTriggerNode(SourceFile file, int lineNumber, TriggerContext context,
                                                String triggerType, String handler) {
        String component = context.getComponent();
        WorkflowNode.WorkflowNodeBuilder builder = baseNode(file, UI_TRIGGER, lineNumber,
                WorkflowType.DATA_TRANSFORM, context.getLabel() + ": " + triggerTitle(triggerType))
                .description(component != null ? "User interaction in " + component
                        : context.getFramework() + " " + triggerType)
                .meta(WorkflowNode.META_UI_TRIGGER, true)
                .meta("framework", context.getFramework())
                .meta("trigger_type", triggerType)
                .meta("handler", handler);
        if (component != null) {
            builder.meta("component", component);
        }
        if (context.getUrl() != null) {
            builder.meta("url", context.getUrl());
        }
        return builder.build();
    }

    /**
     * Event-binding pass shared by the UI scanners. Each pattern's label is the trigger type and its
     * first group the handler expression; at most one trigger is produced per line.
     */
    protected static List<WorkflowNode> scanTriggers(SourceFile file, List<DetectionPattern> bindings,
                                                     TriggerContext context, WorkflowGraph fragment) {
        List<WorkflowNode> triggers = new ArrayList<>();
        for (int lineNumber = 1; lineNumber <= file.lineCount(); lineNumber++) {
            String line = file.line(lineNumber);
            for (DetectionPattern binding : bindings) {
                Matcher matcher = binding.getRegex().matcher(line);
                if (!matcher.find()) continue;
                WorkflowNode trigger = uiTriggerNode(file, lineNumber, context, binding.getLabel(),
                        handlerName(matcher.group(1)));
                fragment.addNode(trigger);
                triggers.add(trigger);
                break;
            }
        }
        return triggers;
    }

    /**
     * Reduce a bound handler expression to the invoked name: {@code "onSave($event)"},
     * {@code "() => handleSave(id)"} and {@code "this.handleSave"} all give the bare method name.
     */
    static String handlerName(String expression) {
        String text = expression.trim();
        int arrow = text.indexOf("=>");
        if (arrow >= 0) {
            text = text.substring(arrow + 2).trim();
        }
        if (text.startsWith("this.")) {
            text = text.substring("this.".length());
        }
        Matcher name = HANDLER_NAME.matcher(text);
        return name.find() ? name.group() : text;
    }

    /**
     * "ui_click" becomes "Click", "page_load" becomes "Page Load".
     */
    static String triggerTitle(String triggerType) {
        String bare = triggerType.startsWith("ui_") ? triggerType.substring(3) : triggerType;
        StringBuilder title = new StringBuilder();
        for (String word : bare.split("_")) {
            if (word.isEmpty()) continue;
            if (title.length() > 0) title.append(' ');
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }

    protected static String firstQuoted(String text) {
        Matcher m = QUOTED.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    /**
     * First capture of {@code pattern} in {@code text}, scanning groups left to right.
     */
    protected static String firstCapture(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) return null;
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) return m.group(i);
        }
        return m.group();
    }

    protected static String group(Matcher matcher, int index) {
        return index <= matcher.groupCount() ? matcher.group(index) : null;
    }

    protected static String lowerName(Path file) {
        Path name = file.getFileName();
        return name != null ? name.toString().toLowerCase(Locale.ROOT) : "";
    }
}
