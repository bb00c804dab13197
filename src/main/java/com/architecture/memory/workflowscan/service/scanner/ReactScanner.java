package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.exception.SourceReadException;
import com.architecture.memory.workflowscan.model.DetectionCategory;
import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.WorkflowEdge;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.ignoreCase;
import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.of;

/**
 * Scanner for React components (.tsx/.jsx). Detects JSX event bindings and component HTTP calls
 * and links each trigger to the calls near it in the same file.
 */
@Slf4j
public class ReactScanner extends TypeScriptScanner {

    static final String FRAMEWORK = "React";
    static final int TRIGGER_CALL_WINDOW = 50;

    private static final List<DetectionPattern> EVENT_BINDINGS = List.of(
            of("onClick\\s*=\\s*\\{([^}]+)\\}", "ui_click"),
            of("onSubmit\\s*=\\s*\\{([^}]+)\\}", "ui_submit"),
            of("onChange\\s*=\\s*\\{([^}]+)\\}", "ui_change"),
            of("onLoad\\s*=\\s*\\{([^}]+)\\}", "page_load"));

    private static final PatternGroup HTTP_GROUP = PatternGroup.of("http", DetectionCategory.API_CALLS,
            ignoreCase("fetch\\s*\\(\\s*['\"]([^'\"]+)['\"](?:.*?method\\s*:\\s*['\"](\\w+)['\"])?", "fetch"),
            ignoreCase("axios\\.(get|post|put|delete|patch)\\s*\\(\\s*['\"]([^'\"]+)['\"]", "axios"),
            ignoreCase("http\\.(get|post|put|delete|patch)\\s*\\(\\s*['\"]([^'\"]+)['\"]", "http"));

    private static final List<PatternGroup> GROUPS = List.of(HTTP_GROUP, FILE_GROUP, CACHE_GROUP, TRANSFORM_GROUP);

    private static final List<Pattern> COMPONENT_PATTERNS = List.of(
            Pattern.compile("export\\s+(?:default\\s+)?(?:function|const)\\s+(\\w+)"),
            Pattern.compile("const\\s+(\\w+)\\s*[=:]\\s*\\([^)]*\\)\\s*(?:=>|:)"),
            Pattern.compile("function\\s+(\\w+)\\s*\\([^)]*\\)"));

    private static final List<Pattern> ROUTE_PATTERNS = List.of(
            Pattern.compile("<Route\\s+path\\s*=\\s*['\"]([^'\"]+)['\"]"),
            Pattern.compile("path\\s*:\\s*['\"]([^'\"]+)['\"]"),
            Pattern.compile("href\\s*=\\s*['\"]([^'\"]+)['\"]"));

    private static final Pattern METHOD_OPTION = Pattern.compile("method\\s*:\\s*['\"](\\w+)['\"]", Pattern.CASE_INSENSITIVE);

    public ReactScanner(DetectionToggles toggles) {
        super(toggles);
    }

    public ReactScanner() {
        this(DetectionToggles.allEnabled());
    }

    @Override
    public String getName() {
        return "react";
    }

    @Override
    public boolean canScan(Path file) {
        String name = lowerName(file);
        return name.endsWith(".tsx") || name.endsWith(".jsx");
    }

    @Override
    protected List<PatternGroup> patternGroups() {
        return GROUPS;
    }

    @Override
    public WorkflowGraph scanFile(Path file, SchemaRegistry registry) throws SourceReadException {
        SourceFile source = SourceFileReader.read(file);
        WorkflowGraph fragment = new WorkflowGraph();

        String component = detectComponentName(source, file);
        String url = detectUrl(source.getContent());

        TriggerContext context = new TriggerContext("UI", FRAMEWORK, component, url);
        List<WorkflowNode> triggers = scanTriggers(source, EVENT_BINDINGS, context, fragment);
        List<WorkflowNode> produced = scanLines(source, patternGroups(), registry, fragment);

        for (WorkflowNode trigger : triggers) {
            for (WorkflowNode call : produced) {
                if (call.getType() != WorkflowType.API_CALL) continue;
                if (Math.abs(call.getLine() - trigger.getLine()) <= TRIGGER_CALL_WINDOW) {
                    WorkflowEdge.WorkflowEdgeBuilder edge = WorkflowEdge.builder()
                            .source(trigger.getId())
                            .target(call.getId())
                            .label("User Action → API Call")
                            .meta("workflow_type", "ui_to_api")
                            .meta("trigger_type", trigger.getMetadata().get("trigger_type"));
                    if (url != null) {
                        edge.meta("url", url);
                    }
                    fragment.addEdge(edge.build());
                }
            }
        }
        if (!triggers.isEmpty()) {
            log.debug("{}: {} UI triggers in component {}", file, triggers.size(), component);
        }
        return fragment;
    }

    @Override
    protected WorkflowNode createNode(SourceFile file, PatternGroup group, DetectionPattern pattern,
                                      Matcher matcher, int lineNumber, SchemaRegistry registry) {
        if (!"http".equals(group.getCategory())) {
            return super.createNode(file, group, pattern, matcher, lineNumber, registry);
        }
        String method;
        String endpoint;
        if ("fetch".equals(pattern.getLabel())) {
            endpoint = matcher.group(1);
            method = matcher.group(2);
            if (method == null) {
                method = firstCapture(METHOD_OPTION, file.range(lineNumber - 2, lineNumber + 3));
            }
            method = method != null ? method.toUpperCase(Locale.ROOT) : "GET";
        } else {
            method = matcher.group(1).toUpperCase(Locale.ROOT);
            endpoint = matcher.group(2);
        }
        return baseNode(file, "http", lineNumber, WorkflowType.API_CALL, "HTTP " + method)
                .description("Frontend API call to " + endpoint)
                .endpoint(endpoint)
                .method(method)
                .meta("library", pattern.getLabel())
                .meta("is_frontend_call", true)
                .build();
    }

    static String detectComponentName(SourceFile source, Path file) {
        for (Pattern pattern : COMPONENT_PATTERNS) {
            Matcher m = pattern.matcher(source.getContent());
            if (m.find()) {
                return m.group(1);
            }
        }
        String name = file.getFileName().toString();
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String detectUrl(String content) {
        for (Pattern pattern : ROUTE_PATTERNS) {
            Matcher m = pattern.matcher(content);
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }
}
