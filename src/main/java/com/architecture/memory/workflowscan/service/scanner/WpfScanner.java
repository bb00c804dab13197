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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.of;

/**
 * Scanner for WPF windows, pages and user controls.
 *
 * <p>A {@code .xaml} scan owns the pairing: it emits the markup's event triggers, the HTTP calls
 * of the {@code .xaml.cs} code-behind and the edges between them. Scanning the code-behind on its
 * own emits the same call nodes, so both scans merge without duplicates.
 */
@Slf4j
public class WpfScanner extends AbstractPatternScanner {

    static final String FRAMEWORK = "WPF";
    static final int HANDLER_CALL_WINDOW = 50;

    // PreviewMouseDown is matched by the MouseDown binding as a substring
    private static final List<DetectionPattern> EVENT_BINDINGS = List.of(
            of("Click\\s*=\\s*\"([^\"]+)\"", "ui_click"),
            of("MouseDown\\s*=\\s*\"([^\"]+)\"", "ui_click"),
            of("MouseUp\\s*=\\s*\"([^\"]+)\"", "ui_click"),
            of("SelectionChanged\\s*=\\s*\"([^\"]+)\"", "ui_change"),
            of("TextChanged\\s*=\\s*\"([^\"]+)\"", "ui_change"),
            of("KeyDown\\s*=\\s*\"([^\"]+)\"", "ui_keypress"),
            of("KeyUp\\s*=\\s*\"([^\"]+)\"", "ui_keypress"),
            of("Loaded\\s*=\\s*\"([^\"]+)\"", "page_load"));

    private static final PatternGroup HTTP_GROUP = PatternGroup.of("http", DetectionCategory.API_CALLS,
            of("\\.GetAsync\\s*\\(\\s*['\"]([^'\"]+)['\"]", "GET"),
            of("\\.PostAsync\\s*\\(\\s*['\"]([^'\"]+)['\"]", "POST"),
            of("\\.PutAsync\\s*\\(\\s*['\"]([^'\"]+)['\"]", "PUT"),
            of("\\.DeleteAsync\\s*\\(\\s*['\"]([^'\"]+)['\"]", "DELETE"),
            of("\\.DownloadString\\s*\\(\\s*['\"]([^'\"]+)['\"]", "GET"),
            of("\\.UploadString\\s*\\(\\s*['\"]([^'\"]+)['\"]", "POST"));

    private static final List<PatternGroup> GROUPS = List.of(HTTP_GROUP);

    private static final Pattern HANDLER_METHOD = Pattern.compile(
            "private\\s+(?:async\\s+)?void\\s+(\\w+)\\s*\\(\\s*object\\s+sender\\s*,\\s*\\w*EventArgs\\s+\\w+\\s*\\)");

    private static final List<Pattern> WINDOW_PATTERNS = List.of(
            Pattern.compile("<(?:Window|Page|UserControl)\\s+x:Class\\s*=\\s*\"([^\"]+)\""),
            Pattern.compile("public\\s+partial\\s+class\\s+(\\w+)\\s*:\\s*(?:Window|Page|UserControl)"));

    public WpfScanner(DetectionToggles toggles) {
        super(toggles);
    }

    public WpfScanner() {
        this(DetectionToggles.allEnabled());
    }

    @Override
    public String getName() {
        return "wpf";
    }

    @Override
    public boolean canScan(Path file) {
        String name = lowerName(file);
        return name.endsWith(".xaml") || name.endsWith(".xaml.cs");
    }

    @Override
    protected List<PatternGroup> patternGroups() {
        return GROUPS;
    }

    @Override
    public WorkflowGraph scanFile(Path file, SchemaRegistry registry) throws SourceReadException {
        SourceFile source = SourceFileReader.read(file);
        WorkflowGraph fragment = new WorkflowGraph();

        if (lowerName(file).endsWith(".xaml.cs")) {
            scanLines(source, GROUPS, registry, fragment);
            return fragment;
        }

        TriggerContext context = new TriggerContext(FRAMEWORK, FRAMEWORK, detectWindowName(source, file), null);
        List<WorkflowNode> triggers = scanTriggers(source, EVENT_BINDINGS, context, fragment);

        Path codeBehindPath = file.resolveSibling(file.getFileName() + ".cs");
        Optional<SourceFile> codeBehind = SourceFileReader.readCompanion(codeBehindPath, codeBehindPath.toString());
        if (codeBehind.isEmpty()) {
            return fragment;
        }
        List<WorkflowNode> calls = scanLines(codeBehind.get(), GROUPS, registry, fragment);
        Map<String, Integer> handlers = handlerMethods(codeBehind.get());

        for (WorkflowNode trigger : triggers) {
            String handler = (String) trigger.getMetadata().get("handler");
            Integer handlerLine = handlers.get(handler);
            for (WorkflowNode call : calls) {
                if (handlerLine == null) {
                    fragment.addEdge(link(trigger, call, handler, "WPF Event → HTTP Call (proximity)",
                            "wpf_ui_to_api_proximity"));
                } else if (Math.abs(call.getLine() - handlerLine) <= HANDLER_CALL_WINDOW) {
                    fragment.addEdge(link(trigger, call, handler, "WPF Event → HTTP Call", "wpf_ui_to_api"));
                }
            }
        }
        log.debug("{}: {} triggers, {} code-behind calls, {} handlers",
                file, triggers.size(), calls.size(), handlers.size());
        return fragment;
    }

    @Override
    protected WorkflowNode createNode(SourceFile file, PatternGroup group, DetectionPattern pattern,
                                      Matcher matcher, int lineNumber, SchemaRegistry registry) {
        String method = pattern.getLabel();
        String endpoint = matcher.group(1);
        return baseNode(file, "http", lineNumber, WorkflowType.API_CALL, "WPF HTTP " + method)
                .description("WPF HTTP call to " + endpoint)
                .endpoint(endpoint)
                .method(method)
                .meta("library", "HttpClient/WebClient")
                .meta("is_frontend_call", true)
                .meta("framework", FRAMEWORK)
                .build();
    }

    private static WorkflowEdge link(WorkflowNode trigger, WorkflowNode call, String handler,
                                     String label, String workflowType) {
        return WorkflowEdge.builder()
                .source(trigger.getId())
                .target(call.getId())
                .label(label)
                .meta("workflow_type", workflowType)
                .meta("trigger_type", trigger.getMetadata().get("trigger_type"))
                .meta("handler", handler)
                .meta("framework", FRAMEWORK)
                .build();
    }

    private static Map<String, Integer> handlerMethods(SourceFile codeBehind) {
        Map<String, Integer> handlers = new HashMap<>();
        for (int n = 1; n <= codeBehind.lineCount(); n++) {
            Matcher m = HANDLER_METHOD.matcher(codeBehind.line(n));
            if (m.find()) {
                handlers.putIfAbsent(m.group(1), n);
            }
        }
        return handlers;
    }

    static String detectWindowName(SourceFile source, Path file) {
        for (Pattern pattern : WINDOW_PATTERNS) {
            Matcher m = pattern.matcher(source.getContent());
            if (m.find()) {
                String name = m.group(1);
                return name.substring(name.lastIndexOf('.') + 1);
            }
        }
        String name = file.getFileName().toString();
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
