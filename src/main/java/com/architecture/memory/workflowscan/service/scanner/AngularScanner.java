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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.of;

/**
 * Scanner for Angular components. A {@code .component.ts} file is scanned together with its
 * template; template event bindings are attributed to the component file so trigger and call
 * share one file scope. A template scanned on its own yields only its triggers.
 */
@Slf4j
public class AngularScanner extends TypeScriptScanner {

    static final String FRAMEWORK = "Angular";
    static final int TRIGGER_CALL_WINDOW = 100;

    private static final List<DetectionPattern> EVENT_BINDINGS = List.of(
            of("\\(click\\)\\s*=\\s*\"([^\"]+)\"", "ui_click"),
            of("\\(submit\\)\\s*=\\s*\"([^\"]+)\"", "ui_submit"),
            of("\\(ngSubmit\\)\\s*=\\s*\"([^\"]+)\"", "ui_submit"),
            of("\\(change\\)\\s*=\\s*\"([^\"]+)\"", "ui_change"),
            of("\\(input\\)\\s*=\\s*\"([^\"]+)\"", "ui_change"),
            of("\\(mousedown\\)\\s*=\\s*\"([^\"]+)\"", "ui_click"),
            of("\\(keyup\\)\\s*=\\s*\"([^\"]+)\"", "ui_keypress"));

    private static final PatternGroup HTTP_GROUP = PatternGroup.of("http", DetectionCategory.API_CALLS,
            of("this\\.http\\.(get|post|put|delete|patch)\\s*(?:<.+?>)?\\s*\\(\\s*['\"`]([^'\"` ]+)['\"`]", "literal"),
            of("this\\.http\\.(get|post|put|delete|patch)\\s*(?:<.+?>)?\\s*\\(", "dynamic"));

    private static final List<PatternGroup> GROUPS = List.of(HTTP_GROUP, FILE_GROUP, CACHE_GROUP, TRANSFORM_GROUP);

    private static final Pattern SELECTOR = Pattern.compile("@Component\\s*\\(\\s*\\{[^}]*selector\\s*:\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern COMPONENT_CLASS = Pattern.compile("export\\s+class\\s+(\\w+)Component");
    private static final Pattern TEMPLATE_URL = Pattern.compile("templateUrl\\s*:\\s*['\"]([^'\"]+)['\"]");
    private static final List<Pattern> ROUTE_PATTERNS = List.of(
            Pattern.compile("path\\s*:\\s*['\"]([^'\"]+)['\"]"),
            Pattern.compile("this\\.router\\.navigate\\s*\\(\\s*\\[['\"]([^'\"]+)['\"]"));
    private static final Pattern METHOD_DECLARATION = Pattern.compile(
            "^\\s*(?:public\\s+|private\\s+|protected\\s+)?(?:async\\s+)?(\\w+)\\s*\\([^)]*\\)\\s*(?::\\s*[^{=]+)?\\{");

    public AngularScanner(DetectionToggles toggles) {
        super(toggles);
    }

    public AngularScanner() {
        this(DetectionToggles.allEnabled());
    }

    @Override
    public String getName() {
        return "angular";
    }

    @Override
    public boolean canScan(Path file) {
        String name = lowerName(file);
        return name.endsWith(".component.ts") || name.endsWith(".html");
    }

    @Override
    protected List<PatternGroup> patternGroups() {
        return GROUPS;
    }

    @Override
    public WorkflowGraph scanFile(Path file, SchemaRegistry registry) throws SourceReadException {
        SourceFile source = SourceFileReader.read(file);
        WorkflowGraph fragment = new WorkflowGraph();

        if (lowerName(file).endsWith(".html")) {
            TriggerContext context = new TriggerContext(FRAMEWORK, FRAMEWORK,
                    componentNameFromPath(file), detectUrl(source.getContent()));
            scanTriggers(source, EVENT_BINDINGS, context, fragment);
            return fragment;
        }

        List<WorkflowNode> produced = scanLines(source, patternGroups(), registry, fragment);
        if (!source.getContent().contains("@Component")) {
            return fragment;
        }

        Optional<SourceFile> template = loadTemplate(file, source);
        if (template.isEmpty()) {
            log.debug("No template found for component {}", file);
            return fragment;
        }
        TriggerContext context = new TriggerContext(FRAMEWORK, FRAMEWORK,
                detectComponentName(source, file), detectUrl(source.getContent()));
        List<WorkflowNode> triggers = scanTriggers(template.get(), EVENT_BINDINGS, context, fragment);
        Map<String, Integer> methods = methodLines(source);

        for (WorkflowNode trigger : triggers) {
            String handler = (String) trigger.getMetadata().get("handler");
            int anchor = methods.getOrDefault(handler, trigger.getLine());
            for (WorkflowNode call : produced) {
                if (call.getType() != WorkflowType.API_CALL) continue;
                if (Math.abs(call.getLine() - anchor) <= TRIGGER_CALL_WINDOW) {
                    fragment.addEdge(WorkflowEdge.builder()
                            .source(trigger.getId())
                            .target(call.getId())
                            .label("Angular Event → HTTP Call")
                            .meta("workflow_type", "angular_ui_to_api")
                            .meta("trigger_type", trigger.getMetadata().get("trigger_type"))
                            .meta("handler", handler)
                            .meta("framework", FRAMEWORK)
                            .build());
                }
            }
        }
        return fragment;
    }

    @Override
    protected WorkflowNode createNode(SourceFile file, PatternGroup group, DetectionPattern pattern,
                                      Matcher matcher, int lineNumber, SchemaRegistry registry) {
        if (!"http".equals(group.getCategory())) {
            return super.createNode(file, group, pattern, matcher, lineNumber, registry);
        }
        String method = matcher.group(1).toUpperCase(Locale.ROOT);
        String endpoint = "literal".equals(pattern.getLabel()) ? matcher.group(2) : null;
        return baseNode(file, "http", lineNumber, WorkflowType.API_CALL, "Angular HTTP " + method)
                .description(endpoint != null ? "Angular HTTP call to " + endpoint : "Angular HTTP call")
                .endpoint(endpoint)
                .method(method)
                .meta("library", "HttpClient")
                .meta("is_frontend_call", true)
                .meta("framework", FRAMEWORK)
                .build();
    }

    /**
     * Template referenced by {@code templateUrl}, else the sibling {@code .component.html}.
     * The returned text is attributed to the component file.
     */
    private Optional<SourceFile> loadTemplate(Path componentFile, SourceFile component) {
        String attributed = componentFile.toString();
        Path dir = componentFile.getParent() != null ? componentFile.getParent() : Path.of(".");
        Matcher templateUrl = TEMPLATE_URL.matcher(component.getContent());
        if (templateUrl.find()) {
            Optional<SourceFile> referenced =
                    SourceFileReader.readCompanion(dir.resolve(templateUrl.group(1)).normalize(), attributed);
            if (referenced.isPresent()) {
                return referenced;
            }
        }
        String name = componentFile.getFileName().toString();
        String sibling = name.substring(0, name.length() - ".ts".length()) + ".html";
        return SourceFileReader.readCompanion(dir.resolve(sibling), attributed);
    }

    private static Map<String, Integer> methodLines(SourceFile source) {
        Map<String, Integer> methods = new HashMap<>();
        for (int n = 1; n <= source.lineCount(); n++) {
            Matcher m = METHOD_DECLARATION.matcher(source.line(n));
            if (m.find()) {
                methods.putIfAbsent(m.group(1), n);
            }
        }
        return methods;
    }

    static String detectComponentName(SourceFile source, Path file) {
        Matcher selector = SELECTOR.matcher(source.getContent());
        if (selector.find()) {
            String name = selector.group(1);
            if (name.startsWith("app-")) {
                name = name.substring(4);
            }
            return titleCase(name.replace('-', ' '));
        }
        Matcher className = COMPONENT_CLASS.matcher(source.getContent());
        if (className.find()) {
            return className.group(1);
        }
        return componentNameFromPath(file);
    }

    static String componentNameFromPath(Path file) {
        String stem = file.getFileName().toString();
        int dot = stem.lastIndexOf('.');
        if (dot > 0) stem = stem.substring(0, dot);
        if (stem.endsWith(".component")) {
            stem = stem.substring(0, stem.length() - ".component".length());
        }
        return titleCase(stem.replace('-', ' '));
    }

    private static String detectUrl(String content) {
        for (Pattern pattern : ROUTE_PATTERNS) {
            Matcher m = pattern.matcher(content);
            if (m.find()) {
                return m.group(1);
            }
        }
        return null;
    }

    private static String titleCase(String words) {
        StringBuilder out = new StringBuilder(words.length());
        boolean start = true;
        for (char c : words.toCharArray()) {
            out.append(start ? Character.toUpperCase(c) : c);
            start = c == ' ';
        }
        return out.toString();
    }
}
