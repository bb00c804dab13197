package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.DetectionCategory;
import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import com.architecture.memory.workflowscan.model.WorkflowType;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.ignoreCase;
import static com.architecture.memory.workflowscan.service.scanner.DetectionPattern.of;

/**
 * Scanner for plain TypeScript/JavaScript: HTTP clients, browser file API, web storage and
 * RxJS/array transforms. The UI dialects extend it and replace the generic HTTP group.
 */
public class TypeScriptScanner extends AbstractPatternScanner {

    private static final String STORAGE_READ = "read";
    private static final String STORAGE_WRITE = "write";

    protected static final PatternGroup API_GROUP = PatternGroup.of("api", DetectionCategory.API_CALLS,
            ignoreCase("http\\.get"),
            ignoreCase("http\\.post"),
            ignoreCase("http\\.put"),
            ignoreCase("http\\.delete"),
            ignoreCase("http\\.patch"),
            ignoreCase("fetch\\s*\\("),
            ignoreCase("axios\\."));

    protected static final PatternGroup FILE_GROUP = PatternGroup.of("file", DetectionCategory.FILE_IO,
            of("FileReader"),
            of("\\.readAsText"),
            of("\\.readAsDataURL"),
            of("Blob"));

    // web storage has no toggle of its own; the label is the access direction
    protected static final PatternGroup CACHE_GROUP = PatternGroup.of("cache", DetectionCategory.ALWAYS,
            of("localStorage\\.setItem", STORAGE_WRITE),
            of("localStorage\\.getItem", STORAGE_READ),
            of("sessionStorage\\.setItem", STORAGE_WRITE),
            of("sessionStorage\\.getItem", STORAGE_READ),
            of("indexedDB\\.open", STORAGE_READ),
            of("indexedDB\\.deleteDatabase", STORAGE_WRITE),
            of("indexedDB", STORAGE_READ));

    protected static final PatternGroup TRANSFORM_GROUP = PatternGroup.of("transform", DetectionCategory.DATA_TRANSFORMS,
            of("\\.pipe\\s*\\("),
            of("\\.map\\s*\\("),
            of("\\.filter\\s*\\("),
            of("\\.reduce\\s*\\("),
            of("\\.switchMap\\s*\\("),
            of("\\.mergeMap\\s*\\("),
            of("\\.concatMap\\s*\\("));

    private static final List<PatternGroup> GROUPS = List.of(API_GROUP, FILE_GROUP, CACHE_GROUP, TRANSFORM_GROUP);

    private static final Pattern URL_LITERAL = Pattern.compile("['\"`](https?://[^'\"`]+|/[^'\"`]*)['\"`]");
    private static final Pattern TEMPLATE_LITERAL = Pattern.compile("`([^`]*)`");
    private static final Pattern NEARBY_URL_LITERAL = Pattern.compile("['\"`](https?://[^'\"`]+|/api/[^'\"`]*)['\"`]");
    private static final Pattern FILE_READ = Pattern.compile("read|Reader", Pattern.CASE_INSENSITIVE);
    private static final Pattern STORAGE_KEY = Pattern.compile("(?:getItem|setItem)\\s*\\(\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern OPERATOR = Pattern.compile("\\.(pipe|map|filter|reduce|switchMap|mergeMap|concatMap)");
    private static final Map<String, Pattern> HTTP_METHODS = Map.of(
            "GET", Pattern.compile("\\.get\\s*\\(", Pattern.CASE_INSENSITIVE),
            "POST", Pattern.compile("\\.post\\s*\\(", Pattern.CASE_INSENSITIVE),
            "PUT", Pattern.compile("\\.put\\s*\\(", Pattern.CASE_INSENSITIVE),
            "DELETE", Pattern.compile("\\.delete\\s*\\(", Pattern.CASE_INSENSITIVE),
            "PATCH", Pattern.compile("\\.patch\\s*\\(", Pattern.CASE_INSENSITIVE));
    private static final List<String> METHOD_ORDER = List.of("GET", "POST", "PUT", "DELETE", "PATCH");

    public TypeScriptScanner(DetectionToggles toggles) {
        super(toggles);
    }

    public TypeScriptScanner() {
        this(DetectionToggles.allEnabled());
    }

    @Override
    public String getName() {
        return "typescript";
    }

    @Override
    public boolean canScan(Path file) {
        String name = lowerName(file);
        return name.endsWith(".ts") || name.endsWith(".js");
    }

    @Override
    protected List<PatternGroup> patternGroups() {
        return GROUPS;
    }

    @Override
    protected WorkflowNode createNode(SourceFile file, PatternGroup group, DetectionPattern pattern,
                                      Matcher matcher, int lineNumber, SchemaRegistry registry) {
        String line = file.line(lineNumber);
        switch (group.getCategory()) {
            case "api": {
                String endpoint = extractEndpoint(file, lineNumber);
                String method = extractHttpMethod(line);
                return baseNode(file, "api", lineNumber, WorkflowType.API_CALL,
                        "API " + method + ": " + (endpoint != null ? endpoint : "Unknown"))
                        .description("HTTP API call from TypeScript")
                        .endpoint(endpoint)
                        .method(method)
                        .build();
            }
            case "file": {
                boolean read = FILE_READ.matcher(line).find();
                return baseNode(file, "file", lineNumber,
                        read ? WorkflowType.FILE_READ : WorkflowType.FILE_WRITE,
                        read ? "File Read" : "File Write")
                        .description("Browser file API operation")
                        .build();
            }
            case "cache": {
                boolean read = STORAGE_READ.equals(pattern.getLabel());
                String key = firstCapture(STORAGE_KEY, line);
                WorkflowNode.WorkflowNodeBuilder builder = baseNode(file, "cache", lineNumber,
                        read ? WorkflowType.CACHE_READ : WorkflowType.CACHE_WRITE,
                        (read ? "Cache Read: " : "Cache Write: ") + (key != null ? key : "Unknown"))
                        .description("Browser storage operation");
                if (key != null) {
                    builder.meta("key", key);
                }
                return builder.build();
            }
            case "transform": {
                Matcher op = OPERATOR.matcher(line);
                String operator = op.find() ? op.group(1) : "transform";
                return baseNode(file, "transform", lineNumber, WorkflowType.DATA_TRANSFORM,
                        "Data Transform: " + operator)
                        .description("Data transformation using " + operator)
                        .meta("operator", operator)
                        .build();
            }
            default:
                return null;
        }
    }

    String extractEndpoint(SourceFile file, int lineNumber) {
        String line = file.line(lineNumber);
        String literal = firstCapture(URL_LITERAL, line);
        if (literal != null) return literal;
        String template = firstCapture(TEMPLATE_LITERAL, line);
        if (template != null) return template;
        for (int n = Math.max(1, lineNumber - 3); n <= lineNumber; n++) {
            String nearby = firstCapture(NEARBY_URL_LITERAL, file.line(n));
            if (nearby != null) return nearby;
        }
        return null;
    }

    static String extractHttpMethod(String line) {
        for (String method : METHOD_ORDER) {
            if (HTTP_METHODS.get(method).matcher(line).find()) {
                return method;
            }
        }
        return "HTTP";
    }
}
