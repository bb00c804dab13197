package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.EdgeInferenceConfig;
import com.architecture.memory.workflowscan.model.ScanConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the optional {@code .workflow-scanner.yml} at a repository root and overlays its
 * {@code scanner:} section on a base {@link ScanConfig}.
 */
@Component
@Slf4j
public class ScanConfigLoader {

    static final List<String> CONFIG_FILE_NAMES = List.of(".workflow-scanner.yml", ".workflow-scanner.yaml");

    // ${VAR} or ${VAR:-default}
    private static final Pattern ENV_PLACEHOLDER =
            Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?\\}");

    private final Function<String, String> environment;

    @Autowired
    public ScanConfigLoader() {
        this(System::getenv);
    }

    ScanConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Base config with the repository's overrides applied, or {@code base} unchanged when the
     * repository has no override file or it cannot be parsed.
     */
    public ScanConfig load(Path repositoryRoot, ScanConfig base) {
        for (String name : CONFIG_FILE_NAMES) {
            Path candidate = repositoryRoot.resolve(name);
            if (Files.isRegularFile(candidate)) {
                log.info("Found scanner configuration: {}", candidate);
                return loadFile(candidate, base);
            }
        }
        return base;
    }

    ScanConfig loadFile(Path configFile, ScanConfig base) {
        try {
            String raw = Files.readString(configFile, StandardCharsets.UTF_8);
            Object document = new Yaml().load(expandEnvironment(raw));
            if (document == null) {
                return base;
            }
            if (!(document instanceof Map)) {
                log.warn("Ignoring scanner configuration {}: top level is not a mapping", configFile);
                return base;
            }
            Object scanner = ((Map<?, ?>) document).get("scanner");
            if (scanner == null) {
                return base;
            }
            if (!(scanner instanceof Map)) {
                log.warn("Ignoring scanner configuration {}: 'scanner' is not a mapping", configFile);
                return base;
            }
            return overlay(base, (Map<?, ?>) scanner);
        } catch (IOException | YAMLException | IllegalArgumentException e) {
            log.warn("Failed to load scanner configuration {}: {}", configFile, e.getMessage());
            return base;
        }
    }

    String expandEnvironment(String text) {
        Matcher matcher = ENV_PLACEHOLDER.matcher(text);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String value = environment.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }

    private ScanConfig overlay(ScanConfig base, Map<?, ?> scanner) {
        ScanConfig.ScanConfigBuilder builder = base.toBuilder();

        List<String> extensions = stringList(scanner, "include_extensions");
        if (extensions != null) builder.includeExtensions(extensions);
        List<String> excludeDirs = stringList(scanner, "exclude_dirs");
        if (excludeDirs != null) builder.excludeDirs(excludeDirs);
        List<String> excludePatterns = stringList(scanner, "exclude_patterns");
        if (excludePatterns != null) builder.excludePatterns(excludePatterns);

        Object detect = scanner.get("detect");
        if (detect instanceof Map) {
            builder.detect(overlayDetect(base.getDetect(), (Map<?, ?>) detect));
        }
        Object edges = scanner.get("edge_inference");
        if (edges instanceof Map) {
            builder.edgeInference(overlayEdgeInference(base.getEdgeInference(), (Map<?, ?>) edges));
        }

        Integer workers = integer(scanner, "worker_threads");
        if (workers != null) builder.workerThreads(Math.max(1, workers));
        Boolean analyze = bool(scanner, "analyze_workflows");
        if (analyze != null) builder.analyzeWorkflows(analyze);
        Integer maxSchemaFiles = integer(scanner, "max_schema_files");
        if (maxSchemaFiles != null) builder.maxSchemaFiles(maxSchemaFiles);
        Integer maxSchemas = integer(scanner, "max_schemas");
        if (maxSchemas != null) builder.maxSchemas(maxSchemas);

        return builder.build();
    }

    private DetectionToggles overlayDetect(DetectionToggles base, Map<?, ?> detect) {
        DetectionToggles.DetectionTogglesBuilder builder = base.toBuilder();
        Boolean database = bool(detect, "database");
        if (database != null) builder.database(database);
        Boolean api = bool(detect, "api_calls");
        if (api != null) builder.apiCalls(api);
        Boolean files = bool(detect, "file_io");
        if (files == null) files = bool(detect, "file_operations");
        if (files != null) builder.fileIo(files);
        Boolean messages = bool(detect, "message_queues");
        if (messages != null) builder.messageQueues(messages);
        Boolean transforms = bool(detect, "data_transforms");
        if (transforms != null) builder.dataTransforms(transforms);
        return builder.build();
    }

    private EdgeInferenceConfig overlayEdgeInference(EdgeInferenceConfig base, Map<?, ?> edges) {
        EdgeInferenceConfig.EdgeInferenceConfigBuilder builder = base.toBuilder();
        Boolean enabled = bool(edges, "enabled");
        if (enabled != null) builder.enabled(enabled);
        Boolean proximity = bool(edges, "proximity_edges");
        if (proximity != null) builder.proximityEdges(proximity);
        Boolean dataFlow = bool(edges, "data_flow_edges");
        if (dataFlow != null) builder.dataFlowEdges(dataFlow);
        Integer distance = integer(edges, "max_line_distance");
        if (distance != null) builder.maxLineDistance(distance);
        Integer ingestion = integer(edges, "ingestion_window");
        if (ingestion != null) builder.ingestionWindow(ingestion);
        Integer processing = integer(edges, "processing_window");
        if (processing != null) builder.processingWindow(processing);
        return builder.build();
    }

    private static List<String> stringList(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        List<String> values = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) values.add(item.toString());
        }
        return List.copyOf(values);
    }

    private static Boolean bool(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Boolean) return (Boolean) value;
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (text.equalsIgnoreCase("false")) return Boolean.FALSE;
        throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + text);
    }

    private static Integer integer(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value, e);
        }
    }
}
