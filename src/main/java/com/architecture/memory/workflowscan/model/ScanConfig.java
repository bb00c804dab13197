package com.architecture.memory.workflowscan.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Options for one scan. Immutable; use {@link #toBuilder()} to derive variants.
 */
@Value
@Builder(toBuilder = true)
public class ScanConfig {

    public static final List<String> DEFAULT_INCLUDE_EXTENSIONS =
            List.of(".cs", ".ts", ".tsx", ".js", ".jsx", ".html", ".xaml");

    public static final List<String> DEFAULT_EXCLUDE_DIRS = List.of(
            "node_modules", "bin", "obj", ".git", ".vs", "dist", "build",
            "coverage", ".next", "__pycache__", "venv", "packages", "target");

    public static final List<String> DEFAULT_EXCLUDE_PATTERNS =
            List.of("*.min.js", "*.bundle.js", "*.generated.cs", "*.designer.cs", "*.d.ts", "*.spec.ts");

    @Builder.Default
    List<String> includeExtensions = DEFAULT_INCLUDE_EXTENSIONS;

    @Builder.Default
    List<String> excludeDirs = DEFAULT_EXCLUDE_DIRS;

    @Builder.Default
    List<String> excludePatterns = DEFAULT_EXCLUDE_PATTERNS;

    @Builder.Default
    DetectionToggles detect = DetectionToggles.allEnabled();

    @Builder.Default
    EdgeInferenceConfig edgeInference = EdgeInferenceConfig.defaults();

    // 1 scans sequentially on the builder thread
    @Builder.Default
    int workerThreads = 1;

    @Builder.Default
    boolean analyzeWorkflows = true;

    @Builder.Default
    int maxSchemaFiles = 5_000;

    @Builder.Default
    int maxSchemas = 10_000;

    @Builder.Default
    int progressEveryFiles = 10;

    @Builder.Default
    long progressEverySeconds = 5;

    public static ScanConfig defaults() {
        return ScanConfig.builder().build();
    }
}
