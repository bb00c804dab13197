package com.architecture.memory.workflowscan.config;

import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.EdgeInferenceConfig;
import com.architecture.memory.workflowscan.model.ScanConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Service-wide scanner defaults bound from {@code workflow-scanner.*}. A repository can still
 * override the scan options through its own {@code .workflow-scanner.yml}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "workflow-scanner")
public class ScannerProperties {

    private List<String> includeExtensions = new ArrayList<>(ScanConfig.DEFAULT_INCLUDE_EXTENSIONS);

    private List<String> excludeDirs = new ArrayList<>(ScanConfig.DEFAULT_EXCLUDE_DIRS);

    private List<String> excludePatterns = new ArrayList<>(ScanConfig.DEFAULT_EXCLUDE_PATTERNS);

    @Valid
    @NestedConfigurationProperty
    private Detect detect = new Detect();

    @Valid
    @NestedConfigurationProperty
    private EdgeInference edgeInference = new EdgeInference();

    @Min(1)
    private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    private boolean analyzeWorkflows = true;

    @Min(1)
    private int maxSchemaFiles = 5_000;

    @Min(1)
    private int maxSchemas = 10_000;

    @Valid
    @NestedConfigurationProperty
    private Progress progress = new Progress();

    @Valid
    @NestedConfigurationProperty
    private Executor executor = new Executor();

    @NotBlank
    private String outputDir = "./scan-results";

    @Data
    public static class Detect {
        private boolean database = true;
        private boolean apiCalls = true;
        private boolean fileIo = true;
        private boolean messageQueues = true;
        private boolean dataTransforms = true;
    }

    @Data
    public static class EdgeInference {
        private boolean enabled = true;
        private boolean proximityEdges = true;
        private boolean dataFlowEdges = true;
        @Min(0)
        private int maxLineDistance = EdgeInferenceConfig.DEFAULT_MAX_LINE_DISTANCE;
        @Min(1)
        private int ingestionWindow = EdgeInferenceConfig.DEFAULT_INGESTION_WINDOW;
        @Min(1)
        private int processingWindow = EdgeInferenceConfig.DEFAULT_PROCESSING_WINDOW;
    }

    @Data
    public static class Progress {
        @Min(1)
        private int everyFiles = 10;
        @Min(1)
        private long everySeconds = 5;
        // snapshots buffered per scan before the oldest are dropped
        @Min(1)
        private int channelCapacity = 256;
        @Min(1)
        private long retentionMinutes = 60;
    }

    @Data
    public static class Executor {
        @Min(1)
        private int concurrentScans = 2;
        @Min(0)
        private int queueCapacity = 20;
    }

    /**
     * Per-scan options derived from these defaults.
     */
    public ScanConfig toScanConfig() {
        return ScanConfig.builder()
                .includeExtensions(List.copyOf(includeExtensions))
                .excludeDirs(List.copyOf(excludeDirs))
                .excludePatterns(List.copyOf(excludePatterns))
                .detect(DetectionToggles.builder()
                        .database(detect.isDatabase())
                        .apiCalls(detect.isApiCalls())
                        .fileIo(detect.isFileIo())
                        .messageQueues(detect.isMessageQueues())
                        .dataTransforms(detect.isDataTransforms())
                        .build())
                .edgeInference(EdgeInferenceConfig.builder()
                        .enabled(edgeInference.isEnabled())
                        .proximityEdges(edgeInference.isProximityEdges())
                        .dataFlowEdges(edgeInference.isDataFlowEdges())
                        .maxLineDistance(edgeInference.getMaxLineDistance())
                        .ingestionWindow(edgeInference.getIngestionWindow())
                        .processingWindow(edgeInference.getProcessingWindow())
                        .build())
                .workerThreads(workerThreads)
                .analyzeWorkflows(analyzeWorkflows)
                .maxSchemaFiles(maxSchemaFiles)
                .maxSchemas(maxSchemas)
                .progressEveryFiles(progress.getEveryFiles())
                .progressEverySeconds(progress.getEverySeconds())
                .build();
    }
}
