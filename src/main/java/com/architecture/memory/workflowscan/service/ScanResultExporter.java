package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.config.ScannerProperties;
import com.architecture.memory.workflowscan.model.ScanResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes finished scans to {@code <output-dir>/<scanId>/results.json}.
 */
@Component
@Slf4j
public class ScanResultExporter {

    static final String RESULTS_FILE = "results.json";

    private final ObjectMapper objectMapper;
    private final Path outputDir;

    @Autowired
    public ScanResultExporter(ObjectMapper objectMapper, ScannerProperties properties) {
        this(objectMapper, Path.of(properties.getOutputDir()));
    }

    public ScanResultExporter(ObjectMapper objectMapper, Path outputDir) {
        this.objectMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.outputDir = outputDir;
    }

    /**
     * @return the written results file
     */
    public Path export(String scanId, ScanResult result) throws IOException {
        Path scanDir = outputDir.resolve(scanId);
        Files.createDirectories(scanDir);
        Path target = scanDir.resolve(RESULTS_FILE);
        objectMapper.writeValue(target.toFile(), toDocument(scanId, result));
        log.info("[{}] Results written to {}", scanId, target);
        return target;
    }

    Map<String, Object> toDocument(String scanId, ScanResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("scan_id", scanId);
        document.put("repository_path", result.getRepositoryPath());
        document.put("status", result.getStatus());
        document.put("files_scanned", result.getFilesScanned());
        document.put("files_discovered", result.getFilesDiscovered());
        document.put("nodes", result.getGraph().getNodes());
        document.put("edges", result.getGraph().getEdges());
        document.put("workflows", result.getWorkflows());
        document.put("schemas", result.getSchemasDiscovered().getSchemas());
        document.put("errors", result.getErrors());
        document.put("warnings", result.getWarnings());
        document.put("scan_time_seconds", result.getScanTimeSeconds());
        return document;
    }
}
