package com.architecture.memory.workflowscan.model;

import com.architecture.memory.workflowscan.model.workflow.UIWorkflow;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one scan, populated incrementally by the builder.
 */
@Data
public class ScanResult {

    private final String repositoryPath;
    private final WorkflowGraph graph;
    private int filesScanned;
    private int filesDiscovered;
    private SchemaRegistry schemasDiscovered = new SchemaRegistry();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private double scanTimeSeconds;
    private ScanStatus status = ScanStatus.COMPLETED;
    private List<UIWorkflow> workflows = new ArrayList<>();

    public ScanResult(String repositoryPath, WorkflowGraph graph) {
        this.repositoryPath = repositoryPath;
        this.graph = graph;
    }

    public void incrementFilesScanned() {
        filesScanned++;
    }

    public boolean isCancelled() {
        return status == ScanStatus.CANCELLED;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
