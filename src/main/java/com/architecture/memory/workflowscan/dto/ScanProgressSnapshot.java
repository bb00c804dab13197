package com.architecture.memory.workflowscan.dto;

import com.architecture.memory.workflowscan.model.ScanStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time state of a running scan, as delivered to progress consumers.
 */
@Value
@Builder(toBuilder = true)
public class ScanProgressSnapshot {
    String scanId;
    ScanStatus status;
    double progress;
    String message;
    int filesScanned;
    int nodesFound;
    int totalFiles;

    @Singular
    List<AnalysisStep> steps;

    Instant timestamp;
}
