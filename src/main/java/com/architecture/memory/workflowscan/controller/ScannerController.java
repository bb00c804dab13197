package com.architecture.memory.workflowscan.controller;

import com.architecture.memory.workflowscan.dto.ScanListResponse;
import com.architecture.memory.workflowscan.dto.ScanProgressSnapshot;
import com.architecture.memory.workflowscan.dto.ScanRequest;
import com.architecture.memory.workflowscan.dto.ScanResponse;
import com.architecture.memory.workflowscan.dto.UnviewedCountResponse;
import com.architecture.memory.workflowscan.model.ScanRecord;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.workflow.UIWorkflow;
import com.architecture.memory.workflowscan.service.ScanHistoryService;
import com.architecture.memory.workflowscan.service.ScanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/scanner")
@RequiredArgsConstructor
@Slf4j
public class ScannerController {

    private final ScanService scanService;
    private final ScanHistoryService historyService;

    @PostMapping("/scan")
    public ResponseEntity<ScanResponse> startScan(@Valid @RequestBody ScanRequest request) {
        log.info("Scan requested for {}", request.getRepoPath());
        ScanResponse response = scanService.startScan(request);
        return new ResponseEntity<>(response, HttpStatus.ACCEPTED);
    }

    @GetMapping("/scans")
    public ResponseEntity<ScanListResponse> listScans(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(historyService.list(page, size));
    }

    @GetMapping("/scans/unviewed-count")
    public ResponseEntity<UnviewedCountResponse> getUnviewedCount() {
        return ResponseEntity.ok(new UnviewedCountResponse(historyService.unviewedCount()));
    }

    @GetMapping("/scans/{scanId}")
    public ResponseEntity<ScanRecord> getScan(@PathVariable String scanId) {
        return ResponseEntity.ok(historyService.get(scanId));
    }

    @GetMapping("/scans/{scanId}/status")
    public ResponseEntity<ScanProgressSnapshot> getStatus(@PathVariable String scanId) {
        return ResponseEntity.ok(scanService.status(scanId));
    }

    /**
     * Snapshots published since the previous call; empty when nothing new happened.
     */
    @GetMapping("/scans/{scanId}/progress")
    public ResponseEntity<List<ScanProgressSnapshot>> getProgress(@PathVariable String scanId) {
        return ResponseEntity.ok(scanService.drainProgress(scanId));
    }

    @PostMapping("/scans/{scanId}/cancel")
    public ResponseEntity<ScanResponse> cancelScan(@PathVariable String scanId) {
        boolean cancelled = scanService.cancel(scanId);
        ScanRecord record = historyService.get(scanId);
        return ResponseEntity.ok(ScanResponse.builder()
                .scanId(scanId)
                .status(record.getStatus())
                .message(cancelled ? "Cancellation requested" : "Scan is not running")
                .build());
    }

    @GetMapping("/scans/{scanId}/workflows")
    public ResponseEntity<List<UIWorkflow>> getWorkflows(@PathVariable String scanId) {
        return ResponseEntity.ok(scanService.getWorkflows(scanId));
    }

    @GetMapping("/scans/{scanId}/graph")
    public ResponseEntity<Map<String, Object>> getGraph(@PathVariable String scanId) {
        WorkflowGraph graph = scanService.getGraph(scanId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scan_id", scanId);
        body.put("node_count", graph.nodeCount());
        body.put("edge_count", graph.edgeCount());
        body.put("nodes", graph.getNodes());
        body.put("edges", graph.getEdges());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/scans/{scanId}/viewed")
    public ResponseEntity<ScanRecord> markViewed(@PathVariable String scanId) {
        return ResponseEntity.ok(historyService.markViewed(scanId));
    }
}
