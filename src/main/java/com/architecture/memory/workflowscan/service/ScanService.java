package com.architecture.memory.workflowscan.service;

import com.architecture.memory.workflowscan.config.AsyncConfig;
import com.architecture.memory.workflowscan.config.ScannerProperties;
import com.architecture.memory.workflowscan.dto.AnalysisStep;
import com.architecture.memory.workflowscan.dto.ScanProgressSnapshot;
import com.architecture.memory.workflowscan.dto.ScanRequest;
import com.architecture.memory.workflowscan.dto.ScanResponse;
import com.architecture.memory.workflowscan.exception.InvalidRepositoryPathException;
import com.architecture.memory.workflowscan.exception.ScanNotFoundException;
import com.architecture.memory.workflowscan.exception.ScanRejectedException;
import com.architecture.memory.workflowscan.model.DetectionToggles;
import com.architecture.memory.workflowscan.model.ScanConfig;
import com.architecture.memory.workflowscan.model.ScanRecord;
import com.architecture.memory.workflowscan.model.ScanResult;
import com.architecture.memory.workflowscan.model.ScanStatus;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.workflow.UIWorkflow;
import com.architecture.memory.workflowscan.service.graph.CancellationToken;
import com.architecture.memory.workflowscan.service.graph.ScanProgressListener;
import com.architecture.memory.workflowscan.service.graph.WorkflowGraphBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs scans in the background and keeps their progress, history and results.
 *
 * <p>Lifecycle: {@code queued → discovering → scanning → analyzing → completed | cancelled | error}.
 */
@Service
@Slf4j
public class ScanService {

    static final String EDGE_STEP = "Inferring workflow edges";
    static final String WORKFLOW_STEP = "Analyzing UI workflows";

    private final WorkflowGraphBuilder graphBuilder;
    private final ScanConfigLoader configLoader;
    private final ScanProgressChannel progressChannel;
    private final ScanHistoryService historyService;
    private final ScanResultExporter resultExporter;
    private final ScannerProperties properties;
    private final TaskExecutor scanExecutor;
    private final Clock clock;

    private final Map<String, CancellationToken> runningScans = new ConcurrentHashMap<>();
    private final Map<String, CompletedScan> completedScans = new ConcurrentHashMap<>();

    @Autowired
    public ScanService(WorkflowGraphBuilder graphBuilder,
                       ScanConfigLoader configLoader,
                       ScanProgressChannel progressChannel,
                       ScanHistoryService historyService,
                       ScanResultExporter resultExporter,
                       ScannerProperties properties,
                       @Qualifier(AsyncConfig.SCAN_EXECUTOR) TaskExecutor scanExecutor) {
        this(graphBuilder, configLoader, progressChannel, historyService, resultExporter, properties,
                scanExecutor, Clock.systemUTC());
    }

    ScanService(WorkflowGraphBuilder graphBuilder, ScanConfigLoader configLoader,
                ScanProgressChannel progressChannel, ScanHistoryService historyService,
                ScanResultExporter resultExporter, ScannerProperties properties,
                TaskExecutor scanExecutor, Clock clock) {
        this.graphBuilder = graphBuilder;
        this.configLoader = configLoader;
        this.progressChannel = progressChannel;
        this.historyService = historyService;
        this.resultExporter = resultExporter;
        this.properties = properties;
        this.scanExecutor = scanExecutor;
        this.clock = clock;
    }

    /**
     * Queue a scan of {@code request.repoPath}.
     *
     * @throws InvalidRepositoryPathException if the path is not an existing directory
     */
    public ScanResponse startScan(ScanRequest request) {
        Path repository = validateRepository(request.getRepoPath());
        String scanId = UUID.randomUUID().toString();

        historyService.create(scanId, repository.toString(), request.getScanType(), request.getPerformedBy());
        progressChannel.open(scanId);
        publish(scanId, ScanStatus.QUEUED, 0, "Scan queued", 0, 0, 0, List.of());

        CancellationToken token = new CancellationToken();
        runningScans.put(scanId, token);
        try {
            scanExecutor.execute(() -> runScan(scanId, repository, request, token));
        } catch (TaskRejectedException e) {
            runningScans.remove(scanId);
            log.warn("[{}] Scan rejected, executor is saturated", scanId);
            failScan(scanId, "Scan rejected: too many scans in progress");
            progressChannel.complete(scanId);
            throw new ScanRejectedException(scanId, e);
        }

        log.info("[{}] Scan queued for {}", scanId, repository);
        return ScanResponse.builder()
                .scanId(scanId)
                .status(ScanStatus.QUEUED)
                .message("Scan started for " + repository.getFileName())
                .build();
    }

    void runScan(String scanId, Path repository, ScanRequest request, CancellationToken token) {
        try {
            ScanConfig config = resolveConfig(repository, request);
            historyService.update(scanId, record -> record.setStatus(ScanStatus.DISCOVERING));
            publish(scanId, ScanStatus.DISCOVERING, 0, "Discovering files...", 0, 0, 0, List.of());
            log.info("[{}] Scanning {} with {} worker(s)", scanId, repository, config.getWorkerThreads());

            ProgressAdapter listener = new ProgressAdapter(scanId);
            ScanResult result = graphBuilder.build(repository, config, listener, token);
            finishScan(scanId, result, listener);
        } catch (Exception e) {
            log.error("[{}] Scan failed: {}", scanId, e.getMessage(), e);
            failScan(scanId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            runningScans.remove(scanId);
            progressChannel.complete(scanId);
        }
    }

    private void finishScan(String scanId, ScanResult result, ProgressAdapter listener) {
        ScanStatus status = result.isCancelled() ? ScanStatus.CANCELLED : ScanStatus.COMPLETED;

        String resultFile = null;
        try {
            resultFile = resultExporter.export(scanId, result).toString();
        } catch (IOException e) {
            log.warn("[{}] Could not write results: {}", scanId, e.getMessage());
            result.getWarnings().add("Could not write results: " + e.getMessage());
        }
        completedScans.put(scanId, new CompletedScan(result, clock.instant()));

        String exportedFile = resultFile;
        historyService.update(scanId, record -> {
            record.setStatus(status);
            record.setCompletedAt(LocalDateTime.now(clock));
            record.setFilesScanned(result.getFilesScanned());
            record.setTotalFiles(result.getFilesDiscovered());
            record.setNodesFound(result.getGraph().nodeCount());
            record.setEdgesFound(result.getGraph().edgeCount());
            record.setWorkflowsFound(result.getWorkflows().size());
            record.setScanDuration(result.getScanTimeSeconds());
            record.setErrors(new ArrayList<>(result.getErrors()));
            record.setResultFile(exportedFile);
        });

        String message = status == ScanStatus.CANCELLED
                ? String.format(Locale.ROOT, "Scan cancelled after %,d files", result.getFilesScanned())
                : String.format(Locale.ROOT, "Scan complete: %,d nodes, %,d edges, %,d workflows",
                result.getGraph().nodeCount(), result.getGraph().edgeCount(), result.getWorkflows().size());
        publish(scanId, status, 100, message, result.getFilesScanned(), result.getGraph().nodeCount(),
                result.getFilesDiscovered(), listener.completedSteps());
        log.info("[{}] {}", scanId, message);
    }

    private void failScan(String scanId, String error) {
        publish(scanId, ScanStatus.ERROR, 0, "Scan failed: " + error, 0, 0, 0, List.of());
        try {
            historyService.update(scanId, record -> {
                record.setStatus(ScanStatus.ERROR);
                record.setCompletedAt(LocalDateTime.now(clock));
                record.getErrors().add(error);
            });
        } catch (RuntimeException e) {
            log.error("[{}] Could not record scan failure: {}", scanId, e.getMessage(), e);
        }
    }

    /**
     * Request cancellation of a running scan.
     *
     * @return {@code true} if the scan was running, {@code false} if it had already finished
     * @throws ScanNotFoundException if the scan id is unknown
     */
    public boolean cancel(String scanId) {
        CancellationToken token = runningScans.get(scanId);
        if (token != null) {
            token.cancel();
            log.info("[{}] Cancellation requested", scanId);
            return true;
        }
        historyService.get(scanId);
        return false;
    }

    /**
     * Last known progress of a scan, falling back to its history record when the progress
     * channel has already been evicted.
     */
    public ScanProgressSnapshot status(String scanId) {
        return progressChannel.latest(scanId).orElseGet(() -> fromRecord(historyService.get(scanId)));
    }

    public List<ScanProgressSnapshot> drainProgress(String scanId) {
        if (progressChannel.latest(scanId).isEmpty()) {
            historyService.get(scanId);
        }
        return progressChannel.drain(scanId);
    }

    public Optional<ScanResult> getResult(String scanId) {
        CompletedScan completed = completedScans.get(scanId);
        return completed != null ? Optional.of(completed.result) : Optional.empty();
    }

    public List<UIWorkflow> getWorkflows(String scanId) {
        return requireResult(scanId).getWorkflows();
    }

    public WorkflowGraph getGraph(String scanId) {
        return requireResult(scanId).getGraph();
    }

    public boolean isRunning(String scanId) {
        return runningScans.containsKey(scanId);
    }

    /**
     * Drop in-memory results of scans that finished before {@code cutoff}.
     *
     * @return number of results removed
     */
    public int evictResultsBefore(Instant cutoff) {
        int removed = 0;
        Iterator<CompletedScan> it = completedScans.values().iterator();
        while (it.hasNext()) {
            if (it.next().completedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private ScanResult requireResult(String scanId) {
        return getResult(scanId).orElseThrow(() -> new ScanNotFoundException(scanId));
    }

    ScanConfig resolveConfig(Path repository, ScanRequest request) {
        ScanConfig config = configLoader.load(repository, properties.toScanConfig());
        ScanConfig.ScanConfigBuilder builder = config.toBuilder();
        if (request.getFileExtensions() != null && !request.getFileExtensions().isEmpty()) {
            builder.includeExtensions(List.copyOf(request.getFileExtensions()));
        }
        DetectionToggles.DetectionTogglesBuilder detect = config.getDetect().toBuilder();
        if (request.getDetectDatabase() != null) detect.database(request.getDetectDatabase());
        if (request.getDetectApi() != null) detect.apiCalls(request.getDetectApi());
        if (request.getDetectFiles() != null) detect.fileIo(request.getDetectFiles());
        if (request.getDetectMessages() != null) detect.messageQueues(request.getDetectMessages());
        if (request.getDetectTransforms() != null) detect.dataTransforms(request.getDetectTransforms());
        builder.detect(detect.build());
        if (request.getWorkerThreads() != null) {
            builder.workerThreads(Math.max(1, request.getWorkerThreads()));
        }
        return builder.build();
    }

    private static Path validateRepository(String repoPath) {
        if (repoPath == null || repoPath.isBlank()) {
            throw new InvalidRepositoryPathException(repoPath, "path is empty");
        }
        Path repository = Path.of(repoPath).toAbsolutePath().normalize();
        if (!Files.exists(repository)) {
            throw new InvalidRepositoryPathException(repoPath, "path does not exist");
        }
        if (!Files.isDirectory(repository)) {
            throw new InvalidRepositoryPathException(repoPath, "path is not a directory");
        }
        return repository;
    }

    private void publish(String scanId, ScanStatus status, double progress, String message,
                         int filesScanned, int nodesFound, int totalFiles, List<AnalysisStep> steps) {
        progressChannel.publish(ScanProgressSnapshot.builder()
                .scanId(scanId)
                .status(status)
                .progress(progress)
                .message(message)
                .filesScanned(filesScanned)
                .nodesFound(nodesFound)
                .totalFiles(totalFiles)
                .steps(steps)
                .timestamp(clock.instant())
                .build());
    }

    private static ScanProgressSnapshot fromRecord(ScanRecord record) {
        boolean finished = record.getStatus() != null && record.getStatus().isTerminal();
        return ScanProgressSnapshot.builder()
                .scanId(record.getScanId())
                .status(record.getStatus())
                .progress(record.getStatus() == ScanStatus.COMPLETED ? 100 : 0)
                .message(finished ? "Scan " + record.getStatus().getValue() : "Scan in progress")
                .filesScanned(record.getFilesScanned())
                .nodesFound(record.getNodesFound())
                .totalFiles(record.getTotalFiles() != null ? record.getTotalFiles() : 0)
                .build();
    }

    static double percent(int current, int total) {
        if (total <= 0) return 0;
        return Math.min(100.0, current * 100.0 / total);
    }

    private static final class CompletedScan {
        private final ScanResult result;
        private final Instant completedAt;

        private CompletedScan(ScanResult result, Instant completedAt) {
            this.result = result;
            this.completedAt = completedAt;
        }
    }

    /**
     * Turns builder checkpoints into snapshots on the progress channel.
     */
    private final class ProgressAdapter implements ScanProgressListener {

        private final String scanId;
        private ScanStatus status = ScanStatus.DISCOVERING;
        private boolean edgesStarted;
        private boolean workflowsStarted;
        private int nodesFound;

        private ProgressAdapter(String scanId) {
            this.scanId = scanId;
        }

        @Override
        public void onProgress(int current, int total, int nodesFound, String message) {
            this.nodesFound = nodesFound;
            onProgress(current, total, message);
        }

        @Override
        public void onProgress(int current, int total, String message) {
            if (message.startsWith("Inferring")) {
                edgesStarted = true;
                status = ScanStatus.ANALYZING;
            } else if (message.startsWith("Analyzing")) {
                workflowsStarted = true;
                status = ScanStatus.ANALYZING;
            } else if (status == ScanStatus.DISCOVERING) {
                status = ScanStatus.SCANNING;
                historyService.update(scanId, record -> {
                    record.setStatus(ScanStatus.SCANNING);
                    record.setTotalFiles(total);
                });
            }
            publish(scanId, status, percent(current, total), message, current, nodesFound, total, steps(false));
            log.debug("[{}] {}", scanId, message);
        }

        List<AnalysisStep> completedSteps() {
            return steps(true);
        }

        private List<AnalysisStep> steps(boolean finished) {
            return List.of(
                    step(EDGE_STEP, "🔗", edgesStarted, edgesStarted && (finished || workflowsStarted)),
                    step(WORKFLOW_STEP, "🧭", workflowsStarted, finished && workflowsStarted));
        }

        private AnalysisStep step(String name, String icon, boolean started, boolean done) {
            String stepStatus = done ? AnalysisStep.COMPLETED : started ? AnalysisStep.IN_PROGRESS : AnalysisStep.PENDING;
            return AnalysisStep.builder()
                    .name(name)
                    .icon(icon)
                    .status(stepStatus)
                    .progress(done ? 100 : 0)
                    .build();
        }
    }
}
