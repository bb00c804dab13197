package com.architecture.memory.workflowscan.service.graph;

import com.architecture.memory.workflowscan.exception.InvalidRepositoryPathException;
import com.architecture.memory.workflowscan.model.ScanConfig;
import com.architecture.memory.workflowscan.model.ScanResult;
import com.architecture.memory.workflowscan.model.ScanStatus;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.service.scanner.LanguageScanner;
import com.architecture.memory.workflowscan.service.scanner.ScannerRegistry;
import com.architecture.memory.workflowscan.service.schema.SchemaResolver;
import com.architecture.memory.workflowscan.service.workflow.WorkflowAnalyzer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Orchestrates one scan: discovery, schema pass, per-file scanning, edge inference and workflow
 * analysis.
 *
 * <p>With more than one worker thread, files are scanned on a private pool and the resulting
 * fragments are merged into the aggregate graph on the calling thread only; the aggregate graph
 * is never touched by a worker. Progress callbacks are also made on the calling thread.
 */
@Slf4j
public class WorkflowGraphBuilder {

    private final FileDiscoveryService fileDiscovery;
    private final SchemaResolver schemaResolver;
    private final WorkflowAnalyzer workflowAnalyzer;

    public WorkflowGraphBuilder(FileDiscoveryService fileDiscovery, SchemaResolver schemaResolver,
                                WorkflowAnalyzer workflowAnalyzer) {
        this.fileDiscovery = fileDiscovery;
        this.schemaResolver = schemaResolver;
        this.workflowAnalyzer = workflowAnalyzer;
    }

    public WorkflowGraphBuilder() {
        this(new FileDiscoveryService(), new SchemaResolver(), new WorkflowAnalyzer());
    }

    public ScanResult build(Path repository) {
        return build(repository, ScanConfig.defaults(), ScanProgressListener.NONE, CancellationToken.none());
    }

    public ScanResult build(Path repository, ScanConfig config) {
        return build(repository, config, ScanProgressListener.NONE, CancellationToken.none());
    }

    public ScanResult build(Path repository, ScanConfig config, ScanProgressListener listener) {
        return build(repository, config, listener, CancellationToken.none());
    }

    /**
     * Scan {@code repository}. Per-file failures are recorded on the result; a cancelled scan
     * returns what was merged so far with status {@link ScanStatus#CANCELLED}.
     *
     * @throws InvalidRepositoryPathException if the path is missing or not a directory
     */
    public ScanResult build(Path repository, ScanConfig config, ScanProgressListener listener,
                            CancellationToken token) {
        validateRepository(repository);
        ScanConfig effective = config != null ? config : ScanConfig.defaults();
        ScanProgressListener progress = listener != null ? listener : ScanProgressListener.NONE;
        CancellationToken cancellation = token != null ? token : CancellationToken.none();

        long start = System.nanoTime();
        ScanResult result = new ScanResult(repository.toString(), new WorkflowGraph());

        log.info("Scanning {} (extensions: {}, workers: {})",
                repository, effective.getIncludeExtensions(), effective.getWorkerThreads());

        List<Path> files;
        try {
            files = fileDiscovery.discover(repository, effective);
        } catch (IOException e) {
            log.error("File discovery failed for {}: {}", repository, e.getMessage(), e);
            result.getErrors().add("File discovery failed for " + repository + ": " + e.getMessage());
            files = List.of();
        }
        int total = files.size();
        result.setFilesDiscovered(total);
        log.info("Found {} files to scan", total);
        progress.onProgress(0, total, 0, String.format(Locale.ROOT, "Found %,d files to scan", total));

        if (!cancellation.isCancelled()) {
            result.setSchemasDiscovered(resolveSchemas(files, effective, result));
        }

        ScannerRegistry scanners = ScannerRegistry.defaults(effective.getDetect());
        ProgressTracker tracker = new ProgressTracker(effective, total, progress, start);
        if (effective.getWorkerThreads() <= 1) {
            scanSequentially(files, scanners, result, tracker, cancellation);
        } else {
            scanInParallel(files, scanners, result, tracker, cancellation, effective.getWorkerThreads());
        }

        if (cancellation.isCancelled()) {
            result.setStatus(ScanStatus.CANCELLED);
            log.info("Scan of {} cancelled after {} of {} files", repository, result.getFilesScanned(), total);
        }
        progress.onProgress(total, total, result.getGraph().nodeCount(),
                String.format(Locale.ROOT, "File scanning complete: %,d files processed", result.getFilesScanned()));

        if (effective.getEdgeInference().isEnabled()) {
            progress.onProgress(total, total, result.getGraph().nodeCount(), "Inferring workflow edges...");
            new EdgeInferenceEngine(effective.getEdgeInference()).infer(result.getGraph());
        } else {
            log.info("Skipping edge inference (disabled in config)");
        }

        if (effective.isAnalyzeWorkflows()) {
            progress.onProgress(total, total, result.getGraph().nodeCount(), "Analyzing UI workflows...");
            result.setWorkflows(workflowAnalyzer.analyze(result.getGraph()));
        }

        result.setScanTimeSeconds((System.nanoTime() - start) / 1_000_000_000.0);
        log.info("Scan complete: {} files, {} nodes, {} edges, {} workflows, {} errors in {}s",
                result.getFilesScanned(), result.getGraph().nodeCount(), result.getGraph().edgeCount(),
                result.getWorkflows().size(), result.getErrors().size(),
                String.format(Locale.ROOT, "%.2f", result.getScanTimeSeconds()));
        return result;
    }

    private static void validateRepository(Path repository) {
        if (repository == null) {
            throw new InvalidRepositoryPathException(null, "path is null");
        }
        if (!Files.exists(repository)) {
            throw new InvalidRepositoryPathException(repository.toString(), "path does not exist");
        }
        if (!Files.isDirectory(repository)) {
            throw new InvalidRepositoryPathException(repository.toString(), "path is not a directory");
        }
    }

    private SchemaRegistry resolveSchemas(List<Path> files, ScanConfig config, ScanResult result) {
        List<Path> backendFiles = new ArrayList<>();
        for (Path file : files) {
            if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".cs")) {
                backendFiles.add(file);
            }
        }
        if (backendFiles.isEmpty()) {
            return new SchemaRegistry();
        }
        log.info("Resolving schemas from {} backend files", backendFiles.size());
        return schemaResolver.resolve(backendFiles, config.getMaxSchemaFiles(), config.getMaxSchemas(),
                result.getWarnings());
    }

    private void scanSequentially(List<Path> files, ScannerRegistry scanners, ScanResult result,
                                  ProgressTracker tracker, CancellationToken token) {
        SchemaRegistry registry = result.getSchemasDiscovered();
        for (Path file : files) {
            if (token.isCancelled()) {
                return;
            }
            merge(scanOne(file, scanners, registry), result, tracker);
        }
    }

    private void scanInParallel(List<Path> files, ScannerRegistry scanners, ScanResult result,
                                ProgressTracker tracker, CancellationToken token, int workers) {
        SchemaRegistry registry = result.getSchemasDiscovered();
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("workflow-scan-"));
        CompletionService<FileOutcome> completion = new ExecutorCompletionService<>(pool);
        List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
        try {
            for (Path file : files) {
                futures.add(completion.submit(() -> token.isCancelled()
                        ? FileOutcome.skipped(file)
                        : scanOne(file, scanners, registry)));
            }
            for (int i = 0; i < files.size(); i++) {
                if (token.isCancelled()) {
                    futures.forEach(f -> f.cancel(true));
                    return;
                }
                FileOutcome outcome;
                try {
                    outcome = completion.take().get();
                } catch (ExecutionException e) {
                    // scanOne catches per-file failures; anything here is a bug in the pool wiring
                    log.error("Worker failed: {}", e.getCause().getMessage(), e.getCause());
                    result.getErrors().add("Worker failed: " + e.getCause().getMessage());
                    continue;
                }
                merge(outcome, result, tracker);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            futures.forEach(f -> f.cancel(true));
        } finally {
            pool.shutdownNow();
            try {
                pool.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // runs on worker threads: touches nothing but its own file and the read-only registry
    private static FileOutcome scanOne(Path file, ScannerRegistry scanners, SchemaRegistry registry) {
        Optional<LanguageScanner> scanner = scanners.scannerFor(file);
        if (scanner.isEmpty()) {
            return FileOutcome.skipped(file);
        }
        try {
            return FileOutcome.scanned(file, scanner.get().scanFile(file, registry));
        } catch (Exception e) {
            return FileOutcome.failed(file, "Error scanning " + file + ": " + e.getMessage());
        }
    }

    // single merge point: only ever called on the thread running build()
    private static void merge(FileOutcome outcome, ScanResult result, ProgressTracker tracker) {
        if (outcome.getError() != null) {
            log.warn(outcome.getError());
            result.getErrors().add(outcome.getError());
            return;
        }
        if (outcome.getFragment() == null) {
            return;
        }
        result.getGraph().merge(outcome.getFragment());
        result.incrementFilesScanned();
        log.debug("Scanned {}: {} nodes", outcome.getFile(), outcome.getFragment().nodeCount());
        tracker.fileScanned(result);
    }

    @Value
    static class FileOutcome {
        Path file;
        WorkflowGraph fragment;
        String error;

        static FileOutcome scanned(Path file, WorkflowGraph fragment) {
            return new FileOutcome(file, fragment, null);
        }

        static FileOutcome failed(Path file, String error) {
            return new FileOutcome(file, null, error);
        }

        static FileOutcome skipped(Path file) {
            return new FileOutcome(file, null, null);
        }
    }

    /**
     * Emits a checkpoint every {@code progressEveryFiles} scanned files or when
     * {@code progressEverySeconds} have passed since the last one.
     */
    static class ProgressTracker {
        private final ScanProgressListener listener;
        private final int total;
        private final int everyFiles;
        private final long everyNanos;
        private final long start;
        private long lastReport;

        ProgressTracker(ScanConfig config, int total, ScanProgressListener listener, long start) {
            this.listener = listener;
            this.total = total;
            this.everyFiles = Math.max(1, config.getProgressEveryFiles());
            this.everyNanos = TimeUnit.SECONDS.toNanos(config.getProgressEverySeconds());
            this.start = start;
            this.lastReport = start;
        }

        void fileScanned(ScanResult result) {
            long now = System.nanoTime();
            int scanned = result.getFilesScanned();
            if (scanned % everyFiles != 0 && now - lastReport < everyNanos) {
                return;
            }
            lastReport = now;
            int nodes = result.getGraph().nodeCount();
            String message = format(scanned, total, nodes, now - start);
            log.info(message);
            listener.onProgress(scanned, total, nodes, message);
        }

        static String format(int scanned, int total, int nodes, long elapsedNanos) {
            double percent = total > 0 ? scanned * 100.0 / total : 100.0;
            long etaSeconds = scanned > 0
                    ? TimeUnit.NANOSECONDS.toSeconds(elapsedNanos / scanned * (total - scanned))
                    : 0;
            return String.format(Locale.ROOT, "[%5.1f%%] %,d/%,d files | Nodes: %,d | ETA: %dm %ds",
                    percent, scanned, total, nodes, etaSeconds / 60, etaSeconds % 60);
        }
    }
}
