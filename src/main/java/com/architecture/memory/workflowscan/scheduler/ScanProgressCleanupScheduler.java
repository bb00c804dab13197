package com.architecture.memory.workflowscan.scheduler;

import com.architecture.memory.workflowscan.config.ScannerProperties;
import com.architecture.memory.workflowscan.service.ScanProgressChannel;
import com.architecture.memory.workflowscan.service.ScanService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Evicts progress channels and in-memory results of scans finished longer ago than the
 * configured retention. Exported results files and history records are kept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScanProgressCleanupScheduler {

    private final ScanProgressChannel progressChannel;
    private final ScanService scanService;
    private final ScannerProperties properties;

    @Scheduled(fixedRate = 600000) // every 10 minutes
    public void cleanupFinishedScans() {
        log.debug("Running scan progress cleanup...");
        try {
            Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getProgress().getRetentionMinutes()));
            int channels = progressChannel.evictCompletedBefore(cutoff);
            int results = scanService.evictResultsBefore(cutoff);
            if (channels > 0 || results > 0) {
                log.info("Scan cleanup completed: {} progress channels and {} results removed", channels, results);
            }
        } catch (Exception e) {
            log.error("Scan cleanup failed: {}", e.getMessage(), e);
        }
    }
}
