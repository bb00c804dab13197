package com.architecture.memory.workflowscan.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Marks scans left unfinished by a previous run of the service as failed on startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InterruptedScanInitializer implements CommandLineRunner {

    private final ScanHistoryService historyService;

    @Override
    public void run(String... args) {
        int interrupted = historyService.markInterrupted();
        if (interrupted > 0) {
            log.info("Marked {} interrupted scans as failed", interrupted);
        }
    }
}
