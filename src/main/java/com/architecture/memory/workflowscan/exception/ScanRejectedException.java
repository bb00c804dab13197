package com.architecture.memory.workflowscan.exception;

import lombok.Getter;

/**
 * The scan executor had no capacity left for a new scan.
 */
@Getter
public class ScanRejectedException extends RuntimeException {

    private final String scanId;

    public ScanRejectedException(String scanId, Throwable cause) {
        super("Too many scans in progress, try again later", cause);
        this.scanId = scanId;
    }
}
