package com.architecture.memory.workflowscan.exception;

import lombok.Getter;

@Getter
public class ScanNotFoundException extends RuntimeException {

    private final String scanId;

    public ScanNotFoundException(String scanId) {
        super("Scan not found: " + scanId);
        this.scanId = scanId;
    }
}
