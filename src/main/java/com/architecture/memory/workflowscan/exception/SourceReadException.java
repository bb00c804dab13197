package com.architecture.memory.workflowscan.exception;

import lombok.Getter;

import java.io.IOException;

/**
 * A source file could not be read, even with the fallback encoding.
 */
@Getter
public class SourceReadException extends Exception {

    private final String filePath;

    public SourceReadException(String filePath, IOException cause) {
        super("Failed to read " + filePath + ": " + cause.getMessage(), cause);
        this.filePath = filePath;
    }
}
