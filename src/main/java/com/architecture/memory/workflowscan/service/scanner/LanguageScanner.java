package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.exception.SourceReadException;
import com.architecture.memory.workflowscan.model.SchemaRegistry;
import com.architecture.memory.workflowscan.model.WorkflowGraph;

import java.nio.file.Path;

/**
 * Detects workflow operations in one source dialect.
 *
 * <p>Implementations must be safe to call from several worker threads at once: all per-file
 * state lives on the stack of {@link #scanFile}.
 */
public interface LanguageScanner {

    String getName();

    /**
     * Pure function of the path.
     */
    boolean canScan(Path file);

    /**
     * Scan one file into a fragment holding only what was found in it (and its paired
     * markup/code-behind, for UI dialects).
     *
     * @param registry schema registry from the pre-pass, may be {@code null}
     */
    WorkflowGraph scanFile(Path file, SchemaRegistry registry) throws SourceReadException;

    default WorkflowGraph scanFile(Path file) throws SourceReadException {
        return scanFile(file, null);
    }
}
