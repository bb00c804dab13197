package com.architecture.memory.workflowscan.service.graph;

/**
 * Receives progress checkpoints from {@link WorkflowGraphBuilder}. Always invoked on the thread
 * running {@code build}; implementations that feed another execution context must hand the
 * update off themselves.
 */
@FunctionalInterface
public interface ScanProgressListener {

    ScanProgressListener NONE = (current, total, message) -> { };

    void onProgress(int current, int total, String message);

    /**
     * Checkpoint carrying the number of nodes in the merged graph so far.
     */
    default void onProgress(int current, int total, int nodesFound, String message) {
        onProgress(current, total, message);
    }
}
