package org.iceforge.tilecut.batch;

/**
 * Receives progress updates from a running batch. Called from worker threads, never while
 * the aggregator's lock is held; updates may arrive slightly out of order.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total) -> { };

    void onProgress(int completedRequests, int totalRequests);
}
