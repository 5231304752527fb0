package org.iceforge.tilecut.batch;

import org.iceforge.tilecut.archive.ProductType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared outcome counter for one batch.
 * <p>
 * Workers report every (source, instrument, band) outcome here. All state sits behind one
 * lock, held only long enough to bump counters; the listener is called after the lock is
 * released, once every {@code progressEvery} completed requests and when the last request
 * completes.
 */
public class ProgressAggregator {

    private static final class Counts {
        long succeeded;
        long failed;
        long notFound;
        long invalid;
        long fromCache;

        ProductTypeStats snapshot() {
            return new ProductTypeStats(succeeded, failed, notFound, invalid, fromCache);
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final int totalRequests;
    private final int progressEvery;
    private final int maxFailureSamples;
    private final ProgressListener listener;

    private final Map<String, Counts> counts = new LinkedHashMap<>();
    private final List<FailureSample> samples = new ArrayList<>();
    private long failureCount;
    private int completedRequests;

    public ProgressAggregator(int totalRequests, List<ProductType> productTypes, int progressEvery,
                              int maxFailureSamples, ProgressListener listener) {
        this.totalRequests = totalRequests;
        this.progressEvery = Math.max(1, progressEvery);
        this.maxFailureSamples = Math.max(0, maxFailureSamples);
        this.listener = listener == null ? ProgressListener.NONE : listener;
        for (ProductType t : productTypes) {
            counts.put(t.code(), new Counts());
        }
    }

    public void recordSuccess(ProductType type, boolean fromCache) {
        lock.lock();
        try {
            Counts c = countsFor(type);
            c.succeeded++;
            if (fromCache) {
                c.fromCache++;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordFailed(ProductType type, FailureSample sample) {
        lock.lock();
        try {
            countsFor(type).failed++;
            keep(sample);
        } finally {
            lock.unlock();
        }
    }

    public void recordNotFound(ProductType type, FailureSample sample) {
        lock.lock();
        try {
            countsFor(type).notFound++;
            keep(sample);
        } finally {
            lock.unlock();
        }
    }

    public void recordInvalid(ProductType type, FailureSample sample) {
        lock.lock();
        try {
            countsFor(type).invalid++;
            keep(sample);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks one request as fully handled and publishes progress when due.
     */
    public void requestCompleted() {
        int done;
        boolean publish;
        lock.lock();
        try {
            done = ++completedRequests;
            publish = done % progressEvery == 0 || done == totalRequests;
        } finally {
            lock.unlock();
        }
        if (publish) {
            listener.onProgress(done, totalRequests);
        }
    }

    /** Publishes the current count unconditionally. */
    public void publish() {
        listener.onProgress(completedRequests(), totalRequests);
    }

    public int completedRequests() {
        lock.lock();
        try {
            return completedRequests;
        } finally {
            lock.unlock();
        }
    }

    public int totalRequests() {
        return totalRequests;
    }

    public Map<String, ProductTypeStats> stats() {
        lock.lock();
        try {
            Map<String, ProductTypeStats> out = new LinkedHashMap<>();
            counts.forEach((k, v) -> out.put(k, v.snapshot()));
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<FailureSample> failureSamples() {
        lock.lock();
        try {
            return List.copyOf(samples);
        } finally {
            lock.unlock();
        }
    }

    public long failureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    private Counts countsFor(ProductType type) {
        Objects.requireNonNull(type, "type");
        return counts.computeIfAbsent(type.code(), k -> new Counts());
    }

    private void keep(FailureSample sample) {
        failureCount++;
        if (sample != null && samples.size() < maxFailureSamples) {
            samples.add(sample);
        }
    }
}
