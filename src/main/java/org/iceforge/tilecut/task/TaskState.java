package org.iceforge.tilecut.task;

import org.iceforge.tilecut.batch.BatchReport;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one task. Changes go through {@link TaskStateStore#update}, which
 * swaps in a new snapshot built with the {@code with...} methods below.
 */
public record TaskState(
        String taskId,
        TaskModels.Status status,
        int progress,
        String message,
        String catalogPath,
        CutoutTaskConfig config,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt,
        BatchReport report,
        String archivePath,
        String error,
        boolean cancelRequested
) {
    public TaskState {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100, got " + progress);
        }
    }

    public static TaskState queued(String taskId, String catalogPath, CutoutTaskConfig config) {
        Instant now = Instant.now();
        return new TaskState(taskId, TaskModels.Status.QUEUED, 0, "Queued", catalogPath, config,
                now, now, null, null, null, null, null, false);
    }

    public TaskState withProcessing(int progress, String message) {
        Instant now = Instant.now();
        return new TaskState(taskId, TaskModels.Status.PROCESSING, progress, message, catalogPath, config,
                createdAt, now, startedAt != null ? startedAt : now, null, report, archivePath, error, cancelRequested);
    }

    /** Progress never moves backwards. */
    public TaskState withProgress(int progress, String message) {
        return new TaskState(taskId, status, Math.max(this.progress, progress), message, catalogPath, config,
                createdAt, Instant.now(), startedAt, finishedAt, report, archivePath, error, cancelRequested);
    }

    public TaskState withCompleted(BatchReport report, String archivePath, String message) {
        Instant now = Instant.now();
        return new TaskState(taskId, TaskModels.Status.COMPLETED, 100, message, catalogPath, config,
                createdAt, now, startedAt, now, report, archivePath, null, cancelRequested);
    }

    public TaskState withFailed(String error, BatchReport report) {
        Instant now = Instant.now();
        return new TaskState(taskId, TaskModels.Status.FAILED, progress, "Failed: " + error, catalogPath, config,
                createdAt, now, startedAt, now, report, null, error, cancelRequested);
    }

    public TaskState withCancelled(BatchReport report) {
        Instant now = Instant.now();
        return new TaskState(taskId, TaskModels.Status.CANCELLED, progress, "Cancelled", catalogPath, config,
                createdAt, now, startedAt, now, report, null, null, true);
    }

    public TaskState withCancelRequested() {
        return new TaskState(taskId, status, progress, "Cancellation requested", catalogPath, config,
                createdAt, Instant.now(), startedAt, finishedAt, report, archivePath, error, true);
    }
}
