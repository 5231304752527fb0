package org.iceforge.tilecut.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import org.iceforge.tilecut.batch.BatchReport;

import java.time.Instant;

public final class TaskModels {

    private TaskModels() {}

    public enum Status {
        QUEUED,
        PROCESSING,
        COMPLETED,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    /**
     * Exactly one of {@code catalogPath} and {@code uploadId} names the catalog.
     *
     * @param catalogPath catalog file readable by the service (CSV or FITS table)
     * @param uploadId    id returned by {@code POST /api/catalogs}
     * @param config      cutout options; defaults when omitted
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubmitTaskRequest(
            String catalogPath,
            String uploadId,
            @Valid CutoutTaskConfig config
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TaskStatusResponse(
            String taskId,
            Status status,
            int progress,
            String message,
            String catalogPath,
            Instant createdAt,
            Instant startedAt,
            Instant finishedAt,
            Instant updatedAt,
            String error,
            BatchReport report,
            String downloadUrl
    ) {
        public static TaskStatusResponse from(TaskState s) {
            String download = s.status() == Status.COMPLETED ? "/api/tasks/" + s.taskId() + "/download" : null;
            return new TaskStatusResponse(s.taskId(), s.status(), s.progress(), s.message(), s.catalogPath(),
                    s.createdAt(), s.startedAt(), s.finishedAt(), s.updatedAt(), s.error(), s.report(), download);
        }
    }
}
