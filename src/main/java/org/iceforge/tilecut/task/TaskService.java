package org.iceforge.tilecut.task;

import org.iceforge.tilecut.TilecutProperties;
import org.iceforge.tilecut.batch.BatchOptions;
import org.iceforge.tilecut.batch.BatchOrchestrator;
import org.iceforge.tilecut.batch.BatchReport;
import org.iceforge.tilecut.batch.ProgressListener;
import org.iceforge.tilecut.cache.ArtifactCacheFactory;
import org.iceforge.tilecut.catalog.Catalog;
import org.iceforge.tilecut.catalog.CatalogReader;
import org.iceforge.tilecut.catalog.CatalogUploadStore;
import org.iceforge.tilecut.catalog.SourceRequestFactory;
import org.iceforge.tilecut.output.ResultPackager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Accepts cutout tasks and runs them in the background: read the catalog, build requests,
 * run the batch, package the outputs.
 * <p>
 * Progress runs 0-30 while preparing, 30-90 while the batch processes requests, 95 while
 * packaging and 100 when the archive is ready.
 */
@Service
public class TaskService {
    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    static final int PROGRESS_BATCH_START = 30;
    static final int PROGRESS_BATCH_SPAN = 60;
    static final int PROGRESS_BATCH_CAP = 90;

    private final TilecutProperties props;
    private final TaskStateStore store;
    private final CatalogReader catalogReader;
    private final SourceRequestFactory requestFactory;
    private final BatchOrchestrator orchestrator;
    private final ResultPackager packager;
    private final ArtifactCacheFactory cacheFactory;
    private final CatalogUploadStore uploads;
    private final ExecutorService cutoutTaskExecutor;

    public TaskService(TilecutProperties props,
                       TaskStateStore store,
                       CatalogReader catalogReader,
                       SourceRequestFactory requestFactory,
                       BatchOrchestrator orchestrator,
                       ResultPackager packager,
                       ArtifactCacheFactory cacheFactory,
                       CatalogUploadStore uploads,
                       ExecutorService cutoutTaskExecutor) {
        this.props = Objects.requireNonNull(props);
        this.store = Objects.requireNonNull(store);
        this.catalogReader = Objects.requireNonNull(catalogReader);
        this.requestFactory = Objects.requireNonNull(requestFactory);
        this.orchestrator = Objects.requireNonNull(orchestrator);
        this.packager = Objects.requireNonNull(packager);
        this.cacheFactory = Objects.requireNonNull(cacheFactory);
        this.uploads = Objects.requireNonNull(uploads);
        this.cutoutTaskExecutor = Objects.requireNonNull(cutoutTaskExecutor);
    }

    public TaskState submit(TaskModels.SubmitTaskRequest req) {
        Objects.requireNonNull(req, "req");
        String catalogPath = catalogPath(req);
        CutoutTaskConfig config = req.config() != null ? req.config() : CutoutTaskConfig.defaults();
        String taskId = UUID.randomUUID().toString();
        TaskState created = store.create(TaskState.queued(taskId, catalogPath, config));
        logger.info("Task {} queued: catalog={} products={} instruments={} bands={}",
                taskId, catalogPath, config.productTypes(), config.instruments(), config.bands());

        cutoutTaskExecutor.submit(() -> {
            try {
                execute(taskId);
            } catch (Exception e) {
                store.update(taskId, s -> s.withFailed(e.toString(), s.report()));
                logger.warn("Task execution failed taskId={}: {}", taskId, e.toString());
            }
        });
        return created;
    }

    private String catalogPath(TaskModels.SubmitTaskRequest req) {
        boolean hasPath = req.catalogPath() != null && !req.catalogPath().isBlank();
        boolean hasUpload = req.uploadId() != null && !req.uploadId().isBlank();
        if (hasPath == hasUpload) {
            throw new IllegalArgumentException("Exactly one of catalogPath and uploadId is required");
        }
        if (hasPath) {
            return req.catalogPath();
        }
        return uploads.resolve(req.uploadId().trim())
                .map(p -> p.toAbsolutePath().toString())
                .orElseThrow(() -> new IllegalArgumentException("Unknown uploadId: " + req.uploadId()));
    }

    public Optional<TaskState> status(String taskId) {
        return store.get(taskId);
    }

    public List<TaskState> list() {
        return store.list();
    }

    /**
     * Queued tasks are cancelled at once; running tasks stop between requests. Finished
     * tasks are left as they are.
     */
    public Optional<TaskState> cancel(String taskId) {
        return store.update(taskId, s -> {
            if (s.status().isTerminal()) {
                return s;
            }
            if (s.status() == TaskModels.Status.QUEUED) {
                return s.withCancelled(null);
            }
            return s.withCancelRequested();
        });
    }

    /** The result archive of a completed task. */
    public Optional<Path> archive(String taskId) {
        return store.get(taskId)
                .filter(s -> s.status() == TaskModels.Status.COMPLETED && s.archivePath() != null)
                .map(s -> Path.of(s.archivePath()))
                .filter(Files::isRegularFile);
    }

    void execute(String taskId) throws Exception {
        TaskState state = store.update(taskId,
                s -> s.status() == TaskModels.Status.QUEUED ? s.withProcessing(5, "Reading catalog") : s).orElse(null);
        if (state == null || state.status() != TaskModels.Status.PROCESSING) {
            return;
        }
        CutoutTaskConfig config = state.config();
        Path workDir = Path.of(props.getWorkDir()).resolve(taskId);
        try {
            int maxRows = config.maxRows() != null ? config.maxRows() : props.getMaxCatalogRows();
            Catalog catalog = catalogReader.read(Path.of(state.catalogPath()), maxRows);
            String truncation = catalog.truncated()
                    ? "Catalog truncated to the first " + catalog.size() + " of " + catalog.totalRows() + " rows"
                    : null;
            store.update(taskId, s -> s.withProgress(10, truncation != null ? truncation : "Read " + catalog.size() + " rows"));

            SourceRequestFactory.Result built = requestFactory.create(catalog, config);
            store.update(taskId, s -> s.withProgress(20, "Prepared " + built.requests().size() + " requests"));

            BatchOptions options = new BatchOptions(config.edgeMode(), config.fillValue(), config.rejectInvalid(),
                    config.saveCatalogRow(), config.workers() != null ? config.workers() : props.getWorkers(),
                    props.getProgressEvery(), props.getMaxFailureSamples());
            Files.createDirectories(workDir);
            store.update(taskId, s -> s.withProgress(PROGRESS_BATCH_START, "Processing " + built.requests().size() + " sources"));

            BatchReport report = orchestrator.run(taskId, built.requests(), options, workDir,
                    progressListener(taskId),
                    () -> store.get(taskId).map(TaskState::cancelRequested).orElse(false));

            if (report.cancelled()) {
                store.update(taskId, s -> s.withCancelled(report));
                logger.info("Task {} cancelled ({} cutouts written before stopping)", taskId, report.totalSucceeded());
                return;
            }

            store.update(taskId, s -> s.withProgress(95, "Packaging results"));
            Path zip = Path.of(props.getOutputDir()).resolve(taskId + ".zip");
            int entries = packager.zip(workDir, zip);

            String summary = "Completed: " + report.totalSucceeded() + " cutouts in " + entries + " files"
                    + (report.noTileTargets().isEmpty() ? "" : ", " + report.noTileTargets().size() + " sources outside every tile")
                    + (built.skippedRows() > 0 ? ", " + built.skippedRows() + " rows without a position" : "")
                    + (truncation != null ? ". " + truncation : "");
            store.update(taskId, s -> s.withCompleted(report, zip.toAbsolutePath().toString(), summary));
            logger.info("Task {} completed: {}", taskId, summary);
        } finally {
            packager.deleteQuietly(workDir);
            cacheFactory.discard(taskId);
        }
    }

    ProgressListener progressListener(String taskId) {
        return (done, total) -> {
            if (total <= 0) {
                return;
            }
            int pct = Math.min(PROGRESS_BATCH_CAP, PROGRESS_BATCH_START + (int) ((long) done * PROGRESS_BATCH_SPAN / total));
            store.update(taskId, s -> s.withProgress(pct, "Processed " + done + "/" + total + " sources"));
        };
    }
}
