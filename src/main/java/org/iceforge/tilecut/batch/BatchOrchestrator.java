package org.iceforge.tilecut.batch;

import org.iceforge.tilecut.archive.FileNameResolver;
import org.iceforge.tilecut.archive.ProductType;
import org.iceforge.tilecut.cache.ArtifactCache;
import org.iceforge.tilecut.cache.ArtifactCacheFactory;
import org.iceforge.tilecut.extract.WindowExtractor;
import org.iceforge.tilecut.output.CutoutContainerWriter;
import org.iceforge.tilecut.sky.SpatialTileIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Runs a batch of cutout requests: resolve each request's tile, group by tile, and hand
 * each group to one worker of a bounded pool.
 * <p>
 * Requests no tile covers are reported, not processed. Per-source problems are counted in
 * the {@link BatchReport}; a storage failure stops the remaining groups and surfaces as
 * {@link BatchAbortedException}.
 */
@Service
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final SpatialTileIndex tileIndex;
    private final FileNameResolver resolver;
    private final WindowExtractor extractor;
    private final ArtifactCacheFactory cacheFactory;
    private final CutoutContainerWriter writer;

    public BatchOrchestrator(SpatialTileIndex tileIndex,
                             FileNameResolver resolver,
                             WindowExtractor extractor,
                             ArtifactCacheFactory cacheFactory,
                             CutoutContainerWriter writer) {
        this.tileIndex = Objects.requireNonNull(tileIndex);
        this.resolver = Objects.requireNonNull(resolver);
        this.extractor = Objects.requireNonNull(extractor);
        this.cacheFactory = Objects.requireNonNull(cacheFactory);
        this.writer = Objects.requireNonNull(writer);
    }

    public BatchReport run(String runId,
                           List<SourceRequest> requests,
                           BatchOptions options,
                           Path outputDir,
                           ProgressListener listener,
                           BooleanSupplier cancelRequested) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(outputDir, "outputDir");
        BooleanSupplier cancelled = cancelRequested != null ? cancelRequested : () -> false;

        Set<ProductType> types = new LinkedHashSet<>();
        requests.forEach(r -> types.addAll(r.productTypes()));
        ProgressAggregator progress = new ProgressAggregator(requests.size(), new ArrayList<>(types),
                options.progressEvery(), options.maxFailureSamples(), listener);

        Map<String, List<SourceRequest>> byTile = new LinkedHashMap<>();
        List<String> noTile = new ArrayList<>();
        for (SourceRequest req : requests) {
            Optional<String> tile = tileIndex.lookup(req.ra(), req.dec());
            if (tile.isPresent()) {
                byTile.computeIfAbsent(tile.get(), k -> new ArrayList<>()).add(req);
            } else {
                noTile.add(req.targetId());
                for (ProductType type : req.productTypes()) {
                    progress.recordNotFound(type, new FailureSample(req.targetId(), null, type.code(), null, null,
                            FailureKind.NO_TILE, "No tile covers ra=" + req.ra() + " dec=" + req.dec()));
                }
                progress.requestCompleted();
            }
        }
        List<TileGroup> groups = new ArrayList<>();
        byTile.forEach((tileId, reqs) -> groups.add(new TileGroup(tileId, reqs)));

        int threads = Math.max(1, Math.min(options.workers(), groups.size()));
        log.info("Batch {}: {} requests in {} tile groups ({} without a tile), workers={}",
                runId, requests.size(), groups.size(), noTile.size(), threads);

        ArtifactCache cache = cacheFactory.create(runId);
        List<Path> written = new ArrayList<>();
        if (!groups.isEmpty()) {
            written.addAll(runGroups(runId, groups, threads, cache, progress, options, outputDir, cancelled));
        }
        progress.publish();

        List<String> outputFiles = new ArrayList<>();
        for (Path p : written) {
            outputFiles.add(outputDir.relativize(p).toString().replace('\\', '/'));
        }
        BatchReport report = new BatchReport(requests.size(), groups.size(), noTile, progress.stats(),
                cache.computations(), cache.hits(), progress.failureCount(), progress.failureSamples(),
                outputFiles, cancelled.getAsBoolean());
        log.info("Batch {} finished: succeeded={} extractions={} cacheHits={} failures={} cancelled={}",
                runId, report.totalSucceeded(), report.extractions(), report.cacheHits(),
                report.failureCount(), report.cancelled());
        return report;
    }

    private List<Path> runGroups(String runId, List<TileGroup> groups, int threads, ArtifactCache cache,
                                 ProgressAggregator progress, BatchOptions options, Path outputDir,
                                 BooleanSupplier cancelled) {
        AtomicBoolean aborted = new AtomicBoolean(false);
        BooleanSupplier stop = () -> aborted.get() || cancelled.getAsBoolean();
        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tilecut-batch-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        List<Future<List<Path>>> futures = new ArrayList<>();
        try {
            for (TileGroup g : groups) {
                TileGroupWorker worker = new TileGroupWorker(g, resolver, extractor, cache, writer, progress,
                        options, outputDir, stop);
                futures.add(pool.submit(() -> {
                    try {
                        return worker.call();
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                }));
            }
            pool.shutdown();

            List<Path> written = new ArrayList<>();
            RuntimeException failure = null;
            for (Future<List<Path>> f : futures) {
                try {
                    written.addAll(f.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (failure == null) {
                        failure = new BatchAbortedException("Batch " + runId + " aborted: " + cause.getMessage(), cause);
                    }
                }
            }
            if (failure != null) {
                log.warn("Batch {} aborted: {}", runId, failure.getCause().toString());
                throw failure;
            }
            return written;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchAbortedException("Batch " + runId + " interrupted", e);
        } finally {
            pool.shutdownNow();
        }
    }
}
