package org.iceforge.tilecut.batch;

import org.iceforge.tilecut.archive.ArchiveAccessException;
import org.iceforge.tilecut.archive.FileNameResolver;
import org.iceforge.tilecut.archive.ProductType;
import org.iceforge.tilecut.archive.ResolvedFile;
import org.iceforge.tilecut.archive.TileFileCache;
import org.iceforge.tilecut.cache.ArtifactCache;
import org.iceforge.tilecut.cache.ArtifactFingerprint;
import org.iceforge.tilecut.cache.CacheLookup;
import org.iceforge.tilecut.extract.CutoutArtifact;
import org.iceforge.tilecut.extract.WindowExtractor;
import org.iceforge.tilecut.output.CutoutContainerWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * Processes every request of one tile group, in order, on one thread.
 * <p>
 * Each (request, product type, instrument, band) combination is resolved, extracted through
 * the cache and counted on its own, so one bad file never hides the others. Storage
 * failures ({@code ArtifactStoreException}, {@code OutputWriteException}) propagate and
 * end the batch.
 */
class TileGroupWorker implements Callable<List<Path>> {
    private static final Logger log = LoggerFactory.getLogger(TileGroupWorker.class);

    private final TileGroup group;
    private final TileFileCache files;
    private final WindowExtractor extractor;
    private final ArtifactCache cache;
    private final CutoutContainerWriter writer;
    private final ProgressAggregator progress;
    private final BatchOptions options;
    private final Path outputDir;
    private final BooleanSupplier stopRequested;

    TileGroupWorker(TileGroup group,
                    FileNameResolver resolver,
                    WindowExtractor extractor,
                    ArtifactCache cache,
                    CutoutContainerWriter writer,
                    ProgressAggregator progress,
                    BatchOptions options,
                    Path outputDir,
                    BooleanSupplier stopRequested) {
        this.group = Objects.requireNonNull(group);
        this.files = new TileFileCache(resolver, group.tileId());
        this.extractor = Objects.requireNonNull(extractor);
        this.cache = Objects.requireNonNull(cache);
        this.writer = Objects.requireNonNull(writer);
        this.progress = Objects.requireNonNull(progress);
        this.options = Objects.requireNonNull(options);
        this.outputDir = Objects.requireNonNull(outputDir);
        this.stopRequested = Objects.requireNonNull(stopRequested);
    }

    @Override
    public List<Path> call() {
        List<Path> written = new ArrayList<>();
        List<SourceRequest> requests = group.requests();
        for (int i = 0; i < requests.size(); i++) {
            if (stopRequested.getAsBoolean()) {
                markRemaining(requests, i, FailureKind.CANCELLED, "Cancelled before processing");
                return written;
            }
            if (!files.tileExists()) {
                log.warn("Tile {} disappeared; abandoning {} remaining requests", group.tileId(), requests.size() - i);
                markRemaining(requests, i, FailureKind.TILE_ABANDONED, "Tile directory no longer exists");
                return written;
            }
            process(requests.get(i), written);
            progress.requestCompleted();
        }
        log.debug("Tile {} done: {} requests, {} resolver lookups", group.tileId(), requests.size(), files.resolverLookups());
        return written;
    }

    private void process(SourceRequest req, List<Path> written) {
        boolean rowPending = options.saveCatalogRow();
        for (ProductType type : req.productTypes()) {
            Map<String, ResolvedFile> resolved;
            try {
                resolved = files.resolve(type, req.instruments(), req.bands());
            } catch (ArchiveAccessException e) {
                log.warn("Cannot list tile {} for {}: {}", group.tileId(), req.targetId(), e.getMessage());
                progress.recordFailed(type, sample(req, type, null, null, FailureKind.ARCHIVE_ERROR, e.getMessage()));
                continue;
            }
            reportMissing(req, type, resolved);

            List<CutoutArtifact> planes = new ArrayList<>();
            for (ResolvedFile rf : resolved.values()) {
                CutoutArtifact plane = extract(req, type, rf);
                if (plane != null) {
                    planes.add(plane);
                }
            }
            if (!planes.isEmpty()) {
                written.add(writer.write(outputDir, req, type, planes, rowPending));
                rowPending = false;
            }
        }
    }

    /** Returns the plane on success, null otherwise (the outcome is already counted). */
    private CutoutArtifact extract(SourceRequest req, ProductType type, ResolvedFile rf) {
        ArtifactFingerprint fp = ArtifactFingerprint.of(req.ra(), req.dec(), req.size(), rf.instrument(), type.code(), rf.band());
        CacheLookup lookup = cache.getOrCompute(fp, req.targetId(), options.rejectInvalid(), () -> compute(req, type, rf));
        switch (lookup.outcome()) {
            case HIT, COMPUTED -> {
                progress.recordSuccess(type, lookup.fromCache());
                return lookup.artifact().withSource(rf.instrument(), rf.band());
            }
            case INVALID -> {
                progress.recordInvalid(type, sample(req, type, rf.instrument(), rf.band(),
                        FailureKind.INVALID_PAYLOAD, "Cutout contains NaN or infinite pixels"));
                return null;
            }
            default -> {
                log.debug("Extraction failed for {} {} {}: {}", req.targetId(), type, rf.key(), lookup.artifact().error());
                progress.recordFailed(type, sample(req, type, rf.instrument(), rf.band(),
                        FailureKind.EXTRACTION_FAILURE, lookup.artifact().error()));
                return null;
            }
        }
    }

    private CutoutArtifact compute(SourceRequest req, ProductType type, ResolvedFile rf) {
        if (type.isStampGrid()) {
            return extractor.extractNearestStamp(rf.path(), req.ra(), req.dec());
        }
        return extractor.extractWindow(rf.path(), req.ra(), req.dec(), req.size(), 0,
                options.edgeMode(), options.fillValue());
    }

    /**
     * One not-found per requested instrument with no matching file; when no instrument
     * filter was given, one not-found if nothing matched at all. When some files matched,
     * also one not-found per requested band that none of them carries.
     */
    private void reportMissing(SourceRequest req, ProductType type, Map<String, ResolvedFile> resolved) {
        if (req.instruments().isEmpty()) {
            if (resolved.isEmpty()) {
                progress.recordNotFound(type, sample(req, type, null, null, FailureKind.NOT_FOUND,
                        "No " + type + " files in tile " + group.tileId()));
                return;
            }
        } else {
            for (String instrument : req.instruments()) {
                String wanted = instrument.trim().toUpperCase(Locale.ROOT);
                boolean found = resolved.values().stream()
                        .anyMatch(rf -> rf.instrument().toUpperCase(Locale.ROOT).equals(wanted));
                if (!found) {
                    progress.recordNotFound(type, sample(req, type, instrument, null, FailureKind.NOT_FOUND,
                            "No " + type + " file for " + instrument + " in tile " + group.tileId()));
                }
            }
            if (resolved.isEmpty()) {
                return;
            }
        }
        for (String band : req.bands()) {
            String wanted = band.trim().toUpperCase(Locale.ROOT);
            boolean found = resolved.values().stream()
                    .anyMatch(rf -> rf.band().toUpperCase(Locale.ROOT).equals(wanted));
            if (!found) {
                progress.recordNotFound(type, sample(req, type, null, band, FailureKind.NOT_FOUND,
                        "No " + type + " file for band " + band + " in tile " + group.tileId()));
            }
        }
    }

    private void markRemaining(List<SourceRequest> requests, int from, FailureKind kind, String message) {
        for (int i = from; i < requests.size(); i++) {
            SourceRequest req = requests.get(i);
            for (ProductType type : req.productTypes()) {
                progress.recordFailed(type, sample(req, type, null, null, kind, message));
            }
            progress.requestCompleted();
        }
    }

    private FailureSample sample(SourceRequest req, ProductType type, String instrument, String band,
                                 FailureKind kind, String message) {
        return new FailureSample(req.targetId(), group.tileId(), type.code(), instrument, band, kind, message);
    }
}
