package org.iceforge.tilecut.batch;

import org.iceforge.tilecut.extract.EdgeMode;

import java.util.Objects;

/**
 * Knobs for one batch run.
 *
 * @param workers           upper bound on concurrent tile-group workers
 * @param progressEvery     publish progress every N completed requests
 * @param maxFailureSamples failure samples kept in the report
 */
public record BatchOptions(
        EdgeMode edgeMode,
        double fillValue,
        boolean rejectInvalid,
        boolean saveCatalogRow,
        int workers,
        int progressEvery,
        int maxFailureSamples
) {
    public BatchOptions {
        Objects.requireNonNull(edgeMode, "edgeMode");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        if (progressEvery < 1) {
            throw new IllegalArgumentException("progressEvery must be >= 1, got " + progressEvery);
        }
        if (maxFailureSamples < 0) {
            throw new IllegalArgumentException("maxFailureSamples must be >= 0, got " + maxFailureSamples);
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(EdgeMode.FILL, 0.0, true, true, 4, 10, 10);
    }
}
