package org.iceforge.tilecut.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a finished (or cancelled) batch.
 *
 * @param noTileTargets  targets whose position no tile covers
 * @param byProductType  outcome counts keyed by product type code
 * @param extractions    extractions actually performed (cache misses)
 * @param failureCount   all unsuccessful outcomes, of which at most a few are kept in {@code failureSamples}
 * @param outputFiles    written containers, relative to the output directory
 */
public record BatchReport(
        int totalRequests,
        int tileGroups,
        List<String> noTileTargets,
        Map<String, ProductTypeStats> byProductType,
        long extractions,
        long cacheHits,
        long failureCount,
        List<FailureSample> failureSamples,
        List<String> outputFiles,
        boolean cancelled
) {
    public BatchReport {
        noTileTargets = List.copyOf(noTileTargets);
        byProductType = Collections.unmodifiableMap(new LinkedHashMap<>(byProductType));
        failureSamples = List.copyOf(failureSamples);
        outputFiles = List.copyOf(outputFiles);
    }

    public ProductTypeStats stats(String productType) {
        return byProductType.getOrDefault(productType, ProductTypeStats.EMPTY);
    }

    public long totalSucceeded() {
        return byProductType.values().stream().mapToLong(ProductTypeStats::succeeded).sum();
    }
}
