package org.iceforge.tilecut.batch;

/**
 * Outcome counts for one product type. Every (source, instrument, band) combination is
 * counted once; {@code fromCache} is the subset of {@code succeeded} served by a cache tier.
 */
public record ProductTypeStats(
        long succeeded,
        long failed,
        long notFound,
        long invalid,
        long fromCache
) {
    public static final ProductTypeStats EMPTY = new ProductTypeStats(0, 0, 0, 0, 0);

    public long total() {
        return succeeded + failed + notFound + invalid;
    }
}
