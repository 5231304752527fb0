package org.iceforge.tilecut.archive;

import java.nio.file.Path;

/**
 * One archive file matching a (tile, product type, instrument, band) request.
 */
public record ResolvedFile(
        Path path,
        String tileId,
        ProductType productType,
        String instrument,
        String band
) {
    /** Result-map key, e.g. {@code NISP_NIR-Y}. */
    public String key() {
        return instrument + "_" + band;
    }
}
