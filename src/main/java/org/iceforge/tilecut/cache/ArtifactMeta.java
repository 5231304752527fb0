package org.iceforge.tilecut.cache;

import java.util.Map;

/**
 * JSON sidecar stored next to each cached FITS file. Its presence marks the entry as
 * complete.
 */
public record ArtifactMeta(
        String fingerprintHash,
        String fingerprint,
        String targetId,
        String productType,
        String instrument,
        String band,
        boolean hasInvalidValues,
        int height,
        int width,
        Map<String, Object> transform,
        Map<String, Object> provenance,
        String storedAt
) {}
