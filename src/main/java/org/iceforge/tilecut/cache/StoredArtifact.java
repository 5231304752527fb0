package org.iceforge.tilecut.cache;

import org.iceforge.tilecut.extract.CutoutArtifact;

/**
 * An artifact as a tier holds it, together with the fingerprint it was stored under.
 */
public record StoredArtifact(
        String fingerprintHash,
        String fingerprint,
        String targetId,
        String productType,
        CutoutArtifact artifact
) {}
