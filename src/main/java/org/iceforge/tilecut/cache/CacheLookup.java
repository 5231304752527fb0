package org.iceforge.tilecut.cache;

import org.iceforge.tilecut.extract.CutoutArtifact;

public record CacheLookup(CacheOutcome outcome, CacheSource source, CutoutArtifact artifact) {

    public boolean isSuccess() {
        return outcome == CacheOutcome.HIT || outcome == CacheOutcome.COMPUTED;
    }

    public boolean fromCache() {
        return source == CacheSource.EPHEMERAL || source == CacheSource.PERMANENT;
    }
}
