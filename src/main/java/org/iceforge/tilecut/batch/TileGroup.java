package org.iceforge.tilecut.batch;

import java.util.List;
import java.util.Objects;

/**
 * All requests that resolved to one tile, processed together by a single worker.
 */
public record TileGroup(String tileId, List<SourceRequest> requests) {
    public TileGroup {
        Objects.requireNonNull(tileId, "tileId");
        requests = List.copyOf(requests);
    }
}
