package org.iceforge.tilecut.sky;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only index from sky position to the tile that covers it.
 * <p>
 * Candidate tiles are those whose bounding box, grown by the tolerance, contains the
 * position. When several qualify the one whose centre is angularly closest wins;
 * exact ties go to the lexicographically smallest tile id, so the answer does not
 * depend on the order tiles were loaded in.
 */
public class SpatialTileIndex {
    private static final Logger log = LoggerFactory.getLogger(SpatialTileIndex.class);

    private final Map<String, TileRecord> tiles;
    private final double defaultTolerance;

    public SpatialTileIndex(Collection<TileRecord> records, double defaultTolerance) {
        Objects.requireNonNull(records, "records");
        if (!(defaultTolerance >= 0.0)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + defaultTolerance);
        }
        Map<String, TileRecord> byId = new LinkedHashMap<>();
        for (TileRecord r : records) {
            if (byId.putIfAbsent(r.tileId(), r) != null) {
                throw new IllegalArgumentException("Duplicate tile id in index: " + r.tileId());
            }
        }
        this.tiles = Collections.unmodifiableMap(byId);
        this.defaultTolerance = defaultTolerance;
        log.info("Tile index ready: tiles={} tolerance={}", tiles.size(), defaultTolerance);
    }

    public Optional<String> lookup(double ra, double dec) {
        return lookup(ra, dec, defaultTolerance);
    }

    public Optional<String> lookup(double ra, double dec, double tolerance) {
        if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
            return Optional.empty();
        }
        TileRecord best = null;
        double bestSep = Double.POSITIVE_INFINITY;
        for (TileRecord t : tiles.values()) {
            if (!t.contains(ra, dec, tolerance)) {
                continue;
            }
            double sep = t.separationFromCenter(ra, dec);
            if (best == null || sep < bestSep
                    || (sep == bestSep && t.tileId().compareTo(best.tileId()) < 0)) {
                best = t;
                bestSep = sep;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.tileId());
    }

    /**
     * All tiles whose grown box contains the position, closest first.
     */
    public List<TileRecord> candidates(double ra, double dec, double tolerance) {
        List<TileRecord> out = new ArrayList<>();
        for (TileRecord t : tiles.values()) {
            if (t.contains(ra, dec, tolerance)) {
                out.add(t);
            }
        }
        out.sort((a, b) -> {
            int c = Double.compare(a.separationFromCenter(ra, dec), b.separationFromCenter(ra, dec));
            return c != 0 ? c : a.tileId().compareTo(b.tileId());
        });
        return out;
    }

    public Optional<TileRecord> get(String tileId) {
        return Optional.ofNullable(tiles.get(tileId));
    }

    public int size() {
        return tiles.size();
    }

    public double defaultTolerance() {
        return defaultTolerance;
    }

    public Collection<TileRecord> records() {
        return tiles.values();
    }
}
