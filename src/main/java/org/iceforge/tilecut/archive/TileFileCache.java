package org.iceforge.tilecut.archive;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Memo of {@link FileNameResolver} answers for one tile.
 * <p>
 * Owned by a single worker for the lifetime of one tile group and discarded afterwards.
 * Not thread-safe.
 */
public class TileFileCache {

    private record Key(ProductType productType, List<String> instruments, List<String> bands) {}

    private final FileNameResolver resolver;
    private final String tileId;
    private final Map<Key, Map<String, ResolvedFile>> memo = new HashMap<>();
    private int lookups;

    public TileFileCache(FileNameResolver resolver, String tileId) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.tileId = Objects.requireNonNull(tileId, "tileId");
    }

    public String tileId() {
        return tileId;
    }

    public Map<String, ResolvedFile> resolve(ProductType productType, Collection<String> instruments, Collection<String> bands) {
        Key key = new Key(productType, normalize(instruments), normalize(bands));
        return memo.computeIfAbsent(key, k -> {
            lookups++;
            return Collections.unmodifiableMap(resolver.resolve(tileId, productType, k.instruments(), k.bands()));
        });
    }

    /** Whether the tile directory is still there. Not memoised. */
    public boolean tileExists() {
        return resolver.tileExists(tileId);
    }

    /** How many times the underlying resolver was actually consulted. */
    public int resolverLookups() {
        return lookups;
    }

    private static List<String> normalize(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(values));
    }
}
