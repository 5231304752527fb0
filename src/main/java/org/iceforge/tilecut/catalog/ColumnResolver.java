package org.iceforge.tilecut.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps logical catalog fields to actual column names. Pure: the answer depends only on the
 * column list and the requested names.
 * <p>
 * For each field the explicitly requested name is tried first, then the alias list in
 * order; each candidate is matched exactly before any case-insensitive match is tried.
 */
public final class ColumnResolver {

    public static final List<String> RA_ALIASES = List.of(
            "TARGET_RA", "RA_1", "RA_2", "RA", "ra", "Ra", "RightAscension", "RIGHT_ASCENSION", "RA_DEG");
    public static final List<String> DEC_ALIASES = List.of(
            "TARGET_DEC", "DEC_1", "DEC_2", "DEC", "dec", "Dec", "Declination", "DECLINATION", "DEC_DEG");
    public static final List<String> ID_ALIASES = List.of(
            "TARGETID", "OBJECT_ID", "SOURCE_ID", "ID");
    public static final List<String> SIZE_ALIASES = List.of(
            "CUTOUT_SIZE", "SIZE");

    /**
     * Resolved column names; {@code id} and {@code size} are null when the catalog has none.
     */
    public record Columns(String ra, String dec, String id, String size) {}

    private ColumnResolver() {}

    public static Optional<String> resolve(Collection<String> columns, String explicit, List<String> aliases) {
        List<String> candidates = new ArrayList<>();
        if (explicit != null && !explicit.isBlank()) {
            candidates.add(explicit.trim());
        }
        candidates.addAll(aliases);

        for (String c : candidates) {
            if (columns.contains(c)) {
                return Optional.of(c);
            }
        }
        for (String c : candidates) {
            String lower = c.toLowerCase(Locale.ROOT);
            for (String col : columns) {
                if (col != null && col.toLowerCase(Locale.ROOT).equals(lower)) {
                    return Optional.of(col);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @throws CatalogFormatException if RA or Dec cannot be resolved
     */
    public static Columns resolveAll(Collection<String> columns, String ra, String dec, String id, String size) {
        String raCol = resolve(columns, ra, RA_ALIASES)
                .orElseThrow(() -> new CatalogFormatException("No RA column among " + columns));
        String decCol = resolve(columns, dec, DEC_ALIASES)
                .orElseThrow(() -> new CatalogFormatException("No Dec column among " + columns));
        return new Columns(raCol, decCol,
                resolve(columns, id, ID_ALIASES).orElse(null),
                resolve(columns, size, SIZE_ALIASES).orElse(null));
    }
}
