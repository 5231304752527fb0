package org.iceforge.tilecut.batch;

import org.iceforge.tilecut.archive.ProductType;
import org.iceforge.tilecut.extract.WindowSize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One catalog row turned into a cutout request.
 *
 * @param rowIndex   0-based position in the catalog
 * @param catalogRow the original row, attached to the output when asked for
 */
public record SourceRequest(
        int rowIndex,
        String targetId,
        double ra,
        double dec,
        WindowSize size,
        List<String> instruments,
        List<String> bands,
        List<ProductType> productTypes,
        Map<String, Object> catalogRow
) {
    public SourceRequest {
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(size, "size");
        instruments = instruments == null ? List.of() : List.copyOf(instruments);
        bands = bands == null ? List.of() : List.copyOf(bands);
        productTypes = List.copyOf(Objects.requireNonNull(productTypes, "productTypes"));
        if (productTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one product type is required");
        }
        catalogRow = catalogRow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(catalogRow));
    }

    /** Fallback target id for rows without one. */
    public static String fallbackId(double ra, double dec) {
        return String.format(java.util.Locale.ROOT, "ra_%.6f_dec_%.6f", ra, dec);
    }
}
