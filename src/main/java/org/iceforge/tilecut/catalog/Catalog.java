package org.iceforge.tilecut.catalog;

import java.util.List;
import java.util.Map;

/**
 * Rows read from a source catalog, in file order.
 *
 * @param totalRows rows present in the file, before truncation
 * @param truncated whether rows were dropped to respect the row cap
 */
public record Catalog(
        String source,
        List<String> columns,
        List<Map<String, Object>> rows,
        int totalRows,
        boolean truncated
) {
    public Catalog {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
