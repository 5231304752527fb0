package org.iceforge.tilecut.catalog;

import org.iceforge.tilecut.batch.SourceRequest;
import org.iceforge.tilecut.extract.WindowSize;
import org.iceforge.tilecut.task.CutoutTaskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns catalog rows into {@link SourceRequest}s for one task.
 */
@Component
public class SourceRequestFactory {
    private static final Logger log = LoggerFactory.getLogger(SourceRequestFactory.class);

    /**
     * @param skippedRows rows left out because their position is missing or not a number
     */
    public record Result(List<SourceRequest> requests, ColumnResolver.Columns columns, int skippedRows) {}

    public Result create(Catalog catalog, CutoutTaskConfig config) {
        ColumnResolver.Columns cols = ColumnResolver.resolveAll(catalog.columns(),
                config.raColumn(), config.decColumn(), config.idColumn(), config.sizeColumn());
        log.debug("Catalog {} columns resolved: {}", catalog.source(), cols);

        List<SourceRequest> out = new ArrayList<>(catalog.size());
        int skipped = 0;
        for (int i = 0; i < catalog.size(); i++) {
            Map<String, Object> row = catalog.rows().get(i);
            double ra = number(row.get(cols.ra()));
            double dec = number(row.get(cols.dec()));
            if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
                skipped++;
                log.warn("Skipping catalog row {}: unusable position ra={} dec={}", i, row.get(cols.ra()), row.get(cols.dec()));
                continue;
            }
            out.add(new SourceRequest(i, targetId(row, cols.id(), ra, dec), ra, dec,
                    size(row, cols.size(), config, i),
                    config.instruments(), config.bands(), config.productTypes(), row));
        }
        return new Result(out, cols, skipped);
    }

    static String targetId(Map<String, Object> row, String idColumn, double ra, double dec) {
        if (idColumn != null) {
            Object v = row.get(idColumn);
            if (v instanceof Number) {
                double d = ((Number) v).doubleValue();
                if (Double.isFinite(d)) {
                    return d == Math.rint(d) && Math.abs(d) < 1e15 ? Long.toString((long) d) : Double.toString(d);
                }
            } else if (v != null) {
                String s = v.toString().trim();
                if (!s.isEmpty() && !s.equalsIgnoreCase("nan")) {
                    return s;
                }
            }
        }
        return SourceRequest.fallbackId(ra, dec);
    }

    private static WindowSize size(Map<String, Object> row, String sizeColumn, CutoutTaskConfig config, int rowIndex) {
        if (sizeColumn != null) {
            Object v = row.get(sizeColumn);
            if (v != null && !v.toString().isBlank()) {
                try {
                    return v instanceof Number ? WindowSize.square((int) Math.round(((Number) v).doubleValue()))
                            : WindowSize.parse(v.toString());
                } catch (IllegalArgumentException e) {
                    log.warn("Row {}: ignoring size '{}' ({}); using {}", rowIndex, v, e.getMessage(), config.windowSize());
                }
            }
        }
        return config.windowSize();
    }

    static double number(Object v) {
        if (v == null) {
            return Double.NaN;
        }
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
