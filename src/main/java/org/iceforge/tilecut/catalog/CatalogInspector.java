package org.iceforge.tilecut.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Checks a catalog before a task is submitted against it: are the position columns there,
 * how many rows have a usable position, does it fit under the row cap.
 */
@Component
public class CatalogInspector {
    private static final Logger log = LoggerFactory.getLogger(CatalogInspector.class);

    /** Above this share of rows without a usable position the report carries a warning. */
    static final double INVALID_POSITION_WARN_RATIO = 0.1;

    private final CatalogReader reader;

    public CatalogInspector(CatalogReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Statistics cover the first {@code maxRows} rows. A catalog over the cap, or one without
     * RA/Dec columns, is reported as invalid rather than thrown.
     *
     * @throws CatalogFormatException if the file cannot be read at all
     */
    public CatalogReport inspect(Path path, String raColumn, String decColumn, String idColumn, int maxRows) {
        Catalog catalog = reader.read(path, maxRows);
        long sizeBytes;
        try {
            sizeBytes = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (catalog.truncated()) {
            errors.add("Catalog has " + catalog.totalRows() + " rows, more than the limit of " + maxRows);
        }

        ColumnResolver.Columns cols;
        try {
            cols = ColumnResolver.resolveAll(catalog.columns(), raColumn, decColumn, idColumn, null);
        } catch (CatalogFormatException e) {
            errors.add(e.getMessage());
            return new CatalogReport(path.getFileName().toString(), sizeBytes, catalog.totalRows(), catalog.columns(),
                    null, null, null, 0, catalog.size(), null, null, null, null, false, errors, warnings);
        }

        int valid = 0;
        double raMin = Double.POSITIVE_INFINITY;
        double raMax = Double.NEGATIVE_INFINITY;
        double decMin = Double.POSITIVE_INFINITY;
        double decMax = Double.NEGATIVE_INFINITY;
        for (Map<String, Object> row : catalog.rows()) {
            double ra = SourceRequestFactory.number(row.get(cols.ra()));
            double dec = SourceRequestFactory.number(row.get(cols.dec()));
            if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
                continue;
            }
            valid++;
            raMin = Math.min(raMin, ra);
            raMax = Math.max(raMax, ra);
            decMin = Math.min(decMin, dec);
            decMax = Math.max(decMax, dec);
        }
        int invalid = catalog.size() - valid;

        if (valid == 0) {
            errors.add("No row has a usable position in " + cols.ra() + "/" + cols.dec());
        } else {
            if ((double) invalid / catalog.size() > INVALID_POSITION_WARN_RATIO) {
                warnings.add(String.format(Locale.ROOT, "%d of %d rows have no usable position",
                        invalid, catalog.size()));
            }
            if (raMin < 0 || raMax > 360) {
                warnings.add("RA outside [0, 360]: [" + raMin + ", " + raMax + "]");
            }
            if (decMin < -90 || decMax > 90) {
                warnings.add("Dec outside [-90, 90]: [" + decMin + ", " + decMax + "]");
            }
        }
        boolean ok = errors.isEmpty();
        log.debug("Inspected {}: rows={} valid={} ok={}", path.getFileName(), catalog.totalRows(), valid, ok);
        return new CatalogReport(path.getFileName().toString(), sizeBytes, catalog.totalRows(), catalog.columns(),
                cols.ra(), cols.dec(), cols.id(), valid, invalid,
                valid > 0 ? raMin : null, valid > 0 ? raMax : null,
                valid > 0 ? decMin : null, valid > 0 ? decMax : null,
                ok, errors, warnings);
    }
}
