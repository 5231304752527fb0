package org.iceforge.tilecut.catalog;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of {@link CatalogInspector#inspect}. Column names and ranges are null when they
 * could not be determined.
 *
 * @param totalRows        rows in the file, including any beyond the row cap
 * @param validPositions   inspected rows with a finite RA and Dec
 * @param invalidPositions inspected rows without one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogReport(
        String fileName,
        long sizeBytes,
        int totalRows,
        List<String> columns,
        String raColumn,
        String decColumn,
        String idColumn,
        int validPositions,
        int invalidPositions,
        Double raMin,
        Double raMax,
        Double decMin,
        Double decMax,
        boolean valid,
        List<String> errors,
        List<String> warnings
) {
    public CatalogReport {
        columns = List.copyOf(columns);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
