package org.iceforge.tilecut.catalog;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.TableHDU;
import org.iceforge.tilecut.fits.FitsSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads source catalogs: CSV with a header row, or the first table HDU of a FITS file.
 * Rows beyond {@code maxRows} are dropped and the result is flagged as truncated.
 */
@Component
public class CatalogReader {
    private static final Logger log = LoggerFactory.getLogger(CatalogReader.class);

    private final CsvMapper csvMapper;

    public CatalogReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public Catalog read(Path path, int maxRows) {
        if (maxRows < 1) {
            throw new IllegalArgumentException("maxRows must be positive, got " + maxRows);
        }
        if (!Files.isRegularFile(path)) {
            throw new CatalogFormatException("Catalog not found: " + path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        Catalog catalog;
        if (name.endsWith(".csv")) {
            catalog = readCsv(path, maxRows);
        } else if (name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fits.gz")) {
            catalog = readFits(path, maxRows);
        } else {
            throw new CatalogFormatException("Unsupported catalog format: " + path.getFileName());
        }
        if (catalog.truncated()) {
            log.warn("Catalog {} has {} rows; only the first {} will be processed",
                    path.getFileName(), catalog.totalRows(), catalog.size());
        }
        return catalog;
    }

    private Catalog readCsv(Path path, int maxRows) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        List<String> columns = List.of();
        int total = 0;
        try (MappingIterator<Map<String, String>> it = csvMapper.readerFor(Map.class).with(schema).readValues(path.toFile())) {
            while (it.hasNextValue()) {
                Map<String, String> row = it.nextValue();
                if (total == 0) {
                    columns = new ArrayList<>(row.keySet());
                }
                total++;
                if (rows.size() < maxRows) {
                    rows.add(new LinkedHashMap<>(row));
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new CatalogFormatException("Cannot read CSV catalog " + path.getFileName() + ": " + e.getMessage(), e);
        }
        return new Catalog(path.toString(), columns, rows, total, total > rows.size());
    }

    private Catalog readFits(Path path, int maxRows) {
        try (Fits fits = new Fits(path.toFile())) {
            Optional<TableHDU<?>> found = FitsSupport.firstTable(fits);
            if (found.isEmpty()) {
                throw new CatalogFormatException("No table HDU in " + path.getFileName());
            }
            TableHDU<?> table = found.get();
            int nCols = table.getNCols();
            int total = table.getNRows();
            int keep = Math.min(total, maxRows);

            List<String> columns = new ArrayList<>();
            List<Object> data = new ArrayList<>();
            for (int c = 0; c < nCols; c++) {
                String col = FitsSupport.columnName(table, c);
                columns.add(col != null ? col : "COL" + (c + 1));
                Object raw = table.getColumn(c);
                data.add(FitsSupport.isStringColumn(raw) ? FitsSupport.toStrings(raw) : FitsSupport.toDoubles(raw));
            }

            List<Map<String, Object>> rows = new ArrayList<>(keep);
            for (int r = 0; r < keep; r++) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int c = 0; c < nCols; c++) {
                    Object col = data.get(c);
                    row.put(columns.get(c), col instanceof String[] ? ((String[]) col)[r] : (Object) ((double[]) col)[r]);
                }
                rows.add(row);
            }
            return new Catalog(path.toString(), columns, rows, total, total > keep);
        } catch (FitsException | IOException e) {
            throw new CatalogFormatException("Cannot read FITS catalog " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
