package org.iceforge.tilecut.sky;

import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.TableHDU;
import org.iceforge.tilecut.fits.FitsSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds tile records by scanning {@code <root>/<tileId>/} for each tile's source catalog
 * and summarising the positions it contains.
 */
public class TileIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(TileIndexBuilder.class);

    static final String[] RA_COLUMNS = {"RIGHT_ASCENSION", "RA"};
    static final String[] DEC_COLUMNS = {"DECLINATION", "DEC"};

    private final String catalogPattern;

    public TileIndexBuilder(String catalogPattern) {
        this.catalogPattern = Objects.requireNonNull(catalogPattern, "catalogPattern");
    }

    public List<TileRecord> build(Path catalogRoot) throws IOException {
        if (!Files.isDirectory(catalogRoot)) {
            throw new IOException("Tile catalog root is not a directory: " + catalogRoot);
        }
        List<Path> tileDirs;
        try (Stream<Path> s = Files.list(catalogRoot)) {
            tileDirs = s.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        }

        List<TileRecord> out = new ArrayList<>();
        for (Path dir : tileDirs) {
            String tileId = dir.getFileName().toString();
            Optional<Path> catalog = findCatalog(dir);
            if (catalog.isEmpty()) {
                log.warn("No catalog matching '{}' in tile directory {}", catalogPattern, dir);
                continue;
            }
            try {
                summarise(tileId, catalog.get()).ifPresent(out::add);
            } catch (FitsException | IOException | IllegalArgumentException e) {
                log.warn("Skipping tile {}: {}", tileId, e.toString());
            }
        }
        log.info("Built tile index from {}: {} of {} tile directories indexed", catalogRoot, out.size(), tileDirs.size());
        return out;
    }

    private Optional<Path> findCatalog(Path tileDir) throws IOException {
        try (Stream<Path> s = Files.list(tileDir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.contains(catalogPattern) && name.endsWith(".fits");
                    })
                    .sorted()
                    .findFirst();
        }
    }

    Optional<TileRecord> summarise(String tileId, Path catalog) throws FitsException, IOException {
        try (Fits fits = new Fits(catalog.toFile())) {
            Optional<TableHDU<?>> table = FitsSupport.firstTable(fits);
            if (table.isEmpty()) {
                log.warn("Catalog {} has no table HDU", catalog);
                return Optional.empty();
            }
            Optional<Integer> raCol = FitsSupport.findColumn(table.get(), RA_COLUMNS);
            Optional<Integer> decCol = FitsSupport.findColumn(table.get(), DEC_COLUMNS);
            if (raCol.isEmpty() || decCol.isEmpty()) {
                log.warn("Catalog {} has no RA/DEC columns", catalog);
                return Optional.empty();
            }
            double[] ra = FitsSupport.readColumn(table.get(), raCol.get());
            double[] dec = FitsSupport.readColumn(table.get(), decCol.get());
            return summarise(tileId, ra, dec);
        }
    }

    static Optional<TileRecord> summarise(String tileId, double[] ra, double[] dec) {
        double raMin = Double.POSITIVE_INFINITY;
        double raMax = Double.NEGATIVE_INFINITY;
        double decMin = Double.POSITIVE_INFINITY;
        double decMax = Double.NEGATIVE_INFINITY;
        double raSum = 0.0;
        double decSum = 0.0;
        long n = 0;
        for (int i = 0; i < Math.min(ra.length, dec.length); i++) {
            if (!Double.isFinite(ra[i]) || !Double.isFinite(dec[i])) {
                continue;
            }
            raMin = Math.min(raMin, ra[i]);
            raMax = Math.max(raMax, ra[i]);
            decMin = Math.min(decMin, dec[i]);
            decMax = Math.max(decMax, dec[i]);
            raSum += ra[i];
            decSum += dec[i];
            n++;
        }
        if (n == 0 || !(raMin < raMax) || !(decMin < decMax)) {
            log.warn("Tile {} has a degenerate footprint ({} usable sources)", tileId, n);
            return Optional.empty();
        }
        return Optional.of(new TileRecord(tileId, raMin, raMax, decMin, decMax, raSum / n, decSum / n, n));
    }
}
