package org.iceforge.tilecut.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the archive files for a tile by naming convention.
 * <p>
 * Layout is {@code <root>/<tileId>/<instrumentDir>/<file>}. An absent tile directory or no
 * matching file is a normal "no data" answer (an empty map); only an I/O failure while
 * listing raises {@link ArchiveAccessException}.
 */
public class FileNameResolver {
    private static final Logger log = LoggerFactory.getLogger(FileNameResolver.class);

    private final Path root;

    public FileNameResolver(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public boolean tileExists(String tileId) {
        return Files.isDirectory(tileDir(tileId));
    }

    /**
     * @param instruments instrument directory names to keep; empty keeps all
     * @param bands       full band names ({@code VIS}, {@code NIR-H}, ...) to keep; empty keeps all
     * @return matches keyed {@code <instrumentDir>_<fullBand>}, sorted by key
     */
    public Map<String, ResolvedFile> resolve(String tileId,
                                             ProductType productType,
                                             Collection<String> instruments,
                                             Collection<String> bands) {
        Objects.requireNonNull(productType, "productType");
        Path tileDir = tileDir(tileId);
        Map<String, ResolvedFile> out = new TreeMap<>();
        if (!Files.isDirectory(tileDir)) {
            log.debug("Tile directory {} does not exist", tileDir);
            return out;
        }

        NamingRules.Rule rule = NamingRules.ruleFor(productType);
        for (Path instrumentDir : list(tileDir, true)) {
            String instrument = instrumentDir.getFileName().toString();
            if (!matches(instruments, instrument)) {
                continue;
            }
            Optional<String> expectedCode = NamingRules.instrumentCode(instrument);
            for (Path file : list(instrumentDir, false)) {
                String name = file.getFileName().toString();
                if (!name.endsWith(NamingRules.EXTENSION)) {
                    continue;
                }
                Optional<FileNameParser.ParsedName> parsed = FileNameParser.parse(name, rule);
                if (parsed.isEmpty()) {
                    continue;
                }
                FileNameParser.ParsedName p = parsed.get();
                if (!tileId.equals(p.tileId())) {
                    log.debug("Skipping {}: names tile {} but lives under {}", name, p.tileId(), tileId);
                    continue;
                }
                if (expectedCode.isPresent() && !expectedCode.get().equals(p.instrumentCode())) {
                    log.debug("Skipping {}: instrument code {} does not belong in {}", name, p.instrumentCode(), instrument);
                    continue;
                }
                String fullBand = p.fullBand();
                if (!matches(bands, fullBand)) {
                    continue;
                }
                ResolvedFile rf = new ResolvedFile(file, tileId, productType, instrument, fullBand);
                ResolvedFile prior = out.putIfAbsent(rf.key(), rf);
                if (prior != null) {
                    log.warn("Several {} files for {} in tile {}; using {}", productType, rf.key(), tileId, prior.path().getFileName());
                }
            }
        }
        return out;
    }

    private Path tileDir(String tileId) {
        Objects.requireNonNull(tileId, "tileId");
        Path p = root.resolve(tileId).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new IllegalArgumentException("Illegal tile id (path traversal): " + tileId);
        }
        return p;
    }

    private static boolean matches(Collection<String> filter, String value) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        String v = value.toUpperCase(Locale.ROOT);
        for (String f : filter) {
            if (f != null && f.trim().toUpperCase(Locale.ROOT).equals(v)) {
                return true;
            }
        }
        return false;
    }

    private static List<Path> list(Path dir, boolean directories) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> directories ? Files.isDirectory(p) : Files.isRegularFile(p))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveAccessException("Failed to list " + dir, e);
        }
    }
}
