package org.iceforge.tilecut.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.iceforge.tilecut.extract.CutoutArtifact;
import org.iceforge.tilecut.fits.FitsSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Filesystem tier. Each entry is a FITS image at {@code {baseDir}/{key}} plus a JSON
 * sidecar {@code {key}.meta.json}; the sidecar is written last and an entry without one
 * does not exist.
 */
public class LocalFsArtifactTier implements ArtifactTier {
    private static final Logger log = LoggerFactory.getLogger(LocalFsArtifactTier.class);

    static final String META_SUFFIX = ".meta.json";

    private final String name;
    private final Path baseDir;
    private final ObjectMapper mapper;

    public LocalFsArtifactTier(String name, Path baseDir, ObjectMapper mapper) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to create " + name + " tier at " + this.baseDir, e);
        }
        log.info("Artifact tier '{}' at {}", name, this.baseDir);
    }

    @Override
    public String name() {
        return name;
    }

    public Path baseDir() {
        return baseDir;
    }

    private Path pathFor(String key) {
        // Prevent path traversal by normalizing and verifying base prefix.
        Path p = baseDir.resolve(key).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new IllegalArgumentException("Illegal key (path traversal): " + key);
        }
        return p;
    }

    private Path metaPathFor(String key) {
        Path p = pathFor(key);
        return p.resolveSibling(p.getFileName().toString() + META_SUFFIX);
    }

    private Optional<ArtifactMeta> readMeta(String key) {
        Path meta = metaPathFor(key);
        if (!Files.exists(meta)) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(meta.toFile(), ArtifactMeta.class));
        } catch (IOException e) {
            throw new ArtifactStoreException("Unreadable metadata in " + name + " tier for " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(metaPathFor(key));
    }

    @Override
    public Optional<String> fingerprintAt(String key) {
        return readMeta(key).map(ArtifactMeta::fingerprintHash);
    }

    @Override
    public Optional<StoredArtifact> read(String key) {
        Optional<ArtifactMeta> meta = readMeta(key);
        if (meta.isEmpty()) {
            return Optional.empty();
        }
        ArtifactMeta m = meta.get();
        Path file = pathFor(key);
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new ArtifactStoreException("Empty FITS file in " + name + " tier for " + key);
            }
            double[][] data = FitsSupport.readImage(hdu);
            CutoutArtifact artifact = CutoutArtifact.success(data, m.transform(), m.provenance())
                    .withSource(m.instrument(), m.band());
            return Optional.of(new StoredArtifact(m.fingerprintHash(), m.fingerprint(), m.targetId(), m.productType(), artifact));
        } catch (FitsException | IOException e) {
            throw new ArtifactStoreException("Unreadable FITS in " + name + " tier for " + key, e);
        }
    }

    @Override
    public long write(String key, StoredArtifact stored) {
        CutoutArtifact a = stored.artifact();
        if (!a.isSuccess()) {
            throw new IllegalArgumentException("Only successful artifacts are stored");
        }
        Path dst = pathFor(key);
        try {
            Fits fits = new Fits();
            BasicHDU<?> hdu = Fits.makeHDU(a.data());
            Header h = hdu.getHeader();
            FitsSupport.addCards(h, a.transform());
            FitsSupport.addCards(h, a.provenance());
            if (a.instrument() != null) h.addValue("INSTRUME", a.instrument(), "Instrument");
            if (a.band() != null) h.addValue("BAND", a.band(), "Band");
            fits.addHDU(hdu);
            FitsSupport.writeAtomically(fits, dst);

            ArtifactMeta meta = new ArtifactMeta(stored.fingerprintHash(), stored.fingerprint(), stored.targetId(),
                    stored.productType(), a.instrument(), a.band(), a.hasInvalidValues(), a.height(), a.width(),
                    a.transform(), a.provenance(), Instant.now().toString());
            Path metaPath = metaPathFor(key);
            Path tmp = Files.createTempFile(metaPath.getParent(), "tilecut-", ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), meta);
                Files.move(tmp, metaPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return Files.size(dst) + Files.size(metaPath);
        } catch (FitsException | IOException e) {
            throw new ArtifactStoreException("Write to " + name + " tier failed for " + key, e);
        }
    }

    @Override
    public Usage usage() {
        if (!Files.isDirectory(baseDir)) {
            return new Usage(0, 0);
        }
        long objects = 0;
        long bytes = 0;
        try (Stream<Path> s = Files.walk(baseDir)) {
            for (Path p : (Iterable<Path>) s::iterator) {
                if (!Files.isRegularFile(p)) continue;
                bytes += Files.size(p);
                if (p.getFileName().toString().endsWith(META_SUFFIX)) objects++;
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to scan " + name + " tier at " + baseDir, e);
        }
        return new Usage(objects, bytes);
    }
}
