package org.iceforge.tilecut.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tilecut.TilecutProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Hands out one {@link ArtifactCache} per run: a fresh ephemeral tier under
 * {@code <cacheDir>/ephemeral/<runId>} in front of the shared permanent tier under
 * {@code <cacheDir>/permanent}.
 */
@Component
public class ArtifactCacheFactory {
    private static final Logger log = LoggerFactory.getLogger(ArtifactCacheFactory.class);

    private final Path ephemeralRoot;
    private final ObjectMapper mapper;
    private final LocalFsArtifactTier permanent;

    @Autowired
    public ArtifactCacheFactory(TilecutProperties props, ObjectMapper mapper) {
        this(Path.of(props.getCacheDir()), mapper);
    }

    public ArtifactCacheFactory(Path cacheDir, ObjectMapper mapper) {
        Path root = Objects.requireNonNull(cacheDir, "cacheDir").toAbsolutePath().normalize();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.ephemeralRoot = root.resolve("ephemeral");
        this.permanent = new LocalFsArtifactTier("permanent", root.resolve("permanent"), mapper);
    }

    public ArtifactCache create(String runId) {
        Objects.requireNonNull(runId, "runId");
        return new ArtifactCache(new LocalFsArtifactTier("ephemeral", ephemeralDir(runId), mapper), permanent);
    }

    public ArtifactTier permanentTier() {
        return permanent;
    }

    /** Removes a finished run's ephemeral tier. Failures are logged, not raised. */
    public void discard(String runId) {
        Path dir = ephemeralDir(runId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            log.warn("Could not discard ephemeral cache for run {}: {}", runId, e.toString());
        }
    }

    private Path ephemeralDir(String runId) {
        Path p = ephemeralRoot.resolve(runId).normalize();
        if (!p.startsWith(ephemeralRoot) || p.equals(ephemeralRoot)) {
            throw new IllegalArgumentException("Illegal run id: " + runId);
        }
        return p;
    }
}
