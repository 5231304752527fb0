package org.iceforge.tilecut.archive;

import org.iceforge.tilecut.sky.SpatialTileIndex;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.Objects;

/**
 * DOWN when the archive root is missing; reports how many tiles the index knows about.
 */
@Component("archive")
public class ArchiveHealthIndicator implements HealthIndicator {

    private final FileNameResolver resolver;
    private final SpatialTileIndex tileIndex;

    public ArchiveHealthIndicator(FileNameResolver resolver, SpatialTileIndex tileIndex) {
        this.resolver = Objects.requireNonNull(resolver);
        this.tileIndex = Objects.requireNonNull(tileIndex);
    }

    @Override
    public Health health() {
        Health.Builder b = Files.isDirectory(resolver.root()) ? Health.up() : Health.down();
        return b.withDetail("archiveRoot", resolver.root().toString())
                .withDetail("tiles", tileIndex.size())
                .build();
    }
}
