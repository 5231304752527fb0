package org.iceforge.tilecut.sky;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tilecut.TilecutProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Configuration
public class TileIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(TileIndexConfig.class);

    @Bean
    public TileIndexCodec tileIndexCodec(ObjectMapper objectMapper) {
        return new TileIndexCodec(objectMapper);
    }

    /**
     * Loads the persisted index, or builds and persists it from the tile catalogs when the
     * index file does not exist yet. An archive with neither yields an empty index so the
     * service still starts.
     */
    @Bean
    public SpatialTileIndex spatialTileIndex(TilecutProperties props, TileIndexCodec codec) throws IOException {
        Path indexFile = Path.of(props.getTileIndexFile());
        if (Files.isRegularFile(indexFile)) {
            List<TileRecord> records = codec.read(indexFile);
            log.info("Loaded tile index {} ({} tiles)", indexFile, records.size());
            return new SpatialTileIndex(records, props.getTileToleranceDeg());
        }

        String catalogRoot = props.getTileCatalogRoot() != null ? props.getTileCatalogRoot() : props.getArchiveRoot();
        Path root = Path.of(catalogRoot);
        if (!Files.isDirectory(root)) {
            log.warn("No tile index at {} and no catalog root at {}; starting with an empty index", indexFile, root);
            return new SpatialTileIndex(List.of(), props.getTileToleranceDeg());
        }

        List<TileRecord> records = new TileIndexBuilder(props.getTileCatalogPattern()).build(root);
        codec.write(indexFile, records);
        log.info("Wrote tile index {} ({} tiles)", indexFile, records.size());
        return new SpatialTileIndex(records, props.getTileToleranceDeg());
    }
}
