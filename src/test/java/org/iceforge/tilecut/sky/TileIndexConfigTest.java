package org.iceforge.tilecut.sky;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tilecut.TilecutProperties;
import org.iceforge.tilecut.fits.FitsFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TileIndexConfigTest {

    @TempDir
    Path tmp;

    private final TileIndexConfig config = new TileIndexConfig();
    private final TileIndexCodec codec = new TileIndexCodec(new ObjectMapper());

    private TilecutProperties props() {
        TilecutProperties props = new TilecutProperties();
        props.setArchiveRoot(tmp.resolve("tiles").toString());
        props.setTileIndexFile(tmp.resolve("tile-index.json").toString());
        return props;
    }

    @Test
    void buildsAndPersistsIndexOnFirstStart_thenLoadsIt() throws Exception {
        FitsFixtures.writeCatalog(tmp.resolve("tiles/102018211/EUC_MER_FINAL-CAT_TILE102018211-AB_20240101.fits"),
                new String[]{"RIGHT_ASCENSION", "DECLINATION"}, new double[]{150.0, 150.3}, new double[]{2.0, 2.3});

        SpatialTileIndex first = config.spatialTileIndex(props(), codec);
        assertEquals(1, first.size());
        assertTrue(Files.exists(tmp.resolve("tile-index.json")));

        // remove the catalogs: the persisted index must be enough
        Files.delete(tmp.resolve("tiles/102018211/EUC_MER_FINAL-CAT_TILE102018211-AB_20240101.fits"));
        SpatialTileIndex second = config.spatialTileIndex(props(), codec);
        assertEquals(first.records().iterator().next(), second.records().iterator().next());
        assertEquals("102018211", second.lookup(150.1, 2.1).orElseThrow());
    }

    @Test
    void startsEmptyWithoutIndexOrArchive() throws Exception {
        SpatialTileIndex index = config.spatialTileIndex(props(), codec);

        assertEquals(0, index.size());
    }
}
