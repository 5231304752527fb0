package org.iceforge.tilecut.archive;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileNameResolverTest {

    private static final String TILE = "102018211";

    @TempDir
    Path root;

    private FileNameResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        touch("VIS", "EUC_MER_BGSUB-MOSAIC-VIS");
        touch("VIS", "EUC_MER_MOSAIC-VIS-FLAG");
        touch("VIS", "EUC_MER_MOSAIC-VIS-RMS");
        touch("NISP", "EUC_MER_BGSUB-MOSAIC-NIR-Y");
        touch("NISP", "EUC_MER_BGSUB-MOSAIC-NIR-H");
        touch("DECAM", "EUC_MER_BGSUB-MOSAIC-DES-G");
        touch("DECAM", "EUC_MER_CATALOG-PSF-DES-G");
        // misplaced and foreign files
        touch("DECAM", "EUC_MER_BGSUB-MOSAIC-NIR-J");
        Files.createFile(root.resolve(TILE).resolve("VIS").resolve(
                "EUC_MER_BGSUB-MOSAIC-VIS_TILE999-A1B2C3_20240101T000000.000000Z_00.00.fits"));
        touch("VIS", "EUC_MER_FINAL-CAT");
        Files.createFile(root.resolve(TILE).resolve("VIS").resolve("README.txt"));
        resolver = new FileNameResolver(root);
    }

    private void touch(String instrumentDir, String stem) throws IOException {
        Path dir = Files.createDirectories(root.resolve(TILE).resolve(instrumentDir));
        Files.createFile(dir.resolve(stem + "_TILE" + TILE + "-A1B2C3_20240101T000000.000000Z_00.00.fits"));
    }

    @Test
    void resolve_withoutFilters_returnsEveryMatchingFileSortedByKey() {
        Map<String, ResolvedFile> found = resolver.resolve(TILE, ProductType.BGSUB, List.of(), List.of());

        assertThat(found.keySet()).containsExactly("DECAM_DES-G", "NISP_NIR-H", "NISP_NIR-Y", "VIS_VIS");
        ResolvedFile vis = found.get("VIS_VIS");
        assertEquals(TILE, vis.tileId());
        assertEquals("VIS", vis.instrument());
        assertEquals("VIS", vis.band());
        assertEquals(ProductType.BGSUB, vis.productType());
        assertTrue(vis.path().startsWith(root.toAbsolutePath()));
    }

    @Test
    void resolve_filtersAreCaseInsensitive() {
        Map<String, ResolvedFile> found = resolver.resolve(TILE, ProductType.BGSUB, List.of("nisp"), List.of("nir-y"));

        assertThat(found.keySet()).containsExactly("NISP_NIR-Y");
    }

    @Test
    void resolve_rmsAndFlag_doNotLeakIntoEachOther() {
        assertThat(resolver.resolve(TILE, ProductType.RMS, List.of(), List.of()).keySet()).containsExactly("VIS_VIS");
        Map<String, ResolvedFile> flags = resolver.resolve(TILE, ProductType.FLAG, List.of(), List.of());
        assertThat(flags.keySet()).containsExactly("VIS_VIS");
        assertThat(flags.get("VIS_VIS").path().getFileName().toString()).contains("-FLAG_TILE");
    }

    @Test
    void resolve_psfProducts() {
        assertThat(resolver.resolve(TILE, ProductType.CATALOG_PSF, List.of("DECAM"), List.of()).keySet())
                .containsExactly("DECAM_DES-G");
    }

    @Test
    void resolve_missingTileOrNoMatch_isEmptyNotAnError() {
        assertThat(resolver.resolve("424242", ProductType.BGSUB, List.of(), List.of())).isEmpty();
        assertThat(resolver.resolve(TILE, ProductType.BGMOD, List.of(), List.of())).isEmpty();
        assertThat(resolver.resolve(TILE, ProductType.BGSUB, List.of("MEGACAM"), List.of())).isEmpty();
        assertFalse(resolver.tileExists("424242"));
        assertTrue(resolver.tileExists(TILE));
    }

    @Test
    void resolve_rejectsPathTraversal() {
        assertThatThrownBy(() -> resolver.resolve("../etc", ProductType.BGSUB, List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /* ---------- per-tile memo ---------- */

    @Test
    void tileFileCache_consultsResolverOncePerDistinctQuery() {
        TileFileCache cache = new TileFileCache(resolver, TILE);

        Map<String, ResolvedFile> a = cache.resolve(ProductType.BGSUB, List.of("NISP", "VIS"), List.of());
        Map<String, ResolvedFile> b = cache.resolve(ProductType.BGSUB, List.of("VIS", "NISP"), List.of());
        cache.resolve(ProductType.RMS, List.of("NISP", "VIS"), List.of());

        assertEquals(a, b);
        assertEquals(2, cache.resolverLookups());
        assertTrue(cache.tileExists());
    }
}
