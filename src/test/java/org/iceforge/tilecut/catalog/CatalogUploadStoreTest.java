package org.iceforge.tilecut.catalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogUploadStoreTest {

    @TempDir
    Path tmp;

    private CatalogUploadStore store;

    @BeforeEach
    void setUp() {
        store = new CatalogUploadStore(tmp.resolve("uploads"));
    }

    private static ByteArrayInputStream bytes(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private long uploadDirs() throws Exception {
        Path root = tmp.resolve("uploads");
        if (!Files.isDirectory(root)) {
            return 0;
        }
        try (Stream<Path> s = Files.list(root)) {
            return s.count();
        }
    }

    /* ---------- store / resolve ---------- */

    @Test
    void stored_catalog_resolvesByItsId() throws Exception {
        UploadedCatalog up = store.store("targets.csv", bytes("RA,DEC\n150.0,2.0\n"));

        assertEquals("targets.csv", up.fileName());
        assertEquals(17, up.sizeBytes());
        Path resolved = store.resolve(up.uploadId()).orElseThrow();
        assertEquals("targets.csv", resolved.getFileName().toString());
        assertEquals("RA,DEC\n150.0,2.0\n", Files.readString(resolved));
    }

    @Test
    void twoUploadsOfTheSameName_doNotCollide() {
        UploadedCatalog a = store.store("cat.csv", bytes("RA,DEC\n1,1\n"));
        UploadedCatalog b = store.store("cat.csv", bytes("RA,DEC\n2,2\n"));

        assertThat(a.uploadId()).isNotEqualTo(b.uploadId());
        assertThat(store.resolve(a.uploadId())).isNotEqualTo(store.resolve(b.uploadId()));
    }

    @Test
    void unsupportedFormat_isRejectedWithoutLeavingADirectory() throws Exception {
        assertThatThrownBy(() -> store.store("targets.xlsx", bytes("x")))
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("Unsupported catalog format");
        assertEquals(0, uploadDirs());
    }

    @Test
    void emptyUpload_isRejectedWithoutLeavingADirectory() throws Exception {
        assertThatThrownBy(() -> store.store("targets.fits", bytes("")))
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("empty");
        assertEquals(0, uploadDirs());
    }

    @Test
    void unknownOrMalformedIds_resolveToNothing() throws Exception {
        Files.createDirectories(tmp.resolve("secret"));
        Files.writeString(tmp.resolve("secret/cat.csv"), "RA,DEC\n");

        assertTrue(store.resolve(null).isEmpty());
        assertTrue(store.resolve("../secret").isEmpty());
        assertTrue(store.resolve("not-a-uuid").isEmpty());
        assertTrue(store.resolve("3f2b6c1e-0000-4000-8000-000000000001").isEmpty());
    }

    /* ---------- file names ---------- */

    @Test
    void fileName_dropsDirectoriesAndOddCharacters() {
        assertEquals("cat.csv", CatalogUploadStore.fileName("C:\\Users\\me\\cat.csv"));
        assertEquals("cat.csv", CatalogUploadStore.fileName("../../cat.csv"));
        assertEquals("my_targets_1_.fits.gz", CatalogUploadStore.fileName("my targets(1).fits.gz"));
        assertEquals("catalog.csv", CatalogUploadStore.fileName(".csv"));
        assertEquals("catalog", CatalogUploadStore.fileName(null));
    }
}
