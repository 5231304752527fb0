package org.iceforge.tilecut.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.tilecut.extract.CutoutArtifact;
import org.iceforge.tilecut.extract.WindowSize;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactCacheTest {

    @TempDir
    Path tmp;

    private ArtifactCacheFactory factory;
    private final AtomicInteger computeCalls = new AtomicInteger();

    private final ArtifactFingerprint fp = ArtifactFingerprint.of(150.1, 2.2, WindowSize.square(3), "VIS", "BGSUB", "VIS");

    @BeforeEach
    void setUp() {
        factory = new ArtifactCacheFactory(tmp.resolve("cache"), new ObjectMapper());
    }

    private static CutoutArtifact artifact(double corner) {
        double[][] data = {
                {corner, 0.1, 0.2},
                {1.0, 1.1, 1.2},
                {2.0, 2.1, 1.0 / 3.0}
        };
        Map<String, Object> transform = new LinkedHashMap<>();
        transform.put("CTYPE1", "RA---TAN");
        transform.put("CRPIX1", 2.5);
        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("XPIX", 1234.5678);
        provenance.put("XMIN", 1233);
        return CutoutArtifact.success(data, transform, provenance).withSource("VIS", "VIS");
    }

    private Supplier<CutoutArtifact> counting(CutoutArtifact result) {
        return () -> {
            computeCalls.incrementAndGet();
            return result;
        };
    }

    /* ---------- hits ---------- */

    @Test
    void secondLookup_isServedFromEphemeralWithoutRecomputing() {
        ArtifactCache cache = factory.create("run-1");

        CacheLookup first = cache.getOrCompute(fp, "T1", false, counting(artifact(7.0)));
        CacheLookup second = cache.getOrCompute(fp, "T1", false, counting(artifact(7.0)));

        assertEquals(CacheOutcome.COMPUTED, first.outcome());
        assertFalse(first.fromCache());
        assertEquals(CacheOutcome.HIT, second.outcome());
        assertEquals(CacheSource.EPHEMERAL, second.source());
        assertEquals(first.artifact(), second.artifact());
        assertEquals(1, computeCalls.get());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
        assertThat(cache.bytesUsed()).isPositive();
    }

    @Test
    void permanentTier_servesLaterRuns_bitIdentically() {
        CutoutArtifact original = artifact(Double.NaN);
        factory.create("run-1").getOrCompute(fp, "T1", false, counting(original));
        factory.discard("run-1");

        ArtifactCache second = factory.create("run-2");
        CacheLookup lookup = second.getOrCompute(fp, "T1", false, counting(artifact(99.0)));

        assertEquals(CacheOutcome.HIT, lookup.outcome());
        assertEquals(CacheSource.PERMANENT, lookup.source());
        assertEquals(original, lookup.artifact());
        for (int y = 0; y < 3; y++) {
            assertArrayEquals(original.data()[y], lookup.artifact().data()[y]);
        }
        assertTrue(lookup.artifact().hasInvalidValues());
        assertEquals(1, computeCalls.get());
        assertEquals(0, second.computations());

        // copied forward into the new run's ephemeral tier
        assertEquals(CacheSource.EPHEMERAL, second.getOrCompute(fp, "T1", false, counting(artifact(99.0))).source());
    }

    /* ---------- what is not stored ---------- */

    @Test
    void failures_areNeverCached() {
        ArtifactCache cache = factory.create("run-1");

        CacheLookup a = cache.getOrCompute(fp, "T1", false, counting(CutoutArtifact.failure("off image")));
        CacheLookup b = cache.getOrCompute(fp, "T1", false, counting(CutoutArtifact.failure("off image")));
        CacheLookup c = cache.getOrCompute(fp, "T1", false, () -> null);

        assertEquals(CacheOutcome.FAILED, a.outcome());
        assertEquals(CacheOutcome.FAILED, b.outcome());
        assertEquals(CacheOutcome.FAILED, c.outcome());
        assertEquals(2, computeCalls.get());
        assertEquals(0, factory.permanentTier().usage().objectCount());
    }

    @Test
    void invalidPixels_underRejectInvalid_areReportedAndNotStored() {
        ArtifactCache cache = factory.create("run-1");

        CacheLookup a = cache.getOrCompute(fp, "T1", true, counting(artifact(Double.NaN)));
        CacheLookup b = cache.getOrCompute(fp, "T1", true, counting(artifact(Double.NaN)));

        assertEquals(CacheOutcome.INVALID, a.outcome());
        assertFalse(a.isSuccess());
        assertEquals(CacheOutcome.INVALID, b.outcome());
        assertEquals(2, computeCalls.get());
        assertEquals(0, factory.permanentTier().usage().objectCount());
    }

    @Test
    void invalidPixels_withoutRejectInvalid_areStoredWithFlag() {
        CacheLookup a = factory.create("run-1").getOrCompute(fp, "T1", false, counting(artifact(Double.POSITIVE_INFINITY)));

        assertEquals(CacheOutcome.COMPUTED, a.outcome());
        assertTrue(a.artifact().hasInvalidValues());
        assertEquals(1, factory.permanentTier().usage().objectCount());
    }

    /* ---------- damage and collisions ---------- */

    @Test
    void unreadableEphemeralEntry_fallsThroughToPermanent() throws Exception {
        ArtifactCache cache = factory.create("run-1");
        cache.getOrCompute(fp, "T1", false, counting(artifact(7.0)));

        Path meta = tmp.resolve("cache/ephemeral/run-1").resolve(CacheKeys.ephemeralKey(fp) + LocalFsArtifactTier.META_SUFFIX);
        assertTrue(Files.exists(meta));
        Files.writeString(meta, "{not json");

        CacheLookup lookup = cache.getOrCompute(fp, "T1", false, counting(artifact(7.0)));

        assertEquals(CacheOutcome.HIT, lookup.outcome());
        assertEquals(CacheSource.PERMANENT, lookup.source());
        assertEquals(1, computeCalls.get());
    }

    @Test
    void permanentEntries_areWrittenOnce() {
        ArtifactCache cache = factory.create("run-1");
        ArtifactFingerprint moved = ArtifactFingerprint.of(150.2, 2.2, WindowSize.square(3), "VIS", "BGSUB", "VIS");
        String key = CacheKeys.permanentKey(fp, "T1");

        cache.getOrCompute(fp, "T1", false, counting(artifact(7.0)));
        CacheLookup other = cache.getOrCompute(moved, "T1", false, counting(artifact(8.0)));

        assertEquals(key, CacheKeys.permanentKey(moved, "T1"));
        assertEquals(CacheOutcome.COMPUTED, other.outcome());
        assertEquals(fp.hash(), factory.permanentTier().fingerprintAt(key).orElseThrow());
        assertEquals(2, computeCalls.get());
    }

    @Test
    void unreadablePermanentSidecar_isRecomputedAndReplaced() throws Exception {
        factory.create("run-1").getOrCompute(fp, "T1", false, counting(artifact(7.0)));
        factory.discard("run-1");
        Path meta = permanentPath(CacheKeys.permanentKey(fp, "T1") + LocalFsArtifactTier.META_SUFFIX);
        Files.writeString(meta, "{not json");

        CacheLookup recomputed = factory.create("run-2").getOrCompute(fp, "T1", false, counting(artifact(7.0)));
        factory.discard("run-2");
        CacheLookup later = factory.create("run-3").getOrCompute(fp, "T1", false, counting(artifact(99.0)));

        assertEquals(CacheOutcome.COMPUTED, recomputed.outcome());
        assertEquals(CacheOutcome.HIT, later.outcome());
        assertEquals(CacheSource.PERMANENT, later.source());
        assertEquals(artifact(7.0), later.artifact());
        assertEquals(2, computeCalls.get());
    }

    @Test
    void unreadablePermanentPixels_areRepairedOnNextComputation() throws Exception {
        factory.create("run-1").getOrCompute(fp, "T1", false, counting(artifact(7.0)));
        factory.discard("run-1");
        Path fits = permanentPath(CacheKeys.permanentKey(fp, "T1"));
        Files.write(fits, new byte[]{1, 2, 3});

        ArtifactCache second = factory.create("run-2");
        assertEquals(CacheOutcome.COMPUTED, second.getOrCompute(fp, "T1", false, counting(artifact(7.0))).outcome());
        factory.discard("run-2");
        assertThat(Files.size(fits)).isGreaterThan(3);

        ArtifactCache third = factory.create("run-3");
        CacheLookup lookup = third.getOrCompute(fp, "T1", false, counting(artifact(99.0)));

        assertEquals(CacheSource.PERMANENT, lookup.source());
        assertEquals(0, third.computations());
        assertEquals(2, computeCalls.get());
    }

    /* ---------- concurrency ---------- */

    @Test
    void concurrentLookupsOfOneFingerprint_computeOnce() throws Exception {
        ArtifactCache cache = factory.create("run-1");
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<CacheLookup>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCompute(fp, "T1", false, () -> {
                        computeCalls.incrementAndGet();
                        try {
                            Thread.sleep(50);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return artifact(7.0);
                    });
                }));
            }
            start.countDown();

            int computed = 0;
            for (Future<CacheLookup> f : futures) {
                CacheLookup lookup = f.get(10, TimeUnit.SECONDS);
                assertTrue(lookup.isSuccess());
                if (lookup.outcome() == CacheOutcome.COMPUTED) computed++;
            }
            assertEquals(1, computed);
            assertEquals(1, computeCalls.get());
            assertEquals(threads - 1, cache.hits());
        } finally {
            pool.shutdownNow();
        }
    }

    private Path permanentPath(String key) {
        Path p = tmp.resolve("cache/permanent").resolve(key);
        assertTrue(Files.exists(p), "missing " + p);
        return p;
    }

    @Test
    void discard_removesOnlyTheRunsEphemeralTier() {
        factory.create("run-1").getOrCompute(fp, "T1", false, counting(artifact(7.0)));

        factory.discard("run-1");

        assertFalse(Files.exists(tmp.resolve("cache/ephemeral/run-1")));
        assertEquals(1, factory.permanentTier().usage().objectCount());
    }
}
