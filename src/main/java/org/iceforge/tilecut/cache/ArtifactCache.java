package org.iceforge.tilecut.cache;

import org.iceforge.tilecut.extract.CutoutArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Two-tier, content-addressed store of extraction results.
 * <p>
 * The ephemeral tier belongs to one run and is keyed by fingerprint hash; the permanent tier
 * outlives runs and is keyed by target, instrument, product type and band. Only successful
 * artifacts are stored (and, when the caller rejects them, only those without NaN/inf
 * pixels). Entries are written once and never modified.
 * <p>
 * Calls for the same fingerprint are serialised, so a fingerprint is computed at most once
 * while a stored artifact exists for it.
 */
public class ArtifactCache implements CacheMetrics {
    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);

    private final ArtifactTier ephemeral;
    private final ArtifactTier permanent;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder computations = new LongAdder();
    private final LongAdder bytesWritten = new LongAdder();

    public ArtifactCache(ArtifactTier ephemeral, ArtifactTier permanent) {
        this.ephemeral = Objects.requireNonNull(ephemeral, "ephemeral");
        this.permanent = Objects.requireNonNull(permanent, "permanent");
    }

    /**
     * @param rejectInvalid treat artifacts with NaN/inf pixels as unusable: they are neither
     *                      stored nor reported as success
     * @param compute       the extraction; only called on a miss
     * @throws ArtifactStoreException if a tier write fails
     */
    public CacheLookup getOrCompute(ArtifactFingerprint fp, String targetId, boolean rejectInvalid,
                                    Supplier<CutoutArtifact> compute) {
        Objects.requireNonNull(fp, "fp");
        Objects.requireNonNull(compute, "compute");
        String hash = fp.hash();
        String ephemeralKey = CacheKeys.ephemeralKey(fp);
        String permanentKey = CacheKeys.permanentKey(fp, targetId);

        ReentrantLock lock = locks.computeIfAbsent(hash, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<StoredArtifact> hit = readQuietly(ephemeral, ephemeralKey, hash);
            if (hit.isPresent()) {
                hits.increment();
                return answer(hit.get().artifact(), CacheSource.EPHEMERAL, rejectInvalid);
            }

            boolean permanentUnreadable = false;
            try {
                hit = readMatching(permanent, permanentKey, hash);
            } catch (ArtifactStoreException e) {
                log.warn("Ignoring unreadable {} cache entry {}: {}", permanent.name(), permanentKey, e.getMessage());
                permanentUnreadable = true;
                hit = Optional.empty();
            }
            if (hit.isPresent()) {
                hits.increment();
                bytesWritten.add(ephemeral.write(ephemeralKey, hit.get()));
                return answer(hit.get().artifact(), CacheSource.PERMANENT, rejectInvalid);
            }

            misses.increment();
            computations.increment();
            CutoutArtifact artifact = compute.get();
            if (artifact == null) {
                artifact = CutoutArtifact.failure("Extraction produced no result");
            }
            if (!artifact.isSuccess()) {
                return new CacheLookup(CacheOutcome.FAILED, CacheSource.COMPUTED, artifact);
            }
            if (rejectInvalid && artifact.hasInvalidValues()) {
                return new CacheLookup(CacheOutcome.INVALID, CacheSource.COMPUTED, artifact);
            }

            StoredArtifact stored = new StoredArtifact(hash, fp.canonical(), targetId, fp.productType(), artifact);
            bytesWritten.add(ephemeral.write(ephemeralKey, stored));
            // write-once only protects a readable entry of another fingerprint
            Optional<String> occupant = permanentUnreadable ? Optional.empty() : occupantQuietly(permanentKey);
            if (occupant.isEmpty()) {
                if (permanentUnreadable) {
                    log.info("Replacing unreadable permanent entry {}", permanentKey);
                }
                bytesWritten.add(permanent.write(permanentKey, stored));
            } else if (!occupant.get().equals(hash)) {
                log.warn("Permanent key {} already holds a different artifact; not overwriting", permanentKey);
            }
            return new CacheLookup(CacheOutcome.COMPUTED, CacheSource.COMPUTED, artifact);
        } finally {
            lock.unlock();
        }
    }

    private static CacheLookup answer(CutoutArtifact artifact, CacheSource source, boolean rejectInvalid) {
        CacheOutcome outcome = rejectInvalid && artifact.hasInvalidValues() ? CacheOutcome.INVALID : CacheOutcome.HIT;
        return new CacheLookup(outcome, source, artifact);
    }

    private Optional<StoredArtifact> readQuietly(ArtifactTier tier, String key, String expectedHash) {
        try {
            return readMatching(tier, key, expectedHash);
        } catch (ArtifactStoreException e) {
            log.warn("Ignoring unreadable {} cache entry {}: {}", tier.name(), key, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<StoredArtifact> readMatching(ArtifactTier tier, String key, String expectedHash) {
        Optional<StoredArtifact> stored = tier.read(key);
        if (stored.isPresent() && !expectedHash.equals(stored.get().fingerprintHash())) {
            log.debug("{} tier key {} belongs to another fingerprint", tier.name(), key);
            return Optional.empty();
        }
        return stored;
    }

    /** Fingerprint of the permanent occupant; an undecodable sidecar counts as no occupant. */
    private Optional<String> occupantQuietly(String key) {
        try {
            return permanent.fingerprintAt(key);
        } catch (ArtifactStoreException e) {
            log.warn("Ignoring unreadable permanent metadata {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public long hits() {
        return hits.sum();
    }

    @Override
    public long misses() {
        return misses.sum();
    }

    @Override
    public long bytesUsed() {
        return bytesWritten.sum();
    }

    /** Extractions actually run through this cache. */
    public long computations() {
        return computations.sum();
    }
}
