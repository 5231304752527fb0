package org.iceforge.tilecut.cache;

import java.util.Optional;

/**
 * One storage tier of the artifact cache. Keys are relative, {@code /}-separated paths.
 */
public interface ArtifactTier {

    String name();

    /**
     * @return the stored artifact, or empty when nothing is stored under {@code key}
     * @throws ArtifactStoreException if something is stored but cannot be decoded
     */
    Optional<StoredArtifact> read(String key);

    /** Fingerprint hash of whatever is stored under {@code key}, without loading pixels. */
    Optional<String> fingerprintAt(String key);

    boolean exists(String key);

    /**
     * @return bytes written
     * @throws ArtifactStoreException if the write fails
     */
    long write(String key, StoredArtifact artifact);

    Usage usage();

    record Usage(long objectCount, long bytesUsed) {}
}
