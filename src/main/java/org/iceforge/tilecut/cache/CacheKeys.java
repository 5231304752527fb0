package org.iceforge.tilecut.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Key derivation for the two cache tiers.
 */
public final class CacheKeys {

    private CacheKeys() {}

    /**
     * Ephemeral tier key: {@code <instrument>/<productType>/<fingerprintHash>.fits}.
     */
    public static String ephemeralKey(ArtifactFingerprint fp) {
        return safe(fp.instrument()) + "/" + safe(fp.productType()) + "/" + fp.hash() + ".fits";
    }

    /**
     * Permanent tier key: {@code <BAND>/<target>_<INSTRUMENT>_<PRODUCT_TYPE>_<BAND>.fits}.
     */
    public static String permanentKey(ArtifactFingerprint fp, String targetId) {
        String band = safe(fp.band()).toUpperCase(Locale.ROOT);
        String type = safe(fp.productType()).replace('-', '_').toUpperCase(Locale.ROOT);
        String instrument = safe(fp.instrument()).toUpperCase(Locale.ROOT);
        return band + "/" + safe(targetId) + "_" + instrument + "_" + type + "_" + band + ".fits";
    }

    /** Replaces anything outside {@code [A-Za-z0-9._+-]} with {@code _}. */
    static String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        String out = s.trim().replaceAll("[^A-Za-z0-9._+-]", "_");
        return out.replace("..", "__");
    }

    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
