package org.iceforge.tilecut.extract;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result envelope for one extraction, shared by windows and PSF stamps.
 * <p>
 * A failed artifact carries no pixels, only the reason. {@code hasInvalidValues} is worked
 * out once, when the artifact is built, and is true when any pixel is NaN or infinite.
 *
 * @param data       pixels, row-major {@code [y][x]}
 * @param transform  coordinate-transform header cards for the window (empty for stamps)
 * @param provenance where the pixels came from; nearest-stamp metadata for PSF stamps
 */
public record CutoutArtifact(
        Status status,
        double[][] data,
        Map<String, Object> transform,
        Map<String, Object> provenance,
        String instrument,
        String band,
        boolean hasInvalidValues,
        String error
) {
    public enum Status {
        SUCCESS,
        FAILED
    }

    public CutoutArtifact {
        Objects.requireNonNull(status, "status");
        transform = transform == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(transform));
        provenance = provenance == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        if (status == Status.SUCCESS && data == null) {
            throw new IllegalArgumentException("Successful artifact needs pixel data");
        }
    }

    public static CutoutArtifact success(double[][] data, Map<String, Object> transform, Map<String, Object> provenance) {
        return new CutoutArtifact(Status.SUCCESS, data, transform, provenance, null, null, containsInvalid(data), null);
    }

    public static CutoutArtifact failure(String error) {
        return new CutoutArtifact(Status.FAILED, null, Map.of(), Map.of(), null, null, false, error);
    }

    /** Same artifact, labelled with the instrument and band it was cut from. */
    public CutoutArtifact withSource(String instrument, String band) {
        return new CutoutArtifact(status, data, transform, provenance, instrument, band, hasInvalidValues, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public int height() {
        return data == null ? 0 : data.length;
    }

    public int width() {
        return data == null || data.length == 0 ? 0 : data[0].length;
    }

    static boolean containsInvalid(double[][] data) {
        for (double[] row : data) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CutoutArtifact)) return false;
        CutoutArtifact that = (CutoutArtifact) o;
        return hasInvalidValues == that.hasInvalidValues
                && status == that.status
                && Arrays.deepEquals(data, that.data)
                && transform.equals(that.transform)
                && provenance.equals(that.provenance)
                && Objects.equals(instrument, that.instrument)
                && Objects.equals(band, that.band)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, Arrays.deepHashCode(data), transform, provenance, instrument, band, hasInvalidValues, error);
    }

    @Override
    public String toString() {
        return "CutoutArtifact{status=" + status
                + ", size=" + height() + "x" + width()
                + ", instrument=" + instrument
                + ", band=" + band
                + ", hasInvalidValues=" + hasInvalidValues
                + (error != null ? ", error=" + error : "")
                + "}";
    }
}
