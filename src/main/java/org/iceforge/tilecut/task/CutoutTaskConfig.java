package org.iceforge.tilecut.task;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.iceforge.tilecut.archive.ProductType;
import org.iceforge.tilecut.extract.EdgeMode;
import org.iceforge.tilecut.extract.WindowSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Per-task cutout options. Every field is optional in requests; missing values take the
 * defaults below. Ranges are checked by bean validation when a request is accepted.
 *
 * @param instruments    instrument directories to use; empty means all
 * @param bands          full band names to use; {@value #DEFAULT_BAND} when not given
 * @param size           square window side, used unless both {@code height} and {@code width} are set
 * @param fillValue      value for off-image pixels in {@link EdgeMode#FILL}; 0 when not given
 * @param rejectInvalid  treat cutouts containing NaN/inf as unusable; on unless turned off
 * @param saveCatalogRow attach the source's catalog row to its first output file
 * @param workers        tile-group workers for this task; service default when not given
 * @param maxRows        catalog row cap; service default when not given
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CutoutTaskConfig(
        List<ProductType> productTypes,
        List<String> instruments,
        List<String> bands,
        @Positive Integer size,
        @Positive Integer height,
        @Positive Integer width,
        EdgeMode edgeMode,
        Double fillValue,
        Boolean rejectInvalid,
        Boolean saveCatalogRow,
        String raColumn,
        String decColumn,
        String idColumn,
        String sizeColumn,
        @Min(1) @Max(CutoutTaskConfig.MAX_WORKERS) Integer workers,
        @Positive Integer maxRows
) {
    public static final int DEFAULT_SIZE = 128;
    public static final String DEFAULT_BAND = "VIS";
    public static final int MAX_WORKERS = 16;
    public static final double DEFAULT_FILL_VALUE = 0.0;

    private static final Logger log = LoggerFactory.getLogger(CutoutTaskConfig.class);

    public CutoutTaskConfig {
        if (bands == null || bands.isEmpty()) {
            log.warn("No bands requested; defaulting to {}", DEFAULT_BAND);
        }
        productTypes = productTypes == null || productTypes.isEmpty() ? List.of(ProductType.BGSUB) : List.copyOf(productTypes);
        instruments = instruments == null ? List.of() : List.copyOf(instruments);
        bands = bands == null || bands.isEmpty() ? List.of(DEFAULT_BAND) : List.copyOf(bands);
        size = size == null ? DEFAULT_SIZE : size;
        edgeMode = edgeMode == null ? EdgeMode.FILL : edgeMode;
        fillValue = fillValue == null ? DEFAULT_FILL_VALUE : fillValue;
        rejectInvalid = rejectInvalid == null || rejectInvalid;
        saveCatalogRow = saveCatalogRow == null || saveCatalogRow;
    }

    public static CutoutTaskConfig defaults() {
        return new CutoutTaskConfig(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    @AssertTrue(message = "height and width must be given together")
    public boolean isWindowShapeComplete() {
        return (height == null) == (width == null);
    }

    @JsonIgnore
    public WindowSize windowSize() {
        return height != null ? new WindowSize(height, width) : WindowSize.square(size);
    }
}
