package org.iceforge.tilecut.batch;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureSample(
        String targetId,
        String tileId,
        String productType,
        String instrument,
        String band,
        FailureKind kind,
        String message
) {}
