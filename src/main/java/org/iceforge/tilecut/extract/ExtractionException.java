package org.iceforge.tilecut.extract;

/**
 * Raised inside the extractor when a cutout cannot be produced. Callers never see it:
 * {@link WindowExtractor} turns it into a failed {@link CutoutArtifact}.
 */
public class ExtractionException extends RuntimeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
