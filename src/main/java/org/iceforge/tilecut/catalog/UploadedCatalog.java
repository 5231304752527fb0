package org.iceforge.tilecut.catalog;

/**
 * A catalog accepted by {@link CatalogUploadStore}; submit tasks against it by {@code uploadId}.
 */
public record UploadedCatalog(String uploadId, String fileName, long sizeBytes) {}
