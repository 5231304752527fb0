package org.iceforge.tilecut.catalog;

import org.iceforge.tilecut.TilecutProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps catalogs uploaded by clients until a task is submitted against them:
 * <pre>
 *   {uploadDir}/{uploadId}/{fileName}
 * </pre>
 * The file keeps its original (sanitised) name so the reader can tell CSV from FITS.
 */
@Component
public class CatalogUploadStore {
    private static final Logger log = LoggerFactory.getLogger(CatalogUploadStore.class);

    static final List<String> SUPPORTED_SUFFIXES = List.of(".csv", ".fits", ".fit", ".fits.gz");

    private final Path root;

    @Autowired
    public CatalogUploadStore(TilecutProperties props) {
        this(Path.of(props.getUploadDir()));
    }

    public CatalogUploadStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    /**
     * @throws CatalogFormatException if the name has an unsupported extension or the upload is empty
     */
    public UploadedCatalog store(String originalName, InputStream content) {
        Objects.requireNonNull(content, "content");
        String fileName = fileName(originalName);
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (SUPPORTED_SUFFIXES.stream().noneMatch(lower::endsWith)) {
            throw new CatalogFormatException("Unsupported catalog format: " + fileName
                    + " (expected one of " + SUPPORTED_SUFFIXES + ")");
        }

        String uploadId = UUID.randomUUID().toString();
        Path dir = root.resolve(uploadId);
        Path dst = dir.resolve(fileName);
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "upload-", ".tmp");
            try {
                Files.copy(content, tmp, StandardCopyOption.REPLACE_EXISTING);
                if (Files.size(tmp) == 0) {
                    throw new CatalogFormatException("Uploaded catalog " + fileName + " is empty");
                }
                Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            long size = Files.size(dst);
            log.info("Stored uploaded catalog {} as {} ({} bytes)", fileName, uploadId, size);
            return new UploadedCatalog(uploadId, fileName, size);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store uploaded catalog " + fileName, e);
        } finally {
            deleteIfEmpty(dir);
        }
    }

    /** The stored catalog of an upload, or empty if the id is unknown or malformed. */
    public Optional<Path> resolve(String uploadId) {
        if (uploadId == null) {
            return Optional.empty();
        }
        try {
            UUID.fromString(uploadId);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        Path dir = root.resolve(uploadId).normalize();
        if (!dir.startsWith(root) || !Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> s = Files.list(dir)) {
            List<Path> files = s.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                    .collect(Collectors.toList());
            return files.size() == 1 ? Optional.of(files.get(0)) : Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list upload " + uploadId, e);
        }
    }

    static String fileName(String originalName) {
        String name = originalName == null ? "" : originalName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        String safe = name.replaceAll("[^A-Za-z0-9._+-]", "_").replace("..", "__");
        return safe.isEmpty() || safe.startsWith(".") ? "catalog" + safe : safe;
    }

    private static void deleteIfEmpty(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            if (s.findAny().isEmpty()) {
                Files.delete(dir);
            }
        } catch (IOException e) {
            log.debug("Could not tidy upload directory {}: {}", dir, e.toString());
        }
    }
}
