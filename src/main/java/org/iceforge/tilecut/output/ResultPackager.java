package org.iceforge.tilecut.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs a task's output directory into a single zip.
 */
@Component
public class ResultPackager {
    private static final Logger log = LoggerFactory.getLogger(ResultPackager.class);

    /**
     * Zips every regular file under {@code dir}, with entry names relative to it.
     *
     * @return number of entries written
     */
    public int zip(Path dir, Path zipFile) throws IOException {
        List<Path> files;
        if (Files.isDirectory(dir)) {
            try (Stream<Path> s = Files.walk(dir)) {
                files = s.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            }
        } else {
            files = List.of();
        }

        Path parent = zipFile.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "tilecut-", ".zip.tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp); ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Path f : files) {
                    String entry = dir.relativize(f).toString().replace('\\', '/');
                    zip.putNextEntry(new ZipEntry(entry));
                    Files.copy(f, zip);
                    zip.closeEntry();
                }
            }
            Files.move(tmp, zipFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Packaged {} files from {} into {}", files.size(), dir, zipFile);
        return files.size();
    }

    /** Deletes a directory tree. Failures are logged, not raised. */
    public void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.toString());
        }
    }
}
