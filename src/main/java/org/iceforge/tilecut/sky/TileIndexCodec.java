package org.iceforge.tilecut.sky;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * JSON persistence for the tile index: a plain array of {@link TileRecord}s.
 */
public class TileIndexCodec {

    private static final TypeReference<List<TileRecord>> RECORDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public TileIndexCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper).copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<TileRecord> read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), RECORDS);
    }

    public void write(Path file, List<TileRecord> records) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "tile-index-", ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
