package io.loremesh.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.function.Supplier;

public final class JsonStateFile<T> {
    private final Path path;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonStateFile(Path path, Class<T> type) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.mapper = mapper();
    }

    public static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public synchronized T read(Supplier<T> whenMissing) throws PersistenceException {
        if (!Files.exists(path)) {
            return whenMissing.get();
        }
        try {
            return mapper.readValue(Files.readString(path), type);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read state file " + path, e);
        }
    }

    public synchronized void write(T state) throws PersistenceException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, json + System.lineSeparator());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write state file " + path, e);
        }
    }
}
