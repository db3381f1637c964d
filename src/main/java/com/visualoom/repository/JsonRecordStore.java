package com.visualoom.repository;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes a flat JSON array of records.
 *
 * A missing file loads as an empty list. A file that cannot be parsed also
 * loads as an empty list after a warning, so whatever it held is lost to the
 * caller. Writes go to a temp file in the same directory which is then moved
 * over the target.
 *
 * @param <T> record type
 */
public class JsonRecordStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordStore.class);

    private final ObjectMapper objectMapper;
    private final JavaType listType;

    public JsonRecordStore(ObjectMapper objectMapper, Class<T> recordType) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.listType = this.objectMapper.getTypeFactory().constructCollectionType(List.class, recordType);
    }

    /**
     * Loads every record in the file.
     *
     * @param path JSON file location
     * @return the records in file order, or an empty list if the file is absent
     *         or unreadable
     */
    public List<T> load(Path path) {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            List<T> records = objectMapper.readValue(path.toFile(), listType);
            if (records == null) {
                return new ArrayList<>();
            }
            records.removeIf(Objects::isNull);
            return records;
        } catch (IOException e) {
            log.warn("Store file {} is unreadable, starting from an empty set: {}", path, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Replaces the file content with the given records.
     *
     * @throws IOException if the temp file cannot be written or moved into place
     */
    public void save(Path path, List<T> records) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, path.getFileName().toString() + ".", ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), records != null ? records : Collections.emptyList());
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
