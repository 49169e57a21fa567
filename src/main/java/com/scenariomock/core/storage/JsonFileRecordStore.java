package com.scenariomock.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scenariomock.core.error.BackendException;
import com.scenariomock.core.util.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Record store that keeps its tables in memory and writes them through to a single JSON file
 * after every change. Match counts are written with the next change or on {@link #flush()}, so a
 * matched call never waits for the disk. A store opened on an existing file continues from its
 * content, including the id sequences.
 */
public class JsonFileRecordStore extends InMemoryRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileRecordStore.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    /**
     * @throws BackendException of kind STORAGE if the file exists but cannot be read
     */
    public JsonFileRecordStore(Path file) throws BackendException {
        this.file = file;
        if (Files.exists(file)) {
            try {
                restore(objectMapper.readValue(file.toFile(), StoreSnapshot.class));
                logger.info("Loaded mock store from {}", file);
            } catch (IOException e) {
                throw BackendException.storage("Failed to read mock store " + file, e);
            }
        } else {
            logger.debug("Mock store {} does not exist yet, starting empty", file);
        }
    }

    public Path getFile() {
        return file;
    }

    @Override
    protected void afterWrite(StoreSnapshot snapshot) throws BackendException {
        try {
            AtomicFileWriter.writeAtomically(file, tempPath -> objectMapper.writeValue(tempPath.toFile(), snapshot));
        } catch (IOException e) {
            logger.error("Failed to write mock store {}: {}", file, e.getMessage());
            throw BackendException.storage("Failed to write mock store " + file, e);
        }
    }
}
