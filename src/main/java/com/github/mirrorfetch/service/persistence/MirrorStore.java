package com.github.mirrorfetch.service.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.mirrorfetch.exception.MirrorRegistryException;
import com.github.mirrorfetch.model.MirrorSite;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the mirror list as a JSON array, including learned health state.
 */
@Slf4j
public class MirrorStore {

    private static final TypeReference<List<MirrorSite>> MIRROR_LIST = new TypeReference<>() {
    };

    private final Path mirrorFile;
    private final ObjectMapper objectMapper;

    public MirrorStore(Path mirrorFile) {
        this(mirrorFile, defaultObjectMapper());
    }

    public MirrorStore(Path mirrorFile, ObjectMapper objectMapper) {
        this.mirrorFile = mirrorFile;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Load the stored mirror list.
     *
     * @return the mirrors, or empty when no file has been written yet
     * @throws MirrorRegistryException if the file exists but cannot be parsed
     */
    public Optional<List<MirrorSite>> load() {
        if (!Files.exists(mirrorFile)) {
            log.debug("Mirror file not found: {}", mirrorFile);
            return Optional.empty();
        }
        try {
            List<MirrorSite> mirrors = objectMapper.readValue(mirrorFile.toFile(), MIRROR_LIST);
            log.info("Loaded {} mirrors from {}", mirrors.size(), mirrorFile);
            return Optional.of(mirrors);
        } catch (IOException e) {
            throw new MirrorRegistryException("Failed to read mirror file: " + e.getMessage(), mirrorFile, e);
        }
    }

    /**
     * Write the mirror list through a temp file and an atomic move, so a crash mid-write
     * never leaves a truncated mirror file behind.
     */
    public synchronized void save(List<MirrorSite> mirrors) {
        Path tempFile = null;
        try {
            Path target = mirrorFile.toAbsolutePath();
            Files.createDirectories(target.getParent());
            tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tempFile.toFile(), mirrors);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} mirrors to {}", mirrors.size(), mirrorFile);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new MirrorRegistryException("Failed to write mirror file: " + e.getMessage(), mirrorFile, e);
        }
    }

    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Failed to delete temp mirror file {}: {}", tempFile, e.getMessage());
        }
    }

    public Path getMirrorFile() {
        return mirrorFile;
    }
}
