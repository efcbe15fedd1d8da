package com.di.bidshub.upload.manifest;

import com.di.bidshub.exception.ManifestCorruptionException;
import com.di.bidshub.upload.config.UploadProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each manifest as pretty-printed JSON in a local state directory.
 * Writes go to a temp file first and are moved into place atomically, so a crash never
 * leaves a half-written manifest behind.
 */
@Slf4j
@Component
public class FileUploadManifestStore implements UploadManifestStore {

    private final Path         stateDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileUploadManifestStore(UploadProperties properties) {
        this(Path.of(properties.getStateDir()));
    }

    public FileUploadManifestStore(Path stateDir) {
        this.stateDir     = stateDir;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Optional<UploadManifest> load(String datasetId) {
        Path file = fileFor(datasetId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            UploadManifest manifest = objectMapper.readValue(file.toFile(), UploadManifest.class);
            if (manifest == null) {
                throw new ManifestCorruptionException("Manifest " + file + " is empty");
            }
            log.debug("[MANIFEST] loaded {} ({} committed)", file, manifest.getCommitted().size());
            return Optional.of(manifest);
        } catch (IOException e) {
            throw new ManifestCorruptionException("Manifest " + file + " is unreadable: " + e.getMessage(), e);
        }
    }

    @Override
    public void save(UploadManifest manifest) {
        Path file = fileFor(manifest.getDatasetId());
        try {
            Files.createDirectories(stateDir);
            Path tmp = Files.createTempFile(stateDir, manifest.getDatasetId() + ".", ".tmp");
            objectMapper.writeValue(tmp.toFile(), manifest);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot persist manifest " + file, e);
        }
    }

    Path fileFor(String datasetId) {
        if (datasetId == null || datasetId.isBlank() || datasetId.contains("/") || datasetId.contains("\\")
                || datasetId.contains("..")) {
            throw new IllegalArgumentException("Invalid dataset id for manifest file: " + datasetId);
        }
        return stateDir.resolve(datasetId + ".manifest.json");
    }
}
