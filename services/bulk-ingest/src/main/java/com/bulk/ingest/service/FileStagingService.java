package com.bulk.ingest.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.bulk.ingest.config.IngestProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps uploaded files on local disk between submission and processing.
 */
@Service
@Slf4j
public class FileStagingService {

    private final Path stagingDir;

    public FileStagingService(IngestProperties properties) {
        this.stagingDir = Path.of(properties.getStagingDir());
    }

    public Path stage(UUID stagingId, InputStream content) {
        Path target = stagingDir.resolve(stagingId + ".csv");
        try {
            Files.createDirectories(stagingDir);
            long bytes = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Staged {} bytes to {}", bytes, target);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to stage upload to " + target, e);
        }
    }

    public void delete(String stagedPath) {
        if (stagedPath == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(Path.of(stagedPath))) {
                log.debug("Removed staged file {}", stagedPath);
            }
        } catch (IOException e) {
            log.warn("Could not remove staged file {}: {}", stagedPath, e.getMessage());
        }
    }
}
