package com.gamecatalog.dumpimport.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the last downloaded payload of each entity as {@code <download-dir>/<entity>.csv}.
 */
@Service
public class DumpFileStore {

    private static final Logger logger = LoggerFactory.getLogger(DumpFileStore.class);

    private final Path downloadDirectory;

    public DumpFileStore(@Value("${app.import.download-dir:./dumps}") String downloadDirectory) {
        this.downloadDirectory = Paths.get(downloadDirectory);
    }

    /**
     * Writes the payload atomically so a failed download never truncates the previous dump.
     */
    public Path save(String entity, byte[] payload) {
        Path target = pathFor(entity);
        Path temp = null;
        try {
            Files.createDirectories(downloadDirectory);
            temp = Files.createTempFile(downloadDirectory, entity, ".part");
            Files.write(temp, payload);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.info("Stored {} bytes of {} dump at {}", payload.length, entity, target);
            return target;
        } catch (IOException e) {
            deletePartial(temp, e);
            throw new UncheckedIOException("Failed to store dump for " + entity + " at " + target, e);
        }
    }

    private void deletePartial(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove partial dump file {}", temp, e);
            failure.addSuppressed(e);
        }
    }

    /**
     * Path of the stored payload, if one has been downloaded before.
     */
    public Optional<Path> find(String entity) {
        Path path = pathFor(entity);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    Path pathFor(String entity) {
        return downloadDirectory.resolve(entity + ".csv");
    }
}
