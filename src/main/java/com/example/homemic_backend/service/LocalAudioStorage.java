package com.example.homemic_backend.service;

import com.example.homemic_backend.exception.StorageFailureException;
import com.example.homemic_backend.service.Interfaces.AudioStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class LocalAudioStorage implements AudioStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalAudioStorage.class);

    private final Path audioDir;

    public LocalAudioStorage(Path baseDir, String audioPrefix) {
        this.audioDir = baseDir.toAbsolutePath().normalize().resolve(audioPrefix).normalize();
        try {
            Files.createDirectories(audioDir);
            LOGGER.info("LocalAudioStorage ready. audio={}", audioDir);
        } catch (IOException e) {
            throw new StorageFailureException("Cannot create storage directory " + audioDir, e);
        }
    }

    @Override
    public void write(String objectKey, byte[] bytes) {
        Path target = safeResolve(objectKey);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            // Write next to the target first so a crash never leaves a half-written clip under its key.
            tmp = Files.createTempFile(target.getParent(), ".upload-", ".part");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageFailureException("Write failed: " + objectKey, e);
        }
    }

    @Override
    public byte[] read(String objectKey) {
        Path src = safeResolve(objectKey);
        try {
            return Files.readAllBytes(src);
        } catch (IOException e) {
            throw new StorageFailureException("Read failed: " + objectKey, e);
        }
    }

    @Override
    public Path resolve(String objectKey) {
        return safeResolve(objectKey);
    }

    @Override
    public boolean exists(String objectKey) {
        return Files.exists(safeResolve(objectKey));
    }

    @Override
    public void delete(String objectKey) {
        Path p = safeResolve(objectKey);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageFailureException("Delete failed: " + p, e);
        }
    }

    @Override
    public Path root() {
        return audioDir;
    }

    private Path safeResolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageFailureException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = audioDir.resolve(normalizedKey).normalize();
        if (!p.startsWith(audioDir)) {
            throw new StorageFailureException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private void deleteQuietly(Path p) {
        if (p == null) {
            return;
        }
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("Could not remove partial upload {}: {}", p, e.toString());
        }
    }
}
