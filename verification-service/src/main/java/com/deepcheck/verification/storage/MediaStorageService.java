package com.deepcheck.verification.storage;

import com.deepcheck.common.exception.DecodeException;
import com.deepcheck.common.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Stores uploaded artifacts on the local filesystem under {@code verification.storage.upload-dir}.
 * All file IO runs on {@code boundedElastic}.
 */
@Service
public class MediaStorageService {

    private static final Logger log = LoggerFactory.getLogger(MediaStorageService.class);

    private final Path uploadDir;
    private final long maxUploadBytes;

    public MediaStorageService(@Value("${verification.storage.upload-dir:./uploads}") String uploadDir,
                               @Value("${verification.storage.max-upload-bytes:104857600}") long maxUploadBytes) {
        this.uploadDir = Paths.get(uploadDir).toAbsolutePath().normalize();
        this.maxUploadBytes = maxUploadBytes;
    }

    public long maxUploadBytes() {
        return maxUploadBytes;
    }

    /**
     * Writes {@code bytes} under a collision-free name derived from {@code filename}.
     *
     * @return the absolute storage path; fails with {@link StorageException} when the write fails
     */
    public Mono<String> store(String filename, byte[] bytes) {
        return Mono.fromCallable(() -> {
                Files.createDirectories(uploadDir);
                Path target = uploadDir.resolve(UUID.randomUUID() + "_" + sanitize(filename));
                Files.write(target, bytes);
                log.info("Stored upload. filename={} bytes={} path={}", filename, bytes.length, target);
                return target.toString();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(IOException.class, e -> {
                log.error("Could not store upload. filename={} dir={}", filename, uploadDir, e);
                return new StorageException("could not store upload " + filename, e);
            });
    }

    /** Reads a stored artifact; a missing or unreadable file is a {@link DecodeException}. */
    public Mono<byte[]> read(String storagePath) {
        return Mono.fromCallable(() -> Files.readAllBytes(Paths.get(storagePath)))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(NoSuchFileException.class,
                        e -> new DecodeException("stored artifact missing: " + storagePath, e))
            .onErrorMap(e -> e instanceof IOException,
                        e -> new DecodeException("stored artifact unreadable: " + e.getMessage(), e));
    }

    public Path resolve(String storagePath) {
        return Paths.get(storagePath);
    }

    static String sanitize(String filename) {
        if (filename == null) return "upload";
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() ? "upload" : cleaned;
    }
}
