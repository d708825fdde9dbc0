package com.brainvault.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Durable storage for raw voice uploads.
 *
 * Files are written under app.audio.storage.path with the key
 * {@code {userId}/{uuid}.{ext}}. The returned reference is the key appended to
 * app.audio.storage.public-base-url when one is configured (e.g. a CDN or bucket front),
 * otherwise the file: URI of the stored file.
 *
 * Storage is best effort: a failed write is logged and yields a null reference, and the
 * surrounding voice operation carries on.
 */
@Service
@Slf4j
public class AudioStorageService {

    @Value("${app.audio.storage.enabled:true}")
    private boolean enabled;

    @Value("${app.audio.storage.path:./storage/audio}")
    private String audioStoragePath;

    @Value("${app.audio.storage.public-base-url:}")
    private String publicBaseUrl;

    /**
     * Store an audio payload.
     *
     * @param userId owner of the upload
     * @param audio raw bytes
     * @param extension file extension without the dot
     * @return durable reference, or null when storage is disabled or failed
     */
    public String store(String userId, byte[] audio, String extension) {
        if (!enabled) {
            log.debug("Audio storage disabled, skipping upload for user {}", userId);
            return null;
        }

        String key = sanitize(userId) + "/" + UUID.randomUUID() + "." + extension;
        try {
            Path target = Paths.get(audioStoragePath).resolve(key).normalize();
            Files.createDirectories(target.getParent());
            Files.write(target, audio);

            log.info("Audio stored: key={}, size={} bytes", key, audio.length);
            return referenceFor(key, target);

        } catch (IOException | RuntimeException e) {
            log.warn("Audio storage failed, continuing without storage reference: key={}, error={}",
                    key, e.getMessage());
            return null;
        }
    }

    private String referenceFor(String key, Path target) {
        if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
            String base = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
            return base + key;
        }
        return target.toAbsolutePath().toUri().toString();
    }

    // External ids may contain characters that are not safe in a path segment (e.g. "auth0|123")
    private static String sanitize(String userId) {
        return userId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
