package com.brainvault.service;

import com.brainvault.exception.ProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Validates uploaded audio before any transcription call is made.
 *
 * Checks, in order:
 * 1. Declared size against the configured ceiling (10 MB by default)
 * 2. Declared content type, when one is sent, must be audio/* or application/octet-stream
 * 3. Leading bytes must carry a WAV, MP3 or OGG container signature
 */
@Component
@Slf4j
public class AudioValidator {

    /**
     * Recognized audio containers and their storage extensions.
     */
    public enum AudioFormat {
        WAV("wav"), MP3("mp3"), OGG("ogg");

        private final String extension;

        AudioFormat(String extension) {
            this.extension = extension;
        }

        public String getExtension() {
            return extension;
        }
    }

    @Value("${app.voice.max-size-bytes:10485760}")
    private long maxSizeBytes;

    /**
     * @param fileName uploaded file name, for messages
     * @param contentType declared content type, may be null
     * @param sizeBytes declared payload size
     * @throws ProcessingException if the payload is too large or not declared as audio
     */
    public void validateUpload(String fileName, String contentType, long sizeBytes) {
        if (sizeBytes > maxSizeBytes) {
            log.warn("Audio rejected: file={}, size={} bytes, max={} bytes", fileName, sizeBytes, maxSizeBytes);
            throw ProcessingException.audioTooLarge(fileName, sizeBytes, maxSizeBytes);
        }
        if (sizeBytes <= 0) {
            throw ProcessingException.invalidAudio(fileName, "file is empty");
        }
        if (contentType != null && !contentType.startsWith("audio/")
                && !contentType.startsWith("application/octet-stream")) {
            log.warn("Audio rejected: file={}, contentType={}", fileName, contentType);
            throw ProcessingException.invalidAudio(fileName, "content type must be audio/*, got " + contentType);
        }
    }

    /**
     * Check the payload bytes and detect the container format.
     *
     * @return the detected format
     * @throws ProcessingException if the payload is too large or has no known signature
     */
    public AudioFormat validateContent(String fileName, byte[] data) {
        if (data == null || data.length == 0) {
            throw ProcessingException.invalidAudio(fileName, "file is empty");
        }
        if (data.length > maxSizeBytes) {
            log.warn("Audio rejected: file={}, size={} bytes, max={} bytes", fileName, data.length, maxSizeBytes);
            throw ProcessingException.audioTooLarge(fileName, data.length, maxSizeBytes);
        }

        AudioFormat format = detectFormat(data);
        if (format == null) {
            log.warn("Audio rejected: file={}, unrecognized signature", fileName);
            throw ProcessingException.invalidAudio(fileName, "unsupported format, expected WAV, MP3 or OGG");
        }
        log.debug("Audio accepted: file={}, format={}, size={} bytes", fileName, format, data.length);
        return format;
    }

    static AudioFormat detectFormat(byte[] a) {
        if (startsWith(a, 'R', 'I', 'F', 'F')) {
            return AudioFormat.WAV;
        }
        if (startsWith(a, 'I', 'D', '3')) {
            return AudioFormat.MP3;
        }
        if (a.length >= 2 && (a[0] & 0xFF) == 0xFF && (a[1] & 0xFF) == 0xFB) {
            return AudioFormat.MP3;
        }
        if (startsWith(a, 'O', 'g', 'g', 'S')) {
            return AudioFormat.OGG;
        }
        return null;
    }

    private static boolean startsWith(byte[] a, char... signature) {
        if (a.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (a[i] != (byte) signature[i]) {
                return false;
            }
        }
        return true;
    }

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }
}
