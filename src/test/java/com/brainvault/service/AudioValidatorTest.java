package com.brainvault.service;

import com.brainvault.exception.ProcessingException;
import com.brainvault.service.AudioValidator.AudioFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AudioValidator Unit Tests")
class AudioValidatorTest {

    static final long MAX_SIZE = 10L * 1024 * 1024;

    private AudioValidator audioValidator;

    @BeforeEach
    void setUp() {
        audioValidator = new AudioValidator();
        ReflectionTestUtils.setField(audioValidator, "maxSizeBytes", MAX_SIZE);
    }

    static byte[] wav(int size) {
        byte[] data = new byte[size];
        System.arraycopy("RIFF".getBytes(StandardCharsets.US_ASCII), 0, data, 0, 4);
        return data;
    }

    @Test
    @DisplayName("Upload of 11 MB is rejected as too large")
    void testOversizedUpload() {
        ProcessingException exception = assertThrows(ProcessingException.class,
                () -> audioValidator.validateUpload("memo.wav", "audio/wav", 11L * 1024 * 1024));

        assertEquals(ProcessingException.AUDIO_TOO_LARGE, exception.getErrorCode());
        assertTrue(exception.isValidationFailure());
    }

    @Test
    @DisplayName("Upload at exactly the maximum size is accepted")
    void testUploadAtLimit() {
        assertDoesNotThrow(() -> audioValidator.validateUpload("memo.wav", "audio/wav", MAX_SIZE));
    }

    @Test
    @DisplayName("Non-audio content type and empty upload are rejected")
    void testInvalidUploads() {
        ProcessingException wrongType = assertThrows(ProcessingException.class,
                () -> audioValidator.validateUpload("notes.pdf", "application/pdf", 1024));
        ProcessingException empty = assertThrows(ProcessingException.class,
                () -> audioValidator.validateUpload("memo.wav", "audio/wav", 0));

        assertEquals(ProcessingException.INVALID_AUDIO, wrongType.getErrorCode());
        assertEquals(ProcessingException.INVALID_AUDIO, empty.getErrorCode());
    }

    @Test
    @DisplayName("Generic binary content type is allowed through to signature checks")
    void testOctetStreamAccepted() {
        assertDoesNotThrow(() -> audioValidator.validateUpload("memo", "application/octet-stream", 1024));
    }

    @Test
    @DisplayName("Known container signatures are detected")
    void testSignatures() {
        assertEquals(AudioFormat.WAV, audioValidator.validateContent("a.wav", wav(64)));
        assertEquals(AudioFormat.MP3, audioValidator.validateContent("a.mp3", new byte[]{'I', 'D', '3', 4, 0}));
        assertEquals(AudioFormat.MP3, audioValidator.validateContent("a.mp3", new byte[]{(byte) 0xFF, (byte) 0xFB, 0x10}));
        assertEquals(AudioFormat.OGG, audioValidator.validateContent("a.ogg", new byte[]{'O', 'g', 'g', 'S', 0}));
    }

    @Test
    @DisplayName("Text renamed to .wav is rejected")
    void testUnknownSignature() {
        byte[] text = "just some text".getBytes(StandardCharsets.UTF_8);

        ProcessingException exception = assertThrows(ProcessingException.class,
                () -> audioValidator.validateContent("fake.wav", text));

        assertEquals(ProcessingException.INVALID_AUDIO, exception.getErrorCode());
        assertTrue(exception.getMessage().contains("fake.wav"));
    }

    @Test
    @DisplayName("Truncated header shorter than the signature is rejected")
    void testTruncatedHeader() {
        assertThrows(ProcessingException.class, () -> audioValidator.validateContent("a.wav", new byte[]{'R', 'I'}));
    }
}
