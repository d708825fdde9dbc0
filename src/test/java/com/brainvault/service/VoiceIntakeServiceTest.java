package com.brainvault.service;

import com.brainvault.dto.response.ExtractedIdeasResponse;
import com.brainvault.dto.response.TranscriptionResponse;
import com.brainvault.dto.response.TranscriptionResponse.Transcription;
import com.brainvault.entity.Idea;
import com.brainvault.exception.ProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VoiceIntakeService.
 *
 * Uses a real AudioValidator so size and signature checks run as in production; the
 * speech-to-text call, storage and idea store are mocked.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("VoiceIntakeService Unit Tests")
class VoiceIntakeServiceTest {

    private static final String OWNER = "auth0|speaker";

    @Mock
    private WhisperService whisperService;

    @Mock
    private AudioStorageService audioStorageService;

    @Mock
    private IdeaService ideaService;

    private VoiceIntakeService voiceIntakeService;

    @BeforeEach
    void setUp() {
        AudioValidator audioValidator = new AudioValidator();
        ReflectionTestUtils.setField(audioValidator, "maxSizeBytes", AudioValidatorTest.MAX_SIZE);

        voiceIntakeService = new VoiceIntakeService(audioValidator, whisperService, audioStorageService, ideaService);
    }

    private static MockMultipartFile wavUpload(String name, int size) {
        return new MockMultipartFile("audio_file", name, "audio/wav", AudioValidatorTest.wav(size));
    }

    private static Transcription transcription(String text) {
        return Transcription.builder().text(text).language("en").build();
    }

    @Test
    @DisplayName("Transcription returns text, language and storage reference")
    void testSuccessfulTranscription() {
        // Arrange
        MockMultipartFile upload = wavUpload("memo.wav", 2048);
        when(whisperService.transcribe(any(byte[].class), eq("memo.wav"))).thenReturn(transcription("Hello world"));
        when(audioStorageService.store(eq(OWNER), any(byte[].class), eq("wav"))).thenReturn("https://cdn.example/a.wav");

        // Act
        TranscriptionResponse response = voiceIntakeService.transcribe(OWNER, upload);

        // Assert
        assertTrue(response.isSuccess());
        assertEquals("Hello world", response.getTranscription().getText());
        assertEquals("en", response.getTranscription().getLanguage());
        assertNull(response.getTranscription().getConfidence());
        assertEquals("https://cdn.example/a.wav", response.getStorageUrl());
    }

    @Test
    @DisplayName("11 MB upload is rejected before speech-to-text is called")
    void testOversizedUploadRejected() {
        MockMultipartFile upload = wavUpload("long.wav", 11 * 1024 * 1024);

        ProcessingException exception = assertThrows(ProcessingException.class,
                () -> voiceIntakeService.transcribe(OWNER, upload));

        assertEquals(ProcessingException.AUDIO_TOO_LARGE, exception.getErrorCode());
        verifyNoInteractions(whisperService);
        verifyNoInteractions(audioStorageService);
    }

    @Test
    @DisplayName("Unrecognized audio is rejected before speech-to-text is called")
    void testInvalidAudioRejected() {
        MockMultipartFile upload = new MockMultipartFile("audio_file", "memo.wav", "audio/wav",
                "definitely not audio".getBytes());

        assertThrows(ProcessingException.class, () -> voiceIntakeService.transcribe(OWNER, upload));
        verifyNoInteractions(whisperService);
    }

    @Test
    @DisplayName("Missing storage does not fail the transcription")
    void testStorageUnavailable() {
        when(whisperService.transcribe(any(byte[].class), anyString())).thenReturn(transcription("Hello world"));
        when(audioStorageService.store(anyString(), any(byte[].class), anyString())).thenReturn(null);

        TranscriptionResponse response = voiceIntakeService.transcribe(OWNER, wavUpload("memo.wav", 128));

        assertTrue(response.isSuccess());
        assertNull(response.getStorageUrl());
    }

    @Test
    @DisplayName("Detected format extension is added to the name sent for transcription")
    void testExtensionAppended() {
        MockMultipartFile upload = new MockMultipartFile("audio_file", "recording", "application/octet-stream",
                new byte[]{'O', 'g', 'g', 'S', 0, 0});
        when(whisperService.transcribe(any(byte[].class), eq("recording.ogg"))).thenReturn(transcription("Hi there"));

        voiceIntakeService.transcribe(OWNER, upload);

        verify(whisperService).transcribe(any(byte[].class), eq("recording.ogg"));
        verify(audioStorageService).store(eq(OWNER), any(byte[].class), eq("ogg"));
    }

    @Test
    @DisplayName("Candidates are sentences longer than ten characters")
    void testCandidateExtraction() {
        List<String> ideas = voiceIntakeService.extractCandidateIdeas(
                "Build a recipe app for students. Ok. Maybe also a podcast about cooking! Cool?");

        assertEquals(List.of("Build a recipe app for students", "Maybe also a podcast about cooking"), ideas);
    }

    @Test
    @DisplayName("At most ten candidates are extracted")
    void testCandidateLimit() {
        String transcript = "This is candidate number one. ".repeat(15);

        assertEquals(10, voiceIntakeService.extractCandidateIdeas(transcript).size());
        assertTrue(voiceIntakeService.extractCandidateIdeas(null).isEmpty());
    }

    @Test
    @DisplayName("Extraction without save stores no ideas")
    void testExtractWithoutSave() {
        when(whisperService.transcribe(any(byte[].class), anyString()))
                .thenReturn(transcription("Build a recipe app for students. Ok."));

        ExtractedIdeasResponse response = voiceIntakeService.extractIdeas(OWNER, wavUpload("memo.wav", 256), false);

        assertEquals(List.of("Build a recipe app for students"), response.getIdeas());
        assertEquals("Build a recipe app for students. Ok.", response.getTranscription());
        assertTrue(response.getSavedIdeas().isEmpty());
        verifyNoInteractions(ideaService);
    }

    @Test
    @DisplayName("Extraction with save captures each candidate with voice source")
    void testExtractWithSave() {
        when(whisperService.transcribe(any(byte[].class), anyString()))
                .thenReturn(transcription("Build a recipe app for students. Start a cooking podcast."));
        when(ideaService.createIdea(eq(OWNER), anyString(), eq(VoiceIntakeService.VOICE_SOURCE)))
                .thenAnswer(invocation -> new Idea(OWNER, invocation.getArgument(1), VoiceIntakeService.VOICE_SOURCE));

        ExtractedIdeasResponse response = voiceIntakeService.extractIdeas(OWNER, wavUpload("memo.wav", 256), true);

        assertEquals(2, response.getSavedIdeas().size());
        assertEquals("voice", response.getSavedIdeas().get(0).getSource());
        verify(ideaService, times(2)).createIdea(eq(OWNER), anyString(), eq("voice"));
    }
}
