package com.brainvault.controller;

import com.brainvault.config.CorsConfig;
import com.brainvault.config.SecurityConfig;
import com.brainvault.dto.response.ExtractedIdeasResponse;
import com.brainvault.dto.response.TranscriptionResponse;
import com.brainvault.dto.response.TranscriptionResponse.Transcription;
import com.brainvault.exception.ProcessingException;
import com.brainvault.security.JwtTokenProvider;
import com.brainvault.security.RestAuthenticationEntryPoint;
import com.brainvault.service.VoiceIntakeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(VoiceController.class)
@Import({SecurityConfig.class, CorsConfig.class, JwtTokenProvider.class, RestAuthenticationEntryPoint.class})
@ActiveProfiles("test")
@DisplayName("VoiceController Web Tests")
class VoiceControllerTest {

    private static final String OWNER = "auth0|voice-user";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @MockitoBean
    private VoiceIntakeService voiceIntakeService;

    private String bearer;
    private MockMultipartFile audio;

    @BeforeEach
    void setUp() {
        bearer = "Bearer " + jwtTokenProvider.generateToken(OWNER, null);
        audio = new MockMultipartFile("audio_file", "memo.wav", "audio/wav", new byte[]{'R', 'I', 'F', 'F', 0, 0});
    }

    @Test
    @DisplayName("Transcription returns the transcript in snake case")
    void testTranscribe() throws Exception {
        when(voiceIntakeService.transcribe(eq(OWNER), any())).thenReturn(TranscriptionResponse.builder()
                .transcription(Transcription.builder().text("Call the bank").language("en").build())
                .storageUrl("https://cdn.example.com/a.wav")
                .success(true)
                .build());

        mockMvc.perform(multipart("/api/v1/voice/transcribe").file(audio).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transcription.text").value("Call the bank"))
                .andExpect(jsonPath("$.storage_url").value("https://cdn.example.com/a.wav"))
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    @DisplayName("Oversized audio is reported as 400 with the validation stage")
    void testTooLarge() throws Exception {
        when(voiceIntakeService.transcribe(eq(OWNER), any()))
                .thenThrow(ProcessingException.audioTooLarge("memo.wav", 11534336L, 10485760L));

        mockMvc.perform(multipart("/api/v1/voice/transcribe").file(audio).header("Authorization", bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.processingStage").value("validation"))
                .andExpect(jsonPath("$.errorCode").value("AUDIO_TOO_LARGE"));
    }

    @Test
    @DisplayName("Unconfigured speech-to-text is reported as 503")
    void testTranscriptionUnavailable() throws Exception {
        when(voiceIntakeService.transcribe(eq(OWNER), any())).thenThrow(ProcessingException.transcriptionUnavailable());

        mockMvc.perform(multipart("/api/v1/voice/transcribe").file(audio).header("Authorization", bearer))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("Provider failure is reported as 500 with the transcription stage")
    void testTranscriptionFailed() throws Exception {
        when(voiceIntakeService.transcribe(eq(OWNER), any()))
                .thenThrow(ProcessingException.transcriptionFailed("memo.wav", new RuntimeException("502")));

        mockMvc.perform(multipart("/api/v1/voice/transcribe").file(audio).header("Authorization", bearer))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.processingStage").value("transcription"));
    }

    @Test
    @DisplayName("Missing audio part is rejected with 400")
    void testMissingAudioPart() throws Exception {
        mockMvc.perform(multipart("/api/v1/voice/transcribe").header("Authorization", bearer))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(voiceIntakeService);
    }

    @Test
    @DisplayName("Extraction forwards the save flag")
    void testExtractIdeasWithSave() throws Exception {
        when(voiceIntakeService.extractIdeas(eq(OWNER), any(), eq(true))).thenReturn(ExtractedIdeasResponse.builder()
                .ideas(List.of("Build a recipe app for students"))
                .transcription("Build a recipe app for students.")
                .savedIdeas(List.of())
                .build());

        mockMvc.perform(multipart("/api/v1/voice/extract-ideas").file(audio)
                        .param("save", "true")
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ideas[0]").value("Build a recipe app for students"));

        verify(voiceIntakeService).extractIdeas(eq(OWNER), any(), eq(true));
    }
}
