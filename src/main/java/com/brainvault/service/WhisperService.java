package com.brainvault.service;

import com.brainvault.dto.response.TranscriptionResponse.Transcription;
import com.brainvault.exception.ProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.audio.transcription.AudioTranscriptionPrompt;
import org.springframework.ai.audio.transcription.AudioTranscriptionResponse;
import org.springframework.ai.openai.OpenAiAudioTranscriptionModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

/**
 * Speech-to-text through the OpenAI Whisper API.
 *
 * Language and prompt hints are part of the transcription model's default options
 * (app.ai.transcription.*), so this service only wraps the call and its failures.
 *
 * Error Handling:
 * - No API key configured: ProcessingException TRANSCRIPTION_UNAVAILABLE (503)
 * - Empty transcript: ProcessingException EMPTY_TRANSCRIPTION (500)
 * - API errors and timeouts: ProcessingException TRANSCRIPTION_FAILED (500)
 *
 * Unlike enrichment and transformation, nothing here falls back silently: the transcript
 * is what the caller asked for.
 *
 * Confidence is reported as null. The Whisper transcription endpoint used here returns
 * plain text without per-segment scores.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WhisperService {

    private final ObjectProvider<OpenAiAudioTranscriptionModel> transcriptionModelProvider;

    @Value("${app.ai.transcription.language:en}")
    private String language;

    /**
     * Transcribe an audio payload.
     *
     * @param audio validated audio bytes
     * @param fileName file name sent to the API (its extension tells Whisper the format)
     * @return transcript text, language hint and confidence
     * @throws ProcessingException on any transcription failure
     */
    public Transcription transcribe(byte[] audio, String fileName) {
        if (audio == null || audio.length == 0) {
            log.error("Attempted to transcribe empty audio");
            throw new IllegalArgumentException("Audio data cannot be null or empty");
        }

        OpenAiAudioTranscriptionModel transcriptionModel = transcriptionModelProvider.getIfAvailable();
        if (transcriptionModel == null) {
            log.error("Transcription requested but no speech-to-text model is configured");
            throw ProcessingException.transcriptionUnavailable();
        }

        log.info("Starting audio transcription using Whisper: file={}, size={} bytes", fileName, audio.length);

        String text;
        try {
            AudioTranscriptionResponse response = transcriptionModel.call(
                    new AudioTranscriptionPrompt(namedResource(audio, fileName)));
            text = response != null && response.getResult() != null ? response.getResult().getOutput() : null;
        } catch (Exception e) {
            log.error("Failed to transcribe audio file {}: {}", fileName, e.getMessage(), e);
            throw ProcessingException.transcriptionFailed(fileName, e);
        }

        if (text == null || text.trim().isEmpty()) {
            log.warn("Whisper returned empty transcription for audio file {}", fileName);
            throw ProcessingException.emptyTranscription(fileName);
        }

        log.info("Audio transcription completed: file={}", fileName);
        log.debug("Transcription length: {} characters", text.length());

        return Transcription.builder()
                .text(text.trim())
                .language(language)
                .confidence(null)
                .build();
    }

    private Resource namedResource(byte[] audio, String fileName) {
        return new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return fileName;
            }
        };
    }
}
