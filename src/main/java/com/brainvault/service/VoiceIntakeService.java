package com.brainvault.service;

import com.brainvault.dto.response.ExtractedIdeasResponse;
import com.brainvault.dto.response.IdeaResponse;
import com.brainvault.dto.response.TranscriptionResponse;
import com.brainvault.dto.response.TranscriptionResponse.Transcription;
import com.brainvault.service.AudioValidator.AudioFormat;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Voice capture: audio in, transcript and candidate ideas out.
 *
 * Intake Flow:
 * 1. Validate size and content type from the upload metadata
 * 2. Read the bytes and check the container signature (WAV, MP3, OGG)
 * 3. Transcribe with Whisper; any failure fails the request
 * 4. Store the raw audio; a storage failure only drops the storage reference
 * 5. For extract-ideas: split the transcript into at most 10 candidate ideas and, when
 *    asked to, capture each one through IdeaService with source "voice"
 *
 * @see AudioValidator
 * @see WhisperService
 * @see AudioStorageService
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VoiceIntakeService {

    public static final String VOICE_SOURCE = "voice";
    static final int MAX_CANDIDATES = 10;
    static final int MIN_CANDIDATE_LENGTH = 10;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+");

    private final AudioValidator audioValidator;
    private final WhisperService whisperService;
    private final AudioStorageService audioStorageService;
    private final IdeaService ideaService;

    public TranscriptionResponse transcribe(String owner, MultipartFile audioFile) {
        Intake intake = accept(owner, audioFile);

        return TranscriptionResponse.builder()
                .transcription(intake.getTranscription())
                .storageUrl(intake.getStorageUrl())
                .success(true)
                .build();
    }

    public ExtractedIdeasResponse extractIdeas(String owner, MultipartFile audioFile, boolean save) {
        Intake intake = accept(owner, audioFile);
        String transcript = intake.getTranscription().getText();
        List<String> candidates = extractCandidateIdeas(transcript);

        List<IdeaResponse> saved = new ArrayList<>();
        if (save) {
            for (String candidate : candidates) {
                saved.add(IdeaResponse.from(ideaService.createIdea(owner, candidate, VOICE_SOURCE)));
            }
            log.info("Captured voice ideas: user={}, count={}", owner, saved.size());
        }

        return ExtractedIdeasResponse.builder()
                .ideas(candidates)
                .transcription(transcript)
                .storageUrl(intake.getStorageUrl())
                .savedIdeas(saved)
                .build();
    }

    /**
     * Split a transcript on terminal punctuation and keep fragments longer than
     * 10 characters after trimming, at most 10, in document order.
     */
    public List<String> extractCandidateIdeas(String transcript) {
        List<String> ideas = new ArrayList<>();
        if (transcript == null) {
            return ideas;
        }
        for (String sentence : SENTENCE_BOUNDARY.split(transcript)) {
            String trimmed = sentence.trim();
            if (trimmed.length() > MIN_CANDIDATE_LENGTH) {
                ideas.add(trimmed);
                if (ideas.size() == MAX_CANDIDATES) {
                    break;
                }
            }
        }
        return ideas;
    }

    private Intake accept(String owner, MultipartFile audioFile) {
        String fileName = audioFile.getOriginalFilename() != null ? audioFile.getOriginalFilename() : "audio";
        log.info("Voice intake: user={}, file={}, size={} bytes", owner, fileName, audioFile.getSize());

        audioValidator.validateUpload(fileName, audioFile.getContentType(), audioFile.getSize());

        byte[] audio;
        try {
            audio = audioFile.getBytes();
        } catch (IOException e) {
            log.error("Failed to read uploaded audio: file={}, error={}", fileName, e.getMessage(), e);
            throw new RuntimeException("Failed to read uploaded audio: " + e.getMessage(), e);
        }

        AudioFormat format = audioValidator.validateContent(fileName, audio);
        Transcription transcription = whisperService.transcribe(audio, withExtension(fileName, format));
        String storageUrl = audioStorageService.store(owner, audio, format.getExtension());

        return new Intake(transcription, storageUrl);
    }

    private static String withExtension(String fileName, AudioFormat format) {
        String suffix = "." + format.getExtension();
        return fileName.toLowerCase().endsWith(suffix) ? fileName : fileName + suffix;
    }

    @Value
    private static class Intake {
        Transcription transcription;
        String storageUrl;
    }
}
