package com.brainvault.controller;

import com.brainvault.dto.response.ExtractedIdeasResponse;
import com.brainvault.dto.response.TranscriptionResponse;
import com.brainvault.exception.ProcessingException;
import com.brainvault.service.VoiceIntakeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Voice intake endpoints.
 *
 * Both endpoints take a multipart upload with the part name "audio_file".
 * - POST /api/v1/voice/transcribe: transcript and storage reference
 * - POST /api/v1/voice/extract-ideas?save=false: transcript split into candidate ideas,
 *   captured as ideas with source "voice" when save=true
 *
 * Rejected audio answers 400, transcription failures 500 (503 when speech-to-text is not
 * configured).
 */
@RestController
@RequestMapping("/api/v1/voice")
@RequiredArgsConstructor
@Slf4j
public class VoiceController {

    static final String AUDIO_PART = "audio_file";

    private final VoiceIntakeService voiceIntakeService;

    @PostMapping(value = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TranscriptionResponse> transcribe(
            @RequestPart(AUDIO_PART) MultipartFile audioFile,
            Authentication authentication) {

        log.info("Transcription request received from user: {}, fileName: {}",
                authentication.getName(), audioFile.getOriginalFilename());

        try {
            return ResponseEntity.ok(voiceIntakeService.transcribe(authentication.getName(), audioFile));

        } catch (ProcessingException e) {
            log.warn("Transcription request failed: stage={}, error={}", e.getProcessingStage(), e.getErrorCode());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @PostMapping(value = "/extract-ideas", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ExtractedIdeasResponse> extractIdeas(
            @RequestPart(AUDIO_PART) MultipartFile audioFile,
            @RequestParam(defaultValue = "false") boolean save,
            Authentication authentication) {

        log.info("Idea extraction request received from user: {}, fileName: {}, save={}",
                authentication.getName(), audioFile.getOriginalFilename(), save);

        try {
            return ResponseEntity.ok(voiceIntakeService.extractIdeas(authentication.getName(), audioFile, save));

        } catch (ProcessingException e) {
            log.warn("Idea extraction request failed: stage={}, error={}", e.getProcessingStage(), e.getErrorCode());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }
}
