package com.brainvault.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of POST /api/v1/voice/transcribe.
 *
 * storage_url is null when audio storage is disabled or the upload failed; the
 * transcription itself is unaffected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptionResponse {

    private Transcription transcription;

    private String storageUrl;

    private boolean success;

    /**
     * Speech-to-text output.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Transcription {

        private String text;

        private String language;

        /**
         * Average segment confidence when the speech-to-text provider reports one, else null.
         */
        private Double confidence;
    }
}
