package com.brainvault.exception;

/**
 * Exception thrown when voice intake fails.
 *
 * Unlike enrichment and transformation, which fall back silently, voice intake surfaces
 * its failures because the transcript is what the caller asked for. Each failure carries
 * the stage it happened in and a machine-readable error code.
 *
 * Stages:
 * - validation: the payload was rejected before any external call (HTTP 400)
 * - transcription: the speech-to-text call failed or is not configured (HTTP 500/503)
 *
 * The messages produced by the factory methods are safe to return to callers.
 *
 * @see com.brainvault.exception.GlobalExceptionHandler
 */
public class ProcessingException extends RuntimeException {

    public static final String STAGE_VALIDATION = "validation";
    public static final String STAGE_TRANSCRIPTION = "transcription";

    public static final String INVALID_AUDIO = "INVALID_AUDIO";
    public static final String AUDIO_TOO_LARGE = "AUDIO_TOO_LARGE";
    public static final String TRANSCRIPTION_FAILED = "TRANSCRIPTION_FAILED";
    public static final String TRANSCRIPTION_UNAVAILABLE = "TRANSCRIPTION_UNAVAILABLE";
    public static final String EMPTY_TRANSCRIPTION = "EMPTY_TRANSCRIPTION";

    private final String processingStage;
    private final String errorCode;

    public ProcessingException(String processingStage, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.processingStage = processingStage;
        this.errorCode = errorCode;
    }

    public String getProcessingStage() {
        return processingStage;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isValidationFailure() {
        return STAGE_VALIDATION.equals(processingStage);
    }

    /**
     * The payload does not look like a supported audio container, or was not sent as audio.
     *
     * @param fileName the uploaded file name
     * @param reason why the file was rejected
     * @return a validation-stage ProcessingException
     */
    public static ProcessingException invalidAudio(String fileName, String reason) {
        return new ProcessingException(
                STAGE_VALIDATION,
                INVALID_AUDIO,
                String.format("Invalid audio file '%s': %s", fileName, reason),
                null
        );
    }

    public static ProcessingException audioTooLarge(String fileName, long sizeBytes, long maxBytes) {
        return new ProcessingException(
                STAGE_VALIDATION,
                AUDIO_TOO_LARGE,
                String.format("Audio file '%s' is too large: %d bytes. Maximum allowed is %d bytes.",
                        fileName, sizeBytes, maxBytes),
                null
        );
    }

    public static ProcessingException transcriptionFailed(String fileName, Throwable cause) {
        return new ProcessingException(
                STAGE_TRANSCRIPTION,
                TRANSCRIPTION_FAILED,
                String.format("Failed to transcribe audio file '%s'. The speech-to-text service may be unavailable or the audio is corrupted.", fileName),
                cause
        );
    }

    public static ProcessingException transcriptionUnavailable() {
        return new ProcessingException(
                STAGE_TRANSCRIPTION,
                TRANSCRIPTION_UNAVAILABLE,
                "Speech-to-text is not configured on this server.",
                null
        );
    }

    public static ProcessingException emptyTranscription(String fileName) {
        return new ProcessingException(
                STAGE_TRANSCRIPTION,
                EMPTY_TRANSCRIPTION,
                String.format("Transcription resulted in empty text for audio file '%s'. The audio may be silent or contain no speech.", fileName),
                null
        );
    }
}
