package com.brainvault.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps exceptions leaving the controllers to RFC 7807 problem documents.
 *
 * <pre>
 * {
 *   "type": "https://api.brainvault.app/errors/validation-failed",
 *   "title": "Validation Failed",
 *   "status": 400,
 *   "detail": "One or more fields are invalid. See 'errors'.",
 *   "instance": "/api/v1/ideas",
 *   "timestamp": "2024-02-26T10:30:00",
 *   "errors": { "content": "Content must be between 1 and 10000 characters" }
 * }
 * </pre>
 *
 * Voice intake failures add {@code processingStage} and {@code errorCode}; unexpected
 * failures add an {@code errorId} that matches the server log line. Infrastructure
 * messages never reach the body. The 401 document is written by
 * {@link com.brainvault.security.RestAuthenticationEntryPoint} with {@link #problemDetail}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static final String BASE_ERROR_URI = "https://api.brainvault.app/errors";

    private static final String INVALID_FIELDS = "One or more fields are invalid. See 'errors'.";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, "resource-not-found"));
    }

    /**
     * 400 for rejected audio, 503 when speech-to-text is not configured, 500 for any other
     * transcription failure.
     */
    @ExceptionHandler(ProcessingException.class)
    public ResponseEntity<ProblemDetail> handleProcessing(ProcessingException ex, HttpServletRequest request) {
        ProblemDetail problem;
        if (ex.isValidationFailure()) {
            log.warn("Audio rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
            problem = problem(HttpStatus.BAD_REQUEST, "Invalid Audio", ex.getMessage(), request, "invalid-audio");
        } else {
            HttpStatus status = ProcessingException.TRANSCRIPTION_UNAVAILABLE.equals(ex.getErrorCode())
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Voice intake failed at {} [{}]: {}", ex.getProcessingStage(), ex.getErrorCode(), ex.getMessage(), ex);
            problem = problem(status, "Processing Failed", ex.getMessage(), request, "processing-failed");
        }
        if (ex.getProcessingStage() != null) {
            problem.setProperty("processingStage", ex.getProcessingStage());
        }
        if (ex.getErrorCode() != null) {
            problem.setProperty("errorCode", ex.getErrorCode());
        }
        return respond(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> errors.putIfAbsent(error.getField(), error.getDefaultMessage()));
        log.warn("Invalid request body on {}: {}", request.getRequestURI(), errors.keySet());
        return respond(invalidFields(errors, request));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            errors.putIfAbsent(path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
        });
        log.warn("Constraint violation on {}: {}", request.getRequestURI(), errors.keySet());
        return respond(invalidFields(errors, request));
    }

    // Unparseable JSON is 422 so clients can tell it apart from a well-formed but invalid body.
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(problem(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed Request Body",
                "The request body is not valid JSON for this endpoint.", request, "malformed-request-body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("Bad value for '{}' on {}", ex.getName(), request.getRequestURI());
        return respond(singleField(ex.getName(), "Invalid value", "Invalid Parameter",
                String.format("Invalid value for parameter '%s'.", ex.getName()), request, "invalid-parameter"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException ex, HttpServletRequest request) {
        return respond(singleField(ex.getParameterName(), "Required", "Missing Parameter",
                String.format("Required parameter '%s' is missing.", ex.getParameterName()), request, "missing-parameter"));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ProblemDetail> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        return respond(singleField(ex.getRequestPartName(), "Required", "Missing File",
                String.format("Required file part '%s' is missing.", ex.getRequestPartName()), request, "missing-file"));
    }

    /**
     * Uploads over the multipart limit never reach voice intake, so they are reported here
     * in the same shape as a validation-stage rejection.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ProblemDetail> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        log.warn("Upload over multipart limit on {}", request.getRequestURI());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Audio",
                "Invalid audio format or file too large.", request, "invalid-audio");
        problem.setProperty("processingStage", ProcessingException.STAGE_VALIDATION);
        problem.setProperty("errorCode", ProcessingException.AUDIO_TOO_LARGE);
        return respond(problem);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ProblemDetail> handleUnknownEndpoint(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(problem(HttpStatus.NOT_FOUND, "Endpoint Not Found",
                String.format("No endpoint %s %s.", ex.getHttpMethod(), request.getRequestURI()), request, "endpoint-not-found"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Rejected argument on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(problem(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request, "invalid-argument"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        String errorId = "ERR-" + UUID.randomUUID().toString().substring(0, 8);
        log.error("Unhandled error {} on {} {}", errorId, request.getMethod(), request.getRequestURI(), ex);
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "Something went wrong on our side. Quote the error id if you contact support.", request, "internal-error");
        problem.setProperty("errorId", errorId);
        return respond(problem);
    }

    /**
     * Build a problem document in the shape shared by this handler and the security layer.
     *
     * @param status HTTP status
     * @param title short summary of the problem type
     * @param detail explanation specific to this occurrence
     * @param path request path used as the instance URI; may be null
     * @param errorType last segment of the type URI
     * @return the problem document
     */
    public static ProblemDetail problemDetail(HttpStatus status, String title, String detail, String path, String errorType) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(BASE_ERROR_URI + "/" + errorType));
        problem.setTitle(title);
        if (path != null && !path.isEmpty()) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", LocalDateTime.now().format(DateTimeFormatter.ISO_DATE_TIME));
        return problem;
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail,
                                         HttpServletRequest request, String errorType) {
        return problemDetail(status, title, detail, request.getRequestURI(), errorType);
    }

    private static ProblemDetail invalidFields(Map<String, String> errors, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Failed", INVALID_FIELDS, request, "validation-failed");
        problem.setProperty("errors", errors);
        return problem;
    }

    private static ProblemDetail singleField(String field, String message, String title, String detail,
                                             HttpServletRequest request, String errorType) {
        log.warn("{} on {}: {}", title, request.getRequestURI(), field);
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, title, detail, request, errorType);
        problem.setProperty("errors", Map.of(field, message));
        return problem;
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }
}
