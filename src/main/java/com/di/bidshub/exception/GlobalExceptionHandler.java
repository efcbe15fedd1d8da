package com.di.bidshub.exception;

import com.di.bidshub.upload.validation.ValidationReport;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps pipeline exceptions to HTTP responses with a uniform {@link ErrorResponse} body.
 *
 * <table border="1">
 * <tr><th>Exception</th><th>Status</th></tr>
 * <tr><td>{@link ScanException}, {@link IllegalArgumentException}, bean validation</td><td>400</td></tr>
 * <tr><td>{@link ValidationBlockedException}</td><td>422, body carries the report</td></tr>
 * <tr><td>{@link ManifestCorruptionException}, {@link IllegalStateException}</td><td>409</td></tr>
 * <tr><td>anything else</td><td>500</td></tr>
 * </table>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ScanException.class)
    public ResponseEntity<ErrorResponse> handleScan(ScanException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ValidationBlockedException.class)
    public ResponseEntity<ErrorResponse> handleBlocked(ValidationBlockedException e) {
        ErrorResponse body = build(HttpStatus.UNPROCESSABLE_ENTITY, e);
        body.setReport(e.getReport());
        log.warn("[API] validation blocked: {}", e.getReport().summary());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    /** Needs operator intervention: inspect or remove the manifest file, then re-run. */
    @ExceptionHandler(ManifestCorruptionException.class)
    public ResponseEntity<ErrorResponse> handleManifest(ManifestCorruptionException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, e);
        body.setError(e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining("; ")));
        log.warn("[API] invalid request: {}", body.getError());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    /* ------------------------------------------------------------------ */

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e) {
        ErrorResponse body = build(status, e);
        if (status.is5xxServerError()) {
            log.error("[API] {} [{}]: {}", e.getClass().getSimpleName(), body.getCategory(), e.getMessage(), e);
        } else {
            log.warn("[API] {} [{}]: {}", e.getClass().getSimpleName(), body.getCategory(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body);
    }

    private static ErrorResponse build(HttpStatus status, Throwable e) {
        FailureCategory category = FailureCategory.categorize(e);
        ErrorResponse body = new ErrorResponse();
        body.setOk(false);
        body.setStatus(status.value());
        body.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        body.setCategory(category.name());
        body.setTimestamp(Instant.now().toString());
        String runId = MDC.get("runId");
        if (runId != null) {
            body.getDetails().put("runId", runId);
        }
        body.getDetails().put("exceptionType", e.getClass().getName());
        return body;
    }

    /** Structured error body for API endpoints. */
    @Data
    public static class ErrorResponse {
        private boolean             ok;
        private int                 status;
        private String              error;
        private String              category;
        private String              timestamp;
        private ValidationReport    report;
        private Map<String, Object> details = new LinkedHashMap<>();
    }
}
