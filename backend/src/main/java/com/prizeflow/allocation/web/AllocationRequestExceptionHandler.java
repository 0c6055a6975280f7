package com.prizeflow.allocation.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders every allocation API failure as one {@link AllocationErrorResponse} envelope.
 */
@RestControllerAdvice
public class AllocationRequestExceptionHandler {

    static final String CODE_VALIDATION_FAILED = "validation_failed";
    static final String CODE_MALFORMED_REQUEST = "malformed_request";

    @ExceptionHandler(AllocationRequestException.class)
    public ResponseEntity<AllocationErrorResponse> handle(AllocationRequestException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(AllocationErrorResponse.of(ex.getCode(), ex.getMessage(), ex.isRetryable()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AllocationErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError ->
                fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage())
        );

        String message = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(new AllocationErrorResponse(CODE_VALIDATION_FAILED, message, false, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<AllocationErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(AllocationErrorResponse.of(CODE_MALFORMED_REQUEST, "Request body is missing or malformed", false));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<AllocationErrorResponse> handleStatus(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        String code = status != null ? status.name().toLowerCase(Locale.ROOT) : "http_" + statusCode.value();
        String message = ex.getReason() != null ? ex.getReason() : code;
        return ResponseEntity.status(statusCode).body(AllocationErrorResponse.of(code, message, false));
    }

    public record AllocationErrorResponse(
            String code,
            String message,
            boolean retryable,
            Map<String, String> fieldErrors
    ) {

        static AllocationErrorResponse of(String code, String message, boolean retryable) {
            return new AllocationErrorResponse(code, message, retryable, Map.of());
        }
    }
}
