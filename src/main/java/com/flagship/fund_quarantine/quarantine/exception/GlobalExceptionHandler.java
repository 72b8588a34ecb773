package com.flagship.fund_quarantine.quarantine.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * Expected failures are logged at WARN, anything else at ERROR.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e) {
        log.warn("Resource not found: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler({
        QuarantineNotActiveException.class,
        InsufficientCapacityException.class,
        DrawDownExceedsQuarantineException.class
    })
    public ResponseEntity<ErrorResponse> handleUnprocessable(QuarantineException e) {
        log.warn("Request rejected: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Entity", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(DuplicateQuarantineException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateQuarantineException e) {
        log.warn("Duplicate quarantine: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header", VALIDATION_ERROR,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", VALIDATION_ERROR,
                "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter: name={}, value={}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", VALIDATION_ERROR,
                "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", VALIDATION_ERROR,
                "Request body is missing or malformed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", VALIDATION_ERROR, e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code,
                                                         String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .code(code)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
