package com.purchasingpower.memory.api;

import com.purchasingpower.memory.exception.ErrorCode;
import com.purchasingpower.memory.exception.MemoryServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps service exceptions to {@link ApiErrorResponse} bodies. Anything unrecognised is a
 * 500 with a generic message; the details only go to the log.
 */
@Slf4j
@RestControllerAdvice(basePackages = "com.purchasingpower.memory.api")
public class GlobalExceptionHandler {

    @ExceptionHandler(MemoryServiceException.class)
    public ResponseEntity<ApiErrorResponse> handleMemoryService(MemoryServiceException ex) {
        HttpStatus status = ex.getCode().getStatus();
        if (status.is5xxServerError()) {
            log.error("[API] {} {}: {}", status.value(), ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[API] {} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        }
        return build(status, ex.getCode(), ex.getMessage(), ex.isRetryable());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("[API] Invalid request: {}", message);
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION, message, false);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        String message = ex.getMostSpecificCause().getMessage();
        log.warn("[API] Unreadable request body: {}", message);
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION, "Malformed request body: " + message, false);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION, ex.getMessage(), false);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION, ex.getMessage(), false);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL, "Internal server error", false);
    }

    private static ResponseEntity<ApiErrorResponse> build(HttpStatus status, ErrorCode code, String message,
                                                          boolean retryable) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code.name())
                .message(message)
                .retryable(retryable)
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
