package com.trustledger.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maps rejected ledger operations and malformed requests to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex, WebRequest request) {
        log.warn("Ledger operation rejected - Error ID: {} - code={} category={} - {}",
                ex.getErrorId(), ex.getErrorCode().getCode(), ex.getCategory(), ex.getMessage());

        ErrorResponse body = ErrorResponse.builder()
                .timestamp(ex.getTimestamp())
                .status(ex.getStatus().value())
                .error(ex.getStatus().getReasonPhrase())
                .errorCode(ex.getErrorCode().getCode())
                .category(ex.getCategory())
                .correctable(ex.getCategory().isCorrectable())
                .message(ex.getMessage())
                .path(request.getDescription(false).replace("uri=", ""))
                .errorId(ex.getErrorId())
                .details(ex.getMetadata().isEmpty() ? null : ex.getMetadata())
                .build();
        return new ResponseEntity<>(body, ex.getStatus());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex, WebRequest request) {
        Map<String, Object> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        log.warn("Request validation failed: {}", fieldErrors);
        return badRequest("Request validation failed", fieldErrors, request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex, WebRequest request) {
        log.warn("Missing request header: {}", ex.getHeaderName());
        return badRequest(ex.getMessage(), Map.of("header", ex.getHeaderName()), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        log.warn("Argument type mismatch: name={} value={}", ex.getName(), ex.getValue());
        return badRequest("Invalid value for " + ex.getName(), null, request);
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, Map<String, Object> details, WebRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
                .category(FailureCategory.INVALID_INPUT)
                .correctable(true)
                .message(message)
                .path(request.getDescription(false).replace("uri=", ""))
                .errorId(UUID.randomUUID().toString())
                .details(details)
                .build();
        return ResponseEntity.badRequest().body(body);
    }
}
