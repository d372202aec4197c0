package com.trustledger.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for every rejected ledger operation.
 *
 * Carries the {@link ErrorCode} naming the violated precondition, a unique error id for
 * correlating logs with API responses, and optional metadata added through the fluent API:
 * <pre>
 * throw new ResourceNotFoundException(ErrorCode.ITEM_NOT_FOUND, "Item not found: " + id)
 *     .withMetadata("itemId", id);
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(buildMessage(errorCode, message), cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode is required");
        }
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode;
        this.metadata = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add single metadata entry (fluent API). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public FailureCategory getCategory() {
        return errorCode.getCategory();
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message;
        }
        return String.format("[%s] %s", errorCode.getCode(),
                message != null ? message : errorCode.getDefaultMessage());
    }
}
