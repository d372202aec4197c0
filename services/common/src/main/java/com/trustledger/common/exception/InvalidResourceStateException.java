package com.trustledger.common.exception;

/**
 * Exception thrown when an operation is attempted on a resource that is in an invalid state
 */
public class InvalidResourceStateException extends BusinessException {
    private final String resourceType;
    private final String currentState;

    public InvalidResourceStateException(ErrorCode errorCode, String resourceType, String currentState) {
        super(errorCode, String.format("%s is in invalid state: %s", resourceType, currentState));
        this.resourceType = resourceType;
        this.currentState = currentState;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getCurrentState() {
        return currentState;
    }
}
