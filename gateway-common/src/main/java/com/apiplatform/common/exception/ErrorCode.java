package com.apiplatform.common.exception;

/**
 * Error codes for categorizing different types of failures.
 * Error codes are organized by category:
 * - 1xxx: Client errors
 * - 2xxx: Storage errors
 * - 3xxx: EventHub lifecycle errors
 */
public enum ErrorCode {
    
    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    ORGANIZATION_NOT_FOUND(1002, "Organization is not registered"),
    ORGANIZATION_ALREADY_EXISTS(1003, "Organization is already registered"),
    SUBSCRIPTION_FAILED(1004, "Failed to subscribe to organization events"),
    
    // Storage errors (2xxx)
    STATEMENT_PREPARE_FAILED(2001, "Failed to prepare database statement"),
    WRITE_FAILED(2002, "Failed to write to the event store"),
    CLEANUP_FAILED(2004, "Failed to clean up events"),
    
    // EventHub lifecycle errors (3xxx)
    NOT_INITIALIZED(3001, "EventHub backend not initialized"),
    BACKEND_CLOSED(3002, "EventHub backend has been closed"),
    
    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");
    
    private final int code;
    private final String message;
    
    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
    
    public int getCode() {
        return code;
    }
    
    public String getMessage() {
        return message;
    }
}
