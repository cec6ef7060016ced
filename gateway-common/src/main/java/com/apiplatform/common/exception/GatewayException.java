package com.apiplatform.common.exception;

/**
 * Base exception for gateway control plane failures, tagged with an {@link ErrorCode}
 */
public class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    public GatewayException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "/" + errorCode.getCode() + "]: " + getMessage();
    }
}
