package com.apiplatform.common.exception;

/**
 * Failure raised by the EventHub. Carries the organization it concerns when there is one.
 */
public class EventHubException extends GatewayException {

    private final String organizationId;

    public EventHubException(ErrorCode errorCode, String message) {
        this(errorCode, null, message, null);
    }

    public EventHubException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, null, message, cause);
    }

    private EventHubException(ErrorCode errorCode, String organizationId, String message, Throwable cause) {
        super(errorCode, organizationId == null ? message : message + ": organization=" + organizationId, cause);
        this.organizationId = organizationId;
    }

    public static EventHubException forOrganization(ErrorCode errorCode, String organizationId, String message) {
        return new EventHubException(errorCode, organizationId, message, null);
    }

    public static EventHubException forOrganization(ErrorCode errorCode, String organizationId, String message,
                                                    Throwable cause) {
        return new EventHubException(errorCode, organizationId, message, cause);
    }

    /**
     * @return the organization involved, or null for hub-wide failures
     */
    public String getOrganizationId() {
        return organizationId;
    }
}
