package com.apiplatform.controller.eventhub;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A change notification for one organization-scoped resource.
 * Rows are append-only; the poller hands the same instances to every subscriber,
 * so events are immutable and the payload is copied on read.
 */
@Value
@Builder
public class Event {

    String organizationId;

    /**
     * Assigned by the store at commit time, strictly increasing per store
     */
    Instant processedTimestamp;

    /**
     * Supplied by the publisher
     */
    Instant originatedTimestamp;

    EventType eventType;
    String action;
    String entityId;
    String correlationId;
    byte[] eventData;

    public byte[] getEventData() {
        return eventData != null ? eventData.clone() : null;
    }
}
