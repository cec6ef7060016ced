package com.apiplatform.controller.eventlistener;

import com.apiplatform.common.util.JsonUtils;
import com.apiplatform.controller.eventhub.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Source-independent event handed to listeners
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListenerEvent {

    private String organizationId;
    private EventType eventType;
    private String action;
    private String entityId;
    private String correlationId;
    private byte[] eventData;

    // When the source processed the event
    private Instant timestamp;

    /**
     * Decode the JSON payload
     */
    public <T> T payloadAs(Class<T> type) {
        return JsonUtils.fromJsonBytes(eventData, type);
    }
}
