package com.apiplatform.controller.eventhub;

import com.apiplatform.common.util.JsonUtils;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Organization-scoped publish/subscribe bus used by the controller to propagate
 * resource changes to in-process consumers.
 *
 * <p>Delivery is at-least-once: a subscriber may see the same batch more than once
 * when another subscriber of the organization could not keep up. Publishing is
 * at-most-once per call; the caller owns the retry decision.
 */
public interface EventHub extends AutoCloseable {

    /**
     * Prepare statements and start the background poll and cleanup loops.
     * Calling it on an initialized hub does nothing.
     */
    void initialize();

    /**
     * Register an organization so events can be published and delivered for it.
     * Registering the same id twice is an error.
     */
    void registerOrganization(String orgId);

    /**
     * Publish an event stamped with the current time as its origin.
     *
     * @return the organization's new version id
     */
    String publish(String orgId, EventType eventType, String action, String entityId,
                   String correlationId, byte[] eventData);

    /**
     * Publish an event that originated at {@code originatedAt}.
     *
     * @return the organization's new version id
     */
    String publish(String orgId, EventType eventType, String action, String entityId,
                   String correlationId, Instant originatedAt, byte[] eventData);

    /**
     * Publish an event whose payload is {@code payload} serialized as JSON.
     *
     * @return the organization's new version id
     */
    default String publishJson(String orgId, EventType eventType, String action, String entityId,
                               String correlationId, Object payload) {
        return publish(orgId, eventType, action, entityId, correlationId, JsonUtils.toJsonBytes(payload));
    }

    /**
     * Deliver batches for the organization to {@code queue}. Delivery never blocks:
     * a full queue defers the batch to a later poll.
     */
    void subscribe(String orgId, BlockingQueue<List<Event>> queue);

    /**
     * Stop delivering to {@code queue}; unknown queues are ignored.
     */
    void unsubscribe(String orgId, BlockingQueue<List<Event>> queue);

    /**
     * @return number of events deleted
     */
    int cleanup(Instant olderThan);

    /**
     * Delete events processed within [from, to].
     *
     * @return number of events deleted
     */
    int cleanupRange(Instant from, Instant to);

    /**
     * Stop background loops and release statements. Safe to call more than once.
     */
    @Override
    void close();
}
