package com.apiplatform.controller.eventlistener;

import com.apiplatform.common.exception.ErrorCode;
import com.apiplatform.common.exception.EventHubException;
import com.apiplatform.controller.eventhub.Event;
import com.apiplatform.controller.eventhub.EventHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * {@link EventSource} over an {@link EventHub}.
 *
 * <p>Each subscription gets a bridge queue registered with the hub and a bridge task
 * that converts hub batches into {@link ListenerEvent} batches for the listener.
 * The hub never blocks on delivery; the bridge forwards with a blocking put, so a slow
 * listener fills the bridge queue and the hub redelivers once it drains.
 */
@Slf4j
public class EventHubAdapter implements EventSource {

    static final int BRIDGE_QUEUE_CAPACITY = 10;

    private final EventHub eventHub;
    private final Map<String, Subscription> activeSubscriptions = new HashMap<>();
    private final ExecutorService bridgeExecutor;

    public EventHubAdapter(EventHub eventHub) {
        this.eventHub = eventHub;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("eventhub-bridge-");
        threadFactory.setDaemon(true);
        this.bridgeExecutor = Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    public synchronized void subscribe(String orgId, BlockingQueue<List<ListenerEvent>> sink) {
        if (activeSubscriptions.containsKey(orgId)) {
            throw EventHubException.forOrganization(ErrorCode.INVALID_REQUEST, orgId, "Already subscribed");
        }

        try {
            eventHub.registerOrganization(orgId);
        } catch (EventHubException e) {
            if (e.getErrorCode() != ErrorCode.ORGANIZATION_ALREADY_EXISTS) {
                throw e;
            }
            log.debug("Organization {} already registered with EventHub", orgId);
        }

        BlockingQueue<List<Event>> bridge = new ArrayBlockingQueue<>(BRIDGE_QUEUE_CAPACITY);
        try {
            eventHub.subscribe(orgId, bridge);
        } catch (EventHubException e) {
            throw EventHubException.forOrganization(ErrorCode.SUBSCRIPTION_FAILED, orgId,
                    "Failed to subscribe to EventHub", e);
        }

        Future<?> task = bridgeExecutor.submit(() -> bridgeEvents(orgId, bridge, sink));
        activeSubscriptions.put(orgId, new Subscription(bridge, task));

        log.info("Subscribed to event source: organization={}, source=eventhub", orgId);
    }

    @Override
    public synchronized void unsubscribe(String orgId) {
        Subscription subscription = activeSubscriptions.remove(orgId);
        if (subscription == null) {
            return;
        }

        eventHub.unsubscribe(orgId, subscription.bridge);
        subscription.task.cancel(true);

        log.info("Unsubscribed from event source: organization={}", orgId);
    }

    @Override
    public synchronized void close() {
        for (String orgId : new ArrayList<>(activeSubscriptions.keySet())) {
            try {
                unsubscribe(orgId);
            } catch (EventHubException e) {
                log.warn("Failed to unsubscribe organization {} while closing", orgId, e);
            }
        }
        bridgeExecutor.shutdownNow();

        eventHub.close();
        log.info("Event source closed: source=eventhub");
    }

    synchronized boolean isSubscribed(String orgId) {
        return activeSubscriptions.containsKey(orgId);
    }

    private void bridgeEvents(String orgId, BlockingQueue<List<Event>> from,
                              BlockingQueue<List<ListenerEvent>> to) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                List<Event> hubEvents = from.take();
                to.put(convert(hubEvents));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            log.debug("Bridge task exiting for organization {}", orgId);
        }
    }

    static List<ListenerEvent> convert(List<Event> hubEvents) {
        List<ListenerEvent> converted = new ArrayList<>(hubEvents.size());
        for (Event hubEvent : hubEvents) {
            converted.add(ListenerEvent.builder()
                    .organizationId(hubEvent.getOrganizationId())
                    .eventType(hubEvent.getEventType())
                    .action(hubEvent.getAction())
                    .entityId(hubEvent.getEntityId())
                    .correlationId(hubEvent.getCorrelationId())
                    .eventData(hubEvent.getEventData())
                    .timestamp(hubEvent.getProcessedTimestamp())
                    .build());
        }
        return converted;
    }

    private static final class Subscription {
        private final BlockingQueue<List<Event>> bridge;
        private final Future<?> task;

        private Subscription(BlockingQueue<List<Event>> bridge, Future<?> task) {
            this.bridge = bridge;
            this.task = task;
        }
    }
}
