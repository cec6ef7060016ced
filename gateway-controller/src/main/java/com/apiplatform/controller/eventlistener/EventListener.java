package com.apiplatform.controller.eventlistener;

import com.apiplatform.controller.eventhub.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Consumes one organization's event stream and dispatches each event to the
 * processor registered for its type.
 */
@Slf4j
public class EventListener {

    private final EventSource eventSource;
    private final String organizationId;
    private final Map<EventType, EventProcessor> processors = new EnumMap<>(EventType.class);
    private final BlockingQueue<List<ListenerEvent>> incoming = new LinkedBlockingQueue<>();

    private ExecutorService worker;

    public EventListener(EventSource eventSource, String organizationId) {
        this.eventSource = eventSource;
        this.organizationId = organizationId;
    }

    public synchronized EventListener registerProcessor(EventType eventType, EventProcessor processor) {
        processors.put(eventType, processor);
        return this;
    }

    public synchronized void start() {
        if (worker != null) {
            return;
        }
        eventSource.subscribe(organizationId, incoming);

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("event-listener-");
        threadFactory.setDaemon(true);
        worker = Executors.newSingleThreadExecutor(threadFactory);
        worker.submit(this::consume);

        log.info("Event listener started for organization {}", organizationId);
    }

    public synchronized void stop() {
        if (worker == null) {
            return;
        }
        eventSource.unsubscribe(organizationId);

        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event listener for organization {} did not stop in time", organizationId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        worker = null;

        log.info("Event listener stopped for organization {}", organizationId);
    }

    private void consume() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                List<ListenerEvent> batch = incoming.take();
                for (ListenerEvent event : batch) {
                    dispatch(event);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void dispatch(ListenerEvent event) {
        EventProcessor processor;
        synchronized (this) {
            processor = processors.get(event.getEventType());
        }

        if (processor == null) {
            log.warn("No processor for event type {}: organization={}, entityId={}, action={}",
                    event.getEventType(), event.getOrganizationId(), event.getEntityId(), event.getAction());
            return;
        }

        try {
            processor.process(event);
        } catch (RuntimeException e) {
            log.error("Failed to process {} event: entityId={}, action={}",
                    event.getEventType(), event.getEntityId(), event.getAction(), e);
        }
    }
}
