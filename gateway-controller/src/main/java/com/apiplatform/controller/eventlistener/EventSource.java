package com.apiplatform.controller.eventlistener;

import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Stream of change events per organization, decoupled from how they are transported
 */
public interface EventSource extends AutoCloseable {

    /**
     * Start forwarding the organization's event batches into {@code sink}.
     * At most one subscription per organization.
     */
    void subscribe(String orgId, BlockingQueue<List<ListenerEvent>> sink);

    /**
     * Stop forwarding for the organization; no-op when not subscribed.
     */
    void unsubscribe(String orgId);

    @Override
    void close();
}
