package com.apiplatform.controller.eventlistener;

/**
 * Handles events of one type
 */
@FunctionalInterface
public interface EventProcessor {

    void process(ListenerEvent event);
}
