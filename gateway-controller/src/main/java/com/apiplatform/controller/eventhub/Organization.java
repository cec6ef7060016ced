package com.apiplatform.controller.eventhub;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory view of a registered organization: its subscribers and poll cursor.
 * Guarded by its own lock so one organization's cursor update never blocks another.
 */
class Organization {

    private final String id;
    private final ReentrantLock lock = new ReentrantLock();

    private final List<BlockingQueue<List<Event>>> subscribers = new ArrayList<>();
    private String knownVersion;
    private Instant lastPolled;

    Organization(String id, Instant registeredAt) {
        this.id = id;
        this.knownVersion = "";
        this.lastPolled = registeredAt;
    }

    String getId() {
        return id;
    }

    void addSubscriber(BlockingQueue<List<Event>> queue) {
        lock.lock();
        try {
            subscribers.add(queue);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove by identity; unknown queues are ignored
     */
    boolean removeSubscriber(BlockingQueue<List<Event>> queue) {
        lock.lock();
        try {
            for (int i = 0; i < subscribers.size(); i++) {
                if (subscribers.get(i) == queue) {
                    subscribers.remove(i);
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the subscriber list, safe to iterate while others subscribe
     */
    List<BlockingQueue<List<Event>>> getSubscribers() {
        lock.lock();
        try {
            return new ArrayList<>(subscribers);
        } finally {
            lock.unlock();
        }
    }

    String getKnownVersion() {
        lock.lock();
        try {
            return knownVersion;
        } finally {
            lock.unlock();
        }
    }

    Instant getLastPolled() {
        lock.lock();
        try {
            return lastPolled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advance the poll cursor; version and timestamp always move together
     */
    void updatePollState(String version, Instant polledUpTo) {
        lock.lock();
        try {
            this.knownVersion = version;
            this.lastPolled = polledUpTo;
        } finally {
            lock.unlock();
        }
    }
}
