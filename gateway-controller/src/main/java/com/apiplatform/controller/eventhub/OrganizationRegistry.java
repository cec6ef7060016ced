package com.apiplatform.controller.eventhub;

import com.apiplatform.common.exception.ErrorCode;
import com.apiplatform.common.exception.EventHubException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of known organizations and their live subscribers.
 * Pure in-memory bookkeeping, independent of persistence.
 */
@Slf4j
class OrganizationRegistry {

    private final Map<String, Organization> organizations = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    OrganizationRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create an entry with no subscribers and a cursor starting now,
     * so events published before registration are never replayed.
     * The cursor sits one microsecond back: reads are strictly-after and
     * an event may share the registration microsecond.
     */
    Organization register(String orgId) {
        validateId(orgId);

        lock.writeLock().lock();
        try {
            if (organizations.containsKey(orgId)) {
                throw EventHubException.forOrganization(ErrorCode.ORGANIZATION_ALREADY_EXISTS, orgId,
                        "Organization already registered");
            }
            Organization organization = new Organization(orgId, clock.instant().minusNanos(1_000));
            organizations.put(orgId, organization);
            log.debug("Registered organization {} in registry", orgId);
            return organization;
        } finally {
            lock.writeLock().unlock();
        }
    }

    Organization get(String orgId) {
        lock.readLock().lock();
        try {
            Organization organization = organizations.get(orgId);
            if (organization == null) {
                throw EventHubException.forOrganization(ErrorCode.ORGANIZATION_NOT_FOUND, orgId,
                        "Organization not found");
            }
            return organization;
        } finally {
            lock.readLock().unlock();
        }
    }

    void addSubscriber(String orgId, BlockingQueue<List<Event>> queue) {
        if (queue == null) {
            throw new EventHubException(ErrorCode.INVALID_REQUEST, "Subscriber queue must not be null");
        }
        get(orgId).addSubscriber(queue);
    }

    void removeSubscriber(String orgId, BlockingQueue<List<Event>> queue) {
        get(orgId).removeSubscriber(queue);
    }

    List<BlockingQueue<List<Event>>> getSubscribers(String orgId) {
        return get(orgId).getSubscribers();
    }

    /**
     * Snapshot of all organizations, taken once per poll tick
     */
    List<Organization> getAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(organizations.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void validateId(String orgId) {
        if (orgId == null || orgId.isBlank()) {
            throw new EventHubException(ErrorCode.INVALID_REQUEST, "Organization id must not be blank");
        }
    }
}
