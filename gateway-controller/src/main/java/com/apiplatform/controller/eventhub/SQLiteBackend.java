package com.apiplatform.controller.eventhub;

import com.apiplatform.common.exception.ErrorCode;
import com.apiplatform.common.exception.EventHubException;
import com.apiplatform.controller.config.EventHubConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link EventHub} backed by SQLite with polling.
 *
 * <p>Publishers write an event and bump the organization's version in one transaction.
 * A poll loop reads every organization's version in a single query and, for the ones
 * that changed, fetches the new events and offers them to subscribers. The cursor only
 * moves once every subscriber accepted the batch, so a full queue delays delivery
 * instead of losing it. A separate cleanup loop deletes events past the retention period.
 *
 * <p>Hot-path statements are prepared once on a dedicated connection. When one of them
 * is invalidated (schema change, or the handle was closed underneath) only that
 * statement is re-prepared and the call is retried once.
 */
@Slf4j
public class SQLiteBackend implements EventHub {

    enum State {
        UNINITIALIZED,
        INITIALIZED,
        CLOSED
    }

    private final EventStore store;
    private final OrganizationRegistry registry;
    private final EventHubConfig config;
    private final Clock clock;

    // Prepared statements for the hot path
    private final Map<StatementKey, PreparedStatement> statements = new EnumMap<>(StatementKey.class);
    private final ReadWriteLock statementsLock = new ReentrantReadWriteLock();
    private Connection statementConnection;

    private final Object lifecycleMonitor = new Object();
    private volatile State state = State.UNINITIALIZED;
    private ScheduledExecutorService poller;
    private ScheduledExecutorService cleaner;

    public SQLiteBackend(DataSource dataSource, EventHubConfig config) {
        this(dataSource, config, Clock.systemUTC());
    }

    public SQLiteBackend(DataSource dataSource, EventHubConfig config, Clock clock) {
        this.config = config != null ? config : new EventHubConfig();
        this.clock = clock;
        this.store = new EventStore(dataSource, clock);
        this.registry = new OrganizationRegistry(clock);
    }

    @Override
    public void initialize() {
        synchronized (lifecycleMonitor) {
            if (state == State.INITIALIZED) {
                return;
            }
            if (state == State.CLOSED) {
                throw new EventHubException(ErrorCode.BACKEND_CLOSED, "SQLite backend was closed and cannot be re-initialized");
            }

            log.info("Initializing SQLite backend");
            validateConfig();
            prepareStatements();

            state = State.INITIALIZED;

            // Start poller
            long pollMs = config.getPollInterval().toMillis();
            poller = Executors.newSingleThreadScheduledExecutor(daemonThreads("eventhub-poller-"));
            poller.scheduleWithFixedDelay(guarded("poll", this::pollAllOrganizations),
                    pollMs, pollMs, TimeUnit.MILLISECONDS);

            // Start cleanup loop
            long cleanupMs = config.getCleanupInterval().toMillis();
            cleaner = Executors.newSingleThreadScheduledExecutor(daemonThreads("eventhub-cleanup-"));
            cleaner.scheduleWithFixedDelay(guarded("cleanup", this::runCleanup),
                    cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);

            log.info("SQLite backend initialized: pollInterval={}, cleanupInterval={}, retentionPeriod={}",
                    config.getPollInterval(), config.getCleanupInterval(), config.getRetentionPeriod());
        }
    }

    @Override
    public void registerOrganization(String orgId) {
        ensureInitialized();
        if (orgId == null || orgId.isBlank()) {
            throw new EventHubException(ErrorCode.INVALID_REQUEST, "Organization id must not be blank");
        }

        // The state row is written first so a registration that failed on the database can be retried
        try {
            executeWithRetry(StatementKey.INSERT_STATE, stmt -> {
                store.initializeState(stmt, orgId);
                return null;
            });
        } catch (SQLException e) {
            throw EventHubException.forOrganization(ErrorCode.WRITE_FAILED, orgId,
                    "Failed to initialize organization state", e);
        }

        registry.register(orgId);
        log.info("Organization registered in SQLite backend: {}", orgId);
    }

    @Override
    public String publish(String orgId, EventType eventType, String action, String entityId,
                          String correlationId, byte[] eventData) {
        return publish(orgId, eventType, action, entityId, correlationId, null, eventData);
    }

    @Override
    public String publish(String orgId, EventType eventType, String action, String entityId,
                          String correlationId, Instant originatedAt, byte[] eventData) {
        ensureInitialized();

        // Verify organization is registered
        registry.get(orgId);

        if (eventType == null || action == null || entityId == null) {
            throw new EventHubException(ErrorCode.INVALID_REQUEST, "eventType, action and entityId are required");
        }

        String newVersion;
        try {
            newVersion = store.publishEventAtomic(orgId, eventType, action, entityId,
                    correlationId, originatedAt, eventData);
        } catch (SQLException e) {
            throw EventHubException.forOrganization(ErrorCode.WRITE_FAILED, orgId,
                    "Failed to publish " + eventType + " " + action + " for " + entityId, e);
        }

        log.debug("Event published: organization={}, eventType={}, action={}, entityId={}, correlationId={}, version={}",
                orgId, eventType, action, entityId, correlationId, newVersion);
        return newVersion;
    }

    @Override
    public void subscribe(String orgId, BlockingQueue<List<Event>> queue) {
        ensureInitialized();
        registry.addSubscriber(orgId, queue);
        log.info("Subscription registered for organization: {}", orgId);
    }

    @Override
    public void unsubscribe(String orgId, BlockingQueue<List<Event>> queue) {
        ensureInitialized();
        registry.removeSubscriber(orgId, queue);
        log.info("Subscription removed for organization: {}", orgId);
    }

    @Override
    public int cleanup(Instant olderThan) {
        ensureInitialized();

        int deleted;
        try {
            deleted = executeWithRetry(StatementKey.CLEANUP, stmt -> store.cleanupOlderThan(stmt, olderThan));
        } catch (SQLException e) {
            throw new EventHubException(ErrorCode.CLEANUP_FAILED, "Failed to cleanup old events", e);
        }

        log.info("Cleaned up old events: deleted={}, olderThan={}", deleted, olderThan);
        return deleted;
    }

    @Override
    public int cleanupRange(Instant from, Instant to) {
        ensureInitialized();

        int deleted;
        try {
            deleted = executeWithRetry(StatementKey.CLEANUP_RANGE, stmt -> store.cleanupRange(stmt, from, to));
        } catch (SQLException e) {
            throw new EventHubException(ErrorCode.CLEANUP_FAILED, "Failed to cleanup events in range", e);
        }

        log.info("Cleaned up events in range: deleted={}, from={}, to={}", deleted, from, to);
        return deleted;
    }

    @Override
    public void close() {
        synchronized (lifecycleMonitor) {
            if (state != State.INITIALIZED) {
                return;
            }

            log.info("Shutting down SQLite backend");
            state = State.CLOSED;

            awaitStopped(poller, "poller");
            awaitStopped(cleaner, "cleanup");

            closeStatements();
            log.info("SQLite backend shutdown complete");
        }
    }

    /**
     * One poll tick: detect version changes and deliver new events
     */
    void pollAllOrganizations() {
        List<OrganizationState> states;
        try {
            states = executeWithRetry(StatementKey.GET_ALL_STATES, store::getAllStates);
        } catch (SQLException e) {
            log.error("Failed to fetch all organization states", e);
            return;
        }

        Map<String, Organization> known = new HashMap<>();
        for (Organization organization : registry.getAll()) {
            known.put(organization.getId(), organization);
        }

        for (OrganizationState orgState : states) {
            if (state != State.INITIALIZED) {
                return;
            }

            Organization organization = known.get(orgState.getOrganization());
            if (organization == null) {
                // Not registered in this process
                continue;
            }

            if (Objects.equals(orgState.getVersionId(), organization.getKnownVersion())) {
                continue;
            }

            pollOrganization(organization, orgState.getVersionId());
        }
    }

    private void pollOrganization(Organization organization, String newVersion) {
        String orgId = organization.getId();
        Instant since = organization.getLastPolled();

        log.debug("State change detected: organization={}, oldVersion={}, newVersion={}",
                orgId, organization.getKnownVersion(), newVersion);

        List<Event> events;
        try {
            events = executeWithRetry(StatementKey.GET_EVENTS_SINCE,
                    stmt -> store.getEventsSince(stmt, orgId, since));
        } catch (SQLException e) {
            log.error("Failed to fetch events for organization: {}", orgId, e);
            return;
        }

        if (events.isEmpty()) {
            organization.updatePollState(newVersion, since);
            return;
        }

        // On failure the cursor stays put so the same events are fetched next tick
        if (deliverEvents(organization, events)) {
            Instant newest = events.get(events.size() - 1).getProcessedTimestamp();
            organization.updatePollState(newVersion, newest);
        }
    }

    /**
     * Offer the batch to every subscriber without blocking.
     *
     * @return false if any subscriber queue was full
     */
    private boolean deliverEvents(Organization organization, List<Event> events) {
        List<BlockingQueue<List<Event>>> subscribers = organization.getSubscribers();

        if (subscribers.isEmpty()) {
            log.debug("No subscribers for organization {}, {} events", organization.getId(), events.size());
            return true;
        }

        List<Event> batch = Collections.unmodifiableList(events);
        boolean delivered = true;
        for (BlockingQueue<List<Event>> subscriber : subscribers) {
            if (subscriber.offer(batch)) {
                log.debug("Delivered {} events to subscriber of organization {}", events.size(), organization.getId());
            } else {
                log.error("Subscriber queue full for organization {}, deferring {} events to next poll",
                        organization.getId(), events.size());
                delivered = false;
            }
        }
        return delivered;
    }

    /**
     * One cleanup tick: delete events older than the retention period
     */
    void runCleanup() {
        Instant cutoff = clock.instant().minus(config.getRetentionPeriod());
        try {
            cleanup(cutoff);
        } catch (EventHubException e) {
            log.error("Periodic cleanup failed", e);
        }
    }

    OrganizationRegistry getRegistry() {
        return registry;
    }

    EventStore getStore() {
        return store;
    }

    State getState() {
        return state;
    }

    /**
     * Current handle for a cached statement
     */
    PreparedStatement currentStatement(StatementKey key) {
        statementsLock.readLock().lock();
        try {
            return statements.get(key);
        } finally {
            statementsLock.readLock().unlock();
        }
    }

    /**
     * Run work against the cached statement, re-preparing and retrying once on a recoverable error
     */
    private <T> T executeWithRetry(StatementKey key, SqlFunction<T> work) throws SQLException {
        PreparedStatement stmt = currentStatement(key);
        if (stmt == null) {
            throw new EventHubException(ErrorCode.NOT_INITIALIZED, "Statement not prepared: " + key);
        }

        try {
            return runOn(stmt, work);
        } catch (SQLException e) {
            if (!isRecoverable(e, stmt)) {
                throw e;
            }
            log.warn("Statement {} failed with recoverable error, re-preparing: {}", key, e.getMessage());
            PreparedStatement fresh = reprepare(key, stmt, e);
            return runOn(fresh, work);
        }
    }

    private static <T> T runOn(PreparedStatement stmt, SqlFunction<T> work) throws SQLException {
        // JDBC statements are not thread-safe
        synchronized (stmt) {
            return work.apply(stmt);
        }
    }

    private PreparedStatement reprepare(StatementKey key, PreparedStatement failed, SQLException cause)
            throws SQLException {
        statementsLock.writeLock().lock();
        try {
            // close() already released the handles; nothing may be prepared after that
            if (state != State.INITIALIZED) {
                EventHubException closed = new EventHubException(ErrorCode.NOT_INITIALIZED,
                        "SQLite backend not initialized (state=" + state + "), not re-preparing " + key);
                closed.addSuppressed(cause);
                throw closed;
            }

            PreparedStatement current = statements.get(key);
            if (current != null && current != failed && !current.isClosed()) {
                // Another caller already swapped it
                return current;
            }

            PreparedStatement fresh;
            try {
                if (statementConnection == null || statementConnection.isClosed()) {
                    statementConnection = store.getDataSource().getConnection();
                }
                fresh = store.prepare(statementConnection, key);
            } catch (SQLException prepareError) {
                prepareError.addSuppressed(cause);
                throw prepareError;
            }

            closeQuietly(key, current);
            statements.put(key, fresh);
            log.info("Re-prepared statement {}", key);
            return fresh;
        } finally {
            statementsLock.writeLock().unlock();
        }
    }

    /**
     * Whether the failure means the statement handle itself is stale
     */
    static boolean isRecoverable(SQLException e, PreparedStatement stmt) {
        if (e instanceof SQLiteException
                && ((SQLiteException) e).getResultCode() == SQLiteErrorCode.SQLITE_SCHEMA) {
            return true;
        }
        String message = e.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains("schema")) {
            return true;
        }
        try {
            return stmt.isClosed();
        } catch (SQLException closedCheckError) {
            e.addSuppressed(closedCheckError);
            return false;
        }
    }

    private void prepareStatements() {
        statementsLock.writeLock().lock();
        try {
            statementConnection = store.getDataSource().getConnection();
            for (StatementKey key : StatementKey.values()) {
                if (key.isCached()) {
                    statements.put(key, store.prepare(statementConnection, key));
                }
            }
            log.info("Prepared {} statements", statements.size());
        } catch (SQLException e) {
            closeStatementsLocked();
            throw new EventHubException(ErrorCode.STATEMENT_PREPARE_FAILED, "Failed to prepare statements", e);
        } finally {
            statementsLock.writeLock().unlock();
        }
    }

    private void closeStatements() {
        statementsLock.writeLock().lock();
        try {
            closeStatementsLocked();
        } finally {
            statementsLock.writeLock().unlock();
        }
        log.info("Prepared statements closed");
    }

    private void closeStatementsLocked() {
        for (Map.Entry<StatementKey, PreparedStatement> entry : statements.entrySet()) {
            closeQuietly(entry.getKey(), entry.getValue());
        }
        statements.clear();

        if (statementConnection != null) {
            try {
                statementConnection.close();
            } catch (SQLException e) {
                log.warn("Failed to close statement connection", e);
            }
            statementConnection = null;
        }
    }

    private static void closeQuietly(StatementKey key, PreparedStatement stmt) {
        if (stmt == null) {
            return;
        }
        // Waits for a caller still executing on this handle
        synchronized (stmt) {
            try {
                stmt.close();
            } catch (SQLException e) {
                log.warn("Failed to close prepared statement {}", key, e);
            }
        }
    }

    private void ensureInitialized() {
        if (state != State.INITIALIZED) {
            throw new EventHubException(ErrorCode.NOT_INITIALIZED, "SQLite backend not initialized (state=" + state + ")");
        }
    }

    private void validateConfig() {
        requirePositive("pollInterval", config.getPollInterval());
        requirePositive("cleanupInterval", config.getCleanupInterval());
        requirePositive("retentionPeriod", config.getRetentionPeriod());
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new EventHubException(ErrorCode.INVALID_REQUEST, name + " must be positive, got " + value);
        }
    }

    /**
     * Stop a loop and block until its current tick, if any, has finished
     */
    private void awaitStopped(ScheduledExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        long timeoutMs = config.getShutdownTimeout().toMillis();
        boolean interrupted = false;
        boolean terminated = false;
        while (!terminated) {
            try {
                terminated = executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
                if (!terminated) {
                    log.warn("EventHub {} loop did not stop within {} ms, interrupting", name, timeoutMs);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                // Keep waiting; the flag is restored once the loop has exited
                interrupted = true;
                executor.shutdownNow();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        log.info("EventHub {} loop stopped", name);
    }

    private static Runnable guarded(String name, Runnable tick) {
        return () -> {
            try {
                tick.run();
            } catch (RuntimeException e) {
                log.error("EventHub {} tick failed", name, e);
            }
        };
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
