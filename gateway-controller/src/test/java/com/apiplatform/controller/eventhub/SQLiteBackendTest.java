package com.apiplatform.controller.eventhub;

import com.apiplatform.common.exception.ErrorCode;
import com.apiplatform.common.exception.EventHubException;
import com.apiplatform.controller.config.EventHubConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Backend tests. Poll and cleanup ticks are driven by hand; the background loops
 * are configured far enough apart that they never fire during a test.
 */
public class SQLiteBackendTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private MutableClock clock;
    private SQLiteBackend backend;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabases.create(tempDir);
        clock = new MutableClock(START);
        backend = new SQLiteBackend(dataSource, manualConfig(), clock);
        backend.initialize();
    }

    @AfterEach
    void tearDown() {
        backend.close();
        dataSource.close();
    }

    private static EventHubConfig manualConfig() {
        EventHubConfig config = new EventHubConfig();
        config.setPollInterval(Duration.ofHours(1));
        config.setCleanupInterval(Duration.ofHours(1));
        config.setRetentionPeriod(Duration.ofHours(1));
        config.setShutdownTimeout(Duration.ofSeconds(5));
        return config;
    }

    /**
     * Queue whose offer parks until released, holding a poll tick inside delivery
     */
    private static class GatedQueue extends ArrayBlockingQueue<List<Event>> {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        GatedQueue() {
            super(10);
        }

        @Override
        public boolean offer(List<Event> batch) {
            entered.countDown();
            boolean interrupted = false;
            while (true) {
                try {
                    release.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return super.offer(batch);
        }
    }

    private SQLiteBackend startWithBlockedTick(GatedQueue queue) throws InterruptedException {
        EventHubConfig config = manualConfig();
        config.setPollInterval(Duration.ofMillis(20));
        SQLiteBackend live = new SQLiteBackend(dataSource, config);
        live.initialize();
        live.registerOrganization("org-gated");
        live.subscribe("org-gated", queue);
        live.publish("org-gated", EventType.API, "CREATE", "api-1", null, null);

        assertTrue(queue.entered.await(5, TimeUnit.SECONDS), "poll tick should reach delivery");
        return live;
    }

    private String publish(String orgId, String action, String entityId) {
        return backend.publish(orgId, EventType.API, action, entityId, null,
                ("{\"id\":\"" + entityId + "\"}").getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testPublishThenPollDelivers() throws Exception {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);

        String version = backend.publish("org-1", EventType.API, "CREATE", "api-1", "corr-1",
                "{\"id\":\"api-1\"}".getBytes(StandardCharsets.UTF_8));
        backend.pollAllOrganizations();

        List<Event> batch = queue.poll();
        assertNotNull(batch);
        assertEquals(1, batch.size());

        Event event = batch.get(0);
        assertEquals("org-1", event.getOrganizationId());
        assertEquals(EventType.API, event.getEventType());
        assertEquals("CREATE", event.getAction());
        assertEquals("api-1", event.getEntityId());
        assertEquals("corr-1", event.getCorrelationId());
        assertEquals("{\"id\":\"api-1\"}", new String(event.getEventData(), StandardCharsets.UTF_8));

        Organization organization = backend.getRegistry().get("org-1");
        assertEquals(version, organization.getKnownVersion());
        assertEquals(event.getProcessedTimestamp(), organization.getLastPolled());
    }

    @Test
    void testNothingDeliveredWithoutChanges() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);

        backend.pollAllOrganizations();
        backend.pollAllOrganizations();

        assertTrue(queue.isEmpty());
    }

    @Test
    void testBatchPreservesPublishOrder() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);

        for (int i = 0; i < 5; i++) {
            publish("org-1", "UPDATE", "api-" + i);
        }
        backend.pollAllOrganizations();

        List<Event> batch = queue.poll();
        assertNotNull(batch);
        assertEquals(5, batch.size());
        for (int i = 0; i < 5; i++) {
            assertEquals("api-" + i, batch.get(i).getEntityId());
        }

        // Already delivered, so the next tick has nothing new
        backend.pollAllOrganizations();
        assertTrue(queue.isEmpty());
    }

    @Test
    void testOrganizationsAreIsolated() {
        backend.registerOrganization("org-1");
        backend.registerOrganization("org-2");
        BlockingQueue<List<Event>> first = new ArrayBlockingQueue<>(10);
        BlockingQueue<List<Event>> second = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", first);
        backend.subscribe("org-2", second);

        publish("org-1", "CREATE", "api-1");
        backend.pollAllOrganizations();

        assertEquals(1, first.size());
        assertTrue(second.isEmpty());
        assertEquals("", backend.getRegistry().get("org-2").getKnownVersion());
    }

    @Test
    void testEventsBeforeRegistrationAreNotReplayed() throws SQLException {
        backend.getStore().publishEventAtomic("org-1", EventType.API, "CREATE", "old", null, null, null);
        clock.advance(Duration.ofSeconds(1));

        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);

        publish("org-1", "UPDATE", "new");
        backend.pollAllOrganizations();

        List<Event> batch = queue.poll();
        assertNotNull(batch);
        assertEquals(1, batch.size());
        assertEquals("new", batch.get(0).getEntityId());
    }

    @Test
    void testFailedPublishLeavesNoTrace() throws SQLException {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);
        TestDatabases.failStateWrites(dataSource, "org-1");

        EventHubException e = assertThrows(EventHubException.class,
                () -> publish("org-1", "CREATE", "api-1"));
        assertEquals(ErrorCode.WRITE_FAILED, e.getErrorCode());
        assertTrue(e.getCause() instanceof SQLException);

        assertEquals("", backend.getStore().getState("org-1").orElseThrow().getVersionId());
        assertTrue(backend.getStore().getEventsSince("org-1", Instant.EPOCH).isEmpty());
        backend.pollAllOrganizations();
        assertTrue(queue.isEmpty());
    }

    @Test
    void testSinglePublishReachesSubscriberOnNextTick() {
        backend.registerOrganization("acme");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("acme", queue);

        String version = backend.publish("acme", EventType.POLICY, "update", "api-1", null, null);
        backend.pollAllOrganizations();

        assertEquals(1, queue.size());
        List<Event> batch = queue.poll();
        assertEquals(1, batch.size());
        assertEquals("api-1", batch.get(0).getEntityId());
        assertEquals(EventType.POLICY, batch.get(0).getEventType());
        assertEquals(version, backend.getRegistry().get("acme").getKnownVersion());
    }

    @Test
    void testPublishesBetweenTicksArriveAsOneBatch() {
        backend.registerOrganization("acme");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("acme", queue);

        backend.publish("acme", EventType.API, "create", "api-1", null, null);
        backend.publish("acme", EventType.API, "update", "api-2", null, null);
        backend.pollAllOrganizations();

        assertEquals(1, queue.size());
        List<Event> batch = queue.poll();
        assertEquals(2, batch.size());
        assertEquals("api-1", batch.get(0).getEntityId());
        assertEquals("api-2", batch.get(1).getEntityId());
    }

    @Test
    void testDuplicateRegistrationKeepsSubscribersAndCursor() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);
        publish("org-1", "CREATE", "api-1");
        backend.pollAllOrganizations();

        Organization before = backend.getRegistry().get("org-1");
        Instant cursor = before.getLastPolled();
        String version = before.getKnownVersion();

        EventHubException e = assertThrows(EventHubException.class, () -> backend.registerOrganization("org-1"));
        assertEquals(ErrorCode.ORGANIZATION_ALREADY_EXISTS, e.getErrorCode());

        Organization after = backend.getRegistry().get("org-1");
        assertSame(before, after);
        assertEquals(1, after.getSubscribers().size());
        assertEquals(cursor, after.getLastPolled());
        assertEquals(version, after.getKnownVersion());
    }

    @Test
    void testPublishToUnknownOrganizationFails() {
        EventHubException e = assertThrows(EventHubException.class, () -> publish("ghost", "CREATE", "api-1"));
        assertEquals(ErrorCode.ORGANIZATION_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void testSubscribeToUnknownOrganizationFails() {
        EventHubException e = assertThrows(EventHubException.class,
                () -> backend.subscribe("ghost", new ArrayBlockingQueue<>(1)));
        assertEquals(ErrorCode.ORGANIZATION_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void testBlankOrganizationRejected() {
        EventHubException e = assertThrows(EventHubException.class, () -> backend.registerOrganization(""));
        assertEquals(ErrorCode.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    void testFullQueueDefersDelivery() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(1);
        backend.subscribe("org-1", queue);
        assertTrue(queue.offer(List.of()));

        publish("org-1", "CREATE", "api-1");
        backend.pollAllOrganizations();

        // Not delivered and the cursor did not move
        Organization organization = backend.getRegistry().get("org-1");
        assertEquals("", organization.getKnownVersion());
        assertEquals(1, queue.size());

        queue.clear();
        publish("org-1", "UPDATE", "api-1");
        backend.pollAllOrganizations();

        List<Event> batch = queue.poll();
        assertNotNull(batch);
        assertEquals(2, batch.size());
        assertEquals("CREATE", batch.get(0).getAction());
        assertEquals("UPDATE", batch.get(1).getAction());
    }

    @Test
    void testSlowSubscriberCausesRedeliveryToOthers() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> slow = new ArrayBlockingQueue<>(1);
        BlockingQueue<List<Event>> fast = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", slow);
        backend.subscribe("org-1", fast);
        assertTrue(slow.offer(List.of()));

        publish("org-1", "CREATE", "api-1");
        backend.pollAllOrganizations();
        assertEquals(1, fast.size());

        slow.clear();
        backend.pollAllOrganizations();

        assertEquals(1, slow.size());
        assertEquals(2, fast.size());
        assertEquals(fast.poll(), fast.poll());
    }

    @Test
    void testUnsubscribeStopsDelivery() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);
        backend.unsubscribe("org-1", queue);
        backend.unsubscribe("org-1", new ArrayBlockingQueue<>(1));

        publish("org-1", "CREATE", "api-1");
        backend.pollAllOrganizations();

        assertTrue(queue.isEmpty());
    }

    @Test
    void testPeriodicCleanupHonoursRetention() throws SQLException {
        backend.registerOrganization("org-1");
        publish("org-1", "CREATE", "api-1");
        publish("org-1", "UPDATE", "api-1");

        clock.advance(Duration.ofMinutes(30));
        backend.runCleanup();
        assertEquals(2, backend.getStore().getEventsSince("org-1", Instant.EPOCH).size());

        clock.advance(Duration.ofMinutes(31));
        publish("org-1", "DELETE", "api-1");
        backend.runCleanup();

        List<Event> remaining = backend.getStore().getEventsSince("org-1", Instant.EPOCH);
        assertEquals(1, remaining.size());
        assertEquals("DELETE", remaining.get(0).getAction());
    }

    @Test
    void testCleanupRange() throws SQLException {
        backend.registerOrganization("org-1");
        for (int i = 0; i < 3; i++) {
            publish("org-1", "UPDATE", "api-" + i);
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(2, backend.cleanupRange(START, START.plusSeconds(1)));
        assertEquals(1, backend.cleanup(START.plusSeconds(10)));
        assertTrue(backend.getStore().getEventsSince("org-1", Instant.EPOCH).isEmpty());
    }

    @Test
    void testClosedStatementIsReprepared() throws SQLException {
        PreparedStatement original = backend.currentStatement(StatementKey.CLEANUP);
        original.close();

        assertEquals(0, backend.cleanup(START));

        PreparedStatement replacement = backend.currentStatement(StatementKey.CLEANUP);
        assertNotSame(original, replacement);
        assertFalse(replacement.isClosed());
    }

    @Test
    void testPollRecoversFromClosedStatements() throws SQLException {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);
        publish("org-1", "CREATE", "api-1");

        backend.currentStatement(StatementKey.GET_ALL_STATES).close();
        backend.currentStatement(StatementKey.GET_EVENTS_SINCE).close();
        backend.pollAllOrganizations();

        assertEquals(1, queue.size());
    }

    @Test
    void testDeliveryContinuesAfterSchemaChange() throws SQLException {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", queue);
        backend.pollAllOrganizations();

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("ALTER TABLE events ADD COLUMN source TEXT");
        }

        publish("org-1", "CREATE", "api-1");
        backend.pollAllOrganizations();

        assertEquals(1, queue.size());
    }

    @Test
    void testRecoverableErrorClassification() throws SQLException {
        PreparedStatement open = backend.currentStatement(StatementKey.GET_ALL_STATES);

        assertTrue(SQLiteBackend.isRecoverable(
                new SQLiteException("database schema has changed", SQLiteErrorCode.SQLITE_SCHEMA), open));
        assertTrue(SQLiteBackend.isRecoverable(new SQLException("schema changed"), open));
        assertFalse(SQLiteBackend.isRecoverable(
                new SQLiteException("constraint failed", SQLiteErrorCode.SQLITE_CONSTRAINT), open));
    }

    @Test
    void testOperationsRequireInitialization() {
        SQLiteBackend fresh = new SQLiteBackend(dataSource, manualConfig(), clock);

        EventHubException e = assertThrows(EventHubException.class, () -> fresh.registerOrganization("org-1"));
        assertEquals(ErrorCode.NOT_INITIALIZED, e.getErrorCode());
        assertThrows(EventHubException.class, () -> fresh.cleanup(START));

        // Closing a hub that never started is harmless
        fresh.close();
    }

    @Test
    void testInitializeTwiceIsNoOp() {
        backend.initialize();

        assertEquals(SQLiteBackend.State.INITIALIZED, backend.getState());
        backend.registerOrganization("org-1");
    }

    @Test
    void testCloseIsIdempotentAndFinal() {
        backend.registerOrganization("org-1");

        backend.close();
        backend.close();

        assertEquals(SQLiteBackend.State.CLOSED, backend.getState());
        EventHubException notInitialized = assertThrows(EventHubException.class,
                () -> publish("org-1", "CREATE", "api-1"));
        assertEquals(ErrorCode.NOT_INITIALIZED, notInitialized.getErrorCode());

        EventHubException closed = assertThrows(EventHubException.class, () -> backend.initialize());
        assertEquals(ErrorCode.BACKEND_CLOSED, closed.getErrorCode());
    }

    @Test
    void testInvalidConfigRejected() {
        EventHubConfig config = manualConfig();
        config.setPollInterval(Duration.ZERO);
        SQLiteBackend misconfigured = new SQLiteBackend(dataSource, config, clock);

        EventHubException e = assertThrows(EventHubException.class, misconfigured::initialize);
        assertEquals(ErrorCode.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    void testBackgroundPollerDelivers() throws Exception {
        EventHubConfig config = manualConfig();
        config.setPollInterval(Duration.ofMillis(50));

        try (SQLiteBackend live = new SQLiteBackend(dataSource, config)) {
            live.initialize();
            live.registerOrganization("org-live");
            BlockingQueue<List<Event>> queue = new ArrayBlockingQueue<>(10);
            live.subscribe("org-live", queue);

            live.publish("org-live", EventType.POLICY, "CREATE", "policy-1", null, null);

            List<Event> batch = queue.poll(5, TimeUnit.SECONDS);
            assertNotNull(batch, "background poller should deliver within timeout");
            assertEquals("policy-1", batch.get(0).getEntityId());
        }
    }

    @Test
    void testSubscribersCannotAlterEachOthersPayload() {
        backend.registerOrganization("org-1");
        BlockingQueue<List<Event>> first = new ArrayBlockingQueue<>(10);
        BlockingQueue<List<Event>> second = new ArrayBlockingQueue<>(10);
        backend.subscribe("org-1", first);
        backend.subscribe("org-1", second);

        backend.publish("org-1", EventType.API, "CREATE", "api-1", null, "abc".getBytes(StandardCharsets.UTF_8));
        backend.pollAllOrganizations();

        List<Event> firstBatch = first.poll();
        Event mine = firstBatch.get(0);
        Event theirs = second.poll().get(0);
        mine.getEventData()[0] = 'x';

        assertEquals("abc", new String(theirs.getEventData(), StandardCharsets.UTF_8));
        assertEquals("abc", new String(mine.getEventData(), StandardCharsets.UTF_8));
        assertThrows(UnsupportedOperationException.class, () -> firstBatch.add(mine));
    }

    @Test
    void testCleanupRacingCloseLeavesNoStatements() throws Exception {
        for (int i = 0; i < 50; i++) {
            SQLiteBackend racing = new SQLiteBackend(dataSource, manualConfig(), clock);
            racing.initialize();

            CountDownLatch started = new CountDownLatch(1);
            Thread caller = new Thread(() -> {
                started.countDown();
                while (racing.getState() == SQLiteBackend.State.INITIALIZED) {
                    try {
                        racing.cleanup(Instant.EPOCH);
                    } catch (EventHubException e) {
                        assertEquals(ErrorCode.NOT_INITIALIZED, e.getErrorCode());
                    }
                }
            });
            caller.start();
            assertTrue(started.await(5, TimeUnit.SECONDS));

            racing.close();
            caller.join(5000);
            assertFalse(caller.isAlive());

            for (StatementKey key : StatementKey.values()) {
                assertNull(racing.currentStatement(key), "statement left open after close: " + key);
            }
        }

        // Only the backend from setUp still holds its statement connection
        assertEquals(1, dataSource.getHikariPoolMXBean().getActiveConnections());
    }

    @Test
    void testCloseWaitsForRunningPollTick() throws Exception {
        GatedQueue queue = new GatedQueue();
        SQLiteBackend live = startWithBlockedTick(queue);

        CountDownLatch closed = new CountDownLatch(1);
        Thread closer = new Thread(() -> {
            live.close();
            closed.countDown();
        });
        closer.start();

        assertFalse(closed.await(300, TimeUnit.MILLISECONDS), "close must wait for the running tick");
        assertNotNull(live.currentStatement(StatementKey.GET_ALL_STATES));

        queue.release.countDown();
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertNull(live.currentStatement(StatementKey.GET_ALL_STATES));
        assertEquals(1, queue.size());
    }

    @Test
    void testInterruptedCloseStillWaitsForTick() throws Exception {
        GatedQueue queue = new GatedQueue();
        SQLiteBackend live = startWithBlockedTick(queue);

        CountDownLatch closed = new CountDownLatch(1);
        AtomicBoolean interruptRestored = new AtomicBoolean();
        Thread closer = new Thread(() -> {
            live.close();
            interruptRestored.set(Thread.currentThread().isInterrupted());
            closed.countDown();
        });
        closer.start();

        assertFalse(closed.await(200, TimeUnit.MILLISECONDS));
        closer.interrupt();
        assertFalse(closed.await(300, TimeUnit.MILLISECONDS), "an interrupt must not cut the wait short");
        assertNotNull(live.currentStatement(StatementKey.GET_ALL_STATES));

        queue.release.countDown();
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertTrue(interruptRestored.get());
        assertNull(live.currentStatement(StatementKey.GET_ALL_STATES));
    }
}
