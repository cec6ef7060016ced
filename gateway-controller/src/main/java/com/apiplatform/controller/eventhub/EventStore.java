package com.apiplatform.controller.eventhub;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQL access layer over the organization_states and events tables.
 *
 * <p>Query methods come in two forms: one that binds and maps against a statement
 * handed in by the caller (the backend keeps those prepared), and a standalone form
 * that prepares the statement on a pooled connection for one call.
 *
 * <p>No retries happen here; callers decide what to do with a {@link SQLException}.
 */
@Slf4j
public class EventStore {

    private final DataSource dataSource;
    private final Clock clock;

    // SQLite allows a single writer; publishing one at a time keeps
    // processed timestamps in commit order
    private final ReentrantLock publishLock = new ReentrantLock();
    private long lastProcessedMicros;

    public EventStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    /**
     * Create an empty state row if none exists; safe to call repeatedly
     */
    public void initializeState(String orgId) throws SQLException {
        withStatement(StatementKey.INSERT_STATE, stmt -> {
            initializeState(stmt, orgId);
            return null;
        });
    }

    void initializeState(PreparedStatement stmt, String orgId) throws SQLException {
        stmt.setString(1, orgId);
        stmt.setString(2, "");
        stmt.setLong(3, toMicros(clock.instant()));
        stmt.executeUpdate();
    }

    /**
     * Fetch every organization's state in a single query
     */
    public List<OrganizationState> getAllStates() throws SQLException {
        return withStatement(StatementKey.GET_ALL_STATES, this::getAllStates);
    }

    List<OrganizationState> getAllStates(PreparedStatement stmt) throws SQLException {
        List<OrganizationState> states = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                states.add(mapState(rs));
            }
        }
        return states;
    }

    /**
     * Point lookup; empty when the organization was never initialized
     */
    public Optional<OrganizationState> getState(String orgId) throws SQLException {
        return withStatement(StatementKey.GET_STATE, stmt -> {
            stmt.setString(1, orgId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapState(rs)) : Optional.<OrganizationState>empty();
            }
        });
    }

    /**
     * Record an event and bump the organization's version in one transaction.
     *
     * @return the new version id
     */
    public String publishEventAtomic(String orgId, EventType eventType, String action, String entityId,
                                     String correlationId, Instant originatedAt, byte[] eventData)
            throws SQLException {
        publishLock.lock();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long processedMicros = nextProcessedMicros();
                long originatedMicros = originatedAt != null ? toMicros(originatedAt) : processedMicros;

                // Step 1: append the event
                try (PreparedStatement insert = conn.prepareStatement(StatementKey.INSERT_EVENT.getSql())) {
                    insert.setString(1, orgId);
                    insert.setLong(2, processedMicros);
                    insert.setLong(3, originatedMicros);
                    insert.setString(4, eventType.getValue());
                    insert.setString(5, action);
                    insert.setString(6, entityId);
                    if (correlationId != null) {
                        insert.setString(7, correlationId);
                    } else {
                        insert.setNull(7, Types.VARCHAR);
                    }
                    insert.setBytes(8, eventData != null ? eventData : new byte[0]);
                    insert.executeUpdate();
                }

                // Step 2: bump the version
                String newVersion = UUID.randomUUID().toString();
                try (PreparedStatement upsert = conn.prepareStatement(StatementKey.UPSERT_STATE.getSql())) {
                    upsert.setString(1, orgId);
                    upsert.setString(2, newVersion);
                    upsert.setLong(3, processedMicros);
                    upsert.executeUpdate();
                }

                conn.commit();

                log.debug("Published event atomically: organization={}, eventType={}, action={}, entityId={}, version={}",
                        orgId, eventType, action, entityId, newVersion);
                return newVersion;

            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } finally {
            publishLock.unlock();
        }
    }

    /**
     * Events for the organization strictly after {@code since}, oldest first
     */
    public List<Event> getEventsSince(String orgId, Instant since) throws SQLException {
        return withStatement(StatementKey.GET_EVENTS_SINCE, stmt -> getEventsSince(stmt, orgId, since));
    }

    List<Event> getEventsSince(PreparedStatement stmt, String orgId, Instant since) throws SQLException {
        stmt.setString(1, orgId);
        stmt.setLong(2, toMicros(since));

        List<Event> events = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                events.add(Event.builder()
                        .organizationId(orgId)
                        .processedTimestamp(fromMicros(rs.getLong("processed_timestamp")))
                        .originatedTimestamp(fromMicros(rs.getLong("originated_timestamp")))
                        .eventType(EventType.fromValue(rs.getString("event_type")))
                        .action(rs.getString("action"))
                        .entityId(rs.getString("entity_id"))
                        .correlationId(rs.getString("correlation_id"))
                        .eventData(rs.getBytes("event_data"))
                        .build());
            }
        }
        return events;
    }

    /**
     * Delete events processed before the cutoff
     *
     * @return number of rows deleted
     */
    public int cleanupOlderThan(Instant cutoff) throws SQLException {
        return withStatement(StatementKey.CLEANUP, stmt -> cleanupOlderThan(stmt, cutoff));
    }

    int cleanupOlderThan(PreparedStatement stmt, Instant cutoff) throws SQLException {
        stmt.setLong(1, toMicros(cutoff));
        return stmt.executeUpdate();
    }

    /**
     * Delete events processed within [from, to]
     *
     * @return number of rows deleted
     */
    public int cleanupRange(Instant from, Instant to) throws SQLException {
        return withStatement(StatementKey.CLEANUP_RANGE, stmt -> cleanupRange(stmt, from, to));
    }

    int cleanupRange(PreparedStatement stmt, Instant from, Instant to) throws SQLException {
        stmt.setLong(1, toMicros(from));
        stmt.setLong(2, toMicros(to));
        return stmt.executeUpdate();
    }

    /**
     * Prepare a statement on the given connection
     */
    PreparedStatement prepare(Connection conn, StatementKey key) throws SQLException {
        return conn.prepareStatement(key.getSql());
    }

    DataSource getDataSource() {
        return dataSource;
    }

    private <T> T withStatement(StatementKey key, SqlFunction<T> work) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = prepare(conn, key)) {
            return work.apply(stmt);
        }
    }

    private long nextProcessedMicros() {
        long now = toMicros(clock.instant());
        lastProcessedMicros = Math.max(now, lastProcessedMicros + 1);
        return lastProcessedMicros;
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private static OrganizationState mapState(ResultSet rs) throws SQLException {
        return OrganizationState.builder()
                .organization(rs.getString("organization"))
                .versionId(rs.getString("version_id"))
                .updatedAt(fromMicros(rs.getLong("updated_at")))
                .build();
    }

    static long toMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
    }

    static Instant fromMicros(long micros) {
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    }
}
