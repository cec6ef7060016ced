package com.apiplatform.controller.eventhub;

/**
 * Identifies every SQL statement the EventHub runs.
 * Keys marked as cached are prepared once by the backend and re-prepared individually
 * when invalidated; the rest are prepared per use.
 */
enum StatementKey {

    GET_ALL_STATES(true,
            "SELECT organization, version_id, updated_at "
            + "FROM organization_states "
            + "ORDER BY organization"),

    GET_STATE(false,
            "SELECT organization, version_id, updated_at "
            + "FROM organization_states "
            + "WHERE organization = ?"),

    GET_EVENTS_SINCE(true,
            "SELECT processed_timestamp, originated_timestamp, event_type, "
            + "action, entity_id, correlation_id, event_data "
            + "FROM events "
            + "WHERE organization_id = ? AND processed_timestamp > ? "
            + "ORDER BY processed_timestamp ASC"),

    INSERT_EVENT(false,
            "INSERT INTO events (organization_id, processed_timestamp, originated_timestamp, "
            + "event_type, action, entity_id, correlation_id, event_data) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)"),

    UPSERT_STATE(false,
            "INSERT INTO organization_states (organization, version_id, updated_at) "
            + "VALUES (?, ?, ?) "
            + "ON CONFLICT(organization) "
            + "DO UPDATE SET version_id = excluded.version_id, updated_at = excluded.updated_at"),

    INSERT_STATE(true,
            "INSERT INTO organization_states (organization, version_id, updated_at) "
            + "VALUES (?, ?, ?) "
            + "ON CONFLICT(organization) "
            + "DO NOTHING"),

    CLEANUP(true, "DELETE FROM events WHERE processed_timestamp < ?"),

    CLEANUP_RANGE(true, "DELETE FROM events WHERE processed_timestamp >= ? AND processed_timestamp <= ?");

    private final boolean cached;
    private final String sql;

    StatementKey(boolean cached, String sql) {
        this.cached = cached;
        this.sql = sql;
    }

    boolean isCached() {
        return cached;
    }

    String getSql() {
        return sql;
    }
}
