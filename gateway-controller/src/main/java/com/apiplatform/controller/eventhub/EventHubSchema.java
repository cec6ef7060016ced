package com.apiplatform.controller.eventhub;

import com.apiplatform.common.exception.ErrorCode;
import com.apiplatform.common.exception.EventHubException;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DDL for the EventHub tables. Every statement is idempotent, so applying it to an
 * already migrated database changes nothing.
 */
@Slf4j
public final class EventHubSchema {

    private static final String[] DDL = {
            "CREATE TABLE IF NOT EXISTS organization_states ("
                    + "organization TEXT PRIMARY KEY, "
                    + "version_id TEXT NOT NULL DEFAULT '', "
                    + "updated_at INTEGER NOT NULL)",

            "CREATE TABLE IF NOT EXISTS events ("
                    + "organization_id TEXT NOT NULL, "
                    + "processed_timestamp INTEGER NOT NULL, "
                    + "originated_timestamp INTEGER NOT NULL, "
                    + "event_type TEXT NOT NULL, "
                    + "action TEXT NOT NULL, "
                    + "entity_id TEXT NOT NULL, "
                    + "correlation_id TEXT, "
                    + "event_data BLOB)",

            "CREATE INDEX IF NOT EXISTS idx_events_org_processed "
                    + "ON events(organization_id, processed_timestamp)"
    };

    private EventHubSchema() {
    }

    public static void migrate(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
            log.info("EventHub schema applied");
        } catch (SQLException e) {
            throw new EventHubException(ErrorCode.WRITE_FAILED, "Failed to apply EventHub schema", e);
        }
    }
}
