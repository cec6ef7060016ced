package com.apiplatform.controller.eventhub;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Work performed against a prepared statement.
 */
@FunctionalInterface
interface SqlFunction<T> {
    T apply(PreparedStatement statement) throws SQLException;
}
