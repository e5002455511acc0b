package io.github.yok.statlink.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Connection/session related operations for each database dialect.
 */
public interface DbDialectConnectionOperations {

    /**
     * Applies dialect-specific initialization to a freshly opened JDBC connection.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;
}
