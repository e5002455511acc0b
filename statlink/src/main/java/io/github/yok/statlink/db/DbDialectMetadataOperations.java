package io.github.yok.statlink.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Metadata operations for each database dialect.
 *
 * <p>
 * Default implementations use {@link DatabaseMetaData} scoped to the connection's current catalog
 * and schema, and compare table names exactly; metadata name patterns treat {@code _} as a
 * wildcard, so results are filtered again.
 * </p>
 */
public interface DbDialectMetadataOperations {

    // H2 2.x reports ordinary tables as BASE TABLE
    String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    /**
     * Checks whether a table exists.
     *
     * @param connection JDBC connection
     * @param table table name
     * @return true when the table exists
     * @throws SQLException if metadata retrieval fails
     */
    default boolean tableExists(Connection connection, String table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        try (ResultSet rs = meta.getTables(connection.getCatalog(), connection.getSchema(), table,
                TABLE_TYPES)) {
            while (rs.next()) {
                if (matchesTableName(rs.getString("TABLE_NAME"), table)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Retrieves the column names of a table in ordinal order.
     *
     * @param connection JDBC connection
     * @param table table name
     * @return column names (empty if the table does not exist)
     * @throws SQLException if metadata retrieval fails
     */
    default List<String> getColumnNames(Connection connection, String table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        List<String> cols = new ArrayList<>();
        try (ResultSet rs =
                meta.getColumns(connection.getCatalog(), connection.getSchema(), table, null)) {
            while (rs.next()) {
                if (matchesTableName(rs.getString("TABLE_NAME"), table)) {
                    cols.add(rs.getString("COLUMN_NAME"));
                }
            }
        }
        return cols;
    }

    /**
     * Returns the total row count for a table.
     *
     * @param connection JDBC connection
     * @param quotedTable quoted table name
     * @return number of rows
     * @throws SQLException if SQL execution fails
     */
    default long countRows(Connection connection, String quotedTable) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + quotedTable;
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * Compares a table name reported by metadata with the requested one.
     *
     * @param reported name returned by {@link DatabaseMetaData}
     * @param requested requested name
     * @return true when they denote the same table
     */
    default boolean matchesTableName(String reported, String requested) {
        return requested.equals(reported);
    }
}
