package io.github.yok.statlink.db.mysql;

import io.github.yok.statlink.config.BackendKind;
import io.github.yok.statlink.db.DbDialectHandler;
import io.github.yok.statlink.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * MySQL-specific implementation of {@link DbDialectHandler}.
 *
 * <p>
 * The single current version per identifier is enforced by a functional unique index over
 * {@code CASE WHEN expiry_date IS NULL THEN <identifier> END}: historical rows index as
 * {@code NULL}, which a unique index admits any number of times. Functional indexes require MySQL
 * 8.0.13 or later.
 * </p>
 *
 * <p>
 * Table names are compared case-insensitively because their case sensitivity depends on the
 * server's {@code lower_case_table_names} setting. {@code String} columns use the binary,
 * NO PAD collation {@code utf8mb4_0900_bin} (MySQL 8.0.17+) so that identifier lookups compare
 * case and trailing spaces exactly like {@link String#equals(Object)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler implements DbDialectHandler {

    static final String BINARY_COLLATION = "CHARACTER SET utf8mb4 COLLATE utf8mb4_0900_bin";

    @Override
    public BackendKind getKind() {
        return BackendKind.MYSQL;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    @Override
    public String columnTypeSql(ColumnType type) {
        switch (type.getStorageType()) {
            case INTEGER:
                return "INT";
            case SMALL_INTEGER:
                return "SMALLINT";
            case BIG_INTEGER:
                return "BIGINT";
            case FLOAT:
                return "DOUBLE";
            case NUMERIC:
                return "DECIMAL(65,30)";
            case STRING:
                return "VARCHAR(" + type.getLength() + ") " + BINARY_COLLATION;
            case TEXT:
                return "LONGTEXT";
            case BOOLEAN:
                return "BOOLEAN";
            case DATE:
                return "DATE";
            case DATE_TIME:
                return "DATETIME(6)";
            default:
                throw new IllegalArgumentException("Unsupported type: " + type);
        }
    }

    @Override
    public String identityColumnSql() {
        return "BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY";
    }

    @Override
    public Optional<String> currentVersionIndexSql(String indexName, String table,
            String identifierColumn, String expiryColumn) {
        return Optional.of("CREATE UNIQUE INDEX " + quoteIdentifier(indexName) + " ON "
                + quoteIdentifier(table) + " ((CASE WHEN " + quoteIdentifier(expiryColumn)
                + " IS NULL THEN " + quoteIdentifier(identifierColumn) + " END))");
    }

    @Override
    public boolean matchesTableName(String reported, String requested) {
        return requested.equalsIgnoreCase(reported);
    }

    /**
     * Applies MySQL-specific session initialization: UTC session time zone and utf8mb4.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if any statement fails during initialization
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET time_zone = '+00:00'");
            st.execute("SET NAMES utf8mb4");
        }
    }
}
