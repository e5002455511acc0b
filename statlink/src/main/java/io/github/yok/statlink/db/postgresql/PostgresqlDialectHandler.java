package io.github.yok.statlink.db.postgresql;

import io.github.yok.statlink.config.BackendKind;
import io.github.yok.statlink.db.DbDialectHandler;
import io.github.yok.statlink.schema.ColumnType;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * PostgreSQL-specific implementation of {@link DbDialectHandler}.
 *
 * <p>
 * A partial unique index {@code WHERE expiry_date IS NULL} guarantees a single current version per
 * identifier value, even across concurrent writers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler implements DbDialectHandler {

    @Override
    public BackendKind getKind() {
        return BackendKind.POSTGRESQL;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String columnTypeSql(ColumnType type) {
        switch (type.getStorageType()) {
            case INTEGER:
                return "INTEGER";
            case SMALL_INTEGER:
                return "SMALLINT";
            case BIG_INTEGER:
                return "BIGINT";
            case FLOAT:
                return "DOUBLE PRECISION";
            case NUMERIC:
                return "NUMERIC";
            case STRING:
                return "VARCHAR(" + type.getLength() + ")";
            case TEXT:
                return "TEXT";
            case BOOLEAN:
                return "BOOLEAN";
            case DATE:
                return "DATE";
            case DATE_TIME:
                return "TIMESTAMP";
            default:
                throw new IllegalArgumentException("Unsupported type: " + type);
        }
    }

    @Override
    public String identityColumnSql() {
        return "BIGSERIAL PRIMARY KEY";
    }

    @Override
    public Optional<String> currentVersionIndexSql(String indexName, String table,
            String identifierColumn, String expiryColumn) {
        return Optional.of("CREATE UNIQUE INDEX " + quoteIdentifier(indexName) + " ON "
                + quoteIdentifier(table) + " (" + quoteIdentifier(identifierColumn) + ") WHERE "
                + quoteIdentifier(expiryColumn) + " IS NULL");
    }

    /**
     * Pins the session time zone to UTC so that {@code TIMESTAMP} values read back unchanged.
     *
     * @param connection JDBC connection to initialize
     * @throws SQLException if the statement fails
     */
    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET TIME ZONE 'UTC'");
        }
    }
}
