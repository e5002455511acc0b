package io.github.yok.statlink.db.h2;

import io.github.yok.statlink.config.BackendKind;
import io.github.yok.statlink.db.DbDialectHandler;
import io.github.yok.statlink.schema.ColumnType;
import java.sql.Connection;
import java.util.Optional;

/**
 * H2-specific implementation of {@link DbDialectHandler}, used for the embedded file database.
 *
 * <p>
 * H2 has no partial or functional unique index. An H2 file database is locked by one process, so
 * the single current version per identifier is protected by {@code SELECT ... FOR UPDATE} and the
 * guarded expiry update alone.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class H2DialectHandler implements DbDialectHandler {

    // Upper bound of a VARCHAR length in H2 2.x
    static final long MAX_VARCHAR_LENGTH = 1_000_000L;

    @Override
    public BackendKind getKind() {
        return BackendKind.EMBEDDED;
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * {@inheritDoc}
     *
     * <p>
     * {@code Numeric} maps to {@code DECFLOAT} so that decimals keep their full precision.
     * {@code String(N)} reserves {@code 2 * N} UTF-16 units: H2 measures {@code VARCHAR} in
     * {@code char}s while declared lengths count code points.
     * </p>
     */
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
                return "DECFLOAT";
            case STRING:
                return "VARCHAR(" + Math.min(2L * type.getLength(), MAX_VARCHAR_LENGTH) + ")";
            case TEXT:
                return "CLOB";
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
        return "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
    }

    @Override
    public Optional<String> currentVersionIndexSql(String indexName, String table,
            String identifierColumn, String expiryColumn) {
        return Optional.empty();
    }

    @Override
    public void prepareConnection(Connection connection) {
        // nothing to initialize
    }
}
