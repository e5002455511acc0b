package io.github.yok.statlink.db;

import io.github.yok.statlink.schema.ColumnType;
import java.util.Optional;

/**
 * SQL grammar operations for each database dialect.
 */
public interface DbDialectSqlOperations {

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns the column type used to store values of a declared column.
     *
     * @param type declared column type
     * @return SQL type expression, e.g. {@code VARCHAR(10)}
     */
    String columnTypeSql(ColumnType type);

    /**
     * Returns the column definition of the surrogate key, without the column name.
     *
     * @return identity column definition including the primary key clause
     */
    String identityColumnSql();

    /**
     * Appends a row lock clause to a select statement.
     *
     * @param baseSql select statement
     * @return locking select statement
     */
    default String applyForUpdate(String baseSql) {
        return baseSql + " FOR UPDATE";
    }

    /**
     * Returns DDL for a unique index admitting a single current row per identifier value.
     *
     * @param indexName index name
     * @param table table name (unquoted)
     * @param identifierColumn identifier column name (unquoted)
     * @param expiryColumn expiry column name (unquoted)
     * @return DDL, or empty when the engine has no suitable index type
     */
    Optional<String> currentVersionIndexSql(String indexName, String table, String identifierColumn,
            String expiryColumn);
}
