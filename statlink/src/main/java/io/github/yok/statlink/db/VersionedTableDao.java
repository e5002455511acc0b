package io.github.yok.statlink.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.ColumnDefinition;
import io.github.yok.statlink.schema.EntityType;
import io.github.yok.statlink.schema.SchemaException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * JDBC access to versioned entity tables.
 *
 * <p>
 * Every method runs on the connection passed at construction and leaves transaction control to the
 * caller. {@link SQLException}s are wrapped in {@link BackendException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class VersionedTableDao {

    // Databases commonly cap identifier length at 63 (PostgreSQL) or 64 (MySQL)
    private static final int MAX_INDEX_NAME_LENGTH = 60;

    @Getter
    private final Connection connection;

    @Getter
    private final DbDialectHandler dialect;

    // Maximum number of identifier values bound in one IN clause
    private final int identifierChunkSize;

    // Maximum number of rows per JDBC insert batch
    private final int batchSize;

    /**
     * Creates a DAO bound to one connection.
     *
     * @param connection JDBC connection (auto-commit off)
     * @param dialect dialect of the connected backend
     * @param identifierChunkSize identifier values per lookup query
     * @param batchSize rows per insert batch
     */
    public VersionedTableDao(Connection connection, DbDialectHandler dialect,
            int identifierChunkSize, int batchSize) {
        Preconditions.checkArgument(identifierChunkSize > 0, "identifierChunkSize must be > 0");
        Preconditions.checkArgument(batchSize > 0, "batchSize must be > 0");
        this.connection = Preconditions.checkNotNull(connection, "connection must not be null");
        this.dialect = Preconditions.checkNotNull(dialect, "dialect must not be null");
        this.identifierChunkSize = identifierChunkSize;
        this.batchSize = batchSize;
    }

    /**
     * Creates the table of {@code type} when it does not exist, otherwise verifies that it has every
     * declared and system column.
     *
     * @param type entity type
     * @return {@code true} when the table was created
     * @throws SchemaException if an existing table lacks columns
     * @throws BackendException if a statement fails
     */
    public boolean ensureTable(EntityType type) {
        String table = type.getTableName();
        try {
            if (dialect.tableExists(connection, table)) {
                verifyColumns(type);
                log.debug("[{}] Table exists; columns verified", table);
                return false;
            }
            try (Statement st = connection.createStatement()) {
                st.execute(createTableSql(type));
                st.execute("CREATE INDEX " + q(indexName("ix", table, type.getUniqueIdentifier()))
                        + " ON " + q(table) + " (" + q(type.getUniqueIdentifier()) + ")");
                String uniqueSql = dialect.currentVersionIndexSql(
                        indexName("ux", table, "current"), table, type.getUniqueIdentifier(),
                        EntityType.EXPIRY_DATE).orElse(null);
                if (uniqueSql != null) {
                    st.execute(uniqueSql);
                }
            }
            log.info("[{}] Created table", table);
            return true;
        } catch (SQLException e) {
            throw new BackendException("Failed to prepare table " + table, e);
        }
    }

    /**
     * Returns all rows (every version) for the given identifier values.
     *
     * @param type entity type
     * @param identifiers identifier values
     * @return rows ordered by identifier chunk, then identifier and version number
     * @throws BackendException if a query fails
     */
    public List<EntityRecord> findByIdentifiers(EntityType type, Collection<?> identifiers) {
        return select(type, identifiers, false);
    }

    /**
     * Returns the current rows ({@code expiry_date IS NULL}) for the given identifier values,
     * locking them until the transaction ends.
     *
     * @param type entity type
     * @param identifiers identifier values
     * @return current rows
     * @throws BackendException if a query fails
     */
    public List<EntityRecord> findCurrentByIdentifiers(EntityType type, Collection<?> identifiers) {
        return select(type, identifiers, true);
    }

    /**
     * Returns every row of the table.
     *
     * @param type entity type
     * @return rows ordered by identifier and version number
     * @throws BackendException if the query fails
     */
    public List<EntityRecord> findAll(EntityType type) {
        String sql = selectPrefix(type) + " ORDER BY " + q(type.getUniqueIdentifier()) + ", "
                + q(EntityType.VERSION_NUMBER);
        try (PreparedStatement ps = connection.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            List<EntityRecord> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(mapRow(type, rs));
            }
            return rows;
        } catch (SQLException e) {
            throw new BackendException("Failed to read " + type.getTableName(), e);
        }
    }

    /**
     * Sets {@code expiry_date} on a row that is still current.
     *
     * @param type entity type
     * @param id surrogate key of the row
     * @param expiryDate expiry date to set
     * @return number of updated rows; {@code 0} when the row was already expired
     * @throws BackendException if the update fails
     */
    public int expire(EntityType type, long id, LocalDate expiryDate) {
        String sql = "UPDATE " + q(type.getTableName()) + " SET " + q(EntityType.EXPIRY_DATE)
                + " = ? WHERE " + q(EntityType.ID) + " = ? AND " + q(EntityType.EXPIRY_DATE)
                + " IS NULL";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setObject(1, expiryDate);
            ps.setLong(2, id);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new BackendException(
                    "Failed to expire row id=" + id + " of " + type.getTableName(), e);
        }
    }

    /**
     * Inserts versioned rows in JDBC batches.
     *
     * <p>
     * The returned records carry the database-assigned {@code id} when the driver reports generated
     * keys for batches; otherwise the id stays {@code null}.
     * </p>
     *
     * @param type entity type
     * @param rows rows with version number and effective date set
     * @return inserted rows, in input order
     * @throws BackendException if an insert fails
     */
    public List<EntityRecord> insert(EntityType type, List<EntityRecord> rows) {
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> columns = new ArrayList<>(type.getColumnNames());
        columns.add(EntityType.VERSION_NUMBER);
        columns.add(EntityType.EFFECTIVE_DATE);
        columns.add(EntityType.EXPIRY_DATE);
        String sql = "INSERT INTO " + q(type.getTableName()) + " ("
                + columns.stream().map(this::q).collect(Collectors.joining(", ")) + ") VALUES ("
                + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";

        List<EntityRecord> inserted = new ArrayList<>(rows.size());
        try (PreparedStatement ps =
                connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            for (List<EntityRecord> batch : Lists.partition(rows, batchSize)) {
                for (EntityRecord row : batch) {
                    Preconditions.checkArgument(row.getVersionNumber() != null,
                            "row has no version number: %s", row);
                    int index = 1;
                    for (ColumnDefinition column : type.getColumns()) {
                        column.getStorageType().bind(ps, index++, row.get(column.getName()));
                    }
                    ps.setInt(index++, row.getVersionNumber());
                    ps.setObject(index++, row.getEffectiveDate());
                    if (row.getExpiryDate() == null) {
                        ps.setNull(index, Types.DATE);
                    } else {
                        ps.setObject(index, row.getExpiryDate());
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
                inserted.addAll(attachGeneratedKeys(ps, batch));
                log.debug("[{}] Inserted batch of {} rows", type.getTableName(), batch.size());
            }
        } catch (SQLException e) {
            throw new BackendException("Failed to insert into " + type.getTableName(), e);
        }
        return inserted;
    }

    /**
     * Counts the rows of the table.
     *
     * @param type entity type
     * @return row count
     * @throws BackendException if the query fails
     */
    public long countRows(EntityType type) {
        try {
            return dialect.countRows(connection, q(type.getTableName()));
        } catch (SQLException e) {
            throw new BackendException("Failed to count rows of " + type.getTableName(), e);
        }
    }

    private List<EntityRecord> select(EntityType type, Collection<?> identifiers,
            boolean currentOnly) {
        if (identifiers.isEmpty()) {
            return Collections.emptyList();
        }
        ColumnDefinition idColumn = type.getIdentifierColumn();
        List<Object> values = new ArrayList<>(identifiers);
        List<EntityRecord> rows = new ArrayList<>();
        for (List<Object> chunk : Lists.partition(values, identifierChunkSize)) {
            StringBuilder sql = new StringBuilder(selectPrefix(type));
            sql.append(" WHERE ").append(q(idColumn.getName())).append(" IN (")
                    .append(chunk.stream().map(v -> "?").collect(Collectors.joining(", ")))
                    .append(")");
            if (currentOnly) {
                sql.append(" AND ").append(q(EntityType.EXPIRY_DATE)).append(" IS NULL");
            }
            sql.append(" ORDER BY ").append(q(idColumn.getName())).append(", ")
                    .append(q(EntityType.VERSION_NUMBER));
            String statement = currentOnly ? dialect.applyForUpdate(sql.toString()) : sql.toString();
            try (PreparedStatement ps = connection.prepareStatement(statement)) {
                int index = 1;
                for (Object value : chunk) {
                    idColumn.getStorageType().bind(ps, index++, value);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(mapRow(type, rs));
                    }
                }
            } catch (SQLException e) {
                throw new BackendException("Failed to query " + type.getTableName(), e);
            }
        }
        return rows;
    }

    private String selectPrefix(EntityType type) {
        StringBuilder sb = new StringBuilder("SELECT ").append(q(EntityType.ID));
        for (String name : type.getColumnNames()) {
            sb.append(", ").append(q(name));
        }
        sb.append(", ").append(q(EntityType.VERSION_NUMBER)).append(", ")
                .append(q(EntityType.EFFECTIVE_DATE)).append(", ")
                .append(q(EntityType.EXPIRY_DATE)).append(" FROM ")
                .append(q(type.getTableName()));
        return sb.toString();
    }

    private EntityRecord mapRow(EntityType type, ResultSet rs) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ColumnDefinition column : type.getColumns()) {
            values.put(column.getName(), column.getStorageType().read(rs, column.getName()));
        }
        return EntityRecord.persisted(type, values, rs.getLong(EntityType.ID),
                rs.getInt(EntityType.VERSION_NUMBER),
                rs.getObject(EntityType.EFFECTIVE_DATE, LocalDate.class),
                rs.getObject(EntityType.EXPIRY_DATE, LocalDate.class));
    }

    private List<EntityRecord> attachGeneratedKeys(PreparedStatement ps, List<EntityRecord> batch)
            throws SQLException {
        List<Long> keys = new ArrayList<>(batch.size());
        try (ResultSet rs = ps.getGeneratedKeys()) {
            while (rs != null && rs.next()) {
                keys.add(rs.getLong(1));
            }
        }
        if (keys.size() != batch.size()) {
            log.debug("Driver returned {} generated keys for {} rows; ids left unset", keys.size(),
                    batch.size());
            return batch;
        }
        List<EntityRecord> withIds = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            withIds.add(batch.get(i).withId(keys.get(i)));
        }
        return withIds;
    }

    private void verifyColumns(EntityType type) throws SQLException {
        Set<String> actual = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        actual.addAll(dialect.getColumnNames(connection, type.getTableName()));
        List<String> expected = new ArrayList<>(EntityType.SYSTEM_COLUMNS);
        expected.addAll(type.getColumnNames());
        List<String> missing = expected.stream().filter(c -> !actual.contains(c))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new SchemaException("Existing table " + type.getTableName()
                    + " lacks columns: " + String.join(", ", missing));
        }
    }

    private String createTableSql(EntityType type) {
        StringBuilder sb = new StringBuilder("CREATE TABLE ").append(q(type.getTableName()))
                .append(" (").append(q(EntityType.ID)).append(' ')
                .append(dialect.identityColumnSql());
        for (ColumnDefinition column : type.getColumns()) {
            sb.append(", ").append(q(column.getName())).append(' ')
                    .append(dialect.columnTypeSql(column.getType()));
        }
        sb.append(", ").append(q(EntityType.VERSION_NUMBER)).append(" INTEGER NOT NULL");
        sb.append(", ").append(q(EntityType.EFFECTIVE_DATE)).append(" DATE NOT NULL");
        sb.append(", ").append(q(EntityType.EXPIRY_DATE)).append(" DATE");
        sb.append(")");
        return sb.toString();
    }

    /**
     * Builds an index name {@code <prefix>_<table>_<suffix>}, lower-cased and truncated.
     *
     * @param prefix index kind prefix
     * @param table table name
     * @param suffix distinguishing suffix
     * @return index name
     */
    static String indexName(String prefix, String table, String suffix) {
        String name = (prefix + "_" + table + "_" + suffix).toLowerCase(Locale.ROOT);
        return name.length() > MAX_INDEX_NAME_LENGTH ? name.substring(0, MAX_INDEX_NAME_LENGTH)
                : name;
    }

    private String q(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }
}
