package io.github.yok.statlink.core;

import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.ColumnDefinition;
import io.github.yok.statlink.schema.EntityType;
import io.github.yok.statlink.schema.StorageType;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Converts a tabular dataset into candidate {@link EntityRecord}s.
 *
 * <p>
 * Exactly the declared columns are selected; extra dataset columns are ignored. Column lookup is
 * exact first and falls back to a case-insensitive match. Each value is normalized to its column's
 * {@link StorageType}; DBUnit's {@link ITable#NO_VALUE} is treated as {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BulkLoader {

    /**
     * Builds one candidate per dataset row.
     *
     * @param type target entity type
     * @param table dataset
     * @return candidates in row order, system columns unset
     * @throws ShapeException if a declared column is absent, a value does not fit its column, or a
     *         row lacks an identifier value
     */
    public List<EntityRecord> load(EntityType type, ITable table) {
        String tableName = type.getTableName();
        Map<ColumnDefinition, String> sourceColumns = resolveColumns(type, table);

        List<EntityRecord> candidates;
        try {
            int rowCount = table.getRowCount();
            candidates = new ArrayList<>(rowCount);
            for (int row = 0; row < rowCount; row++) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (Map.Entry<ColumnDefinition, String> e : sourceColumns.entrySet()) {
                    ColumnDefinition column = e.getKey();
                    Object raw = table.getValue(row, e.getValue());
                    values.put(column.getName(), convert(tableName, row, column, raw));
                }
                if (values.get(type.getUniqueIdentifier()) == null) {
                    throw new ShapeException("[" + tableName + "] Row " + (row + 1)
                            + " has no value for identifier " + type.getUniqueIdentifier());
                }
                candidates.add(EntityRecord.candidate(type, values));
            }
        } catch (DataSetException e) {
            throw new ShapeException("[" + tableName + "] Failed to read dataset", e);
        }
        log.info("[{}] Loaded {} candidate rows", tableName, candidates.size());
        return candidates;
    }

    private Map<ColumnDefinition, String> resolveColumns(EntityType type, ITable table) {
        Column[] available;
        try {
            available = table.getTableMetaData().getColumns();
        } catch (DataSetException e) {
            throw new ShapeException("[" + type.getTableName() + "] Failed to read dataset columns",
                    e);
        }
        Map<ColumnDefinition, String> resolved = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (ColumnDefinition column : type.getColumns()) {
            String source = findColumn(available, column.getName());
            if (source == null) {
                missing.add(column.getName());
            } else {
                resolved.put(column, source);
            }
        }
        if (!missing.isEmpty()) {
            throw new ShapeException("[" + type.getTableName() + "] Dataset lacks declared columns: "
                    + String.join(", ", missing));
        }
        return resolved;
    }

    private static String findColumn(Column[] available, String name) {
        for (Column c : available) {
            if (c.getColumnName().equals(name)) {
                return c.getColumnName();
            }
        }
        for (Column c : available) {
            if (c.getColumnName().equalsIgnoreCase(name)) {
                return c.getColumnName();
            }
        }
        return null;
    }

    private static Object convert(String tableName, int row, ColumnDefinition column, Object raw) {
        if (raw == ITable.NO_VALUE) {
            return null;
        }
        Object value;
        try {
            value = column.getStorageType().normalize(raw);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ShapeException("[" + tableName + "] Row " + (row + 1) + ", column "
                    + column.getName() + ": cannot convert '" + raw + "' to " + column.getType(),
                    e);
        }
        Integer length = column.getType().getLength();
        if (value instanceof String && length != null
                && ((String) value).codePointCount(0, ((String) value).length()) > length) {
            throw new ShapeException("[" + tableName + "] Row " + (row + 1) + ", column "
                    + column.getName() + ": value exceeds " + column.getType() + ": " + value);
        }
        return value;
    }
}
