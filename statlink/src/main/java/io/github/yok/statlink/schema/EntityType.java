package io.github.yok.statlink.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Validated, immutable definition of a versioned entity.
 *
 * <p>
 * Instances are created only by {@link SchemaRegistry}. Besides the declared columns every entity
 * table carries the four system columns {@link #ID}, {@link #VERSION_NUMBER},
 * {@link #EFFECTIVE_DATE} and {@link #EXPIRY_DATE}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EntityType {

    public static final String ID = "id";
    public static final String VERSION_NUMBER = "version_number";
    public static final String EFFECTIVE_DATE = "effective_date";
    public static final String EXPIRY_DATE = "expiry_date";

    // System columns in table order (id first, the others after the declared columns)
    public static final List<String> SYSTEM_COLUMNS =
            ImmutableList.of(ID, VERSION_NUMBER, EFFECTIVE_DATE, EXPIRY_DATE);

    private static final ImmutableSet<String> SYSTEM_COLUMN_KEYS =
            ImmutableSet.copyOf(SYSTEM_COLUMNS);

    private final String tableName;

    private final String uniqueIdentifier;

    private final ImmutableList<ColumnDefinition> columns;

    EntityType(String tableName, String uniqueIdentifier, List<ColumnDefinition> columns) {
        this.tableName = tableName;
        this.uniqueIdentifier = uniqueIdentifier;
        this.columns = ImmutableList.copyOf(columns);
    }

    /**
     * Returns whether the given name is reserved for a system column (case-insensitive).
     *
     * @param name column name
     * @return {@code true} when reserved
     */
    public static boolean isSystemColumn(String name) {
        return name != null && SYSTEM_COLUMN_KEYS.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Declared column names in declaration order.
     *
     * @return immutable list of names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDefinition::getName)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Looks up a declared column by exact name.
     *
     * @param name column name
     * @return column definition, or empty when not declared
     */
    public Optional<ColumnDefinition> getColumn(String name) {
        return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    /**
     * Returns the definition of the unique identifier column.
     *
     * @return identifier column
     */
    public ColumnDefinition getIdentifierColumn() {
        return getColumn(uniqueIdentifier).orElseThrow(() -> new IllegalStateException(
                "Identifier column missing from " + tableName + ": " + uniqueIdentifier));
    }
}
