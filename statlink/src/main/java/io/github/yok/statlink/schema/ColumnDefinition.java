package io.github.yok.statlink.schema;

import lombok.Value;

/**
 * A declared column of an entity: its name and its type.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnDefinition {

    String name;

    ColumnType type;

    /**
     * Shortcut for the column's storage type.
     *
     * @return storage type
     */
    public StorageType getStorageType() {
        return type.getStorageType();
    }
}
