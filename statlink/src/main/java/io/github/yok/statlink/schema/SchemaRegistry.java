package io.github.yok.statlink.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns entity descriptions into validated {@link EntityType}s and remembers them for the rest of
 * the run.
 *
 * <p>
 * Table names are registered case-insensitively. Defining the same table twice with an identical
 * description returns the type registered first; a differing description is rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaRegistry {

    // Table and column names are embedded in SQL, so only plain identifiers are allowed
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Path entityDir;

    private final ObjectMapper objectMapper;

    private final Map<String, EntityType> registered = new LinkedHashMap<>();

    /**
     * Creates a registry that loads descriptions from {@code entityDir}.
     *
     * @param entityDir directory holding {@code <name>.json} descriptions (may be {@code null} when
     *        only {@link #define(EntityDescription)} is used)
     */
    public SchemaRegistry(Path entityDir) {
        this(entityDir, new ObjectMapper());
    }

    /**
     * Creates a registry with a custom {@link ObjectMapper}.
     *
     * @param entityDir directory holding entity descriptions
     * @param objectMapper mapper used to read descriptions
     */
    public SchemaRegistry(Path entityDir, ObjectMapper objectMapper) {
        this.entityDir = entityDir;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads {@code <entityDir>/<entityName>.json} and defines it.
     *
     * @param entityName entity file name without extension
     * @return registered entity type
     * @throws SchemaException if the file is missing, unreadable or invalid
     */
    public EntityType load(String entityName) {
        if (StringUtils.isBlank(entityName)) {
            throw new SchemaException("Entity name must not be blank.");
        }
        if (entityDir == null) {
            throw new SchemaException("No entity directory configured; cannot load " + entityName);
        }
        Path file = entityDir.resolve(entityName + ".json");
        if (!Files.isRegularFile(file)) {
            throw new SchemaException("Entity description not found: " + file);
        }
        EntityDescription description;
        try {
            description = objectMapper.readValue(file.toFile(), EntityDescription.class);
        } catch (IOException e) {
            throw new SchemaException("Failed to read entity description: " + file, e);
        }
        if (description == null) {
            throw new SchemaException("Entity description is empty: " + file);
        }
        log.debug("Loaded entity description {} from {}", description.getTableName(), file);
        return define(description);
    }

    /**
     * Validates a description and registers the resulting type.
     *
     * @param description raw description
     * @return registered entity type
     * @throws SchemaException if the description is invalid or conflicts with a registered one
     */
    public synchronized EntityType define(EntityDescription description) {
        EntityType type = validate(description);
        String key = type.getTableName().toLowerCase(Locale.ROOT);
        EntityType existing = registered.get(key);
        if (existing != null) {
            if (existing.equals(type)) {
                return existing;
            }
            throw new SchemaException("Table " + type.getTableName()
                    + " is already registered with a different definition.");
        }
        registered.put(key, type);
        log.info("[{}] Registered entity: identifier={}, columns={}", type.getTableName(),
                type.getUniqueIdentifier(), type.getColumns().size());
        return type;
    }

    /**
     * Returns a type registered earlier in this run.
     *
     * @param tableName table name (case-insensitive)
     * @return registered type, or empty
     */
    public synchronized Optional<EntityType> find(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registered.get(tableName.toLowerCase(Locale.ROOT)));
    }

    private EntityType validate(EntityDescription description) {
        if (description == null) {
            throw new SchemaException("Entity description must not be null.");
        }
        String tableName = StringUtils.trimToNull(description.getTableName());
        if (tableName == null) {
            throw new SchemaException("table_name is missing.");
        }
        requireIdentifier(tableName, "table name");

        String identifier = StringUtils.trimToNull(description.getIdentifier());
        if (identifier == null) {
            throw new SchemaException("[" + tableName + "] identifier is missing.");
        }
        if (description.getColumns() == null || description.getColumns().isEmpty()) {
            throw new SchemaException("[" + tableName + "] columns are missing.");
        }

        List<ColumnDefinition> columns = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (EntityDescription.Column c : description.getColumns()) {
            if (c == null) {
                throw new SchemaException("[" + tableName + "] null column entry.");
            }
            String name = StringUtils.trimToNull(c.getName());
            if (name == null) {
                throw new SchemaException("[" + tableName + "] a column has no name.");
            }
            requireIdentifier(name, "column name");
            if (EntityType.isSystemColumn(name)) {
                throw new SchemaException(
                        "[" + tableName + "] column collides with a system column: " + name);
            }
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                throw new SchemaException("[" + tableName + "] duplicate column: " + name);
            }
            if (StringUtils.isBlank(c.getType())) {
                throw new SchemaException("[" + tableName + "] column " + name + " has no type.");
            }
            ColumnType type;
            try {
                type = ColumnType.parse(c.getType());
            } catch (SchemaException e) {
                throw new SchemaException("[" + tableName + "] column " + name + ": "
                        + e.getMessage(), e);
            }
            columns.add(new ColumnDefinition(name, type));
        }

        ColumnDefinition idColumn = columns.stream().filter(c -> c.getName().equals(identifier))
                .findFirst().orElseThrow(() -> new SchemaException("[" + tableName
                        + "] identifier does not name a declared column: " + identifier));
        if (idColumn.getStorageType() == StorageType.TEXT) {
            throw new SchemaException(
                    "[" + tableName + "] identifier column cannot be Text: " + identifier);
        }
        return new EntityType(tableName, identifier, columns);
    }

    private static void requireIdentifier(String name, String what) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new SchemaException("Invalid " + what + ": " + name);
        }
    }
}
