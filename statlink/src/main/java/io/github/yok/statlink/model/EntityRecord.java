package io.github.yok.statlink.model;

import io.github.yok.statlink.schema.EntityType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of a versioned entity table.
 *
 * <p>
 * A record is immutable. A <em>candidate</em> (built by the bulk loader) carries only declared
 * values; the versioned store derives persisted versions from it with {@link #asVersion}, and
 * {@link #withId}/{@link #expiredOn}. Declared values are expected to be normalized to their
 * column's {@link io.github.yok.statlink.schema.StorageType}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EntityRecord {

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final EntityType entityType;

    // Declared column values in declaration order
    private final Map<String, Object> values;

    // Surrogate key; null until persisted
    private final Long id;

    // null for candidates
    private final Integer versionNumber;

    private final LocalDate effectiveDate;

    // null means current
    private final LocalDate expiryDate;

    private EntityRecord(EntityType entityType, Map<String, Object> values, Long id,
            Integer versionNumber, LocalDate effectiveDate, LocalDate expiryDate) {
        this.entityType = entityType;
        this.values = values;
        this.id = id;
        this.versionNumber = versionNumber;
        this.effectiveDate = effectiveDate;
        this.expiryDate = expiryDate;
    }

    /**
     * Creates a candidate with the declared values of {@code type}.
     *
     * <p>
     * Missing declared columns are stored as {@code null}; keys that are not declared columns are
     * rejected.
     * </p>
     *
     * @param type entity type
     * @param values declared values keyed by column name
     * @return new candidate
     * @throws IllegalArgumentException if {@code values} contains undeclared columns
     */
    public static EntityRecord candidate(EntityType type, Map<String, ?> values) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(values, "values must not be null");
        List<String> names = type.getColumnNames();
        for (String key : values.keySet()) {
            if (!names.contains(key)) {
                throw new IllegalArgumentException(
                        "Column " + key + " is not declared by " + type.getTableName());
            }
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String name : names) {
            ordered.put(name, values.get(name));
        }
        return new EntityRecord(type, Collections.unmodifiableMap(ordered), null, null, null,
                null);
    }

    /**
     * Creates a persisted record as read from the database.
     *
     * @param type entity type
     * @param values declared values
     * @param id surrogate key
     * @param versionNumber version number
     * @param effectiveDate effective date
     * @param expiryDate expiry date, or {@code null} when current
     * @return persisted record
     */
    public static EntityRecord persisted(EntityType type, Map<String, ?> values, long id,
            int versionNumber, LocalDate effectiveDate, LocalDate expiryDate) {
        EntityRecord base = candidate(type, values);
        return new EntityRecord(type, base.values, id, versionNumber, effectiveDate, expiryDate);
    }

    /**
     * Returns a copy carrying a version number and effective date, not yet expired and without id.
     *
     * @param version version number (1-based)
     * @param effective effective date
     * @return new record
     */
    public EntityRecord asVersion(int version, LocalDate effective) {
        return new EntityRecord(entityType, values, null, version, effective, null);
    }

    /**
     * Returns a copy with the given surrogate key.
     *
     * @param newId database-assigned key
     * @return new record
     */
    public EntityRecord withId(long newId) {
        return new EntityRecord(entityType, values, newId, versionNumber, effectiveDate,
                expiryDate);
    }

    /**
     * Returns a copy expired on the given date.
     *
     * @param date expiry date
     * @return new record
     */
    public EntityRecord expiredOn(LocalDate date) {
        return new EntityRecord(entityType, values, id, versionNumber, effectiveDate, date);
    }

    /**
     * Returns a declared value.
     *
     * @param column column name
     * @return value, or {@code null}
     */
    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the value of the unique identifier column.
     *
     * @return identifier value, possibly {@code null}
     */
    public Object identifierValue() {
        return values.get(entityType.getUniqueIdentifier());
    }

    /**
     * Whether this record is the current version.
     *
     * @return {@code true} when {@code expiry_date} is unset
     */
    public boolean isCurrent() {
        return expiryDate == null;
    }

    /**
     * Key identifying the declared values, usable in hash-based collections.
     *
     * @return list of declared values in declaration order
     */
    public List<Object> valueKey() {
        return new ArrayList<>(values.values());
    }

    /**
     * Whether every declared value equals the other's; system columns are ignored.
     *
     * @param other other record
     * @return {@code true} when the records are duplicates
     */
    public boolean sameDeclaredValues(EntityRecord other) {
        return other != null && values.equals(other.values);
    }
}
