package io.github.yok.statlink.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import lombok.Getter;

/**
 * Enumeration of the primitive storage types an entity column may declare.
 *
 * <p>
 * Besides naming the type, each constant normalizes values into one canonical Java representation
 * so that a value parsed from a dataset and the same value read back from any supported database
 * compare equal with {@link Object#equals(Object)}:
 * </p>
 * <ul>
 * <li>integer types: {@link Long}</li>
 * <li>{@link #FLOAT}: {@link Double}</li>
 * <li>{@link #NUMERIC}: {@link BigDecimal} without trailing zeros</li>
 * <li>{@link #STRING}, {@link #TEXT}: {@link String}</li>
 * <li>{@link #BOOLEAN}: {@link Boolean}</li>
 * <li>{@link #DATE}: {@link LocalDate}; {@link #DATE_TIME}: {@link LocalDateTime} truncated to
 * microseconds</li>
 * </ul>
 *
 * <p>
 * Blank strings normalize to {@code null} for every type. {@link #INTEGER} and
 * {@link #SMALL_INTEGER} values are range-checked against the 32-bit and 16-bit column bounds.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum StorageType {

    INTEGER("Integer", Types.INTEGER),

    SMALL_INTEGER("SmallInteger", Types.SMALLINT),

    BIG_INTEGER("BigInteger", Types.BIGINT),

    FLOAT("Float", Types.DOUBLE),

    NUMERIC("Numeric", Types.NUMERIC),

    // Bounded text; the only type accepting a length parameter.
    STRING("String", Types.VARCHAR),

    // Unbounded text; cannot be used as the unique identifier.
    TEXT("Text", Types.VARCHAR),

    BOOLEAN("Boolean", Types.BOOLEAN),

    DATE("Date", Types.DATE),

    DATE_TIME("DateTime", Types.TIMESTAMP);

    // Name used in entity descriptions (e.g., "String(50)")
    private final String descriptorName;

    // JDBC type used when binding null
    private final int sqlType;

    StorageType(String descriptorName, int sqlType) {
        this.descriptorName = descriptorName;
        this.sqlType = sqlType;
    }

    /**
     * Resolves a storage type from its descriptor name (case-insensitive).
     *
     * @param name descriptor name without parameters
     * @return matching type, or empty when unsupported
     */
    public static Optional<StorageType> fromDescriptorName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.descriptorName.toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    /**
     * Returns whether a length parameter may follow the descriptor name.
     *
     * @return {@code true} only for {@link #STRING}
     */
    public boolean acceptsLength() {
        return this == STRING;
    }

    /**
     * Converts a raw value into this type's canonical representation.
     *
     * @param raw raw value from a dataset or from JDBC
     * @return normalized value, or {@code null}
     * @throws IllegalArgumentException if the value cannot be represented by this type
     */
    public Object normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String && ((String) raw).isBlank()) {
            return null;
        }
        switch (this) {
            case INTEGER:
                return checkRange(toLong(raw), Integer.MIN_VALUE, Integer.MAX_VALUE);
            case SMALL_INTEGER:
                return checkRange(toLong(raw), Short.MIN_VALUE, Short.MAX_VALUE);
            case BIG_INTEGER:
                return toLong(raw);
            case FLOAT:
                return toDouble(raw);
            case NUMERIC:
                return toDecimal(raw);
            case STRING:
            case TEXT:
                return raw.toString();
            case BOOLEAN:
                return toBoolean(raw);
            case DATE:
                return FlexibleDateParsers.toLocalDate(raw);
            case DATE_TIME:
                return truncateToMicros(FlexibleDateParsers.toLocalDateTime(raw));
            default:
                throw new IllegalStateException("Unhandled storage type: " + this);
        }
    }

    /**
     * Reads a column of this type from the current row and normalizes it.
     *
     * @param rs result set positioned on a row
     * @param column column label
     * @return normalized value, or {@code null} for SQL NULL
     * @throws SQLException if the value cannot be read
     */
    public Object read(ResultSet rs, String column) throws SQLException {
        switch (this) {
            case INTEGER:
            case SMALL_INTEGER:
            case BIG_INTEGER: {
                long value = rs.getLong(column);
                return rs.wasNull() ? null : value;
            }
            case FLOAT: {
                double value = rs.getDouble(column);
                return rs.wasNull() ? null : value;
            }
            case NUMERIC:
                return normalize(rs.getBigDecimal(column));
            case STRING:
            case TEXT:
                return rs.getString(column);
            case BOOLEAN: {
                boolean value = rs.getBoolean(column);
                return rs.wasNull() ? null : value;
            }
            case DATE:
                return rs.getObject(column, LocalDate.class);
            case DATE_TIME:
                return truncateToMicros(rs.getObject(column, LocalDateTime.class));
            default:
                throw new IllegalStateException("Unhandled storage type: " + this);
        }
    }

    /**
     * Binds a normalized value of this type to a statement parameter.
     *
     * @param ps prepared statement
     * @param index one-based parameter index
     * @param value normalized value, or {@code null}
     * @throws SQLException if binding fails
     */
    public void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType);
            return;
        }
        switch (this) {
            case INTEGER:
            case SMALL_INTEGER:
            case BIG_INTEGER:
                ps.setLong(index, (Long) value);
                break;
            case FLOAT:
                ps.setDouble(index, (Double) value);
                break;
            case NUMERIC:
                ps.setBigDecimal(index, (BigDecimal) value);
                break;
            case STRING:
            case TEXT:
                ps.setString(index, (String) value);
                break;
            case BOOLEAN:
                ps.setBoolean(index, (Boolean) value);
                break;
            case DATE:
            case DATE_TIME:
                ps.setObject(index, value);
                break;
            default:
                throw new IllegalStateException("Unhandled storage type: " + this);
        }
    }

    private static Long toLong(Object raw) {
        try {
            if (raw instanceof Long || raw instanceof Integer || raw instanceof Short
                    || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof BigInteger) {
                return ((BigInteger) raw).longValueExact();
            }
            if (raw instanceof BigDecimal) {
                return ((BigDecimal) raw).longValueExact();
            }
            if (raw instanceof Number) {
                return BigDecimal.valueOf(((Number) raw).doubleValue()).longValueExact();
            }
            return new BigDecimal(raw.toString().trim()).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Not an integer: " + raw, e);
        }
    }

    private static Long checkRange(Long value, long min, long max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "Out of range [" + min + ", " + max + "]: " + value);
        }
        return value;
    }

    // TIMESTAMP / DATETIME(6) keep microseconds at most
    private static LocalDateTime truncateToMicros(LocalDateTime value) {
        return value == null ? null : value.truncatedTo(ChronoUnit.MICROS);
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        return Double.valueOf(raw.toString().trim());
    }

    private static BigDecimal toDecimal(Object raw) {
        BigDecimal value;
        if (raw instanceof BigDecimal) {
            value = (BigDecimal) raw;
        } else if (raw instanceof BigInteger) {
            value = new BigDecimal((BigInteger) raw);
        } else if (raw instanceof Double || raw instanceof Float) {
            value = BigDecimal.valueOf(((Number) raw).doubleValue());
        } else if (raw instanceof Number) {
            value = BigDecimal.valueOf(((Number) raw).longValue());
        } else {
            value = new BigDecimal(raw.toString().trim());
        }
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).intValue() != 0;
        }
        String text = raw.toString().trim().toLowerCase(Locale.ROOT);
        switch (text) {
            case "true":
            case "t":
            case "yes":
            case "y":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "f":
            case "no":
            case "n":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("Not a boolean: " + raw);
        }
    }
}
