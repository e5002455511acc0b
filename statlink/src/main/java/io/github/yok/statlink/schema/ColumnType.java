package io.github.yok.statlink.schema;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * A storage type with its optional length, parsed from a type descriptor such as
 * {@code String(50)}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnType {

    // Length applied to String columns declared without one
    public static final int DEFAULT_STRING_LENGTH = 255;

    private static final Pattern DESCRIPTOR =
            Pattern.compile("^\\s*([A-Za-z]+)\\s*(?:\\(\\s*([^)]*?)\\s*\\))?\\s*$");

    StorageType storageType;

    // Declared or defaulted length; null for types without one
    Integer length;

    /**
     * Parses a type descriptor.
     *
     * @param descriptor descriptor text, e.g. {@code Integer}, {@code String(10)}
     * @return parsed column type
     * @throws SchemaException if the descriptor is malformed or names an unsupported type
     */
    public static ColumnType parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new SchemaException("Type descriptor must not be blank.");
        }
        Matcher m = DESCRIPTOR.matcher(descriptor);
        if (!m.matches()) {
            throw new SchemaException("Malformed type descriptor: " + descriptor);
        }
        StorageType type = StorageType.fromDescriptorName(m.group(1)).orElseThrow(
                () -> new SchemaException("Unsupported storage type: " + descriptor));

        String param = m.group(2);
        if (param == null) {
            return new ColumnType(type, type.acceptsLength() ? DEFAULT_STRING_LENGTH : null);
        }
        if (!type.acceptsLength()) {
            throw new SchemaException(
                    "Storage type " + type.getDescriptorName() + " takes no length: " + descriptor);
        }
        int length;
        try {
            length = Integer.parseInt(param);
        } catch (NumberFormatException e) {
            throw new SchemaException("Malformed length in type descriptor: " + descriptor, e);
        }
        if (length <= 0) {
            throw new SchemaException("Length must be positive: " + descriptor);
        }
        return new ColumnType(type, length);
    }

    @Override
    public String toString() {
        return length == null ? storageType.getDescriptorName()
                : storageType.getDescriptorName() + "(" + length + ")";
    }
}
