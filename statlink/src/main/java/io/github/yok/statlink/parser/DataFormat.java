package io.github.yok.statlink.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported dataset formats and their file extensions.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Delimited text; .tsv defaults to a tab delimiter
    CSV("csv", "tsv"),

    // Array of flat JSON objects
    JSON("json"),

    // GeoJSON FeatureCollection; feature properties become rows
    GEOJSON("geojson");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves a format from a file extension.
     *
     * @param ext file extension without dot
     * @return matching format, or empty
     */
    public static Optional<DataFormat> fromExtension(String ext) {
        return Arrays.stream(values()).filter(f -> f.matches(ext)).findFirst();
    }

    /**
     * Resolves a format from its name (case-insensitive) or one of its extensions.
     *
     * @param name format name such as {@code csv} or {@code geojson}
     * @return matching format, or empty
     */
    public static Optional<DataFormat> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (DataFormat f : values()) {
            if (f.name().equals(normalized)) {
                return Optional.of(f);
            }
        }
        return fromExtension(name.trim());
    }
}
