package io.github.yok.statlink.parser;

import java.io.File;
import java.util.List;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.dataset.ITable;

/**
 * Factory for reading a dataset file with the parser matching its format.
 *
 * <p>
 * The format is taken from an explicit setting when given, otherwise from the file extension.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class DatasetReaderFactory {

    @Generated
    private DatasetReaderFactory() {}

    /**
     * Reads a dataset file.
     *
     * @param file dataset file
     * @param format explicit format name, or {@code null} to use the extension
     * @param delimiter delimiter for delimited text, or {@code null} for the extension default
     * @param nullValues cell values read as {@code null} in delimited text
     * @return parsed table
     * @throws Exception if the format is unknown or parsing fails
     */
    public static ITable read(File file, String format, String delimiter, List<String> nullValues)
            throws Exception {
        DataFormat resolved = resolveFormat(file, format);
        log.debug("Reading {} as {}", file.getName(), resolved);
        return createParser(resolved, resolveDelimiter(file, delimiter), nullValues).parse(file);
    }

    /**
     * Resolves the format of a file.
     *
     * @param file dataset file
     * @param format explicit format name, or {@code null}
     * @return resolved format
     * @throws IllegalArgumentException if neither the setting nor the extension is recognized
     */
    public static DataFormat resolveFormat(File file, String format) {
        if (StringUtils.isNotBlank(format)) {
            return DataFormat.fromName(format).orElseThrow(
                    () -> new IllegalArgumentException("Unsupported dataset format: " + format));
        }
        String ext = FilenameUtils.getExtension(file.getName());
        return DataFormat.fromExtension(ext).orElseThrow(() -> new IllegalArgumentException(
                "Cannot determine dataset format from extension: " + file.getName()));
    }

    /**
     * Creates the parser for a format.
     *
     * @param format dataset format
     * @param delimiter delimiter for {@link DataFormat#CSV}
     * @param nullValues null tokens for {@link DataFormat#CSV}
     * @return parser
     */
    public static DataParser createParser(DataFormat format, char delimiter,
            List<String> nullValues) {
        switch (format) {
            case CSV:
                return new CsvDataParser(delimiter, nullValues);
            case JSON:
                return new JsonDataParser();
            case GEOJSON:
                return new GeoJsonDataParser();
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    /**
     * Resolves the delimiter character. {@code \t} and {@code tab} denote a tab.
     *
     * @param file dataset file
     * @param delimiter configured delimiter, or {@code null}
     * @return delimiter character
     * @throws IllegalArgumentException if the delimiter is not a single character
     */
    static char resolveDelimiter(File file, String delimiter) {
        if (StringUtils.isEmpty(delimiter)) {
            return "tsv".equalsIgnoreCase(FilenameUtils.getExtension(file.getName())) ? '\t' : ',';
        }
        if ("\\t".equals(delimiter) || "tab".equalsIgnoreCase(delimiter)) {
            return '\t';
        }
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character: " + delimiter);
        }
        return delimiter.charAt(0);
    }
}
