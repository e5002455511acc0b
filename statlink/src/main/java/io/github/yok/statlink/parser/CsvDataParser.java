package io.github.yok.statlink.parser;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Implementation of {@link DataParser} for delimited text files (UTF-8, optional BOM).
 *
 * <p>
 * The first record is the header. Header names and cells are kept verbatim; a cell equal to one of
 * the configured null tokens (for example the {@code :} placeholder of statistics exports) becomes
 * {@code null}. Records shorter than the header are padded with {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvDataParser implements DataParser {

    private final char delimiter;

    private final Set<String> nullValues;

    /**
     * Creates a comma-separated parser without null tokens.
     */
    public CsvDataParser() {
        this(',', List.of());
    }

    /**
     * Creates a parser.
     *
     * @param delimiter field delimiter
     * @param nullValues cell values to read as {@code null}
     */
    public CsvDataParser(char delimiter, Collection<String> nullValues) {
        this.delimiter = delimiter;
        this.nullValues = new HashSet<>(nullValues == null ? List.of() : nullValues);
    }

    @Override
    public ITable parse(File file) throws IOException, DataSetException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setHeader()
                .setSkipHeaderRecord(true).setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
                .build();
        try (Reader reader = new InputStreamReader(BOMInputStream.builder().setFile(file).get(),
                StandardCharsets.UTF_8); CSVParser parser = format.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new DataSetException("No header row in " + file);
            }
            Column[] columns = headers.stream().map(h -> new Column(h, DataType.VARCHAR))
                    .toArray(Column[]::new);
            DefaultTable table = new DefaultTable(
                    new DefaultTableMetaData(FilenameUtils.getBaseName(file.getName()), columns));
            for (CSVRecord record : parser) {
                Object[] values = new Object[columns.length];
                for (int i = 0; i < columns.length; i++) {
                    String cell = i < record.size() ? record.get(i) : null;
                    values[i] = cell == null || nullValues.contains(cell) ? null : cell;
                }
                table.addRow(values);
            }
            log.debug("Parsed {} rows x {} columns from {}", table.getRowCount(), columns.length,
                    file.getName());
            return table;
        }
    }
}
