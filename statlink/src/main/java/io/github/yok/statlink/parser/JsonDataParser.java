package io.github.yok.statlink.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;

/**
 * Implementation of {@link DataParser} that reads a JSON array of flat objects.
 *
 * <p>
 * The column set is the union of the objects' keys in first-seen order; keys absent from an object
 * read as {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonDataParser implements DataParser {

    private final ObjectMapper mapper;

    public JsonDataParser() {
        this(new ObjectMapper());
    }

    public JsonDataParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ITable parse(File file) throws IOException, DataSetException {
        JsonNode root = mapper.readTree(file);
        if (root == null || !root.isArray()) {
            throw new DataSetException("Expected a JSON array of objects: " + file);
        }
        List<JsonNode> rows = new ArrayList<>();
        root.forEach(rows::add);
        return toTable(FilenameUtils.getBaseName(file.getName()), rows);
    }

    /**
     * Builds a table from JSON objects, one row per object.
     *
     * @param tableName table name
     * @param rows JSON objects
     * @return table
     * @throws DataSetException if an element is not an object
     */
    static ITable toTable(String tableName, List<JsonNode> rows) throws DataSetException {
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                throw new DataSetException("Expected a JSON object but found: " + row.getNodeType());
            }
            Iterator<String> it = row.fieldNames();
            it.forEachRemaining(names::add);
        }
        Column[] columns =
                names.stream().map(n -> new Column(n, DataType.VARCHAR)).toArray(Column[]::new);
        DefaultTable table = new DefaultTable(new DefaultTableMetaData(tableName, columns));
        for (JsonNode row : rows) {
            Object[] values = new Object[columns.length];
            for (int i = 0; i < columns.length; i++) {
                values[i] = cellText(row.get(columns[i].getColumnName()));
            }
            table.addRow(values);
        }
        return table;
    }

    private static String cellText(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isContainerNode() ? value.toString() : value.asText();
    }
}
