package io.github.yok.statlink.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonDataParserTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_正常ケース_キーが揃っていない配列_列はキーの和集合となること() throws Exception {
        File file = write("countries.json",
                "[{\"iso\":\"AT\",\"population\":9000000},"
                        + "{\"iso\":\"DE\",\"name\":\"Deutschland\",\"tags\":[1,2]}]");

        ITable table = new JsonDataParser().parse(file);

        Column[] columns = table.getTableMetaData().getColumns();
        assertEquals(4, columns.length);
        assertEquals("iso", columns[0].getColumnName());
        assertEquals("population", columns[1].getColumnName());
        assertEquals("name", columns[2].getColumnName());
        assertEquals("9000000", table.getValue(0, "population"));
        assertNull(table.getValue(0, "name"));
        assertEquals("[1,2]", table.getValue(1, "tags"));
    }

    @Test
    void parse_異常ケース_配列以外を指定する_DataSetExceptionが送出されること() throws Exception {
        File file = write("object.json", "{\"iso\":\"AT\"}");
        assertThrows(DataSetException.class, () -> new JsonDataParser().parse(file));
    }

    @Test
    void parse_異常ケース_要素がオブジェクトでない_DataSetExceptionが送出されること() throws Exception {
        File file = write("numbers.json", "[1,2]");
        assertThrows(DataSetException.class, () -> new JsonDataParser().parse(file));
    }

    private File write(String name, String content) throws Exception {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path.toFile();
    }
}
