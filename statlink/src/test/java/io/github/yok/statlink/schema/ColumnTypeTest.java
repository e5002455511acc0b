package io.github.yok.statlink.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class ColumnTypeTest {

    @Test
    void parse_正常ケース_長さ付きStringを指定する_長さが保持されること() {
        ColumnType type = ColumnType.parse("String(10)");
        assertEquals(StorageType.STRING, type.getStorageType());
        assertEquals(10, type.getLength());
        assertEquals("String(10)", type.toString());
    }

    @Test
    void parse_正常ケース_長さなしStringを指定する_既定長255になること() {
        assertEquals(255, ColumnType.parse("string").getLength());
    }

    @Test
    void parse_正常ケース_大文字小文字と空白を含む型名を指定する_解決されること() {
        assertEquals(StorageType.DATE_TIME, ColumnType.parse(" datetime ").getStorageType());
        assertEquals(StorageType.SMALL_INTEGER, ColumnType.parse("SMALLINTEGER").getStorageType());
        ColumnType numeric = ColumnType.parse("Numeric");
        assertEquals(StorageType.NUMERIC, numeric.getStorageType());
        assertNull(numeric.getLength());
    }

    @Test
    void parse_異常ケース_数値でない長さを指定する_SchemaExceptionが送出されること() {
        assertThrows(SchemaException.class, () -> ColumnType.parse("String(abc)"));
    }

    @Test
    void parse_異常ケース_長さ0を指定する_SchemaExceptionが送出されること() {
        assertThrows(SchemaException.class, () -> ColumnType.parse("String(0)"));
    }

    @Test
    void parse_異常ケース_Integerに長さを指定する_SchemaExceptionが送出されること() {
        assertThrows(SchemaException.class, () -> ColumnType.parse("Integer(5)"));
    }

    @Test
    void parse_異常ケース_未対応の型名を指定する_SchemaExceptionが送出されること() {
        assertThrows(SchemaException.class, () -> ColumnType.parse("Geometry"));
        assertThrows(SchemaException.class, () -> ColumnType.parse("String(10"));
        assertThrows(SchemaException.class, () -> ColumnType.parse(""));
    }
}
