package io.github.yok.statlink.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class StorageTypeTest {

    @Test
    void normalize_正常ケース_空白文字列を指定する_全ての型でnullになること() {
        for (StorageType type : StorageType.values()) {
            assertNull(type.normalize("  "), type + " で null になりません");
        }
    }

    @Test
    void normalize_正常ケース_整数型に文字列と数値を指定する_Longに揃うこと() {
        assertEquals(42L, StorageType.INTEGER.normalize("42"));
        assertEquals(42L, StorageType.INTEGER.normalize(42));
        assertEquals(7L, StorageType.BIG_INTEGER.normalize(new BigDecimal("7.00")));
    }

    @Test
    void normalize_異常ケース_整数型に小数を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> StorageType.INTEGER.normalize("1.5"));
        assertThrows(IllegalArgumentException.class, () -> StorageType.INTEGER.normalize("abc"));
    }

    @Test
    void normalize_正常ケース_Numericに末尾ゼロ付き値を指定する_同値として比較できること() {
        assertEquals(StorageType.NUMERIC.normalize("1.50"), StorageType.NUMERIC.normalize(1.5));
        assertEquals(BigDecimal.ZERO, StorageType.NUMERIC.normalize("0.000"));
    }

    @Test
    void normalize_正常ケース_Booleanに各種表記を指定する_真偽値になること() {
        assertEquals(Boolean.TRUE, StorageType.BOOLEAN.normalize("yes"));
        assertEquals(Boolean.FALSE, StorageType.BOOLEAN.normalize("0"));
        assertThrows(IllegalArgumentException.class, () -> StorageType.BOOLEAN.normalize("maybe"));
    }

    @Test
    void normalize_正常ケース_Dateに年のみを指定する_1月1日になること() {
        assertEquals(LocalDate.of(2019, 1, 1), StorageType.DATE.normalize("2019"));
        assertEquals(LocalDateTime.of(2020, 3, 1, 12, 30),
                StorageType.DATE_TIME.normalize("2020-03-01 12:30"));
    }

    @Test
    void normalize_正常ケース_DateTimeにナノ秒を指定する_マイクロ秒に切り捨てられること() {
        assertEquals(LocalDateTime.of(2020, 1, 1, 10, 0, 0, 123_456_000),
                StorageType.DATE_TIME.normalize("2020-01-01T10:00:00.1234567"));
        assertEquals(LocalDateTime.of(2020, 1, 1, 10, 0, 0, 123_456_000),
                StorageType.DATE_TIME.normalize(LocalDateTime.of(2020, 1, 1, 10, 0, 0, 123_456_789)));
    }

    @Test
    void normalize_正常ケース_整数型に境界値を指定する_そのまま受け付けられること() {
        assertEquals((long) Integer.MAX_VALUE, StorageType.INTEGER.normalize("2147483647"));
        assertEquals((long) Integer.MIN_VALUE, StorageType.INTEGER.normalize("-2147483648"));
        assertEquals(-32768L, StorageType.SMALL_INTEGER.normalize("-32768"));
        assertEquals(3000000000L, StorageType.BIG_INTEGER.normalize("3000000000"));
    }

    @Test
    void normalize_異常ケース_整数型に範囲外の値を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> StorageType.INTEGER.normalize("3000000000"));
        assertThrows(IllegalArgumentException.class,
                () -> StorageType.INTEGER.normalize(-2147483649L));
        assertThrows(IllegalArgumentException.class,
                () -> StorageType.SMALL_INTEGER.normalize("70000"));
    }

    @Test
    void normalize_正常ケース_Stringに数値を指定する_文字列になること() {
        assertEquals("12", StorageType.STRING.normalize(12));
        assertEquals(1.25d, StorageType.FLOAT.normalize("1.25"));
    }
}
