package io.github.yok.statlink.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.statlink.db.h2.H2DialectHandler;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityDescription;
import io.github.yok.statlink.schema.EntityType;
import io.github.yok.statlink.schema.SchemaRegistry;
import io.github.yok.statlink.schema.StorageType;
import java.sql.Connection;
import java.sql.DriverManager;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VersionedTableDaoTest {

    private static final LocalDate EFFECTIVE = LocalDate.of(2024, 3, 10);

    private final EntityType type = new SchemaRegistry(null).define(new EntityDescription(
            "MEASURE", "code",
            List.of(new EntityDescription.Column("code", "String(10)"),
                    new EntityDescription.Column("amount", "Numeric"),
                    new EntityDescription.Column("ratio", "Float"),
                    new EntityDescription.Column("active", "Boolean"),
                    new EntityDescription.Column("observed", "DateTime"),
                    new EntityDescription.Column("note", "Text"))));

    private Connection connection;
    private VersionedTableDao dao;

    @BeforeEach
    void setup() throws Exception {
        connection = DriverManager.getConnection(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        connection.setAutoCommit(false);
        dao = new VersionedTableDao(connection, new H2DialectHandler(), 2, 2);
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
    }

    @Test
    void ensureTable_正常ケース_2回呼び出す_初回のみ作成されること() {
        assertTrue(dao.ensureTable(type));
        assertFalse(dao.ensureTable(type));
        assertEquals(0L, dao.countRows(type));
    }

    @Test
    void insert_正常ケース_各型の値を書き込む_読み戻した値が正規化済みの値と一致すること() {
        dao.ensureTable(type);
        Map<String, Object> raw = new HashMap<>();
        raw.put("code", "A1");
        raw.put("amount", "1.50");
        raw.put("ratio", "0.25");
        raw.put("active", "yes");
        raw.put("observed", "2024-03-10 08:15:30.5");
        raw.put("note", "long text");
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            values.put(e.getKey(),
                    type.getColumn(e.getKey()).get().getStorageType().normalize(e.getValue()));
        }
        EntityRecord row = EntityRecord.candidate(type, values).asVersion(1, EFFECTIVE);

        List<EntityRecord> inserted = dao.insert(type, List.of(row));
        List<EntityRecord> read = dao.findAll(type);

        assertEquals(1, inserted.size());
        assertEquals(1, read.size());
        assertTrue(read.get(0).sameDeclaredValues(row), "読み戻した値が一致しません: " + read);
        assertTrue(read.get(0).getId() > 0);
        assertEquals(EFFECTIVE, read.get(0).getEffectiveDate());
        assertNull(read.get(0).getExpiryDate());
    }

    @Test
    void findByIdentifiers_正常ケース_チャンクを跨ぐ識別子を指定する_全行が返されること() {
        dao.ensureTable(type);
        List<EntityRecord> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(row("C" + i, 1, null));
        }
        rows.add(row("C1", 2, EFFECTIVE));
        dao.insert(type, rows);

        List<EntityRecord> found = dao.findByIdentifiers(type, List.of("C1", "C3", "C5", "C9"));
        List<EntityRecord> current =
                dao.findCurrentByIdentifiers(type, List.of("C1", "C3", "C5", "C9"));

        assertEquals(4, found.size());
        assertEquals(3, current.size());
        assertTrue(current.stream().allMatch(EntityRecord::isCurrent));
        assertTrue(dao.findByIdentifiers(type, List.of()).isEmpty());
    }

    @Test
    void expire_正常ケース_現行行を失効する_2回目は0件となること() {
        dao.ensureTable(type);
        dao.insert(type, List.of(row("A1", 1, null)));
        long id = dao.findAll(type).get(0).getId();

        assertEquals(1, dao.expire(type, id, EFFECTIVE.minusDays(1)));
        assertEquals(0, dao.expire(type, id, EFFECTIVE));
        assertEquals(EFFECTIVE.minusDays(1), dao.findAll(type).get(0).getExpiryDate());
    }

    @Test
    void insert_異常ケース_版番号のない行を指定する_IllegalArgumentExceptionが送出されること() {
        dao.ensureTable(type);
        EntityRecord candidate = EntityRecord.candidate(type, Map.of("code", "A1"));
        assertThrows(IllegalArgumentException.class, () -> dao.insert(type, List.of(candidate)));
    }

    @Test
    void findAll_異常ケース_表が存在しない_BackendExceptionが送出されること() {
        assertThrows(BackendException.class, () -> dao.findAll(type));
    }

    @Test
    void indexName_正常ケース_長い表名を指定する_小文字化され60文字に切り詰められること() {
        assertEquals("ix_region_code", VersionedTableDao.indexName("ix", "REGION", "code"));
        String name = VersionedTableDao.indexName("ux", "T".repeat(80), "current");
        assertEquals(60, name.length());
        assertTrue(name.startsWith("ux_ttt"));
    }

    @Test
    void constructor_異常ケース_チャンクサイズ0を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new VersionedTableDao(connection, new H2DialectHandler(), 0, 1));
    }

    private EntityRecord row(String code, int version, LocalDate expiry) {
        Map<String, Object> values = new HashMap<>();
        values.put("code", code);
        values.put("active", Boolean.TRUE);
        values.put("amount", StorageType.NUMERIC.normalize("10"));
        EntityRecord row = EntityRecord.candidate(type, values).asVersion(version, EFFECTIVE);
        return expiry == null ? row : row.expiredOn(expiry);
    }
}
