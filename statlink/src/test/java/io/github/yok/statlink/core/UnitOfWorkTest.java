package io.github.yok.statlink.core;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.statlink.config.BackendKind;
import io.github.yok.statlink.config.BackendSettings;
import io.github.yok.statlink.db.BackendException;
import io.github.yok.statlink.db.DbDialectHandlerFactory;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityType;
import io.github.yok.statlink.schema.SchemaException;
import io.github.yok.statlink.schema.SchemaRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UnitOfWorkTest {

    @TempDir
    Path entityDir;

    private String jdbcUrl;
    private ConnectionManager manager;

    @BeforeEach
    void setup() {
        jdbcUrl = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        manager = new ConnectionManager(settings(jdbcUrl, "org.h2.Driver"),
                new DbDialectHandlerFactory(), new SchemaRegistry(entityDir),
                new VersionedStore(null));
    }

    @Test
    void close_正常ケース_コミットせずに閉じる_書き込みが取り消されること() {
        try (UnitOfWork uow = manager.open()) {
            EntityType type = uow.openEntityType(VersionedStoreTest.region());
            uow.apply(type, List.of(alpha(type)));
            assertEquals(1, uow.getDao().countRows(type));
        }

        long count = manager.inUnitOfWork(
                uow -> uow.getDao().countRows(uow.openEntityType(VersionedStoreTest.region())));
        assertEquals(0, count);
    }

    @Test
    void inUnitOfWork_異常ケース_コールバックが失敗する_ロールバックされ例外が伝播すること() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> manager.inUnitOfWork(uow -> {
                    EntityType type = uow.openEntityType(VersionedStoreTest.region());
                    uow.apply(type, List.of(alpha(type)));
                    throw new IllegalStateException("boom");
                }));
        assertEquals("boom", ex.getMessage());

        long count = manager.inUnitOfWork(
                uow -> uow.getDao().countRows(uow.openEntityType(VersionedStoreTest.region())));
        assertEquals(0, count);
    }

    @Test
    void inUnitOfWork_正常ケース_コールバックが成功する_コミットされること() {
        manager.inUnitOfWork(uow -> {
            EntityType type = uow.openEntityType(VersionedStoreTest.region());
            return uow.apply(type, List.of(alpha(type)));
        });

        long count = manager.inUnitOfWork(
                uow -> uow.getDao().countRows(uow.openEntityType(VersionedStoreTest.region())));
        assertEquals(1, count);
    }

    @Test
    void apply_異常ケース_未オープンの型を指定する_IllegalStateExceptionが送出されること() {
        try (UnitOfWork uow = manager.open()) {
            EntityType type = manager.getSchemaRegistry().define(VersionedStoreTest.region());
            assertThrows(IllegalStateException.class,
                    () -> uow.apply(type, List.of(alpha(type))));
        }
    }

    @Test
    void close_正常ケース_2回呼び出す_例外が送出されず以降の操作は拒否されること() {
        UnitOfWork uow = manager.open();
        uow.close();
        assertDoesNotThrow(uow::close);
        assertThrows(IllegalStateException.class, uow::commit);
        assertThrows(IllegalStateException.class,
                () -> uow.openEntityType(VersionedStoreTest.region()));
    }

    @Test
    void openEntityType_正常ケース_エンティティ名を指定する_定義ファイルから表が作成されること()
            throws Exception {
        Files.writeString(entityDir.resolve("COUNTRY.json"),
                "{\"table_name\":\"COUNTRY\",\"identifier\":\"iso\",\"columns\":["
                        + "{\"name\":\"iso\",\"type\":\"String(2)\"},"
                        + "{\"name\":\"population\",\"type\":\"BigInteger\"}]}",
                StandardCharsets.UTF_8);

        manager.inUnitOfWork(uow -> uow.openEntityType("COUNTRY"));

        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "")) {
            assertTrue(manager.getDialect().tableExists(conn, "COUNTRY"),
                    "COUNTRY 表が作成されていません");
            List<String> columns = manager.getDialect().getColumnNames(conn, "COUNTRY");
            assertTrue(columns.containsAll(
                    List.of("id", "iso", "population", "version_number", "effective_date",
                            "expiry_date")),
                    "列が不足しています: " + columns);
        }
    }

    @Test
    void openEntityType_異常ケース_既存表に列が不足している_SchemaExceptionが送出されること()
            throws Exception {
        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "");
                Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE \"REGION\" (\"id\" BIGINT, \"code\" VARCHAR(10))");
        }

        try (UnitOfWork uow = manager.open()) {
            SchemaException ex = assertThrows(SchemaException.class,
                    () -> uow.openEntityType(VersionedStoreTest.region()));
            assertTrue(ex.getMessage().contains("name"), "不足列がメッセージに含まれません");
            assertTrue(ex.getMessage().contains("expiry_date"), "不足列がメッセージに含まれません");
        }
    }

    @Test
    void open_異常ケース_存在しないドライバを指定する_BackendExceptionが送出されること() {
        ConnectionManager broken = new ConnectionManager(
                settings(jdbcUrl, "com.example.MissingDriver"), new DbDialectHandlerFactory(),
                new SchemaRegistry(null), new VersionedStore(null));
        assertThrows(BackendException.class, broken::open);
    }

    @Test
    void open_異常ケース_接続できないURLを指定する_BackendExceptionが送出されること() {
        ConnectionManager broken = new ConnectionManager(
                settings("jdbc:unknown://localhost/db", "org.h2.Driver"),
                new DbDialectHandlerFactory(), new SchemaRegistry(null), new VersionedStore(null));
        BackendException ex = assertThrows(BackendException.class, broken::open);
        assertTrue(ex.getMessage().startsWith("Failed to connect"));
    }

    private static EntityRecord alpha(EntityType type) {
        return EntityRecord.candidate(type, Map.of("code", "A1", "name", "Alpha"));
    }

    private static BackendSettings settings(String url, String driverClass) {
        return BackendSettings.builder().kind(BackendKind.EMBEDDED).jdbcUrl(url).user("sa")
                .password("").driverClass(driverClass).build();
    }
}
