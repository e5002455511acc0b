package io.github.yok.statlink.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.statlink.config.BackendKind;
import io.github.yok.statlink.config.BackendSettings;
import io.github.yok.statlink.config.LoaderConfig;
import io.github.yok.statlink.config.PathsConfig;
import io.github.yok.statlink.db.DbDialectHandlerFactory;
import io.github.yok.statlink.schema.SchemaRegistry;
import io.github.yok.statlink.util.ErrorHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatasetImporterTest {

    @TempDir
    Path dataPath;

    private String jdbcUrl;
    private LoaderConfig loaderConfig;
    private DatasetImporter importer;

    @BeforeEach
    void setup() throws Exception {
        Path entities = Files.createDirectories(dataPath.resolve("entities"));
        Path datasets = Files.createDirectories(dataPath.resolve("datasets"));
        Files.writeString(entities.resolve("REGIONS.json"),
                "{\"table_name\":\"REGIONS\",\"identifier\":\"nuts_id\",\"columns\":["
                        + "{\"name\":\"nuts_id\",\"type\":\"String(10)\"},"
                        + "{\"name\":\"levl_code\",\"type\":\"Integer\"},"
                        + "{\"name\":\"cntr_code\",\"type\":\"String(2)\"},"
                        + "{\"name\":\"name_latn\",\"type\":\"String(255)\"}]}",
                StandardCharsets.UTF_8);
        Files.writeString(entities.resolve("EMPLOYMENT.json"),
                "{\"table_name\":\"EMPLOYMENT\",\"identifier\":\"year\",\"columns\":["
                        + "{\"name\":\"indicator\",\"type\":\"String(20)\"},"
                        + "{\"name\":\"year\",\"type\":\"Integer\"},"
                        + "{\"name\":\"rate\",\"type\":\"Numeric\"}]}",
                StandardCharsets.UTF_8);
        Files.writeString(datasets.resolve("regions.geojson"),
                "{\"type\":\"FeatureCollection\",\"features\":["
                        + feature("AT", 0, "AT", "Österreich") + ","
                        + feature("AT1", 1, "AT", "Ostösterreich") + ","
                        + "{\"type\":\"Feature\",\"geometry\":null}]}",
                StandardCharsets.UTF_8);
        Files.writeString(datasets.resolve("employment.csv"),
                "indicator,2019,2020,2021\nEMP_RATE,71.2,72.0,:\n", StandardCharsets.UTF_8);

        PathsConfig pathsConfig = new PathsConfig();
        pathsConfig.setDataPath(dataPath.toString());

        loaderConfig = new LoaderConfig();
        LoaderConfig.Job regions = new LoaderConfig.Job();
        regions.setName("regions");
        regions.setEntity("REGIONS");
        regions.setFile("regions.geojson");
        regions.setColumnMapping(Map.of("NUTS_ID", "nuts_id", "LEVL_CODE", "levl_code",
                "CNTR_CODE", "cntr_code", "NAME_LATN", "name_latn"));

        LoaderConfig.Job broken = new LoaderConfig.Job();
        broken.setName("broken");
        broken.setEntity("MISSING");
        broken.setFile("regions.geojson");

        LoaderConfig.Job employment = new LoaderConfig.Job();
        employment.setName("employment");
        employment.setEntity("EMPLOYMENT");
        employment.setFile("employment.csv");
        employment.setNullValues(List.of(":"));
        LoaderConfig.Melt melt = new LoaderConfig.Melt();
        melt.setIdColumns(List.of("indicator"));
        melt.setVariableColumn("year");
        melt.setValueColumn("rate");
        employment.setMelt(melt);

        loaderConfig.setJobs(List.of(regions, broken, employment));

        jdbcUrl = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        BackendSettings settings = BackendSettings.builder().kind(BackendKind.EMBEDDED)
                .jdbcUrl(jdbcUrl).user("sa").password("").driverClass("org.h2.Driver").build();
        ConnectionManager manager = new ConnectionManager(settings, new DbDialectHandlerFactory(),
                new SchemaRegistry(Paths.get(pathsConfig.getEntities())),
                new VersionedStore(new LoggingVersionEventListener()));
        importer = new DatasetImporter(manager, loaderConfig, pathsConfig, new BulkLoader());
    }

    @Test
    void execute_正常ケース_失敗するジョブを含む_残りのジョブが実行されること() throws Exception {
        List<DatasetImporter.JobResult> results = importer.execute(null);

        assertEquals(3, results.size());
        assertTrue(results.get(0).isSucceeded(), "regions が失敗しています");
        assertEquals(2, results.get(0).getInserted());
        assertFalse(results.get(1).isSucceeded(), "broken が成功しています");
        assertTrue(results.get(1).getMessage().contains("MISSING"));
        assertTrue(results.get(2).isSucceeded(), "employment が失敗しています");
        assertEquals(3, results.get(2).getInserted());

        assertEquals(2, count("SELECT COUNT(*) FROM \"REGIONS\""));
        assertEquals(1, count("SELECT COUNT(*) FROM \"EMPLOYMENT\" WHERE \"rate\" IS NULL"));
        assertEquals(1, count(
                "SELECT COUNT(*) FROM \"EMPLOYMENT\" WHERE \"year\" = 2019 AND \"rate\" = 71.2"));
    }

    @Test
    void execute_正常ケース_同じジョブを再実行する_重複として何も書き込まれないこと() throws Exception {
        importer.execute(List.of("regions"));

        List<DatasetImporter.JobResult> again = importer.execute(List.of("regions", "unknown"));

        assertEquals(1, again.size());
        assertEquals(0, again.get(0).getInserted());
        assertEquals(2, again.get(0).getDuplicates());
        assertEquals(2, count("SELECT COUNT(*) FROM \"REGIONS\""));
    }

    @Test
    void execute_異常ケース_宣言列が欠けたデータセット_ジョブが失敗し1行も書き込まれないこと()
            throws Exception {
        Files.writeString(dataPath.resolve("datasets").resolve("regions-short.csv"),
                "nuts_id,levl_code,name_latn\nFR,0,France\nFR1,1,Ile de France\n",
                StandardCharsets.UTF_8);
        LoaderConfig.Job shortJob = new LoaderConfig.Job();
        shortJob.setName("regions-short");
        shortJob.setEntity("REGIONS");
        shortJob.setFile("regions-short.csv");
        loaderConfig.setJobs(List.of(shortJob));

        List<DatasetImporter.JobResult> results = importer.execute(null);

        assertEquals(1, results.size());
        assertFalse(results.get(0).isSucceeded(), "宣言列が欠けたジョブが成功しています");
        assertTrue(results.get(0).getMessage().contains("cntr_code"),
                "欠落列がメッセージに含まれません: " + results.get(0).getMessage());
        assertEquals(0, results.get(0).getInserted());
        assertEquals(0, count("SELECT COUNT(*) FROM \"REGIONS\""), "失敗したジョブの行が残っています");
    }

    @Test
    void executeAdHoc_正常ケース_エンティティとファイルを指定する_取り込まれること() throws Exception {
        Path csv = dataPath.resolve("regions-extra.csv");
        Files.writeString(csv, "nuts_id,levl_code,cntr_code,name_latn\nDE,0,DE,Deutschland\n",
                StandardCharsets.UTF_8);

        DatasetImporter.JobResult result = importer.executeAdHoc("REGIONS", csv.toString());

        assertTrue(result.isSucceeded());
        assertEquals(1, result.getInserted());
        assertEquals("Deutschland", string(
                "SELECT \"name_latn\" FROM \"REGIONS\" WHERE \"nuts_id\" = 'DE'"));
    }

    @Test
    void execute_異常ケース_exit無効で失敗するジョブを含む_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> importer.execute(List.of("broken")));
            assertTrue(ex.getMessage().contains("[broken]"));
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    private static String feature(String id, int level, String country, String name) {
        return "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Point\",\"coordinates\":[0,0]},"
                + "\"properties\":{\"NUTS_ID\":\"" + id + "\",\"LEVL_CODE\":" + level
                + ",\"CNTR_CODE\":\"" + country + "\",\"NAME_LATN\":\"" + name + "\"}}";
    }

    private long count(String sql) throws Exception {
        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "");
                Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            assertTrue(rs.next());
            return rs.getLong(1);
        }
    }

    private String string(String sql) throws Exception {
        try (Connection conn = DriverManager.getConnection(jdbcUrl, "sa", "");
                Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            assertTrue(rs.next());
            return rs.getString(1);
        }
    }
}
