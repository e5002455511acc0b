package io.github.yok.statlink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.statlink.config.ConfigurationException;
import io.github.yok.statlink.config.ConnectionConfig;
import io.github.yok.statlink.config.LoaderConfig;
import io.github.yok.statlink.config.PathsConfig;
import io.github.yok.statlink.core.DatasetImporter;
import io.github.yok.statlink.db.DbDialectHandlerFactory;
import io.github.yok.statlink.util.ErrorHandler;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path dataPath;

    private ConnectionConfig connectionConfig;

    private Main main;

    @BeforeEach
    void setup() {
        PathsConfig pathsConfig = new PathsConfig();
        pathsConfig.setDataPath(dataPath.toString());

        connectionConfig = new ConnectionConfig();
        connectionConfig.setKind("embedded");
        connectionConfig.setPath(dataPath.resolve("statlink").toString());

        main = new Main(pathsConfig, connectionConfig, new LoaderConfig(),
                new DbDialectHandlerFactory());
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);

                    Object arg0 = ctx.arguments().get(0);
                    assertTrue(arg0 instanceof Class<?>[]);
                    Class<?>[] sources = (Class<?>[]) arg0;
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"--jobs", "regions"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("--jobs"), eq("regions"));
        }
    }

    @Test
    void run_正常ケース_引数なし_全ジョブが実行されること() {
        try (MockedConstruction<DatasetImporter> mocked =
                mockConstruction(DatasetImporter.class)) {
            main.run();

            DatasetImporter importer = mocked.constructed().get(0);
            verify(importer).execute(eq(List.of()));
        }
    }

    @Test
    void run_正常ケース_jobs指定_指定ジョブのみ実行されること() {
        try (MockedConstruction<DatasetImporter> mocked =
                mockConstruction(DatasetImporter.class)) {
            main.run("--jobs", "regions, employment,");

            DatasetImporter importer = mocked.constructed().get(0);
            verify(importer).execute(eq(List.of("regions", "employment")));
        }
    }

    @Test
    void run_正常ケース_短縮オプションでentityとfileを指定する_単発取り込みが実行されること() {
        try (MockedConstruction<DatasetImporter> mocked =
                mockConstruction(DatasetImporter.class)) {
            main.run("-e", "REGIONS", "-f", "regions.geojson");

            DatasetImporter importer = mocked.constructed().get(0);
            verify(importer).executeAdHoc(eq("REGIONS"), eq("regions.geojson"));
            verify(importer, never()).execute(any());
        }
    }

    @Test
    void run_正常ケース_未知の引数はwarnされても処理継続すること() {
        try (MockedConstruction<DatasetImporter> mocked =
                mockConstruction(DatasetImporter.class)) {
            main.run("--unknown", "-j", "regions");

            DatasetImporter importer = mocked.constructed().get(0);
            verify(importer).execute(eq(List.of("regions")));
        }
    }

    @Test
    void run_異常ケース_entityのみ指定する_ErrorHandlerが呼ばれ取り込みが実行されないこと() {
        try (MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class);
                MockedConstruction<DatasetImporter> mocked =
                        mockConstruction(DatasetImporter.class)) {
            main.run("--entity", "REGIONS");

            handler.verify(() -> ErrorHandler
                    .errorAndExit(eq("--entity and --file must be given together.")));
            assertTrue(mocked.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_未知のバックエンド種別_ErrorHandlerが呼ばれること() {
        connectionConfig.setKind("oracle");
        try (MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class);
                MockedConstruction<DatasetImporter> mocked =
                        mockConstruction(DatasetImporter.class)) {
            main.run();

            handler.verify(() -> ErrorHandler.errorAndExit(startsWith("Fatal error: "),
                    any(ConfigurationException.class)));
            assertTrue(mocked.constructed().isEmpty());
        }
    }

    @Test
    void run_異常ケース_取り込みが例外を送出する_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> handler = mockStatic(ErrorHandler.class);
                MockedConstruction<DatasetImporter> mocked = mockConstruction(
                        DatasetImporter.class, (mock, ctx) -> when(mock.execute(any()))
                                .thenThrow(new IllegalStateException("boom")))) {
            main.run();

            handler.verify(() -> ErrorHandler.errorAndExit(eq("Fatal error: boom"),
                    any(IllegalStateException.class)));
            handler.verify(() -> ErrorHandler.errorAndExit(anyString()), never());
        }
    }
}
