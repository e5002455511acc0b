package io.github.yok.statlink;

import io.github.yok.statlink.config.BackendSettings;
import io.github.yok.statlink.config.ConnectionConfig;
import io.github.yok.statlink.config.LoaderConfig;
import io.github.yok.statlink.config.PathsConfig;
import io.github.yok.statlink.core.BulkLoader;
import io.github.yok.statlink.core.ConnectionManager;
import io.github.yok.statlink.core.DatasetImporter;
import io.github.yok.statlink.core.LoggingVersionEventListener;
import io.github.yok.statlink.core.VersionedStore;
import io.github.yok.statlink.db.DbDialectHandlerFactory;
import io.github.yok.statlink.schema.SchemaRegistry;
import io.github.yok.statlink.util.ErrorHandler;
import io.github.yok.statlink.util.MaskingLogUtil;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --jobs a,b} or {@code -j a,b} runs the named jobs of {@code loader.jobs}. Without it
 * every configured job runs.</li>
 * <li>{@code --entity NAME --file PATH} (or {@code -e}/{@code -f}) runs one job that is not
 * configured; the file is absolute or relative to {@code <data-path>/datasets}.</li>
 * </ul>
 *
 * <p>
 * Unknown arguments are logged and ignored. Backend settings are validated once at startup; an
 * invalid {@code backend} section stops the run before any connection is attempted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ConnectionConfig
 * @see LoaderConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class, LoaderConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final LoaderConfig loaderConfig;
    private final DbDialectHandlerFactory dialectFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        List<String> jobNames = new ArrayList<>();
        String entity = null;
        String file = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--jobs":
                case "-j":
                    if (i + 1 < args.length) {
                        jobNames = Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(s -> !s.isEmpty()).collect(Collectors.toList());
                    }
                    break;
                case "--entity":
                case "-e":
                    entity = i + 1 < args.length ? args[++i] : null;
                    break;
                case "--file":
                case "-f":
                    file = i + 1 < args.length ? args[++i] : null;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        if ((entity == null) != (file == null)) {
            ErrorHandler.errorAndExit("--entity and --file must be given together.");
            return;
        }

        try {
            BackendSettings settings = BackendSettings.from(connectionConfig);
            log.info("Backend: {}", MaskingLogUtil.maskSettings(settings));

            SchemaRegistry registry = new SchemaRegistry(Paths.get(pathsConfig.getEntities()));
            VersionedStore store = new VersionedStore(new LoggingVersionEventListener(),
                    Clock.systemDefaultZone(), loaderConfig.getBatchSize(),
                    loaderConfig.getIdentifierChunkSize());
            ConnectionManager connectionManager =
                    new ConnectionManager(settings, dialectFactory, registry, store);
            DatasetImporter importer = new DatasetImporter(connectionManager, loaderConfig,
                    pathsConfig, new BulkLoader());

            if (entity != null) {
                log.info("Starting ad-hoc import. Entity [{}], File [{}]", entity, file);
                importer.executeAdHoc(entity, file);
            } else {
                log.info("Starting import. Jobs {}", jobNames.isEmpty() ? "(all)" : jobNames);
                importer.execute(jobNames);
            }
            log.info("Import completed.");
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
