package io.github.yok.statlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.statlink.config.BackendSettings;
import io.github.yok.statlink.db.BackendException;
import io.github.yok.statlink.db.DbDialectHandler;
import io.github.yok.statlink.db.DbDialectHandlerFactory;
import io.github.yok.statlink.schema.SchemaRegistry;
import io.github.yok.statlink.util.JdbcDriverLoader;
import io.github.yok.statlink.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.function.Function;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens connections to the configured backend and wraps each in a {@link UnitOfWork}.
 *
 * <p>
 * Connections are opened with auto-commit disabled and initialized by the backend's dialect
 * handler. Every {@link UnitOfWork} owns its connection exclusively.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionManager {

    @Getter
    private final BackendSettings settings;

    @Getter
    private final DbDialectHandler dialect;

    @Getter
    private final SchemaRegistry schemaRegistry;

    private final VersionedStore store;

    /**
     * Creates a connection manager.
     *
     * @param settings validated backend settings
     * @param dialectFactory factory resolving the dialect for {@code settings.kind}
     * @param schemaRegistry registry shared by all units of work
     * @param store versioned store shared by all units of work
     */
    public ConnectionManager(BackendSettings settings, DbDialectHandlerFactory dialectFactory,
            SchemaRegistry schemaRegistry, VersionedStore store) {
        this.settings = Preconditions.checkNotNull(settings, "settings must not be null");
        this.dialect = dialectFactory.create(settings.getKind());
        this.schemaRegistry = Preconditions.checkNotNull(schemaRegistry,
                "schemaRegistry must not be null");
        this.store = Preconditions.checkNotNull(store, "store must not be null");
    }

    /**
     * Opens a connection and starts a unit of work on it.
     *
     * @return new unit of work; the caller must close it
     * @throws BackendException if the driver is missing or the connection fails
     */
    public UnitOfWork open() {
        log.debug("Opening connection: {}", MaskingLogUtil.maskSettings(settings));
        try {
            JdbcDriverLoader.loadIfConfigured(settings.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new BackendException("JDBC driver not found: " + settings.getDriverClass(), e);
        }
        Connection connection;
        try {
            connection = DriverManager.getConnection(settings.getJdbcUrl(), settings.getUser(),
                    settings.getPassword());
        } catch (SQLException e) {
            throw new BackendException("Failed to connect to "
                    + MaskingLogUtil.maskJdbcUrl(settings.getJdbcUrl()), e);
        }
        try {
            connection.setAutoCommit(false);
            dialect.prepareConnection(connection);
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new BackendException("Failed to initialize session", e);
        }
        log.info("Connected: {}", MaskingLogUtil.maskJdbcUrl(settings.getJdbcUrl()));
        return new UnitOfWork(connection, dialect, schemaRegistry, store);
    }

    /**
     * Runs {@code work} in a fresh unit of work and commits it when the callback returns normally.
     * A failing callback leaves the unit of work uncommitted, so it is rolled back on close.
     *
     * @param work callback
     * @param <T> result type
     * @return callback result
     */
    public <T> T inUnitOfWork(Function<UnitOfWork, T> work) {
        try (UnitOfWork unitOfWork = open()) {
            T result = work.apply(unitOfWork);
            unitOfWork.commit();
            return result;
        }
    }

    private static void closeQuietly(Connection connection, Exception cause) {
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
