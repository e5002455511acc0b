package io.github.yok.statlink.db;

import io.github.yok.statlink.config.BackendKind;
import io.github.yok.statlink.db.h2.H2DialectHandler;
import io.github.yok.statlink.db.mysql.MySqlDialectHandler;
import io.github.yok.statlink.db.postgresql.PostgresqlDialectHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the backend kind.
 *
 * <ul>
 * <li>{@code EMBEDDED}: {@link H2DialectHandler}</li>
 * <li>{@code MYSQL}: {@link MySqlDialectHandler}</li>
 * <li>{@code POSTGRESQL}: {@link PostgresqlDialectHandler}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates the dialect handler for a backend kind.
     *
     * @param kind backend kind
     * @return dialect handler
     * @throws IllegalArgumentException if {@code kind} is {@code null}
     */
    public DbDialectHandler create(BackendKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Backend kind must not be null");
        }
        DbDialectHandler handler;
        switch (kind) {
            case EMBEDDED:
                handler = new H2DialectHandler();
                break;
            case MYSQL:
                handler = new MySqlDialectHandler();
                break;
            case POSTGRESQL:
                handler = new PostgresqlDialectHandler();
                break;
            default:
                throw new IllegalArgumentException("Unsupported backend kind: " + kind);
        }
        log.debug("Created dialect handler {} for {}", handler.getClass().getSimpleName(), kind);
        return handler;
    }
}
