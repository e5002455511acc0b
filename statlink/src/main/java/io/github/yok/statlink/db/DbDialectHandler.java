package io.github.yok.statlink.db;

import io.github.yok.statlink.config.BackendKind;

/**
 * Interface that abstracts the differences between database backends.
 *
 * <p>
 * Operations are grouped by concern: SQL grammar ({@link DbDialectSqlOperations}), metadata
 * ({@link DbDialectMetadataOperations}) and session setup ({@link DbDialectConnectionOperations}).
 * Instances are stateless and obtained from {@link DbDialectHandlerFactory}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler
        extends DbDialectSqlOperations, DbDialectMetadataOperations, DbDialectConnectionOperations {

    /**
     * Backend kind served by this handler.
     *
     * @return backend kind
     */
    BackendKind getKind();
}
