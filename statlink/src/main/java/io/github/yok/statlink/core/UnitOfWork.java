package io.github.yok.statlink.core;

import io.github.yok.statlink.db.BackendException;
import io.github.yok.statlink.db.DbDialectHandler;
import io.github.yok.statlink.db.VersionedTableDao;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityDescription;
import io.github.yok.statlink.schema.EntityType;
import io.github.yok.statlink.schema.SchemaRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One transaction on one backend connection.
 *
 * <p>
 * Entity types are opened (their tables created or verified) before candidates are applied.
 * {@link #close()} rolls back whatever has not been committed and always closes the connection.
 * DDL is transactional on PostgreSQL only; MySQL and H2 commit table creation implicitly.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class UnitOfWork implements AutoCloseable {

    private final Connection connection;

    private final SchemaRegistry schemaRegistry;

    private final VersionedStore store;

    @Getter
    private final VersionedTableDao dao;

    private final Set<EntityType> opened = new HashSet<>();

    // Set by commit(); reset by further writes
    private boolean committed;

    private boolean closed;

    UnitOfWork(Connection connection, DbDialectHandler dialect, SchemaRegistry schemaRegistry,
            VersionedStore store) {
        this.connection = connection;
        this.schemaRegistry = schemaRegistry;
        this.store = store;
        this.dao = new VersionedTableDao(connection, dialect, store.getIdentifierChunkSize(),
                store.getBatchSize());
    }

    /**
     * Defines an entity type and prepares its table.
     *
     * @param description entity description
     * @return entity type
     * @throws io.github.yok.statlink.schema.SchemaException if the description is invalid or the
     *         existing table lacks columns
     * @throws BackendException if a statement fails
     */
    public EntityType openEntityType(EntityDescription description) {
        return prepare(schemaRegistry.define(description));
    }

    /**
     * Loads an entity description by name and prepares its table.
     *
     * @param entityName entity file name without extension
     * @return entity type
     */
    public EntityType openEntityType(String entityName) {
        return prepare(schemaRegistry.load(entityName));
    }

    /**
     * Applies candidates of an opened entity type.
     *
     * @param type entity type
     * @param candidates candidates of {@code type}
     * @return what was written
     * @throws IllegalStateException if the type has not been opened here or a candidate belongs to
     *         another type
     */
    public ApplyResult apply(EntityType type, Iterable<EntityRecord> candidates) {
        ensureOpen();
        if (!opened.contains(type)) {
            throw new IllegalStateException(
                    "Entity type " + type.getTableName() + " was not opened in this unit of work");
        }
        for (EntityRecord candidate : candidates) {
            if (!type.equals(candidate.getEntityType())) {
                throw new IllegalStateException("Candidate of "
                        + candidate.getEntityType().getTableName() + " passed for "
                        + type.getTableName());
            }
        }
        committed = false;
        return store.apply(dao, candidates);
    }

    /**
     * Commits the transaction.
     *
     * @throws BackendException if the commit fails
     */
    public void commit() {
        ensureOpen();
        try {
            connection.commit();
            committed = true;
            log.debug("Committed");
        } catch (SQLException e) {
            throw new BackendException("Commit failed", e);
        }
    }

    /**
     * Rolls the transaction back.
     *
     * @throws BackendException if the rollback fails
     */
    public void rollback() {
        ensureOpen();
        try {
            connection.rollback();
            log.debug("Rolled back");
        } catch (SQLException e) {
            throw new BackendException("Rollback failed", e);
        }
    }

    /**
     * Rolls back uncommitted work and closes the connection. Calling it twice is a no-op.
     *
     * @throws BackendException if closing fails
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        BackendException failure = null;
        try {
            if (!committed) {
                connection.rollback();
                log.debug("Rolled back uncommitted work on close");
            }
        } catch (SQLException e) {
            failure = new BackendException("Rollback on close failed", e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            if (failure == null) {
                failure = new BackendException("Failed to close connection", e);
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private EntityType prepare(EntityType type) {
        ensureOpen();
        committed = false;
        dao.ensureTable(type);
        opened.add(type);
        return type;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Unit of work is closed");
        }
    }
}
