package io.github.yok.statlink.core;

import com.google.common.base.Preconditions;
import io.github.yok.statlink.db.BackendException;
import io.github.yok.statlink.db.VersionedTableDao;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityType;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Versioned upsert engine.
 *
 * <p>
 * {@link #apply(VersionedTableDao, Iterable)} runs in two phases per entity type: the current and
 * historical rows for the batch's identifiers are read (current rows with a row lock) and
 * {@link VersionClassifier} plans the changes; then, inside a JDBC savepoint, the superseded current
 * rows are expired with a guarded update and the planned rows are batch-inserted. Any failure rolls
 * the savepoint back, so one call is all-or-nothing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class VersionedStore {

    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final int DEFAULT_IDENTIFIER_CHUNK_SIZE = 500;

    private final VersionEventListener listener;

    private final Clock clock;

    private final VersionClassifier classifier = new VersionClassifier();

    @Getter
    private final int batchSize;

    @Getter
    private final int identifierChunkSize;

    /**
     * Creates a store with default batch settings and the system clock.
     *
     * @param listener event listener
     */
    public VersionedStore(VersionEventListener listener) {
        this(listener, Clock.systemDefaultZone(), DEFAULT_BATCH_SIZE,
                DEFAULT_IDENTIFIER_CHUNK_SIZE);
    }

    /**
     * Creates a store.
     *
     * @param listener event listener
     * @param clock clock deciding "today"
     * @param batchSize rows per insert batch
     * @param identifierChunkSize identifier values per lookup query
     */
    public VersionedStore(VersionEventListener listener, Clock clock, int batchSize,
            int identifierChunkSize) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be > 0");
        Preconditions.checkArgument(identifierChunkSize > 0, "identifierChunkSize must be > 0");
        this.listener = listener == null ? VersionEventListener.NONE : listener;
        this.clock = Preconditions.checkNotNull(clock, "clock must not be null");
        this.batchSize = batchSize;
        this.identifierChunkSize = identifierChunkSize;
    }

    /**
     * Classifies and writes a batch of candidates.
     *
     * @param dao DAO bound to the unit of work's connection
     * @param candidates candidates, possibly of several entity types
     * @return what was written
     * @throws ClassificationException if classification fails or a concurrent writer expired a
     *         current version first
     * @throws BackendException if a statement fails
     */
    public ApplyResult apply(VersionedTableDao dao, Iterable<EntityRecord> candidates) {
        Map<EntityType, List<EntityRecord>> groups = new LinkedHashMap<>();
        for (EntityRecord candidate : candidates) {
            groups.computeIfAbsent(candidate.getEntityType(), t -> new ArrayList<>())
                    .add(candidate);
        }
        if (groups.isEmpty()) {
            return ApplyResult.empty();
        }

        LocalDate today = LocalDate.now(clock);
        Connection connection = dao.getConnection();
        Savepoint savepoint = setSavepoint(connection);
        List<Runnable> events = new ArrayList<>();
        ApplyResult result = ApplyResult.empty();
        EntityType current = null;
        try {
            for (Map.Entry<EntityType, List<EntityRecord>> group : groups.entrySet()) {
                current = group.getKey();
                result = result.plus(applyGroup(dao, current, group.getValue(), today, events));
            }
            releaseSavepoint(connection, savepoint);
        } catch (RuntimeException e) {
            rollbackTo(connection, savepoint, e);
            listener.applyFailed(current, e);
            throw e;
        }
        events.forEach(Runnable::run);
        return result;
    }

    private ApplyResult applyGroup(VersionedTableDao dao, EntityType type,
            List<EntityRecord> candidates, LocalDate today, List<Runnable> events) {
        Set<Object> identifiers = new LinkedHashSet<>();
        for (EntityRecord candidate : candidates) {
            if (candidate.identifierValue() != null) {
                identifiers.add(candidate.identifierValue());
            }
        }
        // Lock current rows before reading the full history
        List<EntityRecord> currentRows = dao.findCurrentByIdentifiers(type, identifiers);
        List<EntityRecord> persisted = dao.findByIdentifiers(type, identifiers);

        ChangePlan plan = classifier.classify(type, candidates, persisted, currentRows, today);

        for (EntityRecord expiry : plan.getExpiries()) {
            int updated = dao.expire(type, expiry.getId(), expiry.getExpiryDate());
            if (updated != 1) {
                throw new ClassificationException("[" + type.getTableName() + "] Current version id="
                        + expiry.getId() + " of " + type.getUniqueIdentifier() + "="
                        + expiry.identifierValue() + " was expired by another writer");
            }
        }
        List<EntityRecord> inserted = dao.insert(type, plan.getInsertRecords());

        Map<EntityRecord, EntityRecord> insertedByPlanned = new IdentityHashMap<>();
        for (int i = 0; i < inserted.size(); i++) {
            insertedByPlanned.put(plan.getInserts().get(i).getRecord(), inserted.get(i));
        }
        for (EntityRecord duplicate : plan.getDuplicates()) {
            events.add(() -> listener.duplicateDropped(duplicate));
        }
        for (int i = 0; i < inserted.size(); i++) {
            ChangePlan.Insert insert = plan.getInserts().get(i);
            EntityRecord row = inserted.get(i);
            if (insert.isRevision()) {
                EntityRecord previous =
                        insertedByPlanned.getOrDefault(insert.getPrevious(), insert.getPrevious());
                events.add(() -> listener.revisionApplied(previous, row));
            } else {
                events.add(() -> listener.firstVersionCreated(row));
            }
        }

        ApplyResult result = new ApplyResult(inserted, plan.getExpiries(), plan.getDuplicates(),
                plan.getRevisionCount(), plan.getInserts().size() - plan.getRevisionCount());
        log.info("[{}] Applied: inserted={}, expired={}, duplicates={}", type.getTableName(),
                result.getInsertedCount(), result.getExpiredCount(), result.getDuplicateCount());
        return result;
    }

    private static Savepoint setSavepoint(Connection connection) {
        try {
            return connection.setSavepoint();
        } catch (SQLException e) {
            throw new BackendException("Failed to set savepoint", e);
        }
    }

    private static void releaseSavepoint(Connection connection, Savepoint savepoint) {
        try {
            connection.releaseSavepoint(savepoint);
        } catch (SQLException e) {
            throw new BackendException("Failed to release savepoint", e);
        }
    }

    private static void rollbackTo(Connection connection, Savepoint savepoint, Exception cause) {
        try {
            connection.rollback(savepoint);
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("Failed to roll back to savepoint", e);
        }
    }
}
