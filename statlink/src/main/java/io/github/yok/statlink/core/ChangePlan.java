package io.github.yok.statlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityType;
import java.util.List;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

/**
 * Outcome of classifying one batch of candidates of a single entity type.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ChangePlan {

    private final EntityType entityType;

    // Candidates identical to a persisted row or to a row planned earlier in the batch
    private final ImmutableList<EntityRecord> duplicates;

    // Persisted current rows to expire, already carrying their expiry date
    private final ImmutableList<EntityRecord> expiries;

    // Rows to insert, in batch order
    private final ImmutableList<Insert> inserts;

    ChangePlan(EntityType entityType, List<EntityRecord> duplicates, List<EntityRecord> expiries,
            List<Insert> inserts) {
        this.entityType = entityType;
        this.duplicates = ImmutableList.copyOf(duplicates);
        this.expiries = ImmutableList.copyOf(expiries);
        this.inserts = ImmutableList.copyOf(inserts);
    }

    /**
     * Rows to insert without their predecessor information.
     *
     * @return insert rows in batch order
     */
    public List<EntityRecord> getInsertRecords() {
        return inserts.stream().map(Insert::getRecord).collect(ImmutableList.toImmutableList());
    }

    /**
     * Number of planned inserts that revise an earlier version.
     *
     * @return revision count
     */
    public int getRevisionCount() {
        return (int) inserts.stream().filter(Insert::isRevision).count();
    }

    /**
     * Whether the plan writes nothing.
     *
     * @return {@code true} when there is nothing to expire or insert
     */
    public boolean isNoOp() {
        return expiries.isEmpty() && inserts.isEmpty();
    }

    /**
     * One planned insert and the version it supersedes.
     */
    @Value
    public static class Insert {

        EntityRecord record;

        // Expired predecessor (persisted or planned in the same batch); null for a first version
        EntityRecord previous;

        public boolean isRevision() {
            return previous != null;
        }
    }
}
