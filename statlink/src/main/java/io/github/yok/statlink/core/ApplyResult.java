package io.github.yok.statlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.statlink.model.EntityRecord;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * What one {@link VersionedStore#apply} call wrote.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ApplyResult {

    private static final ApplyResult EMPTY =
            new ApplyResult(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(), 0, 0);

    // Inserted rows (with ids when the driver reports them)
    private final ImmutableList<EntityRecord> inserted;

    // Previously persisted rows that were expired
    private final ImmutableList<EntityRecord> expired;

    private final ImmutableList<EntityRecord> duplicates;

    private final int revisionCount;

    private final int firstVersionCount;

    ApplyResult(List<EntityRecord> inserted, List<EntityRecord> expired,
            List<EntityRecord> duplicates, int revisionCount, int firstVersionCount) {
        this.inserted = ImmutableList.copyOf(inserted);
        this.expired = ImmutableList.copyOf(expired);
        this.duplicates = ImmutableList.copyOf(duplicates);
        this.revisionCount = revisionCount;
        this.firstVersionCount = firstVersionCount;
    }

    /**
     * Result of a call that wrote nothing.
     *
     * @return empty result
     */
    public static ApplyResult empty() {
        return EMPTY;
    }

    public int getInsertedCount() {
        return inserted.size();
    }

    public int getExpiredCount() {
        return expired.size();
    }

    public int getDuplicateCount() {
        return duplicates.size();
    }

    /**
     * Combines two results.
     *
     * @param other other result
     * @return combined result
     */
    public ApplyResult plus(ApplyResult other) {
        return new ApplyResult(
                ImmutableList.<EntityRecord>builder().addAll(inserted).addAll(other.inserted)
                        .build(),
                ImmutableList.<EntityRecord>builder().addAll(expired).addAll(other.expired).build(),
                ImmutableList.<EntityRecord>builder().addAll(duplicates).addAll(other.duplicates)
                        .build(),
                revisionCount + other.revisionCount, firstVersionCount + other.firstVersionCount);
    }
}
