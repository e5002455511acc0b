package io.github.yok.statlink.core;

import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityType;

/**
 * Receives the outcome of {@link VersionedStore#apply}, one callback per candidate.
 *
 * <p>
 * Success callbacks are delivered only after all writes of the call have succeeded; a failing call
 * delivers {@link #applyFailed} alone.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface VersionEventListener {

    // Listener that ignores every event
    VersionEventListener NONE = new VersionEventListener() {};

    /**
     * A candidate was identical to an existing row and was dropped.
     *
     * @param candidate dropped candidate
     */
    default void duplicateDropped(EntityRecord candidate) {}

    /**
     * A new version superseded an earlier one.
     *
     * @param previous expired predecessor
     * @param inserted inserted version
     */
    default void revisionApplied(EntityRecord previous, EntityRecord inserted) {}

    /**
     * The first version of an identifier value was inserted.
     *
     * @param inserted inserted version 1
     */
    default void firstVersionCreated(EntityRecord inserted) {}

    /**
     * Applying a batch failed and its writes were rolled back.
     *
     * @param type entity type of the failing group, or {@code null} when not known
     * @param cause failure
     */
    default void applyFailed(EntityType type, Throwable cause) {}
}
