package io.github.yok.statlink.core;

import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityType;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VersionEventListener} that writes every event to the SLF4J log, prefixed with the table
 * name.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LoggingVersionEventListener implements VersionEventListener {

    @Override
    public void duplicateDropped(EntityRecord candidate) {
        log.debug("[{}] Duplicate dropped: {}={}", candidate.getEntityType().getTableName(),
                candidate.getEntityType().getUniqueIdentifier(), candidate.identifierValue());
    }

    @Override
    public void revisionApplied(EntityRecord previous, EntityRecord inserted) {
        log.info("[{}] Revision: {}={} v{} -> v{} (previous expired {})",
                inserted.getEntityType().getTableName(),
                inserted.getEntityType().getUniqueIdentifier(), inserted.identifierValue(),
                previous.getVersionNumber(), inserted.getVersionNumber(),
                previous.getExpiryDate());
    }

    @Override
    public void firstVersionCreated(EntityRecord inserted) {
        log.debug("[{}] First version: {}={}", inserted.getEntityType().getTableName(),
                inserted.getEntityType().getUniqueIdentifier(), inserted.identifierValue());
    }

    @Override
    public void applyFailed(EntityType type, Throwable cause) {
        log.error("[{}] Apply failed and was rolled back: {}",
                type == null ? "?" : type.getTableName(), cause.getMessage());
    }
}
