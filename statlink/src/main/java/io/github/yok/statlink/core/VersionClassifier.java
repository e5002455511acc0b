package io.github.yok.statlink.core;

import io.github.yok.statlink.model.EntityRecord;
import io.github.yok.statlink.schema.EntityType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides, without any I/O, what happens to each candidate of a batch.
 *
 * <p>
 * Candidates are walked in batch order:
 * </p>
 * <ol>
 * <li>a candidate whose declared values equal any persisted row (current or historical) or a row
 * planned earlier in the batch is a duplicate and dropped;</li>
 * <li>otherwise, when a current version exists for its identifier (persisted, or planned earlier in
 * the batch), that version is expired on {@code today - 1} and the candidate becomes the next
 * version;</li>
 * <li>otherwise the candidate becomes version 1.</li>
 * </ol>
 *
 * <p>
 * Every planned row is effective {@code today}. A planned row superseded later in the same batch is
 * inserted already expired, so each identifier keeps exactly one current version.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class VersionClassifier {

    /**
     * Classifies candidates of one entity type.
     *
     * @param type entity type of every candidate
     * @param candidates candidates in batch order
     * @param persisted every persisted row (all versions) for the candidates' identifiers
     * @param current persisted current rows for the candidates' identifiers
     * @param today effective date of new versions
     * @return change plan
     * @throws ClassificationException if a candidate has no identifier value, belongs to another
     *         type, or an identifier has more than one current row
     */
    public ChangePlan classify(EntityType type, List<EntityRecord> candidates,
            List<EntityRecord> persisted, List<EntityRecord> current, LocalDate today) {
        LocalDate yesterday = today.minusDays(1);

        Map<Object, EntityRecord> currentById = new HashMap<>();
        for (EntityRecord row : current) {
            EntityRecord clash = currentById.put(row.identifierValue(), row);
            if (clash != null) {
                throw new ClassificationException("[" + type.getTableName()
                        + "] More than one current version for identifier "
                        + row.identifierValue() + " (ids " + clash.getId() + ", " + row.getId()
                        + ")");
            }
        }

        Set<List<Object>> seen = new HashSet<>();
        for (EntityRecord row : persisted) {
            seen.add(row.valueKey());
        }

        List<EntityRecord> duplicates = new ArrayList<>();
        List<EntityRecord> expiries = new ArrayList<>();
        List<EntityRecord> planned = new ArrayList<>();
        List<EntityRecord> previous = new ArrayList<>();
        // identifier value -> index in planned of its latest planned version
        Map<Object, Integer> latestPlanned = new HashMap<>();

        for (EntityRecord candidate : candidates) {
            if (!type.equals(candidate.getEntityType())) {
                throw new ClassificationException("[" + type.getTableName()
                        + "] Candidate of another entity type: " + candidate);
            }
            Object identifier = candidate.identifierValue();
            if (identifier == null) {
                throw new ClassificationException("[" + type.getTableName()
                        + "] Candidate has no value for identifier "
                        + type.getUniqueIdentifier() + ": " + candidate.getValues());
            }
            if (!seen.add(candidate.valueKey())) {
                duplicates.add(candidate);
                continue;
            }

            EntityRecord predecessor = null;
            int version = 1;
            Integer plannedIndex = latestPlanned.get(identifier);
            if (plannedIndex != null) {
                predecessor = planned.get(plannedIndex).expiredOn(yesterday);
                planned.set(plannedIndex, predecessor);
                version = predecessor.getVersionNumber() + 1;
            } else if (currentById.containsKey(identifier)) {
                predecessor = currentById.get(identifier).expiredOn(yesterday);
                expiries.add(predecessor);
                version = predecessor.getVersionNumber() + 1;
            }
            planned.add(candidate.asVersion(version, today));
            previous.add(predecessor);
            latestPlanned.put(identifier, planned.size() - 1);
        }

        List<ChangePlan.Insert> inserts = new ArrayList<>(planned.size());
        for (int i = 0; i < planned.size(); i++) {
            inserts.add(new ChangePlan.Insert(planned.get(i), previous.get(i)));
        }
        return new ChangePlan(type, duplicates, expiries, inserts);
    }
}
