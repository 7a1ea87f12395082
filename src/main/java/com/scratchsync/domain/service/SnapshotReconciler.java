package com.scratchsync.domain.service;

import com.scratchsync.domain.model.CatalogEntity;
import com.scratchsync.domain.model.CatalogScrape;
import com.scratchsync.domain.model.Delta;
import com.scratchsync.domain.model.Lifecycle;
import com.scratchsync.domain.model.MergedHistory;
import com.scratchsync.domain.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToLongFunction;

/**
 * Diffs scrape snapshots against the published one and merges them into history.
 */
public class SnapshotReconciler {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotReconciler.class);

    private final GuardMode guardMode;

    public SnapshotReconciler(GuardMode guardMode) {
        this.guardMode = guardMode == null ? GuardMode.RECORD_COUNT : guardMode;
    }

    public GuardMode getGuardMode() {
        return guardMode;
    }

    /**
     * Set difference of two ID sets, keeping the iteration order of the inputs.
     */
    public Delta diff(Set<String> prevIds, Set<String> nowIds) {
        List<String> added = new ArrayList<>();
        List<String> continuing = new ArrayList<>();
        for (String id : nowIds) {
            if (prevIds.contains(id)) {
                continuing.add(id);
            } else {
                added.add(id);
            }
        }
        List<String> ended = new ArrayList<>();
        for (String id : prevIds) {
            if (!nowIds.contains(id)) {
                ended.add(id);
            }
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("new", added.size());
        counts.put("continuing", continuing.size());
        counts.put("ended", ended.size());
        counts.put("index", nowIds.size());
        counts.put("previous", prevIds.size());
        return new Delta(added, continuing, ended, counts);
    }

    /**
     * Builds the snapshot to publish.
     *
     * Upstream-listed ended IDs are excluded from the live set. Continuing entities get
     * attributes that are missing or null filled from the previously published record.
     * Every live entity is tagged with its lifecycle.
     *
     * @param previous Last published snapshot, empty on the first run
     * @param scrape   Current scrape, asset attributes already rehosted
     * @param now      Run timestamp
     */
    public ReconciledSnapshot reconcile(Snapshot previous, CatalogScrape scrape, Instant now) {
        Map<String, CatalogEntity> previousById = indexById(previous.entities());

        Map<String, CatalogEntity> liveById = new LinkedHashMap<>();
        for (CatalogEntity entity : scrape.entities()) {
            String id = entity.getId();
            if (id == null || id.isBlank()) {
                logger.warn("Skipping {} entity without id", scrape.catalog());
                continue;
            }
            if (scrape.endedIds().contains(id)) {
                continue;
            }
            if (liveById.putIfAbsent(id, entity) != null) {
                logger.warn("Duplicate {} entity id {}, keeping first occurrence", scrape.catalog(), id);
            }
        }

        Delta delta = diff(previousById.keySet(), liveById.keySet());
        Set<String> continuingIds = new LinkedHashSet<>(delta.continuing());

        List<CatalogEntity> live = new ArrayList<>(liveById.size());
        for (CatalogEntity entity : liveById.values()) {
            CatalogEntity current = entity.copy();
            if (continuingIds.contains(current.getId())) {
                carryForward(previousById.get(current.getId()), current);
                current.markLifecycle(Lifecycle.CONTINUING);
            } else {
                current.markLifecycle(Lifecycle.NEW);
            }
            live.add(current);
        }

        Set<String> endedIds = new LinkedHashSet<>(delta.ended());
        endedIds.addAll(scrape.endedIds());
        return new ReconciledSnapshot(now, live, delta, endedIds);
    }

    /**
     * Merges the current snapshot into history: the union of both, current records winning,
     * records no longer live marked ended.
     *
     * The anti-truncation guard refuses the merge when the current snapshot is empty while
     * history is not, or when the merge would shrink history (by record count or, in
     * {@link GuardMode#BYTE_SIZE} mode, by serialized size).
     *
     * @param previous       History on disk, empty on the first run
     * @param current        Reconciled snapshot of this run
     * @param serializedSize Serialized byte size of a history, used in BYTE_SIZE mode
     */
    public MergeOutcome mergeHistory(MergedHistory previous, ReconciledSnapshot current,
                                     ToLongFunction<MergedHistory> serializedSize) {
        List<CatalogEntity> previousEntities = previous.isEmpty() ? List.of() : previous.entities();

        if (current.isEmpty() && !previousEntities.isEmpty()) {
            return refuse(previous, "current snapshot is empty, history holds "
                + previousEntities.size() + " records");
        }

        Map<String, CatalogEntity> merged = new LinkedHashMap<>();
        Set<String> liveIds = new LinkedHashSet<>();
        for (CatalogEntity entity : current.live()) {
            liveIds.add(entity.getId());
        }
        for (CatalogEntity entity : previousEntities) {
            if (entity.getId() == null || liveIds.contains(entity.getId())) {
                continue;
            }
            CatalogEntity ended = entity.copy();
            ended.markLifecycle(Lifecycle.ENDED);
            merged.put(ended.getId(), ended);
        }
        for (CatalogEntity entity : current.live()) {
            merged.put(entity.getId(), entity);
        }

        MergedHistory candidate = MergedHistory.of(current.updatedAt(), new ArrayList<>(merged.values()));

        if (candidate.count() < previousEntities.size()) {
            return refuse(previous, "record count would shrink from "
                + previousEntities.size() + " to " + candidate.count());
        }
        if (guardMode == GuardMode.BYTE_SIZE && !previousEntities.isEmpty()) {
            long before = serializedSize.applyAsLong(previous);
            long after = serializedSize.applyAsLong(candidate);
            if (after < before) {
                return refuse(previous, "serialized size would shrink from " + before + " to " + after + " bytes");
            }
        }
        return MergeOutcome.accepted(candidate);
    }

    private MergeOutcome refuse(MergedHistory previous, String reason) {
        logger.warn("[guard] refusing to overwrite history: {}", reason);
        return MergeOutcome.refused(previous, reason);
    }

    private static void carryForward(CatalogEntity previous, CatalogEntity current) {
        if (previous == null) {
            return;
        }
        for (Map.Entry<String, Object> attribute : previous.getAttributes().entrySet()) {
            String name = attribute.getKey();
            if (CatalogEntity.LIFECYCLE_ATTRIBUTE.equals(name) || attribute.getValue() == null) {
                continue;
            }
            if (!current.hasAttribute(name)) {
                current.setAttribute(name, attribute.getValue());
            }
        }
    }

    private static Map<String, CatalogEntity> indexById(List<CatalogEntity> entities) {
        Map<String, CatalogEntity> byId = new LinkedHashMap<>();
        for (CatalogEntity entity : entities) {
            if (entity.getId() != null) {
                byId.putIfAbsent(entity.getId(), entity);
            }
        }
        return byId;
    }
}
