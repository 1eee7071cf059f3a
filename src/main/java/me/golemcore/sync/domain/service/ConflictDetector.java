package me.golemcore.sync.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.CancellationSignal;
import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.KnowledgePointer;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.SyncConflict;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.port.outbound.KnowledgeRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Classifies every {@code (memoryId, knowledgeId)} pair of
 * {@code pointerMapping}. Read-only: reads the knowledge repository and the
 * memory store but never writes.
 *
 * <p>
 * Per knowledge id:
 * <ol>
 * <li>each pair where either side is gone yields one {@code orphaned_pointer}
 * ({@code knowledge_deleted}, {@code memory_deleted} or
 * {@code both_deleted});
 * <li>when several live pointers share the item, the one synced most recently
 * is kept (smallest memory id on ties) and every other yields a
 * {@code duplicate_pointer};
 * <li>the remaining pointer yields a {@code status_change} if the item was
 * retired since it was written, else a {@code hash_mismatch} if its content
 * is stale or the item moved to another layer ({@code layer_changed} when
 * only the layer differs).
 * </ol>
 * Pairs whose collaborators cannot be read are logged and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictDetector {

    static final String DETAIL_KEEP = "keep";
    static final String DETAIL_REMOVE = "remove";
    static final String DETAIL_STORED_HASH = "storedHash";
    static final String DETAIL_CURRENT_HASH = "currentHash";
    static final String DETAIL_STORED_LAYER = "storedLayer";
    static final String DETAIL_CURRENT_LAYER = "currentLayer";
    static final String DETAIL_FROM_STATUS = "fromStatus";
    static final String DETAIL_TO_STATUS = "toStatus";

    private final KnowledgeRepositoryPort knowledgeRepository;
    private final PointerMemoryService pointerMemoryService;
    private final CollaboratorCallExecutor callExecutor;

    public List<SyncConflict> detect(SyncScope scope, SyncState snapshot, CancellationSignal signal) {
        Map<String, List<String>> byKnowledgeId = new TreeMap<>();
        new TreeMap<>(snapshot.getPointerMapping()).forEach((memoryId, knowledgeId) -> byKnowledgeId
                .computeIfAbsent(knowledgeId, k -> new ArrayList<>()).add(memoryId));

        List<SyncConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : byKnowledgeId.entrySet()) {
            signal.throwIfCancelled();
            try {
                conflicts.addAll(detectFor(scope, snapshot, entry.getKey(), entry.getValue(), signal));
            } catch (SyncException e) {
                if (e.getCode() == SyncErrorCode.CANCELLED) {
                    throw e;
                }
                log.warn("[Conflict] Skipping {}: {}", entry.getKey(), e.getMessage());
            }
        }
        log.debug("[Conflict] {} pairs checked for {}, {} conflicts", snapshot.getPointerMapping().size(),
                scope.key(), conflicts.size());
        return conflicts;
    }

    private List<SyncConflict> detectFor(SyncScope scope, SyncState snapshot, String knowledgeId,
            List<String> memoryIds, CancellationSignal signal) {
        Optional<KnowledgeItem> item = callExecutor.call("knowledge.getItem " + knowledgeId,
                SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                () -> knowledgeRepository.getItem(scope.key(), knowledgeId), signal);
        KnowledgeLayer layer = snapshot.getKnowledgeLayers().get(knowledgeId);
        if (layer == null && item.isPresent()) {
            layer = item.get().getLayer();
        }

        List<SyncConflict> conflicts = new ArrayList<>();
        List<MemoryRecord> livePointers = new ArrayList<>();
        for (String memoryId : memoryIds) {
            Optional<MemoryRecord> memoryRecord = Optional.empty();
            if (layer != null) {
                try {
                    memoryRecord = pointerMemoryService.find(scope, memoryId, layer, signal);
                } catch (SyncException e) {
                    if (e.getCode() == SyncErrorCode.CANCELLED) {
                        throw e;
                    }
                    log.warn("[Conflict] Skipping pair {} -> {}: {}", memoryId, knowledgeId, e.getMessage());
                    continue;
                }
            }
            boolean memoryGone = memoryRecord.flatMap(MemoryRecord::pointer).isEmpty();
            if (item.isEmpty() || memoryGone) {
                conflicts.add(orphaned(memoryId, knowledgeId, item.isEmpty(), memoryGone));
            } else {
                livePointers.add(memoryRecord.get());
            }
        }

        if (item.isEmpty() || livePointers.isEmpty()) {
            return conflicts;
        }

        MemoryRecord kept = livePointers.get(0);
        if (livePointers.size() > 1) {
            kept = livePointers.stream()
                    .sorted(Comparator.comparing(ConflictDetector::syncedAt, Comparator.reverseOrder())
                            .thenComparing(MemoryRecord::getId))
                    .findFirst()
                    .orElseThrow();
            for (MemoryRecord duplicate : livePointers) {
                if (!duplicate.getId().equals(kept.getId())) {
                    conflicts.add(duplicate(duplicate.getId(), kept.getId(), knowledgeId));
                }
            }
        }

        KnowledgeItem current = item.get();
        KnowledgePointer pointer = kept.pointer().orElseThrow();
        String currentHash = KnowledgeHashSupport.resolveHash(current);
        if (current.getStatus() != null && current.getStatus().isRetired()
                && current.getStatus() != pointer.getSourceStatus()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put(DETAIL_FROM_STATUS, pointer.getSourceStatus() != null
                    ? pointer.getSourceStatus().getCode()
                    : null);
            details.put(DETAIL_TO_STATUS, current.getStatus().getCode());
            conflicts.add(conflict(ConflictType.STATUS_CHANGE, kept.getId(), knowledgeId, details));
        } else {
            boolean contentStale = !currentHash.equals(pointer.getContentHash()) || pointer.isOrphaned();
            boolean moved = current.getLayer() != null && current.getLayer() != layer;
            if (contentStale || moved) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put(DETAIL_STORED_HASH, pointer.getContentHash());
                details.put(DETAIL_CURRENT_HASH, currentHash);
                if (moved) {
                    details.put(DETAIL_STORED_LAYER, layer.getCode());
                    details.put(DETAIL_CURRENT_LAYER, current.getLayer().getCode());
                }
                if (!contentStale) {
                    details.put(SyncConflict.REASON, SyncConflict.REASON_LAYER_CHANGED);
                }
                conflicts.add(conflict(ConflictType.HASH_MISMATCH, kept.getId(), knowledgeId, details));
            }
        }
        return conflicts;
    }

    private static SyncConflict orphaned(String memoryId, String knowledgeId, boolean knowledgeGone,
            boolean memoryGone) {
        String reason;
        if (knowledgeGone && memoryGone) {
            reason = SyncConflict.REASON_BOTH_DELETED;
        } else if (knowledgeGone) {
            reason = SyncConflict.REASON_KNOWLEDGE_DELETED;
        } else {
            reason = SyncConflict.REASON_MEMORY_DELETED;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(SyncConflict.REASON, reason);
        return conflict(ConflictType.ORPHANED_POINTER, memoryId, knowledgeId, details);
    }

    private static SyncConflict duplicate(String memoryId, String keptMemoryId, String knowledgeId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(DETAIL_KEEP, keptMemoryId);
        details.put(DETAIL_REMOVE, memoryId);
        return conflict(ConflictType.DUPLICATE_POINTER, memoryId, knowledgeId, details);
    }

    private static SyncConflict conflict(ConflictType type, String memoryId, String knowledgeId,
            Map<String, Object> details) {
        return SyncConflict.builder()
                .type(type)
                .memoryId(memoryId)
                .knowledgeId(knowledgeId)
                .details(details)
                .suggestedResolution(ConflictResolutionPolicy.defaultFor(type))
                .build();
    }

    private static Instant syncedAt(MemoryRecord memoryRecord) {
        Instant syncedAt = memoryRecord.pointer().map(KnowledgePointer::getSyncedAt).orElse(null);
        return syncedAt != null ? syncedAt : Instant.EPOCH;
    }
}
