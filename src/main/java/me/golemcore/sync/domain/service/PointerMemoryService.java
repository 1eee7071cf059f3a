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
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.KnowledgePointer;
import me.golemcore.sync.domain.model.KnowledgePointerMetadata;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Creates, updates, tombstones and deletes pointer memories.
 *
 * <p>
 * A pointer lives in the memory layer matching its knowledge item's layer.
 * Pointer ids are derived from the scope and the knowledge id, so a pointer
 * written again after a rolled-back run replaces the earlier record. Updates
 * keep the id, even when the item moved to another layer, because
 * {@code pointerMapping} is keyed by it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PointerMemoryService {

    private static final String POINTER_ID_PREFIX = "kp-";

    private final MemoryStorePort memoryStore;
    private final CollaboratorCallExecutor callExecutor;
    private final SyncBridgeProperties properties;
    private final Clock clock;

    /**
     * Writes the pointer for {@code item} under its stable id and returns that
     * id. Writing it again replaces the record instead of adding a second one.
     */
    public String create(SyncScope scope, KnowledgeItem item, String contentHash, CancellationSignal signal) {
        MemoryRecord memoryRecord = MemoryRecord.builder()
                .id(pointerId(scope, item.getId()))
                .layer(item.getLayer().toMemoryLayer())
                .content(renderContent(item))
                .metadata(KnowledgePointerMetadata.builder()
                        .knowledgePointer(pointerFor(item, contentHash))
                        .tags(defaultTags(scope, item))
                        .build())
                .build();
        String memoryId = callExecutor.call("memory.add " + item.getId(), SyncErrorCode.MEMORY_UNAVAILABLE,
                () -> memoryStore.add(scope, memoryRecord), signal);
        log.debug("[Pointer] Created {} for {}", memoryId, item.getId());
        return memoryId;
    }

    /**
     * Regenerates content and hash of an existing pointer.
     *
     * @param storedLayer
     *            layer the pointer was written to
     * @return false when no record exists under {@code memoryId}
     */
    public boolean update(SyncScope scope, String memoryId, KnowledgeLayer storedLayer, KnowledgeItem item,
            String contentHash, CancellationSignal signal) {
        Optional<MemoryRecord> existing = find(scope, memoryId, storedLayer, signal);
        if (existing.isEmpty()) {
            return false;
        }

        MemoryRecord memoryRecord = existing.get();
        List<String> tags = mergeTags(memoryRecord, defaultTags(scope, item));
        memoryRecord.setContent(renderContent(item));
        memoryRecord.setMetadata(KnowledgePointerMetadata.builder()
                .knowledgePointer(pointerFor(item, contentHash))
                .tags(tags)
                .build());

        if (storedLayer != item.getLayer()) {
            memoryRecord.setLayer(item.getLayer().toMemoryLayer());
            callExecutor.call("memory.add " + memoryId, SyncErrorCode.MEMORY_UNAVAILABLE,
                    () -> memoryStore.add(scope, memoryRecord), signal);
            callExecutor.call("memory.delete " + memoryId, SyncErrorCode.MEMORY_UNAVAILABLE,
                    () -> memoryStore.delete(scope, storedLayer.toMemoryLayer(), memoryId), signal);
            log.debug("[Pointer] Moved {} from {} to {}", memoryId, storedLayer.getCode(),
                    item.getLayer().getCode());
        } else {
            callExecutor.call("memory.update " + memoryId, SyncErrorCode.MEMORY_UNAVAILABLE,
                    () -> memoryStore.update(scope, memoryRecord), signal);
        }
        log.debug("[Pointer] Updated {} for {}", memoryId, item.getId());
        return true;
    }

    /**
     * Flags a pointer whose knowledge item disappeared. The record is kept.
     *
     * @return true if the flag changed; false for missing or already orphaned
     *         records
     */
    public boolean markOrphaned(SyncScope scope, String memoryId, KnowledgeLayer layer, CancellationSignal signal) {
        Optional<MemoryRecord> existing = find(scope, memoryId, layer, signal);
        if (existing.isEmpty()) {
            return false;
        }
        MemoryRecord memoryRecord = existing.get();
        Optional<KnowledgePointer> pointer = memoryRecord.pointer();
        if (pointer.isEmpty() || pointer.get().isOrphaned()) {
            return false;
        }
        pointer.get().setOrphaned(true);
        callExecutor.call("memory.update " + memoryId, SyncErrorCode.MEMORY_UNAVAILABLE,
                () -> memoryStore.update(scope, memoryRecord), signal);
        log.debug("[Pointer] Orphaned {}", memoryId);
        return true;
    }

    /**
     * Replaces the tags of a pointer. Used when duplicates are merged.
     */
    public void retag(SyncScope scope, MemoryRecord memoryRecord, List<String> tags, CancellationSignal signal) {
        if (memoryRecord.getMetadata() instanceof KnowledgePointerMetadata metadata) {
            metadata.setTags(new ArrayList<>(tags));
            callExecutor.call("memory.update " + memoryRecord.getId(), SyncErrorCode.MEMORY_UNAVAILABLE,
                    () -> memoryStore.update(scope, memoryRecord), signal);
        }
    }

    public void delete(SyncScope scope, String memoryId, KnowledgeLayer layer, CancellationSignal signal) {
        callExecutor.call("memory.delete " + memoryId, SyncErrorCode.MEMORY_UNAVAILABLE,
                () -> memoryStore.delete(scope, layer.toMemoryLayer(), memoryId), signal);
        log.debug("[Pointer] Deleted {}", memoryId);
    }

    public Optional<MemoryRecord> find(SyncScope scope, String memoryId, KnowledgeLayer layer,
            CancellationSignal signal) {
        return callExecutor.call("memory.get " + memoryId, SyncErrorCode.MEMORY_UNAVAILABLE,
                () -> memoryStore.get(scope, layer.toMemoryLayer(), memoryId), signal);
    }

    /**
     * Memory id of the pointer for {@code knowledgeId} within {@code scope}.
     */
    public static String pointerId(SyncScope scope, String knowledgeId) {
        StringBuilder name = new StringBuilder(scope.key());
        scope.identifiers().forEach((key, value) -> name.append('/').append(key).append('=').append(value));
        name.append('#').append(knowledgeId);
        return POINTER_ID_PREFIX + UUID.nameUUIDFromBytes(name.toString().getBytes(StandardCharsets.UTF_8));
    }

    static List<String> mergeTags(MemoryRecord memoryRecord, List<String> tags) {
        Set<String> merged = new LinkedHashSet<>();
        if (memoryRecord.getMetadata() instanceof KnowledgePointerMetadata metadata && metadata.getTags() != null) {
            merged.addAll(metadata.getTags());
        }
        merged.addAll(tags);
        return new ArrayList<>(merged);
    }

    private String renderContent(KnowledgeItem item) {
        SyncBridgeProperties.PointerProperties pointer = properties.getPointer();
        return PointerContentGenerator.generate(item, pointer.getMaxContentLength(),
                pointer.getMaxBlockingConstraints());
    }

    private KnowledgePointer pointerFor(KnowledgeItem item, String contentHash) {
        return KnowledgePointer.builder()
                .sourceId(item.getId())
                .contentHash(contentHash)
                .syncedAt(clock.instant())
                .sourceLayer(item.getLayer())
                .sourceStatus(item.getStatus())
                .orphaned(false)
                .build();
    }

    private static List<String> defaultTags(SyncScope scope, KnowledgeItem item) {
        List<String> tags = new ArrayList<>();
        if (item.getType() != null) {
            tags.add("knowledge:" + item.getType().getCode());
        }
        for (Map.Entry<String, String> identifier : scope.identifiers().entrySet()) {
            tags.add(identifier.getKey() + ":" + identifier.getValue());
        }
        return tags;
    }
}
