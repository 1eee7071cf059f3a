package me.golemcore.sync.adapter.outbound.memory;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.MemoryLayer;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.port.outbound.MemoryStorePort;
import me.golemcore.sync.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * File-backed memory store: one JSON document per record at
 * {@code memory/<tenant>/<layer>/<id>.json}.
 *
 * <p>
 * Record metadata is deserialized into its tagged variant here, so callers
 * receive either pointer metadata or plain metadata and never a raw map.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalMemoryStoreAdapter implements MemoryStorePort {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SyncBridgeProperties properties;
    private final Clock clock;

    @Override
    public CompletableFuture<String> add(SyncScope scope, MemoryRecord memoryRecord) {
        Instant now = clock.instant();
        String memoryId = memoryRecord.getId() != null ? memoryRecord.getId() : UUID.randomUUID().toString();
        memoryRecord.setId(memoryId);
        if (memoryRecord.getCreatedAt() == null) {
            memoryRecord.setCreatedAt(now);
        }
        memoryRecord.setUpdatedAt(now);
        return write(scope, memoryRecord)
                .thenApply(ignored -> {
                    log.debug("[Memory] Added {} to {}/{}", memoryId, scope.key(), memoryRecord.getLayer().getCode());
                    return memoryId;
                });
    }

    @Override
    public CompletableFuture<Void> update(SyncScope scope, MemoryRecord memoryRecord) {
        memoryRecord.setUpdatedAt(clock.instant());
        return write(scope, memoryRecord);
    }

    @Override
    public CompletableFuture<Optional<MemoryRecord>> get(SyncScope scope, MemoryLayer layer, String memoryId) {
        return storagePort.getText(directory(), path(scope, layer, memoryId))
                .handle((json, error) -> {
                    if (error != null) {
                        throw unavailable("read", memoryId, error);
                    }
                    if (json == null) {
                        return Optional.<MemoryRecord>empty();
                    }
                    try {
                        return Optional.of(objectMapper.readValue(json, MemoryRecord.class));
                    } catch (JsonProcessingException e) {
                        throw unavailable("parse", memoryId, e);
                    }
                });
    }

    @Override
    public CompletableFuture<Void> delete(SyncScope scope, MemoryLayer layer, String memoryId) {
        return storagePort.deleteObject(directory(), path(scope, layer, memoryId))
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw unavailable("delete", memoryId, error);
                    }
                    log.debug("[Memory] Deleted {} from {}/{}", memoryId, scope.key(), layer.getCode());
                    return null;
                });
    }

    private CompletableFuture<Void> write(SyncScope scope, MemoryRecord memoryRecord) {
        String json;
        try {
            json = objectMapper.writeValueAsString(memoryRecord);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(unavailable("serialize", memoryRecord.getId(), e));
        }
        return storagePort.putTextAtomic(directory(), path(scope, memoryRecord.getLayer(), memoryRecord.getId()),
                json, false)
                .handle((ignored, error) -> {
                    if (error != null) {
                        throw unavailable("write", memoryRecord.getId(), error);
                    }
                    return null;
                });
    }

    private static SyncException unavailable(String operation, String memoryId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        return new SyncException(SyncErrorCode.MEMORY_UNAVAILABLE,
                "Failed to " + operation + " memory " + memoryId + ": " + cause.getMessage(), cause);
    }

    private String directory() {
        return properties.getStorage().getDirectories().getMemory();
    }

    private static String path(SyncScope scope, MemoryLayer layer, String memoryId) {
        return scope.key() + "/" + layer.getCode() + "/" + memoryId + ".json";
    }
}
