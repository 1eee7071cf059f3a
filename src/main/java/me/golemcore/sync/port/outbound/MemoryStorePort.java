package me.golemcore.sync.port.outbound;

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

import me.golemcore.sync.domain.model.MemoryLayer;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.SyncScope;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Agent memory store, scoped by layer and identifiers. Failures complete
 * exceptionally with a {@code SyncException} coded {@code MEMORY_UNAVAILABLE}.
 */
public interface MemoryStorePort {

    /**
     * Stores a record under its own id, or under a new one when it has none,
     * and completes with that id. A record with the same id in the same layer
     * is replaced. {@code createdAt} is kept when already set.
     */
    CompletableFuture<String> add(SyncScope scope, MemoryRecord memoryRecord);

    CompletableFuture<Void> update(SyncScope scope, MemoryRecord memoryRecord);

    CompletableFuture<Optional<MemoryRecord>> get(SyncScope scope, MemoryLayer layer, String memoryId);

    CompletableFuture<Void> delete(SyncScope scope, MemoryLayer layer, String memoryId);
}
