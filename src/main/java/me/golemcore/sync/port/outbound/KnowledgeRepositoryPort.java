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

import me.golemcore.sync.domain.model.KnowledgeCommit;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.Manifest;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only access to the authoritative knowledge repository. Failures
 * complete exceptionally with a {@code SyncException} coded
 * {@code KNOWLEDGE_UNAVAILABLE}.
 */
public interface KnowledgeRepositoryPort {

    CompletableFuture<Manifest> getManifest(String tenantId);

    /**
     * Completes with an empty optional when the item does not exist.
     */
    CompletableFuture<Optional<KnowledgeItem>> getItem(String tenantId, String itemId);

    /**
     * Commits after {@code commitId}, oldest first.
     */
    CompletableFuture<List<KnowledgeCommit>> getCommitsSince(String tenantId, String commitId);
}
