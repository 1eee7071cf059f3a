package me.golemcore.sync.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The single persisted record of what the bridge has seen and created for one
 * scope.
 *
 * <p>
 * {@code knowledgeHashes} drives delta detection and only changes through a
 * persisted orchestrator run. {@code pointerMapping} maps pointer memory ids to
 * knowledge ids; {@code knowledgeLayers} remembers the layer each knowledge id
 * was synced into so its pointer can be addressed in the memory store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncState {

    public static final String CURRENT_VERSION = "1.0";

    @Builder.Default
    private String version = CURRENT_VERSION;

    private Instant lastSyncAt;
    private String lastKnowledgeCommit;

    @Builder.Default
    private Map<String, String> knowledgeHashes = new TreeMap<>();

    @Builder.Default
    private Map<String, String> pointerMapping = new TreeMap<>();

    @Builder.Default
    private Map<String, KnowledgeLayer> knowledgeLayers = new TreeMap<>();

    @Builder.Default
    private List<SyncFailure> failedItems = new ArrayList<>();

    @Builder.Default
    private SyncStats stats = new SyncStats();

    public static SyncState empty() {
        return SyncState.builder().build();
    }

    /**
     * Deep copy; mutations of the copy never reach this instance.
     */
    public SyncState copy() {
        List<SyncFailure> failures = new ArrayList<>();
        for (SyncFailure failure : failedItems) {
            failures.add(failure.toBuilder().build());
        }
        return SyncState.builder()
                .version(version)
                .lastSyncAt(lastSyncAt)
                .lastKnowledgeCommit(lastKnowledgeCommit)
                .knowledgeHashes(new TreeMap<>(knowledgeHashes))
                .pointerMapping(new TreeMap<>(pointerMapping))
                .knowledgeLayers(new TreeMap<>(knowledgeLayers))
                .failedItems(failures)
                .stats(stats.toBuilder().build())
                .build();
    }

    /**
     * Memory ids currently mapped to the given knowledge id, sorted.
     */
    public List<String> memoryIdsFor(String knowledgeId) {
        List<String> memoryIds = new ArrayList<>();
        new TreeMap<>(pointerMapping).forEach((memoryId, mappedKnowledgeId) -> {
            if (mappedKnowledgeId.equals(knowledgeId)) {
                memoryIds.add(memoryId);
            }
        });
        return memoryIds;
    }
}
