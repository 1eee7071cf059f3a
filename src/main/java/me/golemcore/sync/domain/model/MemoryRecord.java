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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * A record in the agent memory store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

    private String id;
    private MemoryLayer layer;
    private String content;
    private MemoryMetadata metadata;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Pointer metadata of this record, empty for records the bridge does not
     * own.
     */
    @JsonIgnore
    public Optional<KnowledgePointer> pointer() {
        if (metadata instanceof KnowledgePointerMetadata pointerMetadata) {
            return Optional.ofNullable(pointerMetadata.getKnowledgePointer());
        }
        return Optional.empty();
    }
}
