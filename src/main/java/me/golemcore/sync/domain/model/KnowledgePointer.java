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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Link from a pointer memory to its source knowledge item, embedded in the
 * memory record's metadata.
 *
 * <p>
 * {@code contentHash} is the source hash at sync time; comparing it with the
 * current hash is how drift is detected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgePointer {

    public static final String SOURCE_TYPE_KNOWLEDGE = "knowledge";

    @Builder.Default
    private String sourceType = SOURCE_TYPE_KNOWLEDGE;

    private String sourceId;
    private String contentHash;
    private Instant syncedAt;
    private KnowledgeLayer sourceLayer;
    private KnowledgeStatus sourceStatus;

    @JsonProperty("isOrphaned")
    private boolean orphaned;
}
