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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A divergence between a pointer memory and its knowledge item. Computed fresh
 * on every detection pass and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncConflict {

    public static final String REASON = "reason";
    public static final String REASON_KNOWLEDGE_DELETED = "knowledge_deleted";
    public static final String REASON_MEMORY_DELETED = "memory_deleted";
    public static final String REASON_BOTH_DELETED = "both_deleted";
    public static final String REASON_LAYER_CHANGED = "layer_changed";

    private ConflictType type;
    private String memoryId;
    private String knowledgeId;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    private ResolutionAction suggestedResolution;
}
