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

import java.util.ArrayList;
import java.util.List;

/**
 * Full knowledge item as returned by the knowledge repository.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeItem {

    private String id;
    private String title;
    private String summary;
    private String content;

    @Builder.Default
    private List<KnowledgeConstraint> constraints = new ArrayList<>();

    private KnowledgeStatus status;
    private KnowledgeLayer layer;
    private KnowledgeType type;

    /**
     * Hash published by the repository; may be absent, in which case it is
     * recomputed locally.
     */
    private String contentHash;
}
