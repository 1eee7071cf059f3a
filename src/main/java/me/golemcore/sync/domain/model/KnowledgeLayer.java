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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hierarchical scope of a knowledge item, ordered from broadest to narrowest.
 * Each layer has a memory-store counterpart with the same name.
 */
public enum KnowledgeLayer {
    COMPANY("company"), ORG("org"), TEAM("team"), PROJECT("project");

    private final String code;

    KnowledgeLayer(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public MemoryLayer toMemoryLayer() {
        return switch (this) {
        case COMPANY -> MemoryLayer.COMPANY;
        case ORG -> MemoryLayer.ORG;
        case TEAM -> MemoryLayer.TEAM;
        case PROJECT -> MemoryLayer.PROJECT;
        };
    }
}
