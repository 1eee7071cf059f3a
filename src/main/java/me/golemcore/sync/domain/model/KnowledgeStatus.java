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
 * Lifecycle status of a knowledge item.
 */
public enum KnowledgeStatus {
    DRAFT("draft"), PROPOSED("proposed"), ACCEPTED("accepted"), DEPRECATED("deprecated"), SUPERSEDED("superseded");

    private final String code;

    KnowledgeStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Whether the item has been retired. Pointers to retired items must reflect
     * the retirement in their content.
     */
    public boolean isRetired() {
        return this == DEPRECATED || this == SUPERSEDED;
    }
}
