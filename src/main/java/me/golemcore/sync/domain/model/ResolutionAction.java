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
 * What to do about a conflict. {@link #MANUAL} is never applied
 * automatically.
 */
public enum ResolutionAction {
    UPDATE_MEMORY("update_memory"), DELETE_MEMORY("delete_memory"), KEEP_MEMORY("keep_memory"), MERGE(
            "merge"), MANUAL("manual");

    private final String code;

    ResolutionAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
