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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Unit of exclusive sync ownership: a tenant plus optional identifiers such as
 * {@code projectId} or {@code teamId}. The tenant id keys persisted state, the
 * lease and the memory partition.
 */
public record SyncScope(String tenantId, Map<String, String> identifiers) {

    private static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    public SyncScope {
        if (tenantId == null || !TENANT_ID.matcher(tenantId).matches()) {
            throw new IllegalArgumentException("Invalid tenant id: " + tenantId);
        }
        identifiers = Collections.unmodifiableMap(identifiers != null ? new TreeMap<>(identifiers) : new TreeMap<>());
    }

    public static SyncScope of(String tenantId) {
        return new SyncScope(tenantId, Map.of());
    }

    public String key() {
        return tenantId;
    }
}
