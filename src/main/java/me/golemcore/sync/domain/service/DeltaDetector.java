package me.golemcore.sync.domain.service;

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

import me.golemcore.sync.domain.model.SyncDelta;

import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classifies knowledge ids between the current manifest and the previously
 * seen hashes.
 *
 * <ul>
 * <li>only in current: added
 * <li>in both, hash differs: updated
 * <li>in both, hash equal: unchanged
 * <li>only in previous: deleted
 * </ul>
 */
public final class DeltaDetector {

    private DeltaDetector() {
    }

    public static SyncDelta detect(Map<String, String> current, Map<String, String> previous) {
        SortedSet<String> added = new TreeSet<>();
        SortedSet<String> updated = new TreeSet<>();
        SortedSet<String> unchanged = new TreeSet<>();
        SortedSet<String> deleted = new TreeSet<>();

        for (Map.Entry<String, String> entry : current.entrySet()) {
            String id = entry.getKey();
            if (!previous.containsKey(id)) {
                added.add(id);
            } else if (Objects.equals(entry.getValue(), previous.get(id))) {
                unchanged.add(id);
            } else {
                updated.add(id);
            }
        }
        for (String id : previous.keySet()) {
            if (!current.containsKey(id)) {
                deleted.add(id);
            }
        }
        return new SyncDelta(added, updated, deleted, unchanged);
    }
}
