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
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classification of knowledge ids between two manifests. The four sets are
 * disjoint; each is an unmodifiable sorted set.
 */
public record SyncDelta(Set<String> added, Set<String> updated, Set<String> deleted, Set<String> unchanged) {

    public SyncDelta {
        added = Collections.unmodifiableSortedSet(new TreeSet<>(added));
        updated = Collections.unmodifiableSortedSet(new TreeSet<>(updated));
        deleted = Collections.unmodifiableSortedSet(new TreeSet<>(deleted));
        unchanged = Collections.unmodifiableSortedSet(new TreeSet<>(unchanged));
    }

    public int size() {
        return added.size() + updated.size() + deleted.size() + unchanged.size();
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !updated.isEmpty() || !deleted.isEmpty();
    }

    /**
     * Moves the given unchanged ids into {@code updated}. Ids that are not
     * currently unchanged are ignored.
     */
    public SyncDelta promoteToUpdated(Set<String> ids) {
        SortedSet<String> newUpdated = new TreeSet<>(updated);
        SortedSet<String> newUnchanged = new TreeSet<>(unchanged);
        for (String id : ids) {
            if (newUnchanged.remove(id)) {
                newUpdated.add(id);
            }
        }
        return new SyncDelta(added, newUpdated, deleted, newUnchanged);
    }
}
