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

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SyncStats {

    private long totalSyncs;
    private long totalItemsSynced;
    private long totalConflicts;
    private long conflictsResolved;
    private double avgSyncDurationMs;
    private long lastSyncDurationMs;

    /**
     * Folds one completed run into the counters, keeping a running average of
     * the duration.
     */
    public void recordRun(long durationMs, long itemsSynced) {
        avgSyncDurationMs = (avgSyncDurationMs * totalSyncs + durationMs) / (totalSyncs + 1);
        totalSyncs++;
        totalItemsSynced += itemsSynced;
        lastSyncDurationMs = durationMs;
    }

    public void recordConflicts(long detected, long resolved) {
        totalConflicts += detected;
        conflictsResolved += resolved;
    }
}
