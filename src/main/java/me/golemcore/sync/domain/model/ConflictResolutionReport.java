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
 * Outcome of a conflict pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictResolutionReport {

    @Builder.Default
    private List<SyncConflict> detected = new ArrayList<>();

    @Builder.Default
    private List<SyncConflict> applied = new ArrayList<>();

    /**
     * Conflicts whose condition no longer held when re-checked under the lease.
     */
    @Builder.Default
    private List<SyncConflict> alreadyResolved = new ArrayList<>();

    /**
     * Conflicts left in place because the configured action is to keep them.
     */
    @Builder.Default
    private List<SyncConflict> kept = new ArrayList<>();

    @Builder.Default
    private List<SyncConflict> unresolved = new ArrayList<>();

    @Builder.Default
    private List<SyncFailure> failures = new ArrayList<>();
}
