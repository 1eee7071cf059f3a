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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one sync run. Returned even when individual items failed; only
 * run-level failures are thrown instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private String runId;
    private SyncMode mode;
    private String tenantId;
    private Instant startedAt;
    private int added;
    private int updated;
    private int deleted;
    private int unchanged;

    @Builder.Default
    private List<SyncFailure> failures = new ArrayList<>();

    private long durationMs;
    private String knowledgeCommit;

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public int itemsApplied() {
        return added + updated + deleted;
    }
}
