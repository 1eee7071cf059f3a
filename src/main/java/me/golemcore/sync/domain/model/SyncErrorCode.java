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

/**
 * Failure taxonomy of the sync bridge.
 */
public enum SyncErrorCode {

    /**
     * Knowledge repository unreachable or returned an error.
     */
    KNOWLEDGE_UNAVAILABLE(true),

    /**
     * Memory store unreachable or returned an error.
     */
    MEMORY_UNAVAILABLE(true),

    TIMEOUT(true),

    /**
     * Persisted state failed structural validation. Needs an operator; never
     * repaired automatically.
     */
    STATE_CORRUPTED(false),

    CHECKPOINT_FAILED(false),

    ROLLBACK_FAILED(false),

    PERSISTENCE_FAILED(false),

    /**
     * Individual items failed; the run itself completed.
     */
    PARTIAL_FAILURE(false),

    /**
     * A conflict whose policy is {@code manual}.
     */
    CONFLICT_UNRESOLVED(false),

    /**
     * Another run holds the scope lease.
     */
    SYNC_IN_PROGRESS(false),

    CANCELLED(false);

    private final boolean retryable;

    SyncErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
