package me.golemcore.sync.port.outbound;

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

import me.golemcore.sync.domain.model.SyncState;

import java.util.Optional;

/**
 * Durable storage of {@link SyncState} and its pre-run checkpoint, keyed by
 * scope.
 *
 * <p>
 * Loading a record that fails structural validation or carries an unknown
 * version throws a {@code SyncException} coded {@code STATE_CORRUPTED}.
 */
public interface SyncStatePort {

    Optional<SyncState> load(String scopeKey);

    void save(String scopeKey, SyncState state);

    void saveCheckpoint(String scopeKey, SyncState state);

    Optional<SyncState> loadCheckpoint(String scopeKey);

    void deleteCheckpoint(String scopeKey);
}
