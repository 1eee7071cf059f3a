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

import me.golemcore.sync.domain.model.SyncLease;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-scope mutex with a TTL, so a crashed holder cannot block later runs.
 */
public interface SyncLeasePort {

    /**
     * Acquires the lease unless another owner holds an unexpired one.
     */
    Optional<SyncLease> tryAcquire(String key, String owner, Duration ttl);

    /**
     * Extends a lease its owner still holds. Empty once the lease was released
     * or taken over by another owner.
     */
    Optional<SyncLease> renew(SyncLease lease, Duration ttl);

    /**
     * Releases the lease if it is still held by the same owner.
     */
    void release(SyncLease lease);
}
