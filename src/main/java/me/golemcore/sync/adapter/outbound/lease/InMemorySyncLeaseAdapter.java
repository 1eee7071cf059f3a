package me.golemcore.sync.adapter.outbound.lease;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.SyncLease;
import me.golemcore.sync.port.outbound.SyncLeasePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local leases. An expired lease is taken over by the next caller, so
 * a holder that died without releasing blocks the scope for at most one TTL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemorySyncLeaseAdapter implements SyncLeasePort {

    private final Clock clock;
    private final Map<String, SyncLease> leases = new ConcurrentHashMap<>();

    @Override
    public Optional<SyncLease> tryAcquire(String key, String owner, Duration ttl) {
        Instant now = clock.instant();
        SyncLease candidate = new SyncLease(key, owner, now.plus(ttl));
        SyncLease current = leases.compute(key, (k, existing) -> {
            if (existing == null || !existing.expiresAt().isAfter(now) || existing.owner().equals(owner)) {
                if (existing != null && !existing.owner().equals(owner)) {
                    log.warn("[Lease] Taking over expired lease {} from {}", key, existing.owner());
                }
                return candidate;
            }
            return existing;
        });
        if (current == candidate) {
            log.debug("[Lease] {} acquired by {} until {}", key, owner, candidate.expiresAt());
            return Optional.of(candidate);
        }
        log.debug("[Lease] {} held by {} until {}", key, current.owner(), current.expiresAt());
        return Optional.empty();
    }

    @Override
    public Optional<SyncLease> renew(SyncLease lease, Duration ttl) {
        SyncLease renewed = new SyncLease(lease.key(), lease.owner(), clock.instant().plus(ttl));
        SyncLease current = leases.computeIfPresent(lease.key(),
                (k, existing) -> existing.owner().equals(lease.owner()) ? renewed : existing);
        if (current == renewed) {
            log.debug("[Lease] {} renewed by {} until {}", lease.key(), lease.owner(), renewed.expiresAt());
            return Optional.of(renewed);
        }
        log.warn("[Lease] {} is no longer held by {}", lease.key(), lease.owner());
        return Optional.empty();
    }

    @Override
    public void release(SyncLease lease) {
        if (leases.remove(lease.key(), lease)) {
            log.debug("[Lease] {} released by {}", lease.key(), lease.owner());
        }
    }
}
