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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.SyncCompletedEvent;
import me.golemcore.sync.domain.model.SyncMode;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts agent sessions per tenant since the last completed full or
 * incremental sync.
 */
@Component
@Slf4j
public class SessionActivityTracker {

    private final Map<String, AtomicInteger> sessions = new ConcurrentHashMap<>();

    public void recordSession(String tenantId) {
        int count = sessions.computeIfAbsent(tenantId, k -> new AtomicInteger()).incrementAndGet();
        log.trace("[Sessions] {} sessions since last sync for {}", count, tenantId);
    }

    public int sessionsSinceLastSync(String tenantId) {
        AtomicInteger count = sessions.get(tenantId);
        return count != null ? count.get() : 0;
    }

    @EventListener
    public void onSyncCompleted(SyncCompletedEvent event) {
        if (event.result().getMode() == SyncMode.SINGLE_ITEM) {
            return;
        }
        sessions.remove(event.scope().key());
    }
}
