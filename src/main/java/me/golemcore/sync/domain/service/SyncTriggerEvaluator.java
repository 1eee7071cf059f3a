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

import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.domain.model.SyncTriggerContext;
import me.golemcore.sync.domain.model.SyncTriggerDecision;
import me.golemcore.sync.domain.model.TriggerReason;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a sync run should start. Conditions are checked in order and
 * the first match wins: manual request, staleness, session threshold,
 * scheduled interval.
 *
 * <p>
 * A state that was never synced counts as stale. The interval is measured from
 * the last attempt, falling back to the last successful sync.
 */
public final class SyncTriggerEvaluator {

    private SyncTriggerEvaluator() {
    }

    public static SyncTriggerDecision evaluate(SyncBridgeProperties.TriggerProperties config, SyncState state,
            SyncTriggerContext context) {
        if (context.isManualRequest()) {
            return SyncTriggerDecision.fire(TriggerReason.MANUAL);
        }

        Instant now = context.getNow();
        Instant lastSyncAt = state.getLastSyncAt();
        if (lastSyncAt == null || Duration.between(lastSyncAt, now).compareTo(config.getStalenessThreshold()) > 0) {
            return SyncTriggerDecision.fire(TriggerReason.STALENESS);
        }

        if (config.getSessionThreshold() > 0 && context.getSessionsSinceLastSync() >= config.getSessionThreshold()) {
            return SyncTriggerDecision.fire(TriggerReason.SESSION_THRESHOLD);
        }

        Instant reference = context.getLastAttemptAt() != null ? context.getLastAttemptAt() : lastSyncAt;
        if (!Duration.between(reference, now).minus(config.getInterval()).isNegative()) {
            return SyncTriggerDecision.fire(TriggerReason.SCHEDULED_INTERVAL);
        }

        return SyncTriggerDecision.skip();
    }
}
