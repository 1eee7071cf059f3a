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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.ResolutionAction;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncMode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters of the sync bridge.
 *
 * <ul>
 * <li>{@code sync.runs} - runs by {@code mode} and {@code outcome}
 * <li>{@code sync.run.duration} - run duration histogram by {@code mode}
 * <li>{@code sync.items} - applied items by {@code action}
 * <li>{@code sync.items.failed} - failed items by {@code code}
 * <li>{@code sync.conflicts.detected} - conflicts by {@code type}
 * <li>{@code sync.conflicts.resolved} - applied resolutions by {@code action}
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class SyncMetrics {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_PARTIAL = "partial";
    public static final String OUTCOME_ROLLED_BACK = "rolled_back";
    public static final String OUTCOME_CANCELLED = "cancelled";

    private final MeterRegistry registry;

    public void recordRun(SyncMode mode, String outcome, Duration duration) {
        String modeTag = tag(mode);
        Counter.builder("sync.runs")
                .tag("mode", modeTag)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("sync.run.duration")
                .tag("mode", modeTag)
                .publishPercentileHistogram()
                .register(registry)
                .record(duration);
    }

    public void recordItems(int added, int updated, int deleted) {
        increment("sync.items", "action", "added", added);
        increment("sync.items", "action", "updated", updated);
        increment("sync.items", "action", "deleted", deleted);
    }

    public void recordItemFailure(SyncErrorCode code) {
        increment("sync.items.failed", "code", tag(code), 1);
    }

    public void recordConflictDetected(ConflictType type) {
        increment("sync.conflicts.detected", "type", type.getCode(), 1);
    }

    public void recordConflictResolved(ResolutionAction action) {
        increment("sync.conflicts.resolved", "action", action.getCode(), 1);
    }

    private void increment(String name, String tagKey, String tagValue, int amount) {
        if (amount <= 0) {
            return;
        }
        registry.counter(name, tagKey, tagValue).increment(amount);
    }

    private static String tag(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT) : "unknown";
    }
}
