package me.golemcore.sync.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.CancellationSignal;
import me.golemcore.sync.domain.model.ConflictResolutionReport;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncResult;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.domain.model.SyncTriggerContext;
import me.golemcore.sync.domain.model.SyncTriggerDecision;
import me.golemcore.sync.domain.model.TriggerReason;
import me.golemcore.sync.domain.service.ConflictResolver;
import me.golemcore.sync.domain.service.SessionActivityTracker;
import me.golemcore.sync.domain.service.SyncOrchestrator;
import me.golemcore.sync.domain.service.SyncStateService;
import me.golemcore.sync.domain.service.SyncTriggerEvaluator;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background driver of sync runs and conflict passes.
 *
 * <p>
 * Every tick evaluates the trigger for each configured tenant and runs a sync
 * when it fires: a full sync for manual requests, stale or never-synced state,
 * an incremental sync otherwise. A conflict pass follows once
 * {@code sync.conflicts.interval} has elapsed since the previous one.
 *
 * <p>
 * Ticks never overlap: a tick that finds the previous one still running is
 * skipped. On shutdown the in-flight run is cancelled, which restores its
 * checkpoint.
 */
@Component
@Slf4j
public class SyncScheduler {

    private final SyncOrchestrator orchestrator;
    private final ConflictResolver conflictResolver;
    private final SyncStateService stateService;
    private final SessionActivityTracker sessionTracker;
    private final SyncBridgeProperties properties;
    private final Clock clock;

    private final Set<String> manualRequests = ConcurrentHashMap.newKeySet();
    private final Map<String, Instant> lastAttemptAt = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastConflictPassAt = new ConcurrentHashMap<>();
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private volatile CancellationSignal currentSignal;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public SyncScheduler(SyncOrchestrator orchestrator, ConflictResolver conflictResolver,
            SyncStateService stateService, SessionActivityTracker sessionTracker, SyncBridgeProperties properties,
            Clock clock) {
        this.orchestrator = orchestrator;
        this.conflictResolver = conflictResolver;
        this.stateService = stateService;
        this.sessionTracker = sessionTracker;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("[SyncScheduler] Disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sync-scheduler");
            t.setDaemon(true);
            return t;
        });

        long tickMillis = Math.max(1000, properties.getScheduler().getTickInterval().toMillis());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("[SyncScheduler] Started with tick interval: {}ms, tenants: {}", tickMillis,
                properties.getTenants());
    }

    @PreDestroy
    public void shutdown() {
        CancellationSignal signal = currentSignal;
        if (signal != null) {
            signal.cancel();
        }
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[SyncScheduler] Shut down");
    }

    /**
     * Queues a full sync for the tenant on the next tick.
     */
    public void requestManualSync(String tenantId) {
        manualRequests.add(tenantId);
        log.info("[SyncScheduler] Manual sync requested for {}", tenantId);
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[SyncScheduler] Previous tick still running, skipping");
            return;
        }
        try {
            for (String tenantId : properties.getTenants()) {
                if (scheduler != null && scheduler.isShutdown()) {
                    return;
                }
                tickTenant(tenantId);
            }
        } catch (RuntimeException e) {
            log.error("[SyncScheduler] Tick failed", e);
        } finally {
            executing.set(false);
        }
    }

    private void tickTenant(String tenantId) {
        SyncScope scope = SyncScope.of(tenantId);
        SyncState state;
        try {
            state = stateService.load(scope);
        } catch (SyncException e) {
            log.error("[SyncScheduler] Cannot read state of {} ({}): {}", tenantId, e.getCode(), e.getMessage());
            return;
        }

        Instant now = clock.instant();
        SyncTriggerContext context = SyncTriggerContext.builder()
                .manualRequest(manualRequests.contains(tenantId))
                .now(now)
                .sessionsSinceLastSync(sessionTracker.sessionsSinceLastSync(tenantId))
                .lastAttemptAt(lastAttemptAt.get(tenantId))
                .build();
        SyncTriggerDecision decision = SyncTriggerEvaluator.evaluate(properties.getTrigger(), state, context);
        if (decision.shouldSync()) {
            runSync(scope, state, decision.reason(), now);
        }

        if (properties.getConflicts().isEnabled() && conflictPassDue(tenantId, now)) {
            runConflictPass(scope, now);
        }
    }

    private void runSync(SyncScope scope, SyncState state, TriggerReason reason, Instant now) {
        String tenantId = scope.key();
        lastAttemptAt.put(tenantId, now);
        manualRequests.remove(tenantId);
        CancellationSignal signal = CancellationSignal.create();
        currentSignal = signal;
        try {
            boolean full = reason == TriggerReason.MANUAL || reason == TriggerReason.STALENESS
                    || state.getLastKnowledgeCommit() == null;
            log.info("[SyncScheduler] Triggered {} sync for {} ({})", full ? "full" : "incremental", tenantId,
                    reason);
            SyncResult result = full
                    ? orchestrator.fullSync(scope, false, signal)
                    : orchestrator.incrementalSync(scope, signal);
            if (!result.isSuccess()) {
                log.warn("[SyncScheduler] Sync of {} completed with {} failures", tenantId,
                        result.getFailures().size());
            }
        } catch (SyncException e) {
            logRunFailure("Sync", tenantId, e);
        } finally {
            currentSignal = null;
        }
    }

    private void runConflictPass(SyncScope scope, Instant now) {
        String tenantId = scope.key();
        lastConflictPassAt.put(tenantId, now);
        CancellationSignal signal = CancellationSignal.create();
        currentSignal = signal;
        try {
            ConflictResolutionReport report = conflictResolver.reconcile(scope, signal);
            if (!report.getUnresolved().isEmpty()) {
                log.warn("[SyncScheduler] {} conflicts of {} need manual resolution", report.getUnresolved().size(),
                        tenantId);
            }
        } catch (SyncException e) {
            logRunFailure("Conflict pass", tenantId, e);
        } finally {
            currentSignal = null;
        }
    }

    private boolean conflictPassDue(String tenantId, Instant now) {
        Instant last = lastConflictPassAt.get(tenantId);
        Duration interval = properties.getConflicts().getInterval();
        return last == null || !Duration.between(last, now).minus(interval).isNegative();
    }

    private static void logRunFailure(String what, String tenantId, SyncException e) {
        if (e.getCode() == SyncErrorCode.SYNC_IN_PROGRESS || e.getCode() == SyncErrorCode.CANCELLED) {
            log.info("[SyncScheduler] {} of {} skipped: {}", what, tenantId, e.getMessage());
        } else {
            log.error("[SyncScheduler] {} of {} failed ({}): {}", what, tenantId, e.getCode(), e.getMessage());
        }
    }
}
