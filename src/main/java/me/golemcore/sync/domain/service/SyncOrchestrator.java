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
import me.golemcore.sync.domain.model.CancellationSignal;
import me.golemcore.sync.domain.model.KnowledgeCommit;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.Manifest;
import me.golemcore.sync.domain.model.ManifestEntry;
import me.golemcore.sync.domain.model.SyncCompletedEvent;
import me.golemcore.sync.domain.model.SyncDelta;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncFailedEvent;
import me.golemcore.sync.domain.model.SyncFailure;
import me.golemcore.sync.domain.model.SyncLease;
import me.golemcore.sync.domain.model.SyncMode;
import me.golemcore.sync.domain.model.SyncPhase;
import me.golemcore.sync.domain.model.SyncResult;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.infrastructure.event.SpringEventBus;
import me.golemcore.sync.port.outbound.KnowledgeRepositoryPort;
import me.golemcore.sync.port.outbound.SyncLeasePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs full, incremental and single-item syncs for a scope.
 *
 * <p>
 * Every run holds the scope lease and walks
 * {@code CHECKPOINTING → DETECTING → APPLYING → PERSISTING}. Items are applied
 * on the bounded {@code syncApplyExecutor}; workers only compute outcomes, and
 * the calling thread merges them into the working state in id order.
 * Persisting that working state is the run's only durable side effect.
 *
 * <p>
 * The lease is renewed between phases and while workers run. A run that lost
 * it to another run fails without touching the persisted state.
 *
 * <p>
 * Item failures are recorded in {@code failedItems} and never abort a run. A
 * failure to checkpoint aborts before anything changed. A failure to persist,
 * or a cancellation, restores the checkpoint and rethrows.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    /**
     * Key of the {@code failedItems} entry recorded when the manifest or commit
     * list could not be fetched.
     */
    public static final String MANIFEST_FAILURE_KEY = "manifest";

    private final KnowledgeRepositoryPort knowledgeRepository;
    private final PointerMemoryService pointerMemoryService;
    private final SyncStateService stateService;
    private final SyncLeasePort leasePort;
    private final CollaboratorCallExecutor callExecutor;
    private final SyncMetrics metrics;
    private final SpringEventBus eventBus;
    private final SyncBridgeProperties properties;
    private final Clock clock;
    private final ExecutorService applyExecutor;
    private final Map<String, SyncPhase> phases = new ConcurrentHashMap<>();

    public SyncOrchestrator(KnowledgeRepositoryPort knowledgeRepository, PointerMemoryService pointerMemoryService,
            SyncStateService stateService, SyncLeasePort leasePort, CollaboratorCallExecutor callExecutor,
            SyncMetrics metrics, SpringEventBus eventBus, SyncBridgeProperties properties, Clock clock,
            @Qualifier("syncApplyExecutor") ExecutorService applyExecutor) {
        this.knowledgeRepository = knowledgeRepository;
        this.pointerMemoryService = pointerMemoryService;
        this.stateService = stateService;
        this.leasePort = leasePort;
        this.callExecutor = callExecutor;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
        this.applyExecutor = applyExecutor;
    }

    public SyncResult fullSync(SyncScope scope, boolean force) {
        return fullSync(scope, force, CancellationSignal.create());
    }

    /**
     * Reconciles every item of the current manifest.
     *
     * @param force
     *            re-apply items whose hash did not change
     */
    public SyncResult fullSync(SyncScope scope, boolean force, CancellationSignal signal) {
        return run(scope, SyncMode.FULL, signal, run -> planFull(run, force));
    }

    public SyncResult incrementalSync(SyncScope scope) {
        return incrementalSync(scope, CancellationSignal.create());
    }

    /**
     * Reconciles the items touched by commits since the last synced commit,
     * plus previously failed items. Without a recorded commit this is a full
     * sync.
     */
    public SyncResult incrementalSync(SyncScope scope, CancellationSignal signal) {
        return run(scope, SyncMode.INCREMENTAL, signal, this::planIncremental);
    }

    public SyncResult syncItem(SyncScope scope, String knowledgeId) {
        return syncItem(scope, knowledgeId, CancellationSignal.create());
    }

    /**
     * Reconciles one item without consulting the manifest. Does not move
     * {@code lastSyncAt} or {@code lastKnowledgeCommit}.
     */
    public SyncResult syncItem(SyncScope scope, String knowledgeId, CancellationSignal signal) {
        return run(scope, SyncMode.SINGLE_ITEM, signal, run -> planSingleItem(run, knowledgeId));
    }

    public SyncPhase currentPhase(SyncScope scope) {
        return phases.getOrDefault(scope.key(), SyncPhase.IDLE);
    }

    private SyncResult run(SyncScope scope, SyncMode mode, CancellationSignal signal, Planner planner) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        SyncLease lease = leasePort.tryAcquire(scope.key(), runId, properties.getLease().getTtl())
                .orElseThrow(() -> new SyncException(SyncErrorCode.SYNC_IN_PROGRESS,
                        "Another sync run holds the lease for " + scope.key()));
        log.info("[Sync] Run {} started: mode={}, tenant={}", runId, mode, scope.key());

        RunContext run = new RunContext(runId, scope, mode, lease, signal, startedAt);
        try {
            enter(scope, SyncPhase.CHECKPOINTING);
            try {
                run.working = stateService.checkpoint(scope);
            } catch (SyncException e) {
                enter(scope, SyncPhase.FAILED);
                log.error("[Sync] Run {} could not checkpoint: {}", runId, e.getMessage());
                metrics.recordRun(mode, SyncMetrics.OUTCOME_ROLLED_BACK, elapsed(startNanos));
                eventBus.publish(new SyncFailedEvent(scope, runId, mode, e.getCode(), e.getMessage()));
                throw e;
            }

            try {
                return execute(run, planner, startNanos);
            } catch (RuntimeException e) {
                throw rollBack(run, e, startNanos);
            }
        } finally {
            if (!run.leaseLost) {
                phases.remove(scope.key());
            }
            leasePort.release(run.lease);
        }
    }

    private SyncResult execute(RunContext run, Planner planner, long startNanos) {
        enter(run.scope, SyncPhase.DETECTING);
        RunPlan plan = planner.plan(run);
        log.debug("[Sync] Run {} delta: added={}, updated={}, deleted={}, unchanged={}", run.runId,
                plan.delta().added().size(), plan.delta().updated().size(), plan.delta().deleted().size(),
                plan.delta().unchanged().size());

        renewLease(run);
        enter(run.scope, SyncPhase.APPLYING);
        SyncResult result = SyncResult.builder()
                .runId(run.runId)
                .mode(run.effectiveMode)
                .tenantId(run.scope.key())
                .startedAt(run.startedAt)
                .unchanged(plan.delta().unchanged().size())
                .knowledgeCommit(plan.commitId())
                .build();
        if (plan.planFailure() != null) {
            recordFailure(run.working, result, plan.planFailure());
        }
        List<ItemOutcome> outcomes = applyAll(run, plan);
        run.signal.throwIfCancelled();
        merge(run, outcomes, result);
        if (plan.planFailure() == null && plan.advancesMarkers()) {
            clearFailure(run.working, MANIFEST_FAILURE_KEY);
        }

        enter(run.scope, SyncPhase.PERSISTING);
        SyncState working = run.working;
        Instant now = clock.instant();
        if (plan.advancesMarkers()) {
            working.setLastSyncAt(now);
            working.setLastKnowledgeCommit(plan.commitId());
        }
        pruneFailures(working, now);
        long durationMs = elapsed(startNanos).toMillis();
        result.setDurationMs(durationMs);
        working.getStats().recordRun(durationMs, result.itemsApplied());

        run.signal.throwIfCancelled();
        renewLease(run);
        stateService.save(run.scope, working);
        stateService.clearCheckpoint(run.scope);
        enter(run.scope, SyncPhase.IDLE);

        metrics.recordRun(run.effectiveMode,
                result.isSuccess() ? SyncMetrics.OUTCOME_SUCCESS : SyncMetrics.OUTCOME_PARTIAL,
                Duration.ofMillis(durationMs));
        metrics.recordItems(result.getAdded(), result.getUpdated(), result.getDeleted());
        log.info("[Sync] Run {} completed: mode={}, added={}, updated={}, deleted={}, unchanged={}, failures={}, "
                + "durationMs={}", run.runId, run.effectiveMode, result.getAdded(), result.getUpdated(),
                result.getDeleted(), result.getUnchanged(), result.getFailures().size(), durationMs);
        eventBus.publish(new SyncCompletedEvent(run.scope, result));
        return result;
    }

    private SyncException rollBack(RunContext run, RuntimeException cause, long startNanos) {
        SyncErrorCode code = cause instanceof SyncException syncException ? syncException.getCode() : null;
        if (run.leaseLost) {
            // the checkpoint and the state now belong to the run that took the lease over
            log.error("[Sync] Run {} lost the lease for {}, discarding its work: {}", run.runId, run.scope.key(),
                    cause.getMessage());
            metrics.recordRun(run.effectiveMode, SyncMetrics.OUTCOME_ROLLED_BACK, elapsed(startNanos));
            eventBus.publish(new SyncFailedEvent(run.scope, run.runId, run.effectiveMode,
                    SyncErrorCode.SYNC_IN_PROGRESS, cause.getMessage()));
            return cause instanceof SyncException syncException
                    ? syncException
                    : new SyncException(SyncErrorCode.SYNC_IN_PROGRESS, cause.getMessage(), cause);
        }
        enter(run.scope, SyncPhase.FAILED);
        log.error("[Sync] Run {} failed ({}), rolling back: {}", run.runId, code, cause.getMessage());
        try {
            stateService.rollback(run.scope);
        } catch (SyncException rollbackError) {
            rollbackError.addSuppressed(cause);
            log.error("[Sync] Run {} rollback failed: {}", run.runId, rollbackError.getMessage());
            metrics.recordRun(run.effectiveMode, SyncMetrics.OUTCOME_ROLLED_BACK, elapsed(startNanos));
            eventBus.publish(new SyncFailedEvent(run.scope, run.runId, run.effectiveMode,
                    rollbackError.getCode(), rollbackError.getMessage()));
            return rollbackError;
        }
        enter(run.scope, SyncPhase.ROLLED_BACK);
        metrics.recordRun(run.effectiveMode,
                code == SyncErrorCode.CANCELLED ? SyncMetrics.OUTCOME_CANCELLED : SyncMetrics.OUTCOME_ROLLED_BACK,
                elapsed(startNanos));
        eventBus.publish(new SyncFailedEvent(run.scope, run.runId, run.effectiveMode, code, cause.getMessage()));
        if (cause instanceof SyncException syncException) {
            return syncException;
        }
        return new SyncException(SyncErrorCode.PERSISTENCE_FAILED,
                "Run " + run.runId + " failed unexpectedly: " + cause.getMessage(), cause);
    }

    // Planning

    private RunPlan planFull(RunContext run, boolean force) {
        Manifest manifest;
        try {
            manifest = fetchManifest(run);
        } catch (SyncException e) {
            return failedPlan(run, e);
        }

        SyncState working = run.working;
        Map<String, String> current = manifest.hashes();
        SyncDelta delta = promoteMovedItems(run, manifest,
                DeltaDetector.detect(current, working.getKnowledgeHashes()));
        if (force) {
            delta = delta.promoteToUpdated(delta.unchanged());
        } else {
            Set<String> unmapped = new TreeSet<>(delta.unchanged());
            unmapped.removeAll(working.getPointerMapping().values());
            if (!unmapped.isEmpty()) {
                log.info("[Sync] Run {} repairing {} items without pointer", run.runId, unmapped.size());
                delta = delta.promoteToUpdated(unmapped);
            }
        }
        return new RunPlan(manifest.getCommitId(), delta, current, Map.of(), null, true);
    }

    private RunPlan planIncremental(RunContext run) {
        String lastCommit = run.working.getLastKnowledgeCommit();
        if (lastCommit == null) {
            log.info("[Sync] Run {} has no previous commit, falling back to full sync", run.runId);
            run.effectiveMode = SyncMode.FULL;
            return planFull(run, false);
        }

        Manifest manifest;
        List<KnowledgeCommit> commits;
        try {
            manifest = fetchManifest(run);
            if (lastCommit.equals(manifest.getCommitId())) {
                commits = List.of();
            } else {
                commits = callExecutor.call("knowledge.getCommitsSince", SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                        () -> knowledgeRepository.getCommitsSince(run.scope.key(), lastCommit), run.signal);
            }
        } catch (SyncException e) {
            return failedPlan(run, e);
        }

        Set<String> affected = new TreeSet<>();
        for (KnowledgeCommit commit : commits) {
            affected.addAll(commit.affectedItemIds());
        }
        for (SyncFailure failure : run.working.getFailedItems()) {
            if (!MANIFEST_FAILURE_KEY.equals(failure.getKnowledgeId())) {
                affected.add(failure.getKnowledgeId());
            }
        }

        Map<String, String> current = manifest.restrictTo(affected).hashes();
        Map<String, String> previous = new TreeMap<>();
        for (String id : affected) {
            String hash = run.working.getKnowledgeHashes().get(id);
            if (hash != null) {
                previous.put(id, hash);
            }
        }
        SyncDelta delta = promoteMovedItems(run, manifest, DeltaDetector.detect(current, previous));
        log.debug("[Sync] Run {} incremental over {} commits, {} affected items", run.runId, commits.size(),
                affected.size());
        return new RunPlan(manifest.getCommitId(), delta, current, Map.of(), null, true);
    }

    private RunPlan planSingleItem(RunContext run, String knowledgeId) {
        Optional<KnowledgeItem> item;
        try {
            item = fetchItem(run, knowledgeId);
        } catch (SyncException e) {
            if (e.getCode() == SyncErrorCode.CANCELLED) {
                throw e;
            }
            SyncFailure failure = SyncFailure.builder()
                    .knowledgeId(knowledgeId)
                    .error(e.getMessage())
                    .errorCode(e.getCode())
                    .failedAt(clock.instant())
                    .build();
            return new RunPlan(null, emptyDelta(), Map.of(), Map.of(), failure, false);
        }

        SyncState working = run.working;
        String previousHash = working.getKnowledgeHashes().get(knowledgeId);
        boolean mapped = working.getPointerMapping().containsValue(knowledgeId);
        KnowledgeLayer storedLayer = working.getKnowledgeLayers().get(knowledgeId);
        Set<String> target = Set.of(knowledgeId);
        if (item.isEmpty()) {
            boolean known = previousHash != null;
            SyncDelta delta = known
                    ? new SyncDelta(Set.of(), Set.of(), target, Set.of())
                    : emptyDelta();
            return new RunPlan(null, delta, Map.of(), Map.of(), null, false);
        }

        String hash = KnowledgeHashSupport.resolveHash(item.get());
        SyncDelta delta;
        if (previousHash == null) {
            delta = new SyncDelta(target, Set.of(), Set.of(), Set.of());
        } else if (!previousHash.equals(hash) || !mapped
                || (storedLayer != null && storedLayer != item.get().getLayer())) {
            delta = new SyncDelta(Set.of(), target, Set.of(), Set.of());
        } else {
            delta = new SyncDelta(Set.of(), Set.of(), Set.of(), target);
        }
        return new RunPlan(null, delta, Map.of(knowledgeId, hash), Map.of(knowledgeId, item.get()), null, false);
    }

    /**
     * Moves unchanged ids whose manifest layer differs from the layer their
     * pointer was written to into {@code updated}. The content hash does not
     * cover the layer.
     */
    private static SyncDelta promoteMovedItems(RunContext run, Manifest manifest, SyncDelta delta) {
        Set<String> moved = new TreeSet<>();
        for (String id : delta.unchanged()) {
            ManifestEntry entry = manifest.getItems().get(id);
            KnowledgeLayer stored = run.working.getKnowledgeLayers().get(id);
            if (entry != null && entry.getLayer() != null && stored != null && entry.getLayer() != stored) {
                moved.add(id);
            }
        }
        if (moved.isEmpty()) {
            return delta;
        }
        log.info("[Sync] Run {} moving {} items to another layer", run.runId, moved.size());
        return delta.promoteToUpdated(moved);
    }

    private RunPlan failedPlan(RunContext run, SyncException e) {
        if (e.getCode() == SyncErrorCode.CANCELLED) {
            throw e;
        }
        log.warn("[Sync] Run {} could not read the knowledge repository: {}", run.runId, e.getMessage());
        SyncFailure failure = SyncFailure.builder()
                .knowledgeId(MANIFEST_FAILURE_KEY)
                .error(e.getMessage())
                .errorCode(e.getCode())
                .failedAt(clock.instant())
                .build();
        return new RunPlan(run.working.getLastKnowledgeCommit(), emptyDelta(), Map.of(), Map.of(), failure, false);
    }

    private Manifest fetchManifest(RunContext run) {
        return callExecutor.call("knowledge.getManifest", SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                () -> knowledgeRepository.getManifest(run.scope.key()), run.signal);
    }

    private Optional<KnowledgeItem> fetchItem(RunContext run, String knowledgeId) {
        return callExecutor.call("knowledge.getItem " + knowledgeId, SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                () -> knowledgeRepository.getItem(run.scope.key(), knowledgeId), run.signal);
    }

    // Applying

    private List<ItemOutcome> applyAll(RunContext run, RunPlan plan) {
        List<ItemWork> work = new ArrayList<>();
        SyncState working = run.working;
        for (String id : plan.delta().added()) {
            work.add(workFor(working, id, ItemAction.ADDED, plan));
        }
        for (String id : plan.delta().updated()) {
            work.add(workFor(working, id, ItemAction.UPDATED, plan));
        }
        for (String id : plan.delta().deleted()) {
            work.add(workFor(working, id, ItemAction.DELETED, plan));
        }
        if (work.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>();
        for (ItemWork item : work) {
            futures.add(run.signal.track(CompletableFuture.supplyAsync(() -> applyItem(run, item), applyExecutor)));
        }
        try {
            awaitApplied(run, CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])));
        } catch (CancellationException | CompletionException e) {
            run.signal.throwIfCancelled();
            throw e;
        } catch (SyncException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        } finally {
            futures.forEach(run.signal::untrack);
        }

        List<ItemOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<ItemOutcome> future : futures) {
            outcomes.add(future.join());
        }
        outcomes.sort(Comparator.comparing(ItemOutcome::knowledgeId));
        return outcomes;
    }

    /**
     * Waits for the workers, renewing the lease every third of its TTL.
     */
    private void awaitApplied(RunContext run, CompletableFuture<Void> applied) {
        long heartbeatMillis = Math.max(1, properties.getLease().getTtl().toMillis() / 3);
        while (true) {
            try {
                applied.get(heartbeatMillis, TimeUnit.MILLISECONDS);
                return;
            } catch (TimeoutException e) {
                renewLease(run);
            } catch (ExecutionException e) {
                throw new CompletionException(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.signal.cancel();
                throw new SyncException(SyncErrorCode.CANCELLED, "Run " + run.runId + " interrupted", e);
            }
        }
    }

    /**
     * Extends the scope lease. Fails the run once another run took the lease
     * over, so two runs never persist the same scope.
     */
    private void renewLease(RunContext run) {
        Optional<SyncLease> renewed = leasePort.renew(run.lease, properties.getLease().getTtl());
        if (renewed.isEmpty()) {
            run.leaseLost = true;
            throw new SyncException(SyncErrorCode.SYNC_IN_PROGRESS,
                    "Run " + run.runId + " lost the lease for " + run.scope.key());
        }
        run.lease = renewed.get();
    }

    private ItemWork workFor(SyncState working, String id, ItemAction action, RunPlan plan) {
        List<String> memoryIds = working.memoryIdsFor(id);
        return new ItemWork(id, action, plan.hashes().get(id), memoryIds,
                working.getKnowledgeLayers().get(id), plan.prefetched().get(id));
    }

    /**
     * Runs on a worker thread. Reads only its {@link ItemWork}; never touches
     * the working state.
     */
    private ItemOutcome applyItem(RunContext run, ItemWork work) {
        try {
            if (work.action() == ItemAction.DELETED) {
                if (work.storedLayer() != null) {
                    for (String memoryId : work.memoryIds()) {
                        pointerMemoryService.markOrphaned(run.scope, memoryId, work.storedLayer(), run.signal);
                    }
                }
                return ItemOutcome.success(work, null, null, null, null);
            }

            KnowledgeItem item = work.prefetched() != null
                    ? work.prefetched()
                    : fetchItem(run, work.knowledgeId()).orElseThrow(() -> new SyncException(
                            SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                            "Item " + work.knowledgeId() + " is listed in the manifest but could not be found"));
            if (item.getLayer() == null) {
                throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                        "Item " + work.knowledgeId() + " has no layer");
            }
            String hash = work.manifestHash() != null ? work.manifestHash() : KnowledgeHashSupport.resolveHash(item);

            if (!work.memoryIds().isEmpty() && work.storedLayer() != null) {
                String memoryId = work.memoryIds().get(0);
                if (pointerMemoryService.update(run.scope, memoryId, work.storedLayer(), item, hash, run.signal)) {
                    return ItemOutcome.success(work, memoryId, null, hash, item.getLayer());
                }
                log.info("[Sync] Pointer {} of {} is gone, recreating", memoryId, work.knowledgeId());
                String recreated = pointerMemoryService.create(run.scope, item, hash, run.signal);
                return ItemOutcome.success(work, recreated, memoryId, hash, item.getLayer());
            }

            String memoryId = pointerMemoryService.create(run.scope, item, hash, run.signal);
            return ItemOutcome.success(work, memoryId, null, hash, item.getLayer());
        } catch (SyncException e) {
            if (e.getCode() != SyncErrorCode.CANCELLED) {
                log.warn("[Sync] Run {} item {} failed ({}): {}", run.runId, work.knowledgeId(), e.getCode(),
                        e.getMessage());
            }
            return ItemOutcome.failure(work, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Sync] Run {} item {} failed: {}", run.runId, work.knowledgeId(), e.getMessage(), e);
            return ItemOutcome.failure(work, SyncErrorCode.PARTIAL_FAILURE, e.getMessage());
        }
    }

    private void merge(RunContext run, List<ItemOutcome> outcomes, SyncResult result) {
        SyncState working = run.working;
        int added = 0;
        int updated = 0;
        int deleted = 0;
        for (ItemOutcome outcome : outcomes) {
            String id = outcome.knowledgeId();
            if (outcome.errorCode() != null) {
                metrics.recordItemFailure(outcome.errorCode());
                recordFailure(working, result, SyncFailure.builder()
                        .knowledgeId(id)
                        .error(outcome.error())
                        .errorCode(outcome.errorCode())
                        .failedAt(clock.instant())
                        .build());
                continue;
            }

            clearFailure(working, id);
            switch (outcome.action()) {
            case DELETED -> {
                working.getKnowledgeHashes().remove(id);
                deleted++;
            }
            case ADDED, UPDATED -> {
                working.getKnowledgeHashes().put(id, outcome.contentHash());
                if (outcome.replacedMemoryId() != null) {
                    working.getPointerMapping().remove(outcome.replacedMemoryId());
                }
                working.getPointerMapping().put(outcome.memoryId(), id);
                working.getKnowledgeLayers().put(id, outcome.layer());
                if (outcome.action() == ItemAction.ADDED) {
                    added++;
                } else {
                    updated++;
                }
            }
            default -> throw new IllegalStateException("Unexpected action " + outcome.action());
            }
        }
        result.setAdded(added);
        result.setUpdated(updated);
        result.setDeleted(deleted);
    }

    private void recordFailure(SyncState working, SyncResult result, SyncFailure failure) {
        int previousRetries = 0;
        Iterator<SyncFailure> iterator = working.getFailedItems().iterator();
        while (iterator.hasNext()) {
            SyncFailure existing = iterator.next();
            if (existing.getKnowledgeId().equals(failure.getKnowledgeId())) {
                previousRetries = Math.max(previousRetries, existing.getRetryCount());
                iterator.remove();
            }
        }
        SyncFailure recorded = failure.toBuilder().retryCount(previousRetries + 1).build();
        working.getFailedItems().add(recorded);
        result.getFailures().add(recorded);
    }

    private static void clearFailure(SyncState working, String knowledgeId) {
        working.getFailedItems().removeIf(failure -> failure.getKnowledgeId().equals(knowledgeId));
    }

    private void pruneFailures(SyncState working, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getFailures().getRetentionDays()));
        int before = working.getFailedItems().size();
        working.getFailedItems().removeIf(failure -> failure.getFailedAt() != null
                && failure.getFailedAt().isBefore(cutoff));
        int pruned = before - working.getFailedItems().size();
        if (pruned > 0) {
            log.info("[Sync] Pruned {} failed items older than {} days", pruned,
                    properties.getFailures().getRetentionDays());
        }
    }

    private void enter(SyncScope scope, SyncPhase phase) {
        phases.put(scope.key(), phase);
        log.debug("[Sync] {} -> {}", scope.key(), phase);
    }

    private static SyncDelta emptyDelta() {
        return new SyncDelta(Set.of(), Set.of(), Set.of(), Set.of());
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @FunctionalInterface
    private interface Planner {
        RunPlan plan(RunContext run);
    }

    private static final class RunContext {
        private final String runId;
        private final SyncScope scope;
        private final CancellationSignal signal;
        private final Instant startedAt;
        private SyncState working;
        private SyncMode effectiveMode;
        private SyncLease lease;
        private boolean leaseLost;

        private RunContext(String runId, SyncScope scope, SyncMode mode, SyncLease lease,
                CancellationSignal signal, Instant startedAt) {
            this.runId = runId;
            this.scope = scope;
            this.effectiveMode = mode;
            this.lease = lease;
            this.signal = signal;
            this.startedAt = startedAt;
        }
    }

    /**
     * @param hashes
     *            manifest hashes of the ids under consideration
     * @param prefetched
     *            items already fetched while planning
     * @param advancesMarkers
     *            whether a completed run moves {@code lastSyncAt} and
     *            {@code lastKnowledgeCommit}
     */
    private record RunPlan(String commitId, SyncDelta delta, Map<String, String> hashes,
            Map<String, KnowledgeItem> prefetched, SyncFailure planFailure, boolean advancesMarkers) {
    }

    private enum ItemAction {
        ADDED, UPDATED, DELETED
    }

    private record ItemWork(String knowledgeId, ItemAction action, String manifestHash, List<String> memoryIds,
            KnowledgeLayer storedLayer, KnowledgeItem prefetched) {
    }

    private record ItemOutcome(String knowledgeId, ItemAction action, String memoryId, String replacedMemoryId,
            String contentHash, KnowledgeLayer layer, SyncErrorCode errorCode, String error) {

        static ItemOutcome success(ItemWork work, String memoryId, String replacedMemoryId, String contentHash,
                KnowledgeLayer layer) {
            return new ItemOutcome(work.knowledgeId(), work.action(), memoryId, replacedMemoryId, contentHash,
                    layer, null, null);
        }

        static ItemOutcome failure(ItemWork work, SyncErrorCode errorCode, String error) {
            return new ItemOutcome(work.knowledgeId(), work.action(), null, null, null, null, errorCode, error);
        }
    }
}
