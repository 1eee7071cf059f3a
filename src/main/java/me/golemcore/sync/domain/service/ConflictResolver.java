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
import me.golemcore.sync.domain.model.ConflictResolutionReport;
import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.ConflictsDetectedEvent;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.KnowledgePointer;
import me.golemcore.sync.domain.model.KnowledgePointerMetadata;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.ResolutionAction;
import me.golemcore.sync.domain.model.SyncConflict;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncFailure;
import me.golemcore.sync.domain.model.SyncLease;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.infrastructure.event.SpringEventBus;
import me.golemcore.sync.port.outbound.KnowledgeRepositoryPort;
import me.golemcore.sync.port.outbound.SyncLeasePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Detects and resolves conflicts for a scope under the scope lease.
 *
 * <p>
 * Each conflict's condition is re-checked right before acting, so resolving a
 * conflict that an earlier, partially applied pass already fixed is a no-op
 * reported under {@code alreadyResolved}. {@code manual} conflicts are never
 * applied; they are reported as {@code CONFLICT_UNRESOLVED}. Conflicts whose
 * action leaves them in place are reported under {@code kept} and are found
 * again by the next pass.
 *
 * <p>
 * Action semantics per conflict type:
 * <ul>
 * <li>hash_mismatch / status_change: {@code update_memory} and {@code merge}
 * rewrite the pointer, {@code delete_memory} drops it, {@code keep_memory}
 * leaves it
 * <li>orphaned_pointer: {@code delete_memory} drops the record and its mapping,
 * {@code keep_memory} and {@code merge} keep a tombstone, {@code update_memory}
 * recreates a pointer whose record vanished
 * <li>duplicate_pointer: {@code delete_memory} drops the extra pointer,
 * {@code merge} first folds its tags into the kept one
 * </ul>
 * Only {@code pointerMapping}, {@code knowledgeLayers} and the conflict
 * counters of the state are written; {@code knowledgeHashes} stays owned by
 * sync runs.
 */
@Service
@Slf4j
public class ConflictResolver {

    private final ConflictDetector detector;
    private final ConflictResolutionPolicy policy;
    private final PointerMemoryService pointerMemoryService;
    private final KnowledgeRepositoryPort knowledgeRepository;
    private final CollaboratorCallExecutor callExecutor;
    private final SyncStateService stateService;
    private final SyncLeasePort leasePort;
    private final SyncMetrics metrics;
    private final SpringEventBus eventBus;
    private final SyncBridgeProperties properties;
    private final Clock clock;

    public ConflictResolver(ConflictDetector detector, ConflictResolutionPolicy policy,
            PointerMemoryService pointerMemoryService, KnowledgeRepositoryPort knowledgeRepository,
            CollaboratorCallExecutor callExecutor, SyncStateService stateService, SyncLeasePort leasePort,
            SyncMetrics metrics, SpringEventBus eventBus, SyncBridgeProperties properties, Clock clock) {
        this.detector = detector;
        this.policy = policy;
        this.pointerMemoryService = pointerMemoryService;
        this.knowledgeRepository = knowledgeRepository;
        this.callExecutor = callExecutor;
        this.stateService = stateService;
        this.leasePort = leasePort;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Read-only detection pass over the persisted state. Needs no lease.
     */
    public List<SyncConflict> detect(SyncScope scope) {
        return detector.detect(scope, stateService.load(scope), CancellationSignal.create());
    }

    public ConflictResolutionReport reconcile(SyncScope scope) {
        return reconcile(scope, CancellationSignal.create());
    }

    /**
     * Detects conflicts and applies the configured resolutions, then persists
     * the updated mapping.
     */
    public ConflictResolutionReport reconcile(SyncScope scope, CancellationSignal signal) {
        String passId = UUID.randomUUID().toString();
        SyncLease lease = leasePort.tryAcquire(scope.key(), passId, properties.getLease().getTtl())
                .orElseThrow(() -> new SyncException(SyncErrorCode.SYNC_IN_PROGRESS,
                        "Another run holds the lease for " + scope.key()));
        try {
            SyncState working = stateService.load(scope);
            List<SyncConflict> conflicts = detector.detect(scope, working, signal);
            conflicts.forEach(conflict -> metrics.recordConflictDetected(conflict.getType()));
            if (!conflicts.isEmpty()) {
                log.info("[Conflict] {} conflicts detected for {}", conflicts.size(), scope.key());
                eventBus.publish(new ConflictsDetectedEvent(scope, List.copyOf(conflicts)));
            }

            ConflictResolutionReport report = resolve(scope, working, conflicts, signal);
            working.getStats().recordConflicts(conflicts.size(), report.getApplied().size());
            if (!conflicts.isEmpty()) {
                lease = leasePort.renew(lease, properties.getLease().getTtl())
                        .orElseThrow(() -> new SyncException(SyncErrorCode.SYNC_IN_PROGRESS,
                                "Conflict pass " + passId + " lost the lease for " + scope.key()));
                stateService.save(scope, working);
            }
            log.info("[Conflict] Pass {} for {}: detected={}, applied={}, alreadyResolved={}, unresolved={}, "
                    + "failures={}", passId, scope.key(), conflicts.size(), report.getApplied().size(),
                    report.getAlreadyResolved().size(), report.getUnresolved().size(), report.getFailures().size());
            return report;
        } finally {
            leasePort.release(lease);
        }
    }

    /**
     * Applies resolutions to {@code working}. The caller must hold the scope
     * lease and persist {@code working} afterwards.
     */
    ConflictResolutionReport resolve(SyncScope scope, SyncState working, List<SyncConflict> conflicts,
            CancellationSignal signal) {
        ConflictResolutionReport report = ConflictResolutionReport.builder().build();
        report.getDetected().addAll(conflicts);

        for (SyncConflict conflict : conflicts) {
            signal.throwIfCancelled();
            ResolutionAction action = policy.resolve(conflict);
            if (action == ResolutionAction.MANUAL) {
                log.warn("[Conflict] {} on {} -> {} needs manual resolution", conflict.getType().getCode(),
                        conflict.getMemoryId(), conflict.getKnowledgeId());
                report.getUnresolved().add(conflict);
                report.getFailures().add(failure(conflict, SyncErrorCode.CONFLICT_UNRESOLVED,
                        "Manual resolution required for " + conflict.getType().getCode()));
                continue;
            }
            if (leavesInPlace(conflict.getType(), action)) {
                log.debug("[Conflict] Keeping {} on {}", conflict.getType().getCode(), conflict.getMemoryId());
                report.getKept().add(conflict);
                continue;
            }

            try {
                boolean applied = apply(scope, working, conflict, action, signal);
                if (applied) {
                    metrics.recordConflictResolved(action);
                    report.getApplied().add(conflict);
                    log.debug("[Conflict] Applied {} to {} on {}", action.getCode(), conflict.getType().getCode(),
                            conflict.getMemoryId());
                } else {
                    report.getAlreadyResolved().add(conflict);
                }
            } catch (SyncException e) {
                if (e.getCode() == SyncErrorCode.CANCELLED) {
                    throw e;
                }
                log.warn("[Conflict] Failed to apply {} to {}: {}", action.getCode(), conflict.getMemoryId(),
                        e.getMessage());
                report.getFailures().add(failure(conflict, e.getCode(), e.getMessage()));
            }
        }
        return report;
    }

    private boolean apply(SyncScope scope, SyncState working, SyncConflict conflict, ResolutionAction action,
            CancellationSignal signal) {
        if (!conflict.getKnowledgeId().equals(working.getPointerMapping().get(conflict.getMemoryId()))) {
            return false;
        }
        return switch (conflict.getType()) {
        case HASH_MISMATCH, STATUS_CHANGE -> resolveStale(scope, working, conflict, action, signal);
        case ORPHANED_POINTER -> resolveOrphan(scope, working, conflict, action, signal);
        case DUPLICATE_POINTER -> resolveDuplicate(scope, working, conflict, action, signal);
        };
    }

    private boolean resolveStale(SyncScope scope, SyncState working, SyncConflict conflict,
            ResolutionAction action, CancellationSignal signal) {
        String memoryId = conflict.getMemoryId();
        KnowledgeLayer layer = working.getKnowledgeLayers().get(conflict.getKnowledgeId());
        Optional<KnowledgeItem> item = fetchItem(scope, conflict.getKnowledgeId(), signal);
        Optional<MemoryRecord> memoryRecord = layer != null
                ? pointerMemoryService.find(scope, memoryId, layer, signal)
                : Optional.empty();
        if (item.isEmpty() || memoryRecord.flatMap(MemoryRecord::pointer).isEmpty()) {
            // turned into an orphan since detection; the next pass classifies it
            return false;
        }
        KnowledgePointer pointer = memoryRecord.get().pointer().orElseThrow();
        String currentHash = KnowledgeHashSupport.resolveHash(item.get());
        boolean stale = !currentHash.equals(pointer.getContentHash())
                || pointer.isOrphaned()
                || item.get().getStatus() != pointer.getSourceStatus()
                || (item.get().getLayer() != null && item.get().getLayer() != layer);
        if (!stale) {
            return false;
        }

        switch (action) {
        case UPDATE_MEMORY, MERGE -> {
            pointerMemoryService.update(scope, memoryId, layer, item.get(), currentHash, signal);
            working.getKnowledgeLayers().put(conflict.getKnowledgeId(), item.get().getLayer());
        }
        case DELETE_MEMORY -> removePointer(scope, working, memoryId, layer, signal);
        default -> throw new IllegalStateException("Unexpected action " + action);
        }
        return true;
    }

    private boolean resolveOrphan(SyncScope scope, SyncState working, SyncConflict conflict,
            ResolutionAction action, CancellationSignal signal) {
        String memoryId = conflict.getMemoryId();
        String knowledgeId = conflict.getKnowledgeId();
        KnowledgeLayer layer = working.getKnowledgeLayers().get(knowledgeId);
        Optional<KnowledgeItem> item = fetchItem(scope, knowledgeId, signal);
        Optional<MemoryRecord> memoryRecord = layer != null
                ? pointerMemoryService.find(scope, memoryId, layer, signal)
                : Optional.empty();
        boolean memoryPresent = memoryRecord.flatMap(MemoryRecord::pointer).isPresent();
        if (item.isPresent() && memoryPresent) {
            return false;
        }

        switch (action) {
        case DELETE_MEMORY -> {
            if (memoryRecord.isPresent()) {
                pointerMemoryService.delete(scope, memoryId, layer, signal);
            }
            working.getPointerMapping().remove(memoryId);
            if (item.isEmpty() && working.memoryIdsFor(knowledgeId).isEmpty()) {
                working.getKnowledgeLayers().remove(knowledgeId);
            }
        }
        case KEEP_MEMORY, MERGE -> {
            // tombstoning an existing tombstone is a no-op
            return memoryPresent && pointerMemoryService.markOrphaned(scope, memoryId, layer, signal);
        }
        case UPDATE_MEMORY -> {
            if (item.isPresent()) {
                KnowledgeItem current = item.get();
                String memoryIdNew = pointerMemoryService.create(scope, current,
                        KnowledgeHashSupport.resolveHash(current), signal);
                working.getPointerMapping().remove(memoryId);
                working.getPointerMapping().put(memoryIdNew, knowledgeId);
                working.getKnowledgeLayers().put(knowledgeId, current.getLayer());
            } else if (memoryPresent) {
                pointerMemoryService.markOrphaned(scope, memoryId, layer, signal);
            }
        }
        default -> throw new IllegalStateException("Unexpected action " + action);
        }
        return true;
    }

    private boolean resolveDuplicate(SyncScope scope, SyncState working, SyncConflict conflict,
            ResolutionAction action, CancellationSignal signal) {
        String removeId = conflict.getMemoryId();
        String keepId = String.valueOf(conflict.getDetails().get(ConflictDetector.DETAIL_KEEP));
        if (!conflict.getKnowledgeId().equals(working.getPointerMapping().get(keepId))) {
            return false;
        }
        KnowledgeLayer layer = working.getKnowledgeLayers().get(conflict.getKnowledgeId());
        if (layer == null) {
            return false;
        }

        switch (action) {
        case DELETE_MEMORY -> removePointer(scope, working, removeId, layer, signal);
        case MERGE -> {
            Optional<MemoryRecord> kept = pointerMemoryService.find(scope, keepId, layer, signal);
            Optional<MemoryRecord> removed = pointerMemoryService.find(scope, removeId, layer, signal);
            if (kept.isPresent() && removed.isPresent()) {
                List<String> tags = PointerMemoryService.mergeTags(kept.get(), tagsOf(removed.get()));
                pointerMemoryService.retag(scope, kept.get(), tags, signal);
            }
            removePointer(scope, working, removeId, layer, signal);
        }
        default -> throw new IllegalStateException("Unexpected action " + action);
        }
        return true;
    }

    /**
     * Whether {@code action} leaves a conflict of {@code type} untouched.
     */
    static boolean leavesInPlace(ConflictType type, ResolutionAction action) {
        return switch (type) {
        case HASH_MISMATCH, STATUS_CHANGE -> action == ResolutionAction.KEEP_MEMORY;
        case DUPLICATE_POINTER -> action == ResolutionAction.KEEP_MEMORY || action == ResolutionAction.UPDATE_MEMORY;
        case ORPHANED_POINTER -> false;
        };
    }

    private void removePointer(SyncScope scope, SyncState working, String memoryId, KnowledgeLayer layer,
            CancellationSignal signal) {
        pointerMemoryService.delete(scope, memoryId, layer, signal);
        working.getPointerMapping().remove(memoryId);
    }

    private Optional<KnowledgeItem> fetchItem(SyncScope scope, String knowledgeId, CancellationSignal signal) {
        return callExecutor.call("knowledge.getItem " + knowledgeId, SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                () -> knowledgeRepository.getItem(scope.key(), knowledgeId), signal);
    }

    private static List<String> tagsOf(MemoryRecord memoryRecord) {
        if (memoryRecord.getMetadata() instanceof KnowledgePointerMetadata metadata
                && metadata.getTags() != null) {
            return metadata.getTags();
        }
        return List.of();
    }

    private SyncFailure failure(SyncConflict conflict, SyncErrorCode code, String message) {
        return SyncFailure.builder()
                .knowledgeId(conflict.getKnowledgeId())
                .error(message)
                .errorCode(code)
                .failedAt(clock.instant())
                .retryCount(0)
                .build();
    }
}
