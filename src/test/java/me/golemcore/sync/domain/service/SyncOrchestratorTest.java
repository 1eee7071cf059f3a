package me.golemcore.sync.domain.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.sync.adapter.outbound.lease.InMemorySyncLeaseAdapter;
import me.golemcore.sync.domain.model.CancellationSignal;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.KnowledgePointer;
import me.golemcore.sync.domain.model.Manifest;
import me.golemcore.sync.domain.model.MemoryLayer;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.SyncCompletedEvent;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncFailedEvent;
import me.golemcore.sync.domain.model.SyncFailure;
import me.golemcore.sync.domain.model.SyncMode;
import me.golemcore.sync.domain.model.SyncPhase;
import me.golemcore.sync.domain.model.SyncResult;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.infrastructure.event.SpringEventBus;
import me.golemcore.sync.testsupport.InMemoryKnowledgeRepository;
import me.golemcore.sync.testsupport.InMemoryMemoryStore;
import me.golemcore.sync.testsupport.InMemorySyncStatePort;
import me.golemcore.sync.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SyncOrchestratorTest {

    private static final SyncScope SCOPE = SyncScope.of("acme");

    private SyncBridgeProperties properties;
    private InMemoryKnowledgeRepository knowledge;
    private InMemoryMemoryStore memoryStore;
    private InMemorySyncStatePort statePort;
    private InMemorySyncLeaseAdapter leasePort;
    private MutableClock clock;
    private SpringEventBus eventBus;
    private ExecutorService applyExecutor;
    private SyncStateService stateService;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new SyncBridgeProperties();
        properties.getApply().setMaxAttempts(2);
        properties.getApply().setInitialBackoff(Duration.ofMillis(1));
        properties.getApply().setMaxBackoff(Duration.ofMillis(5));
        knowledge = new InMemoryKnowledgeRepository();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        applyExecutor = Executors.newFixedThreadPool(4);
        orchestrator = orchestratorFor(knowledge);
    }

    @AfterEach
    void tearDown() {
        applyExecutor.shutdownNow();
    }

    @Test
    void shouldAddPointerForNewItem() {
        KnowledgeItem a = InMemoryKnowledgeRepository.item("A", "first version");
        knowledge.put(a);

        SyncResult result = orchestrator.fullSync(SCOPE, false);

        assertEquals(1, result.getAdded());
        assertTrue(result.isSuccess());
        assertEquals(SyncMode.FULL, result.getMode());
        SyncState state = stateService.load(SCOPE);
        assertEquals(Map.of("A", KnowledgeHashSupport.resolveHash(a)), state.getKnowledgeHashes());
        assertEquals(1, state.getPointerMapping().size());
        assertEquals(knowledge.headCommit(), state.getLastKnowledgeCommit());
        assertEquals(clock.instant(), state.getLastSyncAt());
        assertEquals(KnowledgeLayer.PROJECT, state.getKnowledgeLayers().get("A"));
        String memoryId = state.memoryIdsFor("A").get(0);
        KnowledgePointer pointer = memoryStore.byId(memoryId).orElseThrow().pointer().orElseThrow();
        assertEquals("A", pointer.getSourceId());
        assertEquals(KnowledgeHashSupport.resolveHash(a), pointer.getContentHash());
        assertEquals(SyncPhase.IDLE, orchestrator.currentPhase(SCOPE));
        assertFalse(statePort.hasCheckpoint(SCOPE.key()));
    }

    @Test
    void shouldUpdateChangedItemIncrementally() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "first version"));
        knowledge.put(InMemoryKnowledgeRepository.item("B", "untouched"));
        orchestrator.fullSync(SCOPE, false);
        String memoryId = stateService.load(SCOPE).memoryIdsFor("A").get(0);
        int itemCallsBefore = knowledge.itemCalls();

        KnowledgeItem edited = InMemoryKnowledgeRepository.item("A", "second version");
        knowledge.put(edited);
        SyncResult result = orchestrator.incrementalSync(SCOPE);

        assertEquals(SyncMode.INCREMENTAL, result.getMode());
        assertEquals(1, result.getUpdated());
        assertEquals(0, result.getAdded());
        assertEquals(1, knowledge.itemCalls() - itemCallsBefore, "only the touched item is fetched");
        SyncState state = stateService.load(SCOPE);
        assertEquals(KnowledgeHashSupport.resolveHash(edited), state.getKnowledgeHashes().get("A"));
        assertEquals(List.of(memoryId), state.memoryIdsFor("A"));
        assertEquals(KnowledgeHashSupport.resolveHash(edited),
                memoryStore.byId(memoryId).orElseThrow().pointer().orElseThrow().getContentHash());
    }

    @Test
    void shouldOrphanPointerOfRemovedItem() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "content"));
        orchestrator.fullSync(SCOPE, false);
        String memoryId = stateService.load(SCOPE).memoryIdsFor("A").get(0);

        knowledge.remove("A");
        SyncResult result = orchestrator.fullSync(SCOPE, false);

        assertEquals(1, result.getDeleted());
        SyncState state = stateService.load(SCOPE);
        assertFalse(state.getKnowledgeHashes().containsKey("A"));
        assertEquals("A", state.getPointerMapping().get(memoryId));
        MemoryRecord tombstone = memoryStore.byId(memoryId).orElseThrow();
        assertTrue(tombstone.pointer().orElseThrow().isOrphaned());
    }

    @Test
    void shouldRestorePreRunStateWhenPersistenceFails() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "content"));
        orchestrator.fullSync(SCOPE, false);
        SyncState before = stateService.load(SCOPE);
        knowledge.put(InMemoryKnowledgeRepository.item("A", "changed"));
        knowledge.put(InMemoryKnowledgeRepository.item("B", "new"));
        statePort.failNextSaves(1);

        SyncException error = assertThrows(SyncException.class, () -> orchestrator.incrementalSync(SCOPE));

        assertEquals(SyncErrorCode.PERSISTENCE_FAILED, error.getCode());
        assertEquals(before, stateService.load(SCOPE));
        assertFalse(statePort.hasCheckpoint(SCOPE.key()));
        assertEquals(SyncPhase.IDLE, orchestrator.currentPhase(SCOPE));
        verify(eventBus).publish(any(SyncFailedEvent.class));

        SyncResult retry = orchestrator.incrementalSync(SCOPE);

        assertTrue(retry.isSuccess());
        assertEquals(1, retry.getAdded());
        assertEquals(1, retry.getUpdated());
        SyncState after = stateService.load(SCOPE);
        assertEquals(2, after.getKnowledgeHashes().size());
        assertEquals(knowledge.headCommit(), after.getLastKnowledgeCommit());
        assertEquals(2, after.getPointerMapping().size());
        assertEquals(2, memoryStore.size(), "the retry rewrites the pointers of the failed run");
        assertEquals(1, memoryStore.all().stream()
                .filter(r -> "B".equals(r.pointer().orElseThrow().getSourceId()))
                .count());
    }

    @Test
    void shouldNotDuplicatePointersWhenFullSyncIsRetried() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        knowledge.put(InMemoryKnowledgeRepository.item("B", "b"));
        statePort.failNextSaves(1);
        assertThrows(SyncException.class, () -> orchestrator.fullSync(SCOPE, false));

        orchestrator.fullSync(SCOPE, false);

        SyncState state = stateService.load(SCOPE);
        assertEquals(2, state.getPointerMapping().size());
        assertEquals(2, memoryStore.size());
        assertEquals(List.of(PointerMemoryService.pointerId(SCOPE, "B")), state.memoryIdsFor("B"));
    }

    @Test
    void shouldBeIdempotentWhenNothingChanged() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        knowledge.put(InMemoryKnowledgeRepository.item("B", "b"));
        orchestrator.fullSync(SCOPE, false);
        SyncState first = stateService.load(SCOPE);
        int writes = memoryStore.writes();

        SyncResult second = orchestrator.fullSync(SCOPE, false);

        assertEquals(0, second.itemsApplied());
        assertEquals(2, second.getUnchanged());
        assertEquals(writes, memoryStore.writes());
        SyncState state = stateService.load(SCOPE);
        assertEquals(first.getKnowledgeHashes(), state.getKnowledgeHashes());
        assertEquals(first.getPointerMapping(), state.getPointerMapping());
        assertEquals(2, state.getStats().getTotalSyncs());
    }

    @Test
    void shouldReapplyUnchangedItemsWhenForced() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);

        SyncResult forced = orchestrator.fullSync(SCOPE, true);

        assertEquals(1, forced.getUpdated());
        assertEquals(0, forced.getUnchanged());
        assertEquals(1, stateService.load(SCOPE).getPointerMapping().size());
    }

    @Test
    void shouldRecreatePointerDeletedOutOfBand() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        String lost = stateService.load(SCOPE).memoryIdsFor("A").get(0);
        memoryStore.removeDirectly(lost);

        SyncResult forced = orchestrator.fullSync(SCOPE, true);

        assertEquals(1, forced.getUpdated());
        List<String> memoryIds = stateService.load(SCOPE).memoryIdsFor("A");
        assertEquals(List.of(lost), memoryIds);
        assertTrue(memoryStore.byId(lost).isPresent());
        assertEquals(1, memoryStore.size());
    }

    @Test
    void shouldRepairItemsWithoutPointer() {
        KnowledgeItem a = InMemoryKnowledgeRepository.item("A", "a");
        knowledge.put(a);
        SyncState seeded = SyncState.empty();
        seeded.getKnowledgeHashes().put("A", KnowledgeHashSupport.resolveHash(a));
        statePort.save(SCOPE.key(), seeded);

        SyncResult result = orchestrator.fullSync(SCOPE, false);

        assertEquals(1, result.getUpdated());
        assertEquals(1, stateService.load(SCOPE).memoryIdsFor("A").size());
    }

    @Test
    void shouldRecordItemFailuresAndKeepGoing() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        knowledge.put(InMemoryKnowledgeRepository.item("B", "b"));
        knowledge.put(InMemoryKnowledgeRepository.item("C", "c"));
        knowledge.failItem("B");

        SyncResult first = orchestrator.fullSync(SCOPE, false);

        assertFalse(first.isSuccess());
        assertEquals(2, first.getAdded());
        assertEquals(1, first.getFailures().size());
        SyncFailure failure = first.getFailures().get(0);
        assertEquals("B", failure.getKnowledgeId());
        assertEquals(SyncErrorCode.KNOWLEDGE_UNAVAILABLE, failure.getErrorCode());
        assertEquals(1, failure.getRetryCount());
        SyncState state = stateService.load(SCOPE);
        assertFalse(state.getKnowledgeHashes().containsKey("B"));
        assertEquals(knowledge.headCommit(), state.getLastKnowledgeCommit());

        SyncResult second = orchestrator.incrementalSync(SCOPE);
        assertEquals(2, second.getFailures().get(0).getRetryCount());

        knowledge.healItem("B");
        SyncResult third = orchestrator.incrementalSync(SCOPE);

        assertTrue(third.isSuccess());
        assertEquals(1, third.getAdded());
        SyncState healed = stateService.load(SCOPE);
        assertTrue(healed.getFailedItems().isEmpty());
        assertEquals(3, healed.getPointerMapping().size());
    }

    @Test
    void shouldRecordManifestFailureWithoutMovingMarkers() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        SyncState before = stateService.load(SCOPE);
        clock.advance(Duration.ofMinutes(10));
        knowledge.put(InMemoryKnowledgeRepository.item("B", "b"));
        knowledge.failNextManifests(properties.getApply().getMaxAttempts());

        SyncResult result = orchestrator.fullSync(SCOPE, false);

        assertEquals(0, result.itemsApplied());
        assertEquals(SyncOrchestrator.MANIFEST_FAILURE_KEY, result.getFailures().get(0).getKnowledgeId());
        SyncState state = stateService.load(SCOPE);
        assertEquals(before.getLastSyncAt(), state.getLastSyncAt());
        assertEquals(before.getLastKnowledgeCommit(), state.getLastKnowledgeCommit());
        assertEquals(before.getKnowledgeHashes(), state.getKnowledgeHashes());

        SyncResult recovered = orchestrator.fullSync(SCOPE, false);

        assertTrue(recovered.isSuccess());
        assertEquals(1, recovered.getAdded());
        assertTrue(stateService.load(SCOPE).getFailedItems().isEmpty());
    }

    @Test
    void shouldFallBackToFullSyncWithoutRecordedCommit() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));

        SyncResult result = orchestrator.incrementalSync(SCOPE);

        assertEquals(SyncMode.FULL, result.getMode());
        assertEquals(1, result.getAdded());
    }

    @Test
    void shouldSkipWorkWhenHeadCommitUnchanged() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        int writes = memoryStore.writes();

        SyncResult result = orchestrator.incrementalSync(SCOPE);

        assertEquals(0, result.itemsApplied());
        assertEquals(writes, memoryStore.writes());
    }

    @Test
    void shouldSyncSingleItemWithoutMovingMarkers() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        SyncState before = stateService.load(SCOPE);
        clock.advance(Duration.ofMinutes(5));
        KnowledgeItem b = InMemoryKnowledgeRepository.item("B", "b");
        knowledge.put(b);

        SyncResult result = orchestrator.syncItem(SCOPE, "B");

        assertEquals(SyncMode.SINGLE_ITEM, result.getMode());
        assertEquals(1, result.getAdded());
        SyncState state = stateService.load(SCOPE);
        assertEquals(KnowledgeHashSupport.resolveHash(b), state.getKnowledgeHashes().get("B"));
        assertEquals(before.getLastKnowledgeCommit(), state.getLastKnowledgeCommit());
        assertEquals(before.getLastSyncAt(), state.getLastSyncAt());
    }

    @Test
    void shouldTreatUnknownMissingItemAsNoOp() {
        SyncResult result = orchestrator.syncItem(SCOPE, "ghost");

        assertTrue(result.isSuccess());
        assertEquals(0, result.itemsApplied());
    }

    @Test
    void shouldOrphanKnownItemMissingInSingleItemSync() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        knowledge.remove("A");

        SyncResult result = orchestrator.syncItem(SCOPE, "A");

        assertEquals(1, result.getDeleted());
        String memoryId = stateService.load(SCOPE).memoryIdsFor("A").get(0);
        assertTrue(memoryStore.byId(memoryId).orElseThrow().pointer().orElseThrow().isOrphaned());
    }

    @Test
    void shouldMovePointerWhenItemChangesLayer() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        String memoryId = stateService.load(SCOPE).memoryIdsFor("A").get(0);
        KnowledgeItem moved = InMemoryKnowledgeRepository.item("A", "a");
        moved.setLayer(KnowledgeLayer.ORG);
        knowledge.put(moved);

        SyncResult result = orchestrator.incrementalSync(SCOPE);

        assertEquals(1, result.getUpdated());
        assertEquals(MemoryLayer.ORG, memoryStore.byId(memoryId).orElseThrow().getLayer());
        assertEquals(1, memoryStore.size());
        assertEquals(KnowledgeLayer.ORG,
                memoryStore.byId(memoryId).orElseThrow().pointer().orElseThrow().getSourceLayer());
        assertEquals(KnowledgeLayer.ORG, stateService.load(SCOPE).getKnowledgeLayers().get("A"));
    }

    @Test
    void shouldMovePointerOnFullSyncWhenOnlyLayerChanged() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        knowledge.put(InMemoryKnowledgeRepository.item("B", "b"));
        orchestrator.fullSync(SCOPE, false);
        String memoryId = stateService.load(SCOPE).memoryIdsFor("A").get(0);
        KnowledgeItem moved = InMemoryKnowledgeRepository.item("A", "a");
        moved.setLayer(KnowledgeLayer.TEAM);
        knowledge.put(moved);

        SyncResult result = orchestrator.fullSync(SCOPE, false);

        assertEquals(1, result.getUpdated());
        assertEquals(1, result.getUnchanged());
        assertEquals(MemoryLayer.TEAM, memoryStore.byId(memoryId).orElseThrow().getLayer());
        assertEquals(KnowledgeLayer.TEAM, stateService.load(SCOPE).getKnowledgeLayers().get("A"));
    }

    @Test
    void shouldMovePointerOnSingleItemSyncWhenOnlyLayerChanged() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        orchestrator.fullSync(SCOPE, false);
        String memoryId = stateService.load(SCOPE).memoryIdsFor("A").get(0);
        KnowledgeItem moved = InMemoryKnowledgeRepository.item("A", "a");
        moved.setLayer(KnowledgeLayer.COMPANY);
        knowledge.put(moved);

        SyncResult result = orchestrator.syncItem(SCOPE, "A");

        assertEquals(1, result.getUpdated());
        assertEquals(MemoryLayer.COMPANY, memoryStore.byId(memoryId).orElseThrow().getLayer());
    }

    @Test
    void shouldRejectConcurrentRunForSameScope() {
        leasePort.tryAcquire(SCOPE.key(), "other-run", Duration.ofMinutes(5)).orElseThrow();
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));

        SyncException error = assertThrows(SyncException.class, () -> orchestrator.fullSync(SCOPE, false));

        assertEquals(SyncErrorCode.SYNC_IN_PROGRESS, error.getCode());
        assertEquals(0, memoryStore.size());
        assertFalse(statePort.hasCheckpoint(SCOPE.key()));
        assertTrue(orchestrator.fullSync(SyncScope.of("globex"), false).isSuccess());
    }

    @Test
    void shouldFailWithoutTouchingStateWhenLeaseIsTakenOverMidRun() {
        AtomicReference<SyncOrchestrator> self = new AtomicReference<>();
        AtomicReference<SyncResult> takeover = new AtomicReference<>();
        AtomicBoolean stalled = new AtomicBoolean();
        InMemoryKnowledgeRepository slow = new InMemoryKnowledgeRepository() {
            @Override
            public CompletableFuture<Manifest> getManifest(String tenantId) {
                if (stalled.compareAndSet(false, true)) {
                    clock.advance(properties.getLease().getTtl().plusMinutes(1));
                    takeover.set(CompletableFuture.supplyAsync(() -> self.get().fullSync(SCOPE, false)).join());
                }
                return super.getManifest(tenantId);
            }
        };
        self.set(orchestratorFor(slow));
        slow.put(InMemoryKnowledgeRepository.item("A", "a"));

        SyncException error = assertThrows(SyncException.class, () -> self.get().fullSync(SCOPE, false));

        assertEquals(SyncErrorCode.SYNC_IN_PROGRESS, error.getCode());
        assertEquals(1, takeover.get().getAdded());
        assertEquals(1, memoryStore.size());
        SyncState state = stateService.load(SCOPE);
        assertEquals(Map.of(PointerMemoryService.pointerId(SCOPE, "A"), "A"), state.getPointerMapping());
        assertEquals(slow.headCommit(), state.getLastKnowledgeCommit());
        assertFalse(statePort.hasCheckpoint(SCOPE.key()));
        assertEquals(SyncPhase.IDLE, self.get().currentPhase(SCOPE));
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, times(2)).publish(events.capture());
        assertInstanceOf(SyncCompletedEvent.class, events.getAllValues().get(0));
        SyncFailedEvent failed = assertInstanceOf(SyncFailedEvent.class, events.getAllValues().get(1));
        assertEquals(SyncErrorCode.SYNC_IN_PROGRESS, failed.code());
    }

    @Test
    void shouldRollBackWhenCancelledDuringApply() {
        CancellationSignal signal = CancellationSignal.create();
        InMemoryKnowledgeRepository cancelling = new InMemoryKnowledgeRepository() {
            @Override
            public synchronized CompletableFuture<Optional<KnowledgeItem>> getItem(String tenantId, String itemId) {
                if ("B".equals(itemId)) {
                    signal.cancel();
                }
                return super.getItem(tenantId, itemId);
            }
        };
        SyncOrchestrator cancellable = orchestratorFor(cancelling);
        cancelling.put(InMemoryKnowledgeRepository.item("A", "a"));
        cancellable.fullSync(SCOPE, false);
        SyncState before = stateService.load(SCOPE);
        cancelling.put(InMemoryKnowledgeRepository.item("B", "b"));
        cancelling.put(InMemoryKnowledgeRepository.item("C", "c"));

        SyncException error = assertThrows(SyncException.class, () -> cancellable.fullSync(SCOPE, false, signal));

        assertEquals(SyncErrorCode.CANCELLED, error.getCode());
        assertEquals(before, stateService.load(SCOPE));
        assertFalse(statePort.hasCheckpoint(SCOPE.key()));
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventBus, atLeastOnce()).publish(events.capture());
        SyncFailedEvent failed = (SyncFailedEvent) events.getAllValues().get(events.getAllValues().size() - 1);
        assertEquals(SyncErrorCode.CANCELLED, failed.code());
    }

    @Test
    void shouldFailFastWhenCheckpointCannotBeWritten() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));
        statePort.failNextCheckpoints(1);

        SyncException error = assertThrows(SyncException.class, () -> orchestrator.fullSync(SCOPE, false));

        assertEquals(SyncErrorCode.CHECKPOINT_FAILED, error.getCode());
        assertEquals(0, memoryStore.size());
        assertTrue(statePort.load(SCOPE.key()).isEmpty());
    }

    @Test
    void shouldPruneExpiredFailures() {
        SyncState seeded = SyncState.empty();
        seeded.getFailedItems().add(SyncFailure.builder()
                .knowledgeId("old")
                .error("gone")
                .errorCode(SyncErrorCode.KNOWLEDGE_UNAVAILABLE)
                .failedAt(clock.instant().minus(Duration.ofDays(31)))
                .retryCount(4)
                .build());
        statePort.save(SCOPE.key(), seeded);

        orchestrator.fullSync(SCOPE, false);

        assertTrue(stateService.load(SCOPE).getFailedItems().isEmpty());
    }

    @Test
    void shouldPublishCompletionEvent() {
        knowledge.put(InMemoryKnowledgeRepository.item("A", "a"));

        SyncResult result = orchestrator.fullSync(SCOPE, false);

        ArgumentCaptor<SyncCompletedEvent> captor = ArgumentCaptor.forClass(SyncCompletedEvent.class);
        verify(eventBus).publish(captor.capture());
        assertSame(result, captor.getValue().result());
        assertEquals(SCOPE, captor.getValue().scope());
        verify(eventBus, never()).publish(any(SyncFailedEvent.class));
    }

    private SyncOrchestrator orchestratorFor(InMemoryKnowledgeRepository repository) {
        memoryStore = new InMemoryMemoryStore();
        statePort = new InMemorySyncStatePort();
        leasePort = new InMemorySyncLeaseAdapter(clock);
        eventBus = mock(SpringEventBus.class);
        stateService = new SyncStateService(statePort);
        CollaboratorCallExecutor callExecutor = new CollaboratorCallExecutor(properties);
        PointerMemoryService pointerMemoryService = new PointerMemoryService(memoryStore, callExecutor, properties,
                clock);
        return new SyncOrchestrator(repository, pointerMemoryService, stateService, leasePort, callExecutor,
                new SyncMetrics(new SimpleMeterRegistry()), eventBus, properties, clock, applyExecutor);
    }
}
