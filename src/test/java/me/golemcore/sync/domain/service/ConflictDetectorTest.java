package me.golemcore.sync.domain.service;

import me.golemcore.sync.domain.model.CancellationSignal;
import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.KnowledgePointerMetadata;
import me.golemcore.sync.domain.model.KnowledgeStatus;
import me.golemcore.sync.domain.model.MemoryRecord;
import me.golemcore.sync.domain.model.SyncConflict;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.testsupport.InMemoryKnowledgeRepository;
import me.golemcore.sync.testsupport.InMemoryMemoryStore;
import me.golemcore.sync.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private static final SyncScope SCOPE = SyncScope.of("acme");

    private InMemoryKnowledgeRepository knowledge;
    private InMemoryMemoryStore memoryStore;
    private MutableClock clock;
    private PointerMemoryService pointerMemoryService;
    private ConflictDetector detector;
    private SyncState state;
    private CancellationSignal signal;

    @BeforeEach
    void setUp() {
        SyncBridgeProperties properties = new SyncBridgeProperties();
        properties.getApply().setMaxAttempts(1);
        CollaboratorCallExecutor callExecutor = new CollaboratorCallExecutor(properties);
        knowledge = new InMemoryKnowledgeRepository();
        memoryStore = new InMemoryMemoryStore();
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        pointerMemoryService = new PointerMemoryService(memoryStore, callExecutor, properties, clock);
        detector = new ConflictDetector(knowledge, pointerMemoryService, callExecutor);
        state = SyncState.empty();
        signal = CancellationSignal.create();
    }

    @Test
    void shouldReportNothingForConsistentPairs() {
        synced("K1");
        synced("K2");

        assertTrue(detector.detect(SCOPE, state, signal).isEmpty());
    }

    @Test
    void shouldReportOneOrphanPerBrokenPair() {
        synced("K1");
        String m2 = synced("K2");
        String m3 = synced("K3");
        knowledge.remove("K2");
        memoryStore.removeDirectly(m3);

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(2, conflicts.size());
        SyncConflict knowledgeGone = conflicts.get(0);
        assertEquals(ConflictType.ORPHANED_POINTER, knowledgeGone.getType());
        assertEquals(m2, knowledgeGone.getMemoryId());
        assertEquals("K2", knowledgeGone.getKnowledgeId());
        assertEquals(SyncConflict.REASON_KNOWLEDGE_DELETED, knowledgeGone.getDetails().get(SyncConflict.REASON));
        SyncConflict memoryGone = conflicts.get(1);
        assertEquals(m3, memoryGone.getMemoryId());
        assertEquals(SyncConflict.REASON_MEMORY_DELETED, memoryGone.getDetails().get(SyncConflict.REASON));
    }

    @Test
    void shouldReportBothDeleted() {
        String m1 = synced("K1");
        knowledge.remove("K1");
        memoryStore.removeDirectly(m1);

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        assertEquals(SyncConflict.REASON_BOTH_DELETED, conflicts.get(0).getDetails().get(SyncConflict.REASON));
    }

    @Test
    void shouldKeepNewestDuplicate() {
        String older = synced("K1");
        clock.advance(Duration.ofMinutes(1));
        String newer = duplicateOf("K1", "dup-K1");

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        SyncConflict conflict = conflicts.get(0);
        assertEquals(ConflictType.DUPLICATE_POINTER, conflict.getType());
        assertEquals(older, conflict.getMemoryId());
        assertEquals(newer, conflict.getDetails().get(ConflictDetector.DETAIL_KEEP));
        assertEquals(older, conflict.getDetails().get(ConflictDetector.DETAIL_REMOVE));
    }

    @Test
    void shouldBreakDuplicateTiesBySmallestMemoryId() {
        String first = synced("K1");
        String second = duplicateOf("K1", "dup-K1");
        String keep = first.compareTo(second) < 0 ? first : second;
        String remove = keep.equals(first) ? second : first;

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        assertEquals(keep, conflicts.get(0).getDetails().get(ConflictDetector.DETAIL_KEEP));
        assertEquals(remove, conflicts.get(0).getMemoryId());
    }

    @Test
    void shouldPreferStatusChangeOverHashMismatch() {
        String m1 = synced("K1");
        KnowledgeItem deprecated = InMemoryKnowledgeRepository.item("K1", "content of K1");
        deprecated.setStatus(KnowledgeStatus.DEPRECATED);
        knowledge.put(deprecated);

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        assertEquals(ConflictType.STATUS_CHANGE, conflicts.get(0).getType());
        assertEquals(m1, conflicts.get(0).getMemoryId());
        assertEquals("accepted", conflicts.get(0).getDetails().get(ConflictDetector.DETAIL_FROM_STATUS));
        assertEquals("deprecated", conflicts.get(0).getDetails().get(ConflictDetector.DETAIL_TO_STATUS));
    }

    @Test
    void shouldReportHashMismatchForEditedItem() {
        synced("K1");
        String oldHash = state.getKnowledgeHashes().get("K1");
        knowledge.put(InMemoryKnowledgeRepository.item("K1", "edited"));

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        assertEquals(ConflictType.HASH_MISMATCH, conflicts.get(0).getType());
        assertEquals(oldHash, conflicts.get(0).getDetails().get(ConflictDetector.DETAIL_STORED_HASH));
        assertNotEquals(oldHash, conflicts.get(0).getDetails().get(ConflictDetector.DETAIL_CURRENT_HASH));
    }

    @Test
    void shouldReportLayerChangeWhenContentIsUnchanged() {
        String m1 = synced("K1");
        KnowledgeItem moved = InMemoryKnowledgeRepository.item("K1", "content of K1");
        moved.setLayer(KnowledgeLayer.ORG);
        knowledge.put(moved);

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        SyncConflict conflict = conflicts.get(0);
        assertEquals(ConflictType.HASH_MISMATCH, conflict.getType());
        assertEquals(m1, conflict.getMemoryId());
        assertEquals(SyncConflict.REASON_LAYER_CHANGED, conflict.getDetails().get(SyncConflict.REASON));
        assertEquals("project", conflict.getDetails().get(ConflictDetector.DETAIL_STORED_LAYER));
        assertEquals("org", conflict.getDetails().get(ConflictDetector.DETAIL_CURRENT_LAYER));
        assertEquals(conflict.getDetails().get(ConflictDetector.DETAIL_STORED_HASH),
                conflict.getDetails().get(ConflictDetector.DETAIL_CURRENT_HASH));
    }

    @Test
    void shouldSkipPairsWhoseItemCannotBeFetched() {
        synced("K1");
        String m2 = synced("K2");
        memoryStore.removeDirectly(m2);
        knowledge.failItem("K1");

        List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

        assertEquals(1, conflicts.size());
        assertEquals("K2", conflicts.get(0).getKnowledgeId());
    }

    @Test
    void shouldDetectEveryBrokenPairForRandomDeletions() {
        Random random = new Random(7);
        for (int round = 0; round < 20; round++) {
            setUp();
            Set<String> expected = new HashSet<>();
            int pairs = 1 + random.nextInt(8);
            for (int i = 0; i < pairs; i++) {
                String knowledgeId = "K" + i;
                String memoryId = synced(knowledgeId);
                boolean dropKnowledge = random.nextBoolean();
                boolean dropMemory = random.nextInt(3) == 0;
                if (dropKnowledge) {
                    knowledge.remove(knowledgeId);
                }
                if (dropMemory) {
                    memoryStore.removeDirectly(memoryId);
                }
                if (dropKnowledge || dropMemory) {
                    expected.add(memoryId);
                }
            }

            List<SyncConflict> conflicts = detector.detect(SCOPE, state, signal);

            Set<String> reported = new HashSet<>();
            for (SyncConflict conflict : conflicts) {
                assertEquals(ConflictType.ORPHANED_POINTER, conflict.getType());
                assertTrue(reported.add(conflict.getMemoryId()), "pair reported twice");
            }
            assertEquals(expected, reported);
        }
    }

    private String synced(String knowledgeId) {
        KnowledgeItem item = InMemoryKnowledgeRepository.item(knowledgeId, "content of " + knowledgeId);
        knowledge.put(item);
        state.getKnowledgeHashes().put(knowledgeId, KnowledgeHashSupport.resolveHash(item));
        return pointerFor(knowledgeId);
    }

    private String pointerFor(String knowledgeId) {
        KnowledgeItem item = InMemoryKnowledgeRepository.item(knowledgeId, "content of " + knowledgeId);
        String memoryId = pointerMemoryService.create(SCOPE, item, KnowledgeHashSupport.resolveHash(item), signal);
        state.getPointerMapping().put(memoryId, knowledgeId);
        state.getKnowledgeLayers().put(knowledgeId, item.getLayer());
        return memoryId;
    }

    /**
     * Writes a second pointer for an already synced item under another id, as
     * an out-of-band writer would.
     */
    private String duplicateOf(String knowledgeId, String memoryId) {
        MemoryRecord copy = memoryStore.byId(PointerMemoryService.pointerId(SCOPE, knowledgeId)).orElseThrow();
        copy.setId(memoryId);
        ((KnowledgePointerMetadata) copy.getMetadata()).setTags(new ArrayList<>(List.of("knowledge:adr")));
        copy.pointer().orElseThrow().setSyncedAt(clock.instant());
        memoryStore.putDirectly(SCOPE, copy);
        state.getPointerMapping().put(memoryId, knowledgeId);
        return memoryId;
    }
}
