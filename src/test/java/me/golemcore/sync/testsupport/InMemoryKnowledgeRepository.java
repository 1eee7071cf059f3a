package me.golemcore.sync.testsupport;

import me.golemcore.sync.domain.model.KnowledgeCommit;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.KnowledgeLayer;
import me.golemcore.sync.domain.model.KnowledgeStatus;
import me.golemcore.sync.domain.model.KnowledgeType;
import me.golemcore.sync.domain.model.Manifest;
import me.golemcore.sync.domain.model.ManifestEntry;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.service.KnowledgeHashSupport;
import me.golemcore.sync.port.outbound.KnowledgeRepositoryPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Knowledge repository fake. Every change is a new commit ({@code c1},
 * {@code c2}, ...) recording the item it touched.
 */
public class InMemoryKnowledgeRepository implements KnowledgeRepositoryPort {

    private final Map<String, KnowledgeItem> items = new TreeMap<>();
    private final List<KnowledgeCommit> commits = new ArrayList<>();
    private final Set<String> failingItems = ConcurrentHashMap.newKeySet();
    private final AtomicInteger manifestFailures = new AtomicInteger();
    private final AtomicInteger itemCalls = new AtomicInteger();
    private String headCommit;

    public static KnowledgeItem item(String id, String content) {
        return KnowledgeItem.builder()
                .id(id)
                .title("Title " + id)
                .summary("Summary of " + id)
                .content(content)
                .status(KnowledgeStatus.ACCEPTED)
                .layer(KnowledgeLayer.PROJECT)
                .type(KnowledgeType.ADR)
                .build();
    }

    public synchronized String put(KnowledgeItem item) {
        items.put(item.getId(), item);
        return commit(item.getId());
    }

    public synchronized String remove(String id) {
        items.remove(id);
        return commit(id);
    }

    public synchronized String headCommit() {
        return headCommit;
    }

    public void failItem(String id) {
        failingItems.add(id);
    }

    public void healItem(String id) {
        failingItems.remove(id);
    }

    public void failNextManifests(int count) {
        manifestFailures.set(count);
    }

    public int itemCalls() {
        return itemCalls.get();
    }

    @Override
    public synchronized CompletableFuture<Manifest> getManifest(String tenantId) {
        if (manifestFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return CompletableFuture.failedFuture(
                    new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE, "manifest unavailable"));
        }
        Map<String, ManifestEntry> entries = new LinkedHashMap<>();
        items.forEach((id, item) -> entries.put(id, ManifestEntry.builder()
                .contentHash(KnowledgeHashSupport.resolveHash(item))
                .layer(item.getLayer())
                .type(item.getType())
                .build()));
        return CompletableFuture.completedFuture(new Manifest(headCommit, entries));
    }

    @Override
    public synchronized CompletableFuture<Optional<KnowledgeItem>> getItem(String tenantId, String itemId) {
        itemCalls.incrementAndGet();
        if (failingItems.contains(itemId)) {
            return CompletableFuture.failedFuture(
                    new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE, "item " + itemId + " unavailable"));
        }
        return CompletableFuture.completedFuture(Optional.ofNullable(items.get(itemId)));
    }

    @Override
    public synchronized CompletableFuture<List<KnowledgeCommit>> getCommitsSince(String tenantId, String commitId) {
        List<KnowledgeCommit> since = new ArrayList<>();
        boolean found = false;
        for (KnowledgeCommit commit : commits) {
            if (found) {
                since.add(commit);
            }
            if (commit.commitId().equals(commitId)) {
                found = true;
            }
        }
        return CompletableFuture.completedFuture(found ? since : List.copyOf(commits));
    }

    private String commit(String affectedId) {
        headCommit = "c" + (commits.size() + 1);
        commits.add(new KnowledgeCommit(headCommit, List.of(affectedId)));
        return headCommit;
    }
}
