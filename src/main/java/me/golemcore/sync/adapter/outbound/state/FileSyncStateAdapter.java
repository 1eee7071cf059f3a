package me.golemcore.sync.adapter.outbound.state;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncFailure;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.port.outbound.StoragePort;
import me.golemcore.sync.port.outbound.SyncStatePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;

/**
 * Stores sync state as JSON under {@code state/<tenant>/sync-state.json}, with
 * the pre-run checkpoint next to it in {@code sync-state.checkpoint.json}.
 *
 * <p>
 * Map entries are written sorted by key so equal states serialize to identical
 * bytes. Loading fails closed: a record with an unknown {@code version} or a
 * missing required section raises {@link SyncErrorCode#STATE_CORRUPTED}.
 */
@Component
@Slf4j
public class FileSyncStateAdapter implements SyncStatePort {

    static final String STATE_FILE = "sync-state.json";
    static final String CHECKPOINT_FILE = "sync-state.checkpoint.json";

    private static final List<String> REQUIRED_FIELDS = List.of("version", "knowledgeHashes", "pointerMapping",
            "failedItems", "stats");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final SyncBridgeProperties properties;

    public FileSyncStateAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            SyncBridgeProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.writer = objectMapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .with(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<SyncState> load(String scopeKey) {
        return read(scopeKey, STATE_FILE);
    }

    @Override
    public void save(String scopeKey, SyncState state) {
        write(scopeKey, STATE_FILE, state, true, SyncErrorCode.PERSISTENCE_FAILED);
        log.debug("[SyncState] Saved state for {}", scopeKey);
    }

    @Override
    public void saveCheckpoint(String scopeKey, SyncState state) {
        write(scopeKey, CHECKPOINT_FILE, state, false, SyncErrorCode.CHECKPOINT_FAILED);
        log.debug("[SyncState] Saved checkpoint for {}", scopeKey);
    }

    @Override
    public Optional<SyncState> loadCheckpoint(String scopeKey) {
        return read(scopeKey, CHECKPOINT_FILE);
    }

    @Override
    public void deleteCheckpoint(String scopeKey) {
        try {
            storagePort.deleteObject(directory(), path(scopeKey, CHECKPOINT_FILE)).join();
        } catch (CompletionException e) {
            log.warn("[SyncState] Failed to delete checkpoint for {}: {}", scopeKey, rootMessage(e));
        }
    }

    private Optional<SyncState> read(String scopeKey, String file) {
        String json;
        try {
            json = storagePort.getText(directory(), path(scopeKey, file)).join();
        } catch (CompletionException e) {
            throw new SyncException(SyncErrorCode.PERSISTENCE_FAILED,
                    "Failed to read " + file + " for " + scopeKey + ": " + rootMessage(e), e);
        }
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(parse(scopeKey, file, json));
    }

    private SyncState parse(String scopeKey, String file, String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw corrupted(scopeKey, file, "root is not an object");
            }
            for (String field : REQUIRED_FIELDS) {
                if (!root.hasNonNull(field)) {
                    throw corrupted(scopeKey, file, "missing " + field);
                }
            }
            String version = root.get("version").asText();
            if (!SyncState.CURRENT_VERSION.equals(version)) {
                throw corrupted(scopeKey, file, "unsupported version " + version);
            }

            SyncState state = objectMapper.treeToValue(root, SyncState.class);
            validate(scopeKey, file, state);
            return normalize(state);
        } catch (JsonProcessingException e) {
            throw new SyncException(SyncErrorCode.STATE_CORRUPTED,
                    "Sync state " + file + " for " + scopeKey + " is not valid JSON", e);
        }
    }

    private void validate(String scopeKey, String file, SyncState state) {
        if (hasNullEntries(state.getKnowledgeHashes()) || hasNullEntries(state.getPointerMapping())) {
            throw corrupted(scopeKey, file, "null map entry");
        }
        if (state.getKnowledgeLayers() != null && hasNullEntries(state.getKnowledgeLayers())) {
            throw corrupted(scopeKey, file, "null layer entry");
        }
        for (SyncFailure failure : state.getFailedItems()) {
            if (failure == null || failure.getKnowledgeId() == null) {
                throw corrupted(scopeKey, file, "failed item without knowledge id");
            }
        }
    }

    private SyncState normalize(SyncState state) {
        state.setKnowledgeHashes(new TreeMap<>(state.getKnowledgeHashes()));
        state.setPointerMapping(new TreeMap<>(state.getPointerMapping()));
        state.setKnowledgeLayers(state.getKnowledgeLayers() != null
                ? new TreeMap<>(state.getKnowledgeLayers())
                : new TreeMap<>());
        return state;
    }

    private void write(String scopeKey, String file, SyncState state, boolean backup, SyncErrorCode errorCode) {
        try {
            String json = writer.writeValueAsString(state);
            storagePort.putTextAtomic(directory(), path(scopeKey, file), json, backup).join();
        } catch (JsonProcessingException | CompletionException e) {
            throw new SyncException(errorCode,
                    "Failed to write " + file + " for " + scopeKey + ": " + rootMessage(e), e);
        }
    }

    private static boolean hasNullEntries(Map<String, ?> map) {
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                return true;
            }
        }
        return false;
    }

    private static SyncException corrupted(String scopeKey, String file, String reason) {
        return new SyncException(SyncErrorCode.STATE_CORRUPTED,
                "Sync state " + file + " for " + scopeKey + " failed validation: " + reason);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private String directory() {
        return properties.getStorage().getDirectories().getState();
    }

    private static String path(String scopeKey, String file) {
        return scopeKey + "/" + file;
    }
}
