package me.golemcore.sync.adapter.outbound.knowledge;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.KnowledgeCommit;
import me.golemcore.sync.domain.model.KnowledgeItem;
import me.golemcore.sync.domain.model.Manifest;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import me.golemcore.sync.port.outbound.KnowledgeRepositoryPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Knowledge repository adapter speaking the repository's REST API over OkHttp.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /tenants/{tenant}/manifest - current commit and id to hash map
 * <li>GET /tenants/{tenant}/items/{id} - full item, 404 when absent
 * <li>GET /tenants/{tenant}/commits?since={commitId} - commits after a commit
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code sync.knowledge.url} - API base URL
 * <li>{@code sync.knowledge.api-key} - optional bearer token
 * <li>{@code sync.knowledge.timeout-seconds} - per-call timeout
 * </ul>
 *
 * <p>
 * Transport errors and non-2xx responses complete the future with a
 * {@link SyncException}: {@code TIMEOUT} for interrupted or timed-out calls,
 * {@code KNOWLEDGE_UNAVAILABLE} otherwise.
 */
@Component
@Slf4j
public class HttpKnowledgeRepositoryAdapter implements KnowledgeRepositoryPort {

    private static final TypeReference<List<KnowledgeCommit>> COMMIT_LIST = new TypeReference<>() {
    };

    private final SyncBridgeProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpKnowledgeRepositoryAdapter(SyncBridgeProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getKnowledge().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<Manifest> getManifest(String tenantId) {
        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = tenantUrl(tenantId).addPathSegment("manifest").build();
            String body = execute(url, false);
            try {
                Manifest manifest = objectMapper.readValue(body, Manifest.class);
                log.debug("[Knowledge] Manifest for {} at {}: {} items", tenantId, manifest.getCommitId(),
                        manifest.getItems().size());
                return manifest;
            } catch (IOException e) {
                throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                        "Unreadable manifest for " + tenantId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Optional<KnowledgeItem>> getItem(String tenantId, String itemId) {
        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = tenantUrl(tenantId).addPathSegment("items").addPathSegment(itemId).build();
            String body = execute(url, true);
            if (body == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(objectMapper.readValue(body, KnowledgeItem.class));
            } catch (IOException e) {
                throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                        "Unreadable item " + itemId + " for " + tenantId, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<KnowledgeCommit>> getCommitsSince(String tenantId, String commitId) {
        return CompletableFuture.supplyAsync(() -> {
            HttpUrl url = tenantUrl(tenantId).addPathSegment("commits")
                    .addQueryParameter("since", commitId)
                    .build();
            String body = execute(url, false);
            try {
                JsonNode root = objectMapper.readTree(body);
                // both a bare array and {"commits": [...]} are accepted
                JsonNode commits = root.isArray() ? root : root.path("commits");
                return objectMapper.convertValue(commits, COMMIT_LIST);
            } catch (IOException | IllegalArgumentException e) {
                throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                        "Unreadable commit list for " + tenantId, e);
            }
        });
    }

    private String execute(HttpUrl url, boolean notFoundAsNull) {
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (notFoundAsNull && response.code() == 404) {
                return null;
            }
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                log.warn("[Knowledge] GET {} failed: HTTP {}", url.encodedPath(), response.code());
                throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                        "Knowledge repository returned HTTP " + response.code() + " for " + url.encodedPath());
            }
            return responseBody.string();
        } catch (InterruptedIOException e) {
            throw new SyncException(SyncErrorCode.TIMEOUT, "Knowledge repository call timed out: "
                    + url.encodedPath(), e);
        } catch (IOException e) {
            log.warn("[Knowledge] GET {} error: {}", url.encodedPath(), e.getMessage());
            throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                    "Knowledge repository unreachable: " + e.getMessage(), e);
        }
    }

    private HttpUrl.Builder tenantUrl(String tenantId) {
        HttpUrl base = HttpUrl.parse(properties.getKnowledge().getUrl());
        if (base == null) {
            throw new SyncException(SyncErrorCode.KNOWLEDGE_UNAVAILABLE,
                    "Invalid knowledge repository url: " + properties.getKnowledge().getUrl());
        }
        return base.newBuilder().addPathSegment("tenants").addPathSegment(tenantId);
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getKnowledge().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }
}
