package me.golemcore.sync.infrastructure.config;

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

import lombok.Data;
import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.ResolutionAction;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the sync bridge.
 *
 * <p>
 * Bound from {@code application.properties} with the {@code sync.*} prefix.
 * Durations accept Spring's format ({@code 100ms}, {@code 15m}, {@code 1h}).
 */
@Component
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncBridgeProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private List<String> tenants = new ArrayList<>(List.of("default"));
    private TriggerProperties trigger = new TriggerProperties();
    private ApplyProperties apply = new ApplyProperties();
    private LeaseProperties lease = new LeaseProperties();
    private FailureProperties failures = new FailureProperties();
    private ConflictProperties conflicts = new ConflictProperties();
    private PointerProperties pointer = new PointerProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoryProperties directories = new DirectoryProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/sync";
    }

    @Data
    public static class DirectoryProperties {
        private String state = "state";
        private String memory = "memory";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class KnowledgeProperties {
        private String url = "http://localhost:8420";
        private String apiKey;
        private int timeoutSeconds = 10;
    }

    @Data
    public static class TriggerProperties {
        private Duration stalenessThreshold = Duration.ofMinutes(60);
        private int sessionThreshold = 10;
        private Duration interval = Duration.ofMinutes(15);
    }

    /**
     * Apply-phase limits. Every collaborator call gets {@code callTimeout}; a
     * failed call is retried with exponential backoff starting at
     * {@code initialBackoff} until {@code maxAttempts} calls were made.
     */
    @Data
    public static class ApplyProperties {
        private int workerPoolSize = 4;
        private Duration callTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class LeaseProperties {
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class FailureProperties {
        private int retentionDays = 30;
    }

    @Data
    public static class ConflictProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
        private Map<ConflictType, ResolutionAction> strategies = new EnumMap<>(ConflictType.class);
    }

    @Data
    public static class PointerProperties {
        private int maxContentLength = 800;
        private int maxBlockingConstraints = 3;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(30);
    }
}
