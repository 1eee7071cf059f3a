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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sync.domain.model.CancellationSignal;
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls with a per-call timeout and exponential backoff.
 *
 * <p>
 * Retryable failures ({@code KNOWLEDGE_UNAVAILABLE}, {@code MEMORY_UNAVAILABLE},
 * {@code TIMEOUT}) are retried until {@code sync.apply.max-attempts} calls were
 * made; the last failure is then thrown. Other {@link SyncException}s are
 * thrown immediately. Waiting on a call and waiting out a backoff both end
 * early when the run's {@link CancellationSignal} fires.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollaboratorCallExecutor {

    private final SyncBridgeProperties properties;

    public <T> T call(String operation, SyncErrorCode unavailableCode, Supplier<CompletableFuture<T>> call,
            CancellationSignal signal) {
        SyncBridgeProperties.ApplyProperties apply = properties.getApply();
        int maxAttempts = Math.max(1, apply.getMaxAttempts());
        SyncException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            signal.throwIfCancelled();
            try {
                return awaitCall(operation, unavailableCode, call, signal, apply.getCallTimeout());
            } catch (SyncException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastError = e;
            }

            if (attempt < maxAttempts) {
                Duration backoff = backoffFor(attempt, apply.getInitialBackoff(), apply.getMaxBackoff());
                log.debug("[Sync] {} failed (attempt {}/{}), retrying in {}ms: {}", operation, attempt,
                        maxAttempts, backoff.toMillis(), lastError.getMessage());
                sleepBeforeRetry(backoff, signal);
            }
        }

        log.warn("[Sync] {} failed after {} attempts: {}", operation, maxAttempts, lastError.getMessage());
        throw lastError;
    }

    private <T> T awaitCall(String operation, SyncErrorCode unavailableCode, Supplier<CompletableFuture<T>> call,
            CancellationSignal signal, Duration timeout) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (SyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SyncException(unavailableCode, operation + " failed: " + e.getMessage(), e);
        }

        signal.track(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SyncException(SyncErrorCode.TIMEOUT,
                    operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            if (signal.isCancelled()) {
                throw new SyncException(SyncErrorCode.CANCELLED, operation + " cancelled", e);
            }
            throw new SyncException(unavailableCode, operation + " was cancelled by the collaborator", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(SyncErrorCode.CANCELLED, operation + " interrupted", e);
        } catch (ExecutionException e) {
            throw translate(operation, unavailableCode, e.getCause());
        } finally {
            signal.untrack(future);
        }
    }

    /**
     * Waits out a backoff delay, aborting with {@code CANCELLED} as soon as the
     * run is cancelled.
     */
    protected void sleepBeforeRetry(Duration backoff, CancellationSignal signal) {
        try {
            if (signal.awaitCancellation(backoff)) {
                throw new SyncException(SyncErrorCode.CANCELLED, "Cancelled during retry backoff");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(SyncErrorCode.CANCELLED, "Interrupted during retry backoff", e);
        }
    }

    static Duration backoffFor(int attempt, Duration initialBackoff, Duration maxBackoff) {
        long initialMs = Math.max(0, initialBackoff.toMillis());
        int shift = Math.min(attempt - 1, 30);
        long delayMs = initialMs << shift;
        if (delayMs < 0 || delayMs > maxBackoff.toMillis()) {
            delayMs = maxBackoff.toMillis();
        }
        return Duration.ofMillis(delayMs);
    }

    private static SyncException translate(String operation, SyncErrorCode unavailableCode, Throwable cause) {
        Throwable unwrapped = cause;
        while (unwrapped instanceof CompletionException && unwrapped.getCause() != null) {
            unwrapped = unwrapped.getCause();
        }
        if (unwrapped instanceof SyncException syncException) {
            return syncException;
        }
        return new SyncException(unavailableCode, operation + " failed: " + unwrapped.getMessage(), unwrapped);
    }
}
