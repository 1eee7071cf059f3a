package me.golemcore.sync.domain.model;

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

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation of a sync run.
 *
 * <p>
 * A run may only suspend while awaiting a collaborator call or a backoff
 * delay. Collaborator futures are tracked so {@link #cancel()} can cancel them,
 * and backoff delays wait on {@link #awaitCancellation(Duration)} so they end
 * as soon as the signal fires.
 */
public class CancellationSignal {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.countDown();
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new SyncException(SyncErrorCode.CANCELLED, "Sync run cancelled");
        }
    }

    /**
     * Waits up to {@code timeout}.
     *
     * @return true if the signal fired before the timeout elapsed
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public <F extends Future<?>> F track(F future) {
        inFlight.add(future);
        if (isCancelled()) {
            future.cancel(true);
        }
        return future;
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
