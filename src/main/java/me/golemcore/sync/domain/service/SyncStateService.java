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
import me.golemcore.sync.domain.model.SyncErrorCode;
import me.golemcore.sync.domain.model.SyncException;
import me.golemcore.sync.domain.model.SyncScope;
import me.golemcore.sync.domain.model.SyncState;
import me.golemcore.sync.port.outbound.SyncStatePort;
import org.springframework.stereotype.Service;

/**
 * Load, checkpoint, persist and roll back {@link SyncState}.
 *
 * <p>
 * Callers always receive copies, so a run mutating its working state cannot
 * affect the checkpoint it may have to restore.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncStateService {

    private final SyncStatePort statePort;

    /**
     * Current state of the scope, or an empty state on first boot.
     */
    public SyncState load(SyncScope scope) {
        return statePort.load(scope.key()).orElseGet(SyncState::empty);
    }

    /**
     * Snapshots the current state as the pre-run checkpoint and returns it.
     * Corrupted state is rethrown unchanged; any other failure becomes
     * {@code CHECKPOINT_FAILED}.
     */
    public SyncState checkpoint(SyncScope scope) {
        try {
            SyncState current = load(scope);
            if (statePort.loadCheckpoint(scope.key()).isPresent()) {
                log.warn("[SyncState] Found checkpoint of an interrupted run for {}, replacing it", scope.key());
            }
            statePort.saveCheckpoint(scope.key(), current);
            return current.copy();
        } catch (SyncException e) {
            if (e.getCode() == SyncErrorCode.STATE_CORRUPTED || e.getCode() == SyncErrorCode.CHECKPOINT_FAILED) {
                throw e;
            }
            throw new SyncException(SyncErrorCode.CHECKPOINT_FAILED,
                    "Failed to checkpoint " + scope.key() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SyncException(SyncErrorCode.CHECKPOINT_FAILED,
                    "Failed to checkpoint " + scope.key() + ": " + e.getMessage(), e);
        }
    }

    public void save(SyncScope scope, SyncState state) {
        try {
            statePort.save(scope.key(), state);
        } catch (SyncException e) {
            if (e.getCode() == SyncErrorCode.PERSISTENCE_FAILED) {
                throw e;
            }
            throw new SyncException(SyncErrorCode.PERSISTENCE_FAILED,
                    "Failed to persist " + scope.key() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SyncException(SyncErrorCode.PERSISTENCE_FAILED,
                    "Failed to persist " + scope.key() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Drops the checkpoint after a run persisted successfully.
     */
    public void clearCheckpoint(SyncScope scope) {
        statePort.deleteCheckpoint(scope.key());
    }

    /**
     * Restores the persisted state from the checkpoint and returns it.
     */
    public SyncState rollback(SyncScope scope) {
        try {
            SyncState checkpoint = statePort.loadCheckpoint(scope.key())
                    .orElseThrow(() -> new SyncException(SyncErrorCode.ROLLBACK_FAILED,
                            "No checkpoint to roll back to for " + scope.key()));
            statePort.save(scope.key(), checkpoint);
            statePort.deleteCheckpoint(scope.key());
            log.info("[SyncState] Rolled back {} to checkpoint", scope.key());
            return checkpoint.copy();
        } catch (SyncException e) {
            if (e.getCode() == SyncErrorCode.ROLLBACK_FAILED) {
                throw e;
            }
            throw new SyncException(SyncErrorCode.ROLLBACK_FAILED,
                    "Failed to roll back " + scope.key() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new SyncException(SyncErrorCode.ROLLBACK_FAILED,
                    "Failed to roll back " + scope.key() + ": " + e.getMessage(), e);
        }
    }
}
