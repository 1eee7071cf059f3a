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
import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.ResolutionAction;
import me.golemcore.sync.domain.model.SyncConflict;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a conflict to the action to take: the override configured under
 * {@code sync.conflicts.strategies.<type>} if any, otherwise the conflict's
 * suggested resolution.
 */
@Component
@RequiredArgsConstructor
public class ConflictResolutionPolicy {

    private static final Map<ConflictType, ResolutionAction> DEFAULTS;

    static {
        Map<ConflictType, ResolutionAction> defaults = new EnumMap<>(ConflictType.class);
        defaults.put(ConflictType.HASH_MISMATCH, ResolutionAction.UPDATE_MEMORY);
        defaults.put(ConflictType.ORPHANED_POINTER, ResolutionAction.DELETE_MEMORY);
        defaults.put(ConflictType.DUPLICATE_POINTER, ResolutionAction.DELETE_MEMORY);
        defaults.put(ConflictType.STATUS_CHANGE, ResolutionAction.UPDATE_MEMORY);
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final SyncBridgeProperties properties;

    public static ResolutionAction defaultFor(ConflictType type) {
        return DEFAULTS.get(type);
    }

    public ResolutionAction resolve(SyncConflict conflict) {
        ResolutionAction configured = properties.getConflicts().getStrategies().get(conflict.getType());
        if (configured != null) {
            return configured;
        }
        if (conflict.getSuggestedResolution() != null) {
            return conflict.getSuggestedResolution();
        }
        return defaultFor(conflict.getType());
    }
}
