package me.golemcore.sync.domain.service;

import me.golemcore.sync.domain.model.ConflictType;
import me.golemcore.sync.domain.model.ResolutionAction;
import me.golemcore.sync.domain.model.SyncConflict;
import me.golemcore.sync.infrastructure.config.SyncBridgeProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConflictResolutionPolicyTest {

    @Test
    void shouldUseDefaultsPerType() {
        assertEquals(ResolutionAction.UPDATE_MEMORY, ConflictResolutionPolicy.defaultFor(ConflictType.HASH_MISMATCH));
        assertEquals(ResolutionAction.DELETE_MEMORY,
                ConflictResolutionPolicy.defaultFor(ConflictType.ORPHANED_POINTER));
        assertEquals(ResolutionAction.DELETE_MEMORY,
                ConflictResolutionPolicy.defaultFor(ConflictType.DUPLICATE_POINTER));
        assertEquals(ResolutionAction.UPDATE_MEMORY, ConflictResolutionPolicy.defaultFor(ConflictType.STATUS_CHANGE));
    }

    @Test
    void shouldPreferConfiguredStrategyOverSuggestion() {
        SyncBridgeProperties properties = new SyncBridgeProperties();
        properties.getConflicts().getStrategies().put(ConflictType.ORPHANED_POINTER, ResolutionAction.KEEP_MEMORY);
        ConflictResolutionPolicy policy = new ConflictResolutionPolicy(properties);

        SyncConflict conflict = SyncConflict.builder()
                .type(ConflictType.ORPHANED_POINTER)
                .suggestedResolution(ResolutionAction.MANUAL)
                .build();

        assertEquals(ResolutionAction.KEEP_MEMORY, policy.resolve(conflict));
    }

    @Test
    void shouldFallBackFromSuggestionToDefault() {
        ConflictResolutionPolicy policy = new ConflictResolutionPolicy(new SyncBridgeProperties());

        assertEquals(ResolutionAction.MANUAL, policy.resolve(SyncConflict.builder()
                .type(ConflictType.HASH_MISMATCH)
                .suggestedResolution(ResolutionAction.MANUAL)
                .build()));
        assertEquals(ResolutionAction.UPDATE_MEMORY, policy.resolve(SyncConflict.builder()
                .type(ConflictType.HASH_MISMATCH)
                .build()));
    }
}
