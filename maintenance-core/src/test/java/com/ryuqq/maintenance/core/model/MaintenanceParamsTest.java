package com.ryuqq.maintenance.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MaintenanceParams Value Object 테스트.
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
class MaintenanceParamsTest {

    @Test
    void defaults_FullCycleEnabledEvery24Hours() {
        MaintenanceParams params = MaintenanceParams.defaults();

        assertTrue(params.fullCycle().enabled());
        assertEquals(Duration.ofHours(24), params.fullCycle().interval());
    }

    @Test
    void defaults_QuickCycleEnabledEveryHour() {
        MaintenanceParams params = MaintenanceParams.defaults();

        assertTrue(params.quickCycle().enabled());
        assertEquals(Duration.ofHours(1), params.quickCycle().interval());
    }

    @Test
    void defaults_HasNoOwnerAndDefaultRetention() {
        MaintenanceParams params = MaintenanceParams.defaults();

        assertEquals("", params.owner());
        assertEquals(LogRetentionOptions.defaults(), params.logRetention());
    }

    @Test
    void defaults_EveryCallReturnsEqualValue() {
        assertEquals(MaintenanceParams.defaults(), MaintenanceParams.defaults());
    }

    @Test
    void constructor_NullOwner_NormalizedToEmpty() {
        MaintenanceParams params = new MaintenanceParams(
            null, CycleParams.enabled(Duration.ofHours(1)), CycleParams.enabled(Duration.ofHours(24)),
            LogRetentionOptions.defaults());

        assertEquals("", params.owner());
    }

    @Test
    void constructor_NullCycle_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new MaintenanceParams("", null, CycleParams.enabled(Duration.ofHours(24)), LogRetentionOptions.defaults())
        );
        assertTrue(exception.getMessage().contains("quickCycle"));
    }

    @Test
    void isOwnedBy_ExactMatch_ReturnsTrue() {
        MaintenanceParams params = MaintenanceParams.defaults().withOwner("alice@host-a");

        assertTrue(params.isOwnedBy(ClientIdentity.of("alice", "host-a")));
    }

    @Test
    void isOwnedBy_DifferentHostOrUser_ReturnsFalse() {
        MaintenanceParams params = MaintenanceParams.defaults().withOwner("alice@host-a");

        assertFalse(params.isOwnedBy(ClientIdentity.of("alice", "host-b")));
        assertFalse(params.isOwnedBy(ClientIdentity.of("Alice", "host-a")));
    }

    @Test
    void isOwnedBy_EmptyOwner_ReturnsFalse() {
        assertFalse(MaintenanceParams.defaults().isOwnedBy(ClientIdentity.of("alice", "host-a")));
    }

    @Test
    void withMethods_ReturnCopiesWithOneFieldChanged() {
        MaintenanceParams original = MaintenanceParams.defaults();
        CycleParams weekly = CycleParams.enabled(Duration.ofDays(7));

        MaintenanceParams changed = original.withFullCycle(weekly);

        assertEquals(weekly, changed.fullCycle());
        assertEquals(original.quickCycle(), changed.quickCycle());
        assertEquals(Duration.ofHours(24), original.fullCycle().interval());
    }
}
