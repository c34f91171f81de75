package com.ryuqq.operations.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProgressSnapshot 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProgressSnapshotTest {

    @Test
    void initial_IsZeroWithoutSteps() {
        ProgressSnapshot initial = ProgressSnapshot.initial();

        assertEquals(0.0, initial.getPercentage());
        assertNull(initial.getCurrentStep());
        assertNull(initial.getStepsCompleted());
        assertNull(initial.getStepsTotal());
        assertEquals(0L, initial.getItemsProcessed());
        assertTrue(initial.getContext().isEmpty());
    }

    @Test
    void build_PercentageOutOfRange_IsClamped() {
        assertEquals(100.0, ProgressSnapshot.of(150.0, null).getPercentage());
        assertEquals(0.0, ProgressSnapshot.of(-5.0, null).getPercentage());
    }

    @Test
    void build_NaNPercentage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProgressSnapshot.of(Double.NaN, null));
    }

    @Test
    void build_NegativeCounts_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> ProgressSnapshot.builder().stepsCompleted(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> ProgressSnapshot.builder().itemsProcessed(-1).build());
    }

    @Test
    void build_StepsInconsistentWithPercentage_IsStoredAsGiven() {
        ProgressSnapshot snapshot = ProgressSnapshot.builder()
            .percentage(10.0)
            .steps(9, 10)
            .build();

        assertEquals(10.0, snapshot.getPercentage());
        assertEquals(9, snapshot.getStepsCompleted());
        assertEquals(10, snapshot.getStepsTotal());
    }

    @Test
    void withPercentage_KeepsOtherFields() {
        ProgressSnapshot original = ProgressSnapshot.builder()
            .percentage(40.0)
            .currentStep("Epoch 4/10")
            .steps(4, 10)
            .itemsProcessed(4000)
            .itemsTotal(10000L)
            .currentItem("batch-4000")
            .context(Map.of("epoch", 4))
            .build();

        ProgressSnapshot updated = original.withPercentage(100.0);

        assertEquals(100.0, updated.getPercentage());
        assertEquals("Epoch 4/10", updated.getCurrentStep());
        assertEquals(4, updated.getStepsCompleted());
        assertEquals(4000L, updated.getItemsProcessed());
        assertEquals(10000L, updated.getItemsTotal());
        assertEquals("batch-4000", updated.getCurrentItem());
        assertEquals(Map.of("epoch", 4), updated.getContext());
        assertEquals(40.0, original.getPercentage());
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        ProgressSnapshot a = ProgressSnapshot.builder().percentage(5.0).context(Map.of("k", "v")).build();
        ProgressSnapshot b = ProgressSnapshot.builder().percentage(5.0).context(Map.of("k", "v")).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
