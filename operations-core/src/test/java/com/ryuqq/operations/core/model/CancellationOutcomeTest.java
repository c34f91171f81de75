package com.ryuqq.operations.core.model;

import com.ryuqq.operations.core.statemachine.OperationStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CancellationOutcome 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationOutcomeTest {

    private static final OperationId ID = OperationId.of("op_test");

    @Test
    void alreadyFinished_ReportsExistingStatus() {
        CancellationOutcome outcome = CancellationOutcome.alreadyFinished(ID, OperationStatus.COMPLETED);

        assertTrue(outcome.alreadyFinished());
        assertFalse(outcome.firstRequest());
        assertFalse(outcome.isCancelledImmediately());
        assertFalse(outcome.isAwaitingAcknowledgement());
        assertTrue(outcome.childrenCancelled().isEmpty());
    }

    @Test
    void runningOutcome_AwaitsAcknowledgement() {
        CancellationOutcome outcome = new CancellationOutcome(ID, OperationStatus.RUNNING, true, false, null);

        assertTrue(outcome.isAwaitingAcknowledgement());
        assertFalse(outcome.isCancelledImmediately());
    }

    @Test
    void childrenCancelled_IsDefensivelyCopied() {
        List<OperationId> children = new ArrayList<>(List.of(OperationId.of("op_child")));
        CancellationOutcome outcome = new CancellationOutcome(ID, OperationStatus.CANCELLED, true, false, children);

        children.clear();

        assertEquals(1, outcome.childrenCancelled().size());
        assertTrue(outcome.isCancelledImmediately());
    }
}
