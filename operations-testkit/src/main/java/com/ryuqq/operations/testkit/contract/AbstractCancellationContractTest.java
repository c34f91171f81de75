package com.ryuqq.operations.testkit.contract;

import com.ryuqq.operations.core.exception.InvalidTransitionException;
import com.ryuqq.operations.core.exception.OperationCancelledException;
import com.ryuqq.operations.core.exception.OperationNotFoundException;
import com.ryuqq.operations.core.model.CancellationOutcome;
import com.ryuqq.operations.core.model.CancellationState;
import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationMetadata;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.spi.OperationHandle;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: Cooperative Cancellation.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>RUNNING: request → task observes → acknowledge → CANCELLED</li>
 *   <li>PENDING: request → CANCELLED immediately</li>
 *   <li>Repeated requests never fail and keep the first non-empty reason</li>
 *   <li>Requests on terminal operations report the existing status</li>
 *   <li>Acknowledgement without a request is rejected</li>
 *   <li>Cascade to active children and global cancellation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractCancellationContractTest extends AbstractRegistryContractTest {

    @Test
    public void runningScenario_RequestObserveAcknowledge_EndsCancelled() {
        // Given
        OperationHandle handle = startOperation(OperationType.TRAINING);
        OperationId id = handle.operationId();

        // When
        CancellationOutcome outcome = registry.requestCancellation(id, "user aborted");

        // Then: still RUNNING until the task acknowledges
        assertTrue(outcome.firstRequest());
        assertTrue(outcome.isAwaitingAcknowledgement());
        assertStatus(id, OperationStatus.RUNNING);
        assertTrue(registry.get(id).cancellation().requested());

        // When: task observes the flag and unwinds
        assertTrue(handle.isCancellationRequested());
        assertEquals("user aborted", handle.cancellationReason());
        tick();
        handle.acknowledgeCancellation();

        // Then
        OperationRecord record = registry.get(id);
        assertEquals(OperationStatus.CANCELLED, record.status());
        assertEquals("user aborted", record.cancellation().reason());
        assertTrue(record.cancellation().acknowledged());
        assertEquals(START.plusSeconds(1), record.completedAt());
        assertNull(record.errorMessage());
    }

    @Test
    public void pendingScenario_Request_CancelsImmediatelyWithoutStart() {
        // Given
        OperationId id = createOperation(OperationType.DATA_LOAD);

        // When
        CancellationOutcome outcome = registry.requestCancellation(id, "no longer needed");

        // Then
        assertTrue(outcome.isCancelledImmediately());
        OperationRecord record = registry.get(id);
        assertEquals(OperationStatus.CANCELLED, record.status());
        assertNull(record.startedAt());
        assertEquals(START, record.completedAt());
        assertTrue(record.cancellation().requested());
        assertFalse(record.cancellation().acknowledged());
        assertEquals("no longer needed", record.cancellation().reason());
    }

    @Test
    public void markStarted_AfterPendingCancellation_ThrowsInvalidTransition() {
        OperationId id = createOperation(OperationType.DATA_LOAD);
        registry.requestCancellation(id, null);

        assertThrows(InvalidTransitionException.class, () -> registry.markStarted(id));
        assertStatus(id, OperationStatus.CANCELLED);
    }

    @Test
    public void requestCancellation_Twice_KeepsFirstReason() {
        OperationHandle handle = startOperation(OperationType.BACKTESTING);
        OperationId id = handle.operationId();

        CancellationOutcome first = registry.requestCancellation(id, "first");
        CancellationOutcome second = assertDoesNotThrow(() -> registry.requestCancellation(id, "second"));

        assertTrue(first.firstRequest());
        assertFalse(second.firstRequest());
        CancellationState state = registry.get(id).cancellation();
        assertTrue(state.requested());
        assertEquals("first", state.reason());
    }

    @Test
    public void requestCancellation_FirstWithoutReason_LaterReasonIsKept() {
        OperationHandle handle = startOperation(OperationType.BACKTESTING);
        OperationId id = handle.operationId();

        registry.requestCancellation(id, null);
        registry.requestCancellation(id, "shutdown");
        registry.requestCancellation(id, "ignored");

        assertEquals("shutdown", registry.get(id).cancellation().reason());
        assertTrue(registry.get(id).cancellation().requested());
    }

    @Test
    public void requestCancellation_OnTerminalOperation_ReportsExistingStatus() {
        OperationHandle completed = startOperation(OperationType.DATA_LOAD);
        completed.complete(ResultSummary.of(Map.of("rows", 10)));
        OperationHandle failed = startOperation(OperationType.DATA_LOAD);
        failed.fail("boom");

        CancellationOutcome afterComplete = registry.requestCancellation(completed.operationId(), "too late");
        CancellationOutcome afterFail = registry.requestCancellation(failed.operationId(), "too late");

        assertTrue(afterComplete.alreadyFinished());
        assertEquals(OperationStatus.COMPLETED, afterComplete.status());
        assertTrue(afterFail.alreadyFinished());
        assertEquals(OperationStatus.FAILED, afterFail.status());
        assertFalse(registry.get(completed.operationId()).cancellation().requested());
    }

    @Test
    public void requestCancellation_UnknownId_ThrowsNotFound() {
        assertThrows(OperationNotFoundException.class,
            () -> registry.requestCancellation(OperationId.of("op_unknown"), "x"));
    }

    @Test
    public void acknowledgeCancellation_WithoutRequest_ThrowsInvalidTransition() {
        OperationHandle handle = startOperation(OperationType.TRAINING);

        assertThrows(InvalidTransitionException.class, handle::acknowledgeCancellation);
        assertStatus(handle.operationId(), OperationStatus.RUNNING);
    }

    @Test
    public void acknowledgeCancellation_Twice_ThrowsInvalidTransition() {
        OperationHandle handle = startOperation(OperationType.TRAINING);
        registry.requestCancellation(handle.operationId(), "stop");
        handle.acknowledgeCancellation();

        assertThrows(InvalidTransitionException.class, handle::acknowledgeCancellation);
    }

    @Test
    public void complete_AfterAcknowledgedCancellation_ThrowsInvalidTransition() {
        OperationHandle handle = startOperation(OperationType.TRAINING);
        registry.requestCancellation(handle.operationId(), "stop");
        handle.acknowledgeCancellation();

        assertThrows(InvalidTransitionException.class, () -> handle.complete(null));
        assertThrows(InvalidTransitionException.class, () -> handle.fail("late"));
        assertStatus(handle.operationId(), OperationStatus.CANCELLED);
    }

    @Test
    public void complete_AfterRequestButBeforeAcknowledge_FinishesNaturally() {
        // Given: the task finished just as cancellation was requested
        OperationHandle handle = startOperation(OperationType.DATA_LOAD);
        registry.requestCancellation(handle.operationId(), "race");

        // When
        handle.complete(ResultSummary.of(Map.of("rows", 42)));

        // Then
        OperationRecord record = registry.get(handle.operationId());
        assertEquals(OperationStatus.COMPLETED, record.status());
        assertTrue(record.cancellation().requested());
        assertFalse(record.cancellation().acknowledged());
    }

    @Test
    public void checkCancellation_WhenRequested_ThrowsWithCheckpointAndReason() {
        OperationHandle handle = startOperation(OperationType.TRAINING);
        assertDoesNotThrow(() -> handle.checkCancellation("epoch 3"));

        registry.requestCancellation(handle.operationId(), "user aborted");

        OperationCancelledException exception = assertThrows(OperationCancelledException.class,
            () -> handle.checkCancellation("epoch 4"));
        assertEquals(handle.operationId(), exception.getOperationId());
        assertEquals("user aborted", exception.getReason());
        assertEquals("Operation " + handle.operationId() + " cancelled at epoch 4 (user aborted)",
            exception.getMessage());
    }

    // ============================================================
    // cascade / global
    // ============================================================

    @Test
    public void requestCancellation_OnParent_CascadesToActiveChildren() {
        // Given
        OperationHandle parent = startOperation(OperationType.AGENT_SESSION);
        OperationId parentId = parent.operationId();
        OperationHandle design = startChild(OperationType.AGENT_DESIGN, parentId);
        design.complete(null);
        OperationHandle training = startChild(OperationType.TRAINING, parentId);
        OperationId backtest = registry.create(OperationType.BACKTESTING, OperationMetadata.empty(), parentId);

        // When
        CancellationOutcome outcome = registry.requestCancellation(parentId, "budget exhausted");

        // Then
        assertEquals(2, outcome.childrenCancelled().size());
        assertTrue(outcome.childrenCancelled().containsAll(List.of(training.operationId(), backtest)));
        assertTrue(training.isCancellationRequested());
        assertEquals("Parent cancelled: budget exhausted", training.cancellationReason());
        assertStatus(backtest, OperationStatus.CANCELLED);
        assertStatus(design.operationId(), OperationStatus.COMPLETED);
        assertFalse(registry.get(design.operationId()).cancellation().requested());
    }

    @Test
    public void requestCancellationForAll_RequestsEveryActiveOperation() {
        OperationId pending = createOperation(OperationType.DATA_LOAD);
        OperationHandle running = startOperation(OperationType.TRAINING);
        OperationHandle completed = startOperation(OperationType.BACKTESTING);
        completed.complete(null);

        int requested = registry.requestCancellationForAll("shutdown");

        assertEquals(2, requested);
        assertStatus(pending, OperationStatus.CANCELLED);
        assertTrue(running.isCancellationRequested());
        assertEquals("shutdown", running.cancellationReason());
        assertStatus(completed.operationId(), OperationStatus.COMPLETED);
    }
}
