/**
 * Operation lifecycle state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.statemachine.OperationStatus} - Operation lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.operations.core.statemachine.StatusTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING   (mark started)
 * PENDING → CANCELLED (cancellation requested before start)
 * RUNNING → COMPLETED (success)
 * RUNNING → FAILED    (failure)
 * RUNNING → CANCELLED (cancellation acknowledged by the task)
 *
 * Forbidden:
 * - COMPLETED / FAILED / CANCELLED → * (terminal)
 * - Backward transitions (e.g., RUNNING → PENDING)
 * </pre>
 *
 * <p>Invalid transitions throw
 * {@link com.ryuqq.operations.core.exception.InvalidTransitionException} immediately.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.statemachine;
