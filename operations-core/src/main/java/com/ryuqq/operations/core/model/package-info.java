/**
 * Core domain model: identifiers, immutable snapshots and the cancellation primitive.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.model.OperationId} - Operation unique identifier</li>
 *   <li>{@link com.ryuqq.operations.core.model.OperationType} - Operation kind (closed set, extensible via {@code of})</li>
 *   <li>{@link com.ryuqq.operations.core.model.OperationMetadata} - Caller-supplied creation context</li>
 *   <li>{@link com.ryuqq.operations.core.model.ProgressSnapshot} - Progress, replaced wholesale on update</li>
 *   <li>{@link com.ryuqq.operations.core.model.ResultSummary} - Terminal structured payload</li>
 * </ul>
 *
 * <h2>Snapshots</h2>
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.model.OperationRecord} - Immutable view of one operation</li>
 *   <li>{@link com.ryuqq.operations.core.model.CancellationState} - Immutable view of a cancellation signal</li>
 *   <li>{@link com.ryuqq.operations.core.model.CancellationOutcome} - Result of a cancellation request</li>
 * </ul>
 *
 * <h2>Primitives</h2>
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.model.CancellationSignal} - Atomic, set-once cooperative cancellation flag</li>
 *   <li>{@link com.ryuqq.operations.core.model.StructuredValues} - Validation of serializable key/value structures</li>
 * </ul>
 *
 * <p>No external dependencies.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.model;
