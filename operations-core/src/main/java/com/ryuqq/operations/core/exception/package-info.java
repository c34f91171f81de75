/**
 * Error taxonomy of the operation registry.
 *
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.exception.OperationNotFoundException} - unknown operation id</li>
 *   <li>{@link com.ryuqq.operations.core.exception.InvalidTransitionException} - lifecycle call not permitted in the current status</li>
 *   <li>{@link com.ryuqq.operations.core.exception.OperationNotReadyException} - results requested before termination</li>
 *   <li>{@link com.ryuqq.operations.core.exception.ConnectivityException} - remote executor unreachable after retries</li>
 * </ul>
 *
 * <p>All of them extend {@link com.ryuqq.operations.core.exception.OperationException} and carry a stable
 * {@link com.ryuqq.operations.core.exception.ErrorCode} for transport layers to translate.
 * {@link com.ryuqq.operations.core.exception.OperationCancelledException} is a control-flow signal for tasks,
 * not an error kind.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.exception;
