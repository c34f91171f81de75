package com.ryuqq.operations.core.spi;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.model.ResultSummary;

/**
 * Task-facing view of one running operation.
 *
 * <p>Issued by {@link OperationRegistry#markStarted(OperationId)}. The executing task uses it
 * to check for cancellation at its checkpoints, report progress and finish. The handle never
 * exposes the registry's mutable state.</p>
 *
 * <p><strong>Cooperative cancellation:</strong></p>
 * <pre>
 * for (Batch batch : batches) {
 *     handle.checkCancellation("batch " + batch.index());
 *     process(batch);
 *     handle.reportProgress(progressFor(batch));
 * }
 * return summary;
 * </pre>
 *
 * <p>Cancellation checks are lock-free and safe to call at high frequency.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OperationHandle {

    OperationId operationId();

    /**
     * @return true once cancellation has been requested (never reverts)
     */
    boolean isCancellationRequested();

    /**
     * @return the cancellation reason, or null when none was given or nothing was requested
     */
    String cancellationReason();

    /**
     * Throws if cancellation has been requested.
     *
     * @throws com.ryuqq.operations.core.exception.OperationCancelledException if requested
     */
    default void checkCancellation() {
        checkCancellation(null);
    }

    /**
     * Throws if cancellation has been requested, naming the checkpoint in the message.
     *
     * @param checkpoint description of the current checkpoint (nullable)
     * @throws com.ryuqq.operations.core.exception.OperationCancelledException if requested
     */
    void checkCancellation(String checkpoint);

    void reportProgress(ProgressSnapshot progress);

    void complete(ResultSummary resultSummary);

    default void fail(String errorMessage) {
        fail(errorMessage, null);
    }

    void fail(String errorMessage, ResultSummary partialResult);

    /**
     * Confirms the task observed the cancellation request and unwound.
     *
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if cancellation was never requested
     */
    void acknowledgeCancellation();
}
