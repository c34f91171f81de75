package com.ryuqq.operations.core.spi;

import com.ryuqq.operations.core.model.CancellationOutcome;
import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationMetadata;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.query.OperationPage;
import com.ryuqq.operations.core.query.OperationQuery;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Registry SPI for tracking long-running operations through their lifecycle.
 *
 * <p>The registry owns every operation record. Callers create operations, tasks report
 * progress and finish through an {@link OperationHandle}, and observers read immutable
 * {@link OperationRecord} snapshots.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * create()            → PENDING
 * markStarted()       → RUNNING   (issues OperationHandle)
 * complete() / fail() → COMPLETED / FAILED
 * requestCancellation()
 *   PENDING           → CANCELLED immediately
 *   RUNNING           → flag set, task acknowledges → CANCELLED
 *   terminal          → no-op, existing status reported
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: every method may be called concurrently from any thread</li>
 *   <li>Per-record serialization: mutations of one id are serialized, different ids never contend</li>
 *   <li>Non-blocking reads: {@code get}/{@code list} never wait for writers and return snapshots</li>
 *   <li>Synchronous errors: state-machine violations are thrown from the offending call</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OperationRegistry {

    /**
     * Creates a new PENDING operation.
     *
     * @param type the operation type
     * @param metadata caller-supplied context, captured as-is
     * @return the new operation ID
     * @throws IllegalArgumentException if type or metadata is null
     */
    OperationId create(OperationType type, OperationMetadata metadata);

    /**
     * Creates a new PENDING child operation of an existing parent.
     *
     * @param type the operation type
     * @param metadata caller-supplied context
     * @param parentId the parent operation ID (null behaves like {@link #create(OperationType, OperationMetadata)})
     * @return the new operation ID
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if the parent is unknown
     */
    OperationId create(OperationType type, OperationMetadata metadata, OperationId parentId);

    /**
     * Transitions PENDING → RUNNING and issues the task handle.
     *
     * @param id the operation ID
     * @return the handle the executing task uses
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not PENDING
     */
    OperationHandle markStarted(OperationId id);

    /**
     * Replaces the progress snapshot of a RUNNING operation.
     *
     * @param id the operation ID
     * @param progress the new snapshot (replaces the previous one wholesale)
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not RUNNING
     */
    void reportProgress(OperationId id, ProgressSnapshot progress);

    /**
     * Transitions RUNNING → COMPLETED. Progress percentage is set to 100.
     *
     * @param id the operation ID
     * @param resultSummary the result (null when the task provided none)
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not RUNNING
     */
    void complete(OperationId id, ResultSummary resultSummary);

    /**
     * Transitions RUNNING → FAILED without a partial result.
     *
     * @param id the operation ID
     * @param errorMessage human-readable failure description
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not RUNNING
     */
    default void fail(OperationId id, String errorMessage) {
        fail(id, errorMessage, null);
    }

    /**
     * Transitions RUNNING → FAILED.
     *
     * @param id the operation ID
     * @param errorMessage human-readable failure description
     * @param partialResult partial result (nullable)
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not RUNNING
     */
    void fail(OperationId id, String errorMessage, ResultSummary partialResult);

    /**
     * Requests cooperative cancellation and cascades it to active children.
     *
     * <p>Never fails on a terminal operation: the outcome reports the existing status
     * with {@code alreadyFinished=true}.</p>
     *
     * @param id the operation ID
     * @param reason cancellation reason (nullable; the first non-blank reason is kept)
     * @return the outcome of the request
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     */
    CancellationOutcome requestCancellation(OperationId id, String reason);

    /**
     * Transitions RUNNING → CANCELLED after the task observed the cancellation request.
     *
     * @param id the operation ID
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not RUNNING or never requested
     */
    void acknowledgeCancellation(OperationId id);

    /**
     * Returns the current snapshot.
     *
     * @param id the operation ID
     * @return the snapshot
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     */
    OperationRecord get(OperationId id);

    /**
     * Lists operations matching the query, newest first.
     *
     * @param query filter and page
     * @return point-in-time page with total and active counts
     */
    OperationPage list(OperationQuery query);

    /**
     * Returns the result summary of a terminal operation.
     *
     * @param id the operation ID
     * @return the result, or empty when the operation finished without one
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.OperationNotReadyException if not yet terminal
     */
    Optional<ResultSummary> getResults(OperationId id);

    /**
     * Removes terminal operations whose completion time is older than {@code now - olderThan}.
     *
     * @param olderThan minimum age of a terminal record to be removed
     * @return the number of removed records
     */
    int cleanup(Duration olderThan);

    /**
     * Returns the child operations of a parent, oldest first.
     *
     * @param parentId the parent operation ID
     * @return child snapshots
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if the parent is unknown
     */
    List<OperationRecord> children(OperationId parentId);

    /**
     * Computes the phase-weighted progress of a parent from its children.
     *
     * @param parentId the parent operation ID
     * @return aggregated snapshot
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if the parent is unknown
     */
    ProgressSnapshot aggregatedProgress(OperationId parentId);

    /**
     * Re-creates a FAILED operation as a new PENDING operation with the same type,
     * metadata and parent. Only ever caller-triggered.
     *
     * @param id the failed operation ID
     * @return the new operation ID
     * @throws com.ryuqq.operations.core.exception.OperationNotFoundException if id is unknown
     * @throws com.ryuqq.operations.core.exception.InvalidTransitionException if not FAILED
     */
    OperationId retry(OperationId id);

    /**
     * Requests cancellation of every active operation.
     *
     * @param reason cancellation reason
     * @return the number of operations for which this call was the first request
     */
    int requestCancellationForAll(String reason);
}
