package com.ryuqq.operations.adapter.inmemory.registry;

import com.ryuqq.operations.core.exception.OperationCancelledException;
import com.ryuqq.operations.core.model.CancellationSignal;
import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.spi.OperationHandle;

/**
 * {@link InMemoryOperationRegistry}가 발급하는 작업용 핸들.
 *
 * <p>취소 확인은 레지스트리와 공유하는 {@link CancellationSignal}을 잠금 없이 읽고,
 * 상태 변경은 모두 레지스트리에 위임합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InMemoryOperationHandle implements OperationHandle {

    private final InMemoryOperationRegistry registry;
    private final OperationId operationId;
    private final CancellationSignal signal;

    InMemoryOperationHandle(InMemoryOperationRegistry registry, OperationId operationId, CancellationSignal signal) {
        this.registry = registry;
        this.operationId = operationId;
        this.signal = signal;
    }

    @Override
    public OperationId operationId() {
        return operationId;
    }

    @Override
    public boolean isCancellationRequested() {
        return signal.isRequested();
    }

    @Override
    public String cancellationReason() {
        return signal.getReason();
    }

    @Override
    public void checkCancellation(String checkpoint) {
        if (signal.isRequested()) {
            throw new OperationCancelledException(operationId, checkpoint, signal.getReason());
        }
    }

    @Override
    public void reportProgress(ProgressSnapshot progress) {
        registry.reportProgress(operationId, progress);
    }

    @Override
    public void complete(ResultSummary resultSummary) {
        registry.complete(operationId, resultSummary);
    }

    @Override
    public void fail(String errorMessage, ResultSummary partialResult) {
        registry.fail(operationId, errorMessage, partialResult);
    }

    @Override
    public void acknowledgeCancellation() {
        registry.acknowledgeCancellation(operationId);
    }

    @Override
    public String toString() {
        return "InMemoryOperationHandle{operationId=" + operationId + '}';
    }
}
