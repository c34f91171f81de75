package com.ryuqq.operations.adapter.runner;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationRecord;

import java.util.concurrent.CompletableFuture;

/**
 * OperationRunner로 시작한 작업.
 *
 * @param operationId 생성된 Operation ID (즉시 사용 가능)
 * @param completion 작업이 끝나면 최종 스냅샷으로 완료되는 Future
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunningOperation(
    OperationId operationId,
    CompletableFuture<OperationRecord> completion
) {

    public RunningOperation {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
    }

    /**
     * 작업 종료까지 대기.
     *
     * @return 최종 스냅샷
     */
    public OperationRecord join() {
        return completion.join();
    }
}
