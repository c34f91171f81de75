package com.ryuqq.operations.core.exception;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.statemachine.OperationStatus;

/**
 * 종료되지 않은 Operation의 결과를 조회한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationNotReadyException extends OperationException {

    private final OperationStatus currentStatus;

    public OperationNotReadyException(OperationId operationId, OperationStatus currentStatus) {
        super(ErrorCode.NOT_READY, operationId,
            "Results not ready for operation " + operationId + " (status: " + currentStatus + ")");
        this.currentStatus = currentStatus;
    }

    public OperationStatus getCurrentStatus() {
        return currentStatus;
    }
}
