package com.ryuqq.operations.core.exception;

import com.ryuqq.operations.core.model.OperationId;

/**
 * 레지스트리에 존재하지 않는 Operation ID로 호출한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationNotFoundException extends OperationException {

    public OperationNotFoundException(OperationId operationId) {
        super(ErrorCode.NOT_FOUND, operationId, "Operation not found: " + operationId);
    }

    public OperationNotFoundException(OperationId operationId, String message) {
        super(ErrorCode.NOT_FOUND, operationId, message);
    }
}
