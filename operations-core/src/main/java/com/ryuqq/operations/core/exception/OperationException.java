package com.ryuqq.operations.core.exception;

import com.ryuqq.operations.core.model.OperationId;

/**
 * Operation 레지스트리 예외의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 안정적인 {@link ErrorCode}와 (알려진 경우) 대상 {@link OperationId}를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OperationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final OperationId operationId;

    protected OperationException(ErrorCode errorCode, OperationId operationId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.operationId = operationId;
    }

    protected OperationException(ErrorCode errorCode, OperationId operationId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.operationId = operationId;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (non-null)
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 대상 Operation ID 조회.
     *
     * @return Operation ID (알 수 없는 경우 null)
     */
    public OperationId getOperationId() {
        return operationId;
    }
}
