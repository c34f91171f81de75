package com.ryuqq.operations.core.exception;

import com.ryuqq.operations.core.model.OperationId;

/**
 * 작업이 취소 신호를 관찰하고 실행을 중단할 때 사용하는 제어 흐름 예외.
 *
 * <p>오류가 아니라 "취소 요청을 확인했다"는 신호입니다.
 * {@code OperationHandle.checkCancellation()}이 던지며, 작업을 실행하는 쪽은
 * 이 예외를 받으면 취소 확인(acknowledge)을 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationCancelledException extends RuntimeException {

    private final OperationId operationId;
    private final String reason;

    public OperationCancelledException(OperationId operationId, String reason) {
        super(buildMessage(operationId, null, reason));
        this.operationId = operationId;
        this.reason = reason;
    }

    public OperationCancelledException(OperationId operationId, String checkpoint, String reason) {
        super(buildMessage(operationId, checkpoint, reason));
        this.operationId = operationId;
        this.reason = reason;
    }

    private static String buildMessage(OperationId operationId, String checkpoint, String reason) {
        StringBuilder message = new StringBuilder("Operation ").append(operationId).append(" cancelled");
        if (checkpoint != null && !checkpoint.isBlank()) {
            message.append(" at ").append(checkpoint);
        }
        if (reason != null && !reason.isBlank()) {
            message.append(" (").append(reason).append(')');
        }
        return message.toString();
    }

    public OperationId getOperationId() {
        return operationId;
    }

    /**
     * @return 취소 사유 (없으면 null)
     */
    public String getReason() {
        return reason;
    }
}
