package com.ryuqq.operations.core.exception;

import com.ryuqq.operations.core.model.OperationId;

/**
 * 원격 실행자에 연결할 수 없는 경우 (재시도 소진).
 *
 * <p>LiveStatusBridge가 연속 실패 허용 횟수를 초과하면 이 예외의 메시지로
 * Operation을 FAILED 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConnectivityException extends OperationException {

    private final String remoteReference;
    private final int attempts;

    public ConnectivityException(OperationId operationId, String remoteReference, int attempts, Throwable cause) {
        super(ErrorCode.CONNECTIVITY, operationId,
            String.format("Lost connectivity to remote executor for %s (ref: %s) after %d attempts: %s",
                operationId, remoteReference, attempts, cause == null ? "unknown" : cause.getMessage()),
            cause);
        this.remoteReference = remoteReference;
        this.attempts = attempts;
    }

    public String getRemoteReference() {
        return remoteReference;
    }

    public int getAttempts() {
        return attempts;
    }
}
