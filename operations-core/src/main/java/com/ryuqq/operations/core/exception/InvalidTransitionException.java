package com.ryuqq.operations.core.exception;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.statemachine.OperationStatus;

/**
 * 상태 머신 위반.
 *
 * <p>현재 상태에서 허용되지 않는 생명주기 메서드를 호출한 경우 발생합니다.
 * 예: 종료된 Operation을 다시 완료 처리, PENDING 상태에서 진행률 보고.</p>
 *
 * <p>이 예외는 절대 삼키지 않습니다. 이중 종료나 호출 순서 오류를 숨기면
 * 호출자의 버그가 드러나지 않기 때문입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends OperationException {

    private final OperationStatus currentStatus;
    private final OperationStatus targetStatus;

    /**
     * 생성자.
     *
     * @param operationId 대상 Operation ID
     * @param currentStatus 호출 시점의 상태
     * @param targetStatus 시도한 전이 대상 상태 (상태 전이가 아닌 호출이면 null)
     * @param message 오류 메시지
     */
    public InvalidTransitionException(OperationId operationId, OperationStatus currentStatus,
                                      OperationStatus targetStatus, String message) {
        super(ErrorCode.INVALID_TRANSITION, operationId, message);
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public OperationStatus getCurrentStatus() {
        return currentStatus;
    }

    /**
     * @return 시도한 전이 대상 상태 (진행률 보고 등 전이가 아닌 호출이면 null)
     */
    public OperationStatus getTargetStatus() {
        return targetStatus;
    }
}
