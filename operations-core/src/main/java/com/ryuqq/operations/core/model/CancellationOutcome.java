package com.ryuqq.operations.core.model;

import com.ryuqq.operations.core.statemachine.OperationStatus;

import java.util.List;

/**
 * 취소 요청 처리 결과.
 *
 * <p>이미 종료된 Operation에 대한 취소 요청은 오류가 아니며,
 * {@code alreadyFinished=true}와 함께 기존 상태를 그대로 보고합니다.
 * 자연 종료와 취소 요청의 경합은 정상적인 상황이기 때문입니다.</p>
 *
 * @param operationId 대상 Operation ID
 * @param status 요청 처리 직후 상태 (PENDING이었다면 CANCELLED, RUNNING이면 RUNNING 유지)
 * @param firstRequest 이번 호출이 최초 취소 요청이었는지 여부
 * @param alreadyFinished 요청 시점에 이미 종료 상태였는지 여부
 * @param childrenCancelled 함께 취소 요청된 하위 Operation ID 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CancellationOutcome(
    OperationId operationId,
    OperationStatus status,
    boolean firstRequest,
    boolean alreadyFinished,
    List<OperationId> childrenCancelled
) {

    public CancellationOutcome {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        childrenCancelled = childrenCancelled == null ? List.of() : List.copyOf(childrenCancelled);
    }

    /**
     * 이미 종료된 Operation에 대한 결과 생성.
     *
     * @param operationId Operation ID
     * @param status 기존 종료 상태
     * @return CancellationOutcome
     */
    public static CancellationOutcome alreadyFinished(OperationId operationId, OperationStatus status) {
        return new CancellationOutcome(operationId, status, false, true, List.of());
    }

    /**
     * 취소가 즉시 반영(CANCELLED)되었는지 확인.
     *
     * @return CANCELLED 상태이면서 이번 요청으로 종료된 경우 true
     */
    public boolean isCancelledImmediately() {
        return !alreadyFinished && status == OperationStatus.CANCELLED;
    }

    /**
     * 작업의 취소 확인을 기다려야 하는지 확인.
     *
     * @return RUNNING 상태로 남아 있는 경우 true
     */
    public boolean isAwaitingAcknowledgement() {
        return !alreadyFinished && status == OperationStatus.RUNNING;
    }
}
