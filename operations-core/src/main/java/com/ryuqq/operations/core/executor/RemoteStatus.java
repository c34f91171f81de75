package com.ryuqq.operations.core.executor;

import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.statemachine.OperationStatus;

/**
 * 원격 실행기가 보고한 작업 상태.
 *
 * @param status 원격 상태
 * @param progress 원격 진행률 (null 가능)
 * @param resultSummary 결과 요약 (COMPLETED/FAILED일 때만, null 가능)
 * @param errorMessage 오류 메시지 (FAILED일 때만)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RemoteStatus(
    OperationStatus status,
    ProgressSnapshot progress,
    ResultSummary resultSummary,
    String errorMessage
) {

    public RemoteStatus {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    public static RemoteStatus pending() {
        return new RemoteStatus(OperationStatus.PENDING, null, null, null);
    }

    public static RemoteStatus running(ProgressSnapshot progress) {
        return new RemoteStatus(OperationStatus.RUNNING, progress, null, null);
    }

    public static RemoteStatus completed(ResultSummary resultSummary) {
        return new RemoteStatus(OperationStatus.COMPLETED, null, resultSummary, null);
    }

    public static RemoteStatus failed(String errorMessage) {
        return new RemoteStatus(OperationStatus.FAILED, null, null, errorMessage);
    }

    public static RemoteStatus cancelled() {
        return new RemoteStatus(OperationStatus.CANCELLED, null, null, null);
    }
}
