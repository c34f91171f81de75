package com.ryuqq.operations.adapter.runner;

import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.spi.OperationHandle;

/**
 * OperationRunner가 실행하는 작업 본문.
 *
 * <p>작업은 체크포인트마다 {@link OperationHandle#checkCancellation(String)}을 호출하고,
 * 진행률은 {@link OperationHandle#reportProgress}로 보고합니다.
 * 정상 반환값은 결과 요약으로 저장됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationTask {

    /**
     * 작업 실행.
     *
     * @param handle 이 작업의 핸들
     * @return 결과 요약 (null 가능)
     * @throws Exception 작업 실패 시 (Operation은 FAILED로 종료)
     */
    ResultSummary execute(OperationHandle handle) throws Exception;
}
