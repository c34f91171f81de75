package com.ryuqq.operations.core.query;

import com.ryuqq.operations.core.model.OperationRecord;

import java.util.List;

/**
 * 목록 조회 결과 페이지.
 *
 * @param operations 현재 페이지의 스냅샷 (생성 시각 내림차순)
 * @param totalCount 필터에 일치한 전체 건수 (페이지 적용 전)
 * @param activeCount 필터에 일치한 건 중 PENDING/RUNNING 건수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationPage(
    List<OperationRecord> operations,
    int totalCount,
    int activeCount
) {

    public OperationPage {
        operations = operations == null ? List.of() : List.copyOf(operations);
        if (totalCount < operations.size()) {
            throw new IllegalArgumentException(
                "totalCount (" + totalCount + ") cannot be less than page size (" + operations.size() + ")");
        }
        if (activeCount < 0 || activeCount > totalCount) {
            throw new IllegalArgumentException(
                "activeCount must be between 0 and totalCount (current: " + activeCount + ")");
        }
    }

    public static OperationPage empty() {
        return new OperationPage(List.of(), 0, 0);
    }

    public int returnedCount() {
        return operations.size();
    }

    /**
     * 다음 페이지 존재 여부.
     *
     * @param query 이 페이지를 만든 조회 조건
     * @return offset + 반환 건수가 전체 건수보다 작으면 true
     */
    public boolean hasMore(OperationQuery query) {
        return query.getOffset() + operations.size() < totalCount;
    }
}
