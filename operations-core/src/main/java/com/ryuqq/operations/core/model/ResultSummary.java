package com.ryuqq.operations.core.model;

import java.util.Map;

/**
 * 종료된 Operation의 결과 요약.
 *
 * <p>작업이 정의하는 자유 형식의 구조화된 데이터입니다 (예: {@code {"rows": 500}}).
 * COMPLETED 또는 FAILED(부분 결과) 상태에서만 존재합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (중첩 구조 포함)</p>
 * <p><strong>허용 값 타입:</strong> {@link StructuredValues} 참고</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResultSummary {

    private static final ResultSummary EMPTY = new ResultSummary(Map.of());

    private final Map<String, Object> values;

    private ResultSummary(Map<String, ?> values) {
        this.values = StructuredValues.copyOf(values);
    }

    /**
     * ResultSummary 생성.
     *
     * @param values 결과 값 (null이면 빈 요약)
     * @return ResultSummary 인스턴스
     * @throws IllegalArgumentException 허용되지 않는 값 타입이 포함된 경우
     */
    public static ResultSummary of(Map<String, ?> values) {
        return new ResultSummary(values);
    }

    /**
     * 빈 ResultSummary.
     *
     * @return 빈 ResultSummary 인스턴스
     */
    public static ResultSummary empty() {
        return EMPTY;
    }

    /**
     * 결과 값 전체 조회.
     *
     * @return 수정 불가 Map (입력 순서 유지)
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * 단일 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultSummary that = (ResultSummary) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResultSummary" + values;
    }
}
