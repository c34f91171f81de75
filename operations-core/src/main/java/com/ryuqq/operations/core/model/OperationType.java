package com.ryuqq.operations.core.model;

import java.util.regex.Pattern;

/**
 * Operation 종류.
 *
 * <p>필터링과 LiveStatusBridge 적용 여부 판단에 사용됩니다.
 * 자주 쓰는 종류는 상수로 제공하며, 그 외 종류는 {@link #of(String)}로 확장합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>OperationType.DATA_LOAD - 대용량 데이터 적재</li>
 *   <li>OperationType.TRAINING - 모델 학습</li>
 *   <li>OperationType.of("report_export") - 사용자 정의 종류</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 소문자로 시작, 소문자/숫자/언더스코어만 허용 (예: data_load)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationType {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    public static final OperationType DATA_LOAD = new OperationType("data_load");
    public static final OperationType TRAINING = new OperationType("training");
    public static final OperationType BACKTESTING = new OperationType("backtesting");
    public static final OperationType AGENT_RESEARCH = new OperationType("agent_research");
    public static final OperationType AGENT_DESIGN = new OperationType("agent_design");
    public static final OperationType AGENT_ASSESSMENT = new OperationType("agent_assessment");
    public static final OperationType AGENT_SESSION = new OperationType("agent_session");
    public static final OperationType GENERIC = new OperationType("generic");

    private final String value;

    private OperationType(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationType cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("OperationType length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("OperationType must be lower snake case (e.g. data_load): " + value);
        }
        this.value = value;
    }

    /**
     * OperationType 생성.
     *
     * @param value 종류 값 (예: data_load)
     * @return OperationType 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationType of(String value) {
        return new OperationType(value);
    }

    /**
     * 종류 값 조회.
     *
     * @return 종류 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationType that = (OperationType) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
