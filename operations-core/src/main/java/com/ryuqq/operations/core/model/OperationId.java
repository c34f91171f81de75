package com.ryuqq.operations.core.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Operation의 고유 식별자.
 *
 * <p>OperationId는 레지스트리 내 모든 Operation을 추적하는 유일한 조회 키입니다.
 * 생성 시 자동 발급되며 이후 변경되지 않습니다.</p>
 *
 * <p><strong>발급 형식:</strong></p>
 * <ul>
 *   <li>기본: {@code op_{type}_{yyyyMMdd_HHmmss}_{8자리 hex}} (예: op_training_20250101_120000_1a2b3c4d)</li>
 *   <li>접두어 지정: {@code op_{prefix}_{type}_{yyyyMMdd_HHmmss}_{8자리 hex}} (예: op_retry_data_load_...)</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("OperationId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("OperationId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 OperationId 생성.
     *
     * @param value OperationId 값
     * @return OperationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * 새 OperationId 발급.
     *
     * @param type Operation 종류
     * @param now 발급 시각
     * @return 새 OperationId
     */
    public static OperationId generate(OperationType type, Instant now) {
        return generate(null, type, now);
    }

    /**
     * 접두어를 붙여 새 OperationId 발급.
     *
     * @param prefix 접두어 (null 또는 빈 문자열이면 생략)
     * @param type Operation 종류
     * @param now 발급 시각
     * @return 새 OperationId
     * @throws IllegalArgumentException type 또는 now가 null인 경우
     */
    public static OperationId generate(String prefix, OperationType type, Instant now) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        String unique = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String timestamp = TIMESTAMP_FORMAT.format(now);

        if (prefix == null || prefix.isBlank()) {
            return new OperationId("op_" + type.getValue() + "_" + timestamp + "_" + unique);
        }
        return new OperationId("op_" + prefix + "_" + type.getValue() + "_" + timestamp + "_" + unique);
    }

    /**
     * OperationId 값 조회.
     *
     * @return OperationId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationId that = (OperationId) o;
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
