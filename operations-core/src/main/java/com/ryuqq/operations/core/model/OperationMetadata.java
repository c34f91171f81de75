package com.ryuqq.operations.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 호출자가 Operation 생성 시 전달하는 컨텍스트.
 *
 * <p>어떤 심볼, 어떤 전략 등 표시와 필터링에 쓰이는 값이며, 생성 후 절대 변경되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationMetadata metadata = OperationMetadata.builder()
 *     .symbol("EURUSD")
 *     .timeframe("1h")
 *     .put("strategy", "mean_reversion_v2")
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationMetadata {

    public static final String SYMBOL = "symbol";
    public static final String TIMEFRAME = "timeframe";
    public static final String MODE = "mode";

    private static final OperationMetadata EMPTY = new OperationMetadata(Map.of());

    private final Map<String, Object> values;

    private OperationMetadata(Map<String, ?> values) {
        this.values = StructuredValues.copyOf(values);
    }

    /**
     * Map으로 OperationMetadata 생성.
     *
     * @param values 메타데이터 값 (null이면 빈 메타데이터)
     * @return OperationMetadata 인스턴스
     * @throws IllegalArgumentException 허용되지 않는 값 타입이 포함된 경우
     */
    public static OperationMetadata of(Map<String, ?> values) {
        return new OperationMetadata(values);
    }

    public static OperationMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

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

    /**
     * 문자열 값 조회.
     *
     * @param key 키
     * @return 값의 문자열 표현 (없으면 null)
     */
    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public String getSymbol() {
        return getString(SYMBOL);
    }

    public String getTimeframe() {
        return getString(TIMEFRAME);
    }

    /**
     * 키가 존재하고 값이 같은지 확인.
     *
     * @param key 키
     * @param expected 기대 값
     * @return 일치하면 true
     */
    public boolean matches(String key, Object expected) {
        return values.containsKey(key) && Objects.equals(values.get(key), expected);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationMetadata that = (OperationMetadata) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "OperationMetadata" + values;
    }

    /**
     * OperationMetadata 빌더.
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder symbol(String symbol) {
            return put(SYMBOL, symbol);
        }

        public Builder timeframe(String timeframe) {
            return put(TIMEFRAME, timeframe);
        }

        public Builder mode(String mode) {
            return put(MODE, mode);
        }

        public Builder put(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("metadata key cannot be null or blank");
            }
            values.put(key, value);
            return this;
        }

        public OperationMetadata build() {
            return new OperationMetadata(values);
        }
    }
}
