package com.ryuqq.operations.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 구조화된 값(진행 컨텍스트, 결과 요약, 메타데이터)의 검증 및 불변 복사.
 *
 * <p>허용 타입: {@code null}, {@link String}, {@link Number}, {@link Boolean},
 * 위 타입들의 {@link List}, 문자열 키를 가진 중첩 {@link Map}.
 * 그 외 타입은 직렬화 가능성을 보장할 수 없으므로 거부합니다.</p>
 *
 * <p>복사본은 입력 순서를 유지하며, 모든 중첩 구조까지 수정 불가입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StructuredValues {

    // Utility class - prevent instantiation
    private StructuredValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Map을 검증하고 순서를 유지한 불변 복사본 생성.
     *
     * @param source 원본 Map (null이면 빈 Map)
     * @return 불변 복사본
     * @throws IllegalArgumentException 키가 null이거나 허용되지 않는 값 타입이 포함된 경우
     */
    public static Map<String, Object> copyOf(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Structured value keys cannot be null");
            }
            copy.put(entry.getKey(), copyValue(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(String path, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("Nested map keys must be strings at '" + path + "'");
                }
                nested.put(key, copyValue(path + "." + key, entry.getValue()));
            }
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            int index = 0;
            for (Object item : collection) {
                items.add(copyValue(path + "[" + index++ + "]", item));
            }
            return Collections.unmodifiableList(items);
        }
        throw new IllegalArgumentException(
            "Unsupported structured value type at '" + path + "': " + value.getClass().getName());
    }
}
