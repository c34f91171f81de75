package com.ryuqq.operations.core.query;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.statemachine.OperationStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Operation 목록 조회 조건.
 *
 * <p>모든 필터는 선택 사항이며, 지정된 필터는 AND로 결합됩니다.
 * 정렬은 항상 생성 시각 내림차순(최신 우선)이고, 같은 시각이면 생성 순번 내림차순입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationQuery query = OperationQuery.builder()
 *     .type(OperationType.TRAINING)
 *     .activeOnly(true)
 *     .metadata("symbol", "AAPL")
 *     .limit(20)
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationQuery {

    public static final int DEFAULT_LIMIT = 100;

    private static final OperationQuery ALL = builder().build();

    private final OperationType type;
    private final OperationStatus status;
    private final boolean activeOnly;
    private final OperationId parentId;
    private final Map<String, Object> metadata;
    private final int limit;
    private final int offset;

    private OperationQuery(Builder builder) {
        if (builder.limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + builder.limit + ")");
        }
        if (builder.offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative (current: " + builder.offset + ")");
        }
        this.type = builder.type;
        this.status = builder.status;
        this.activeOnly = builder.activeOnly;
        this.parentId = builder.parentId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    /**
     * 필터 없이 기본 페이지 크기로 조회하는 조건.
     *
     * @return 기본 조건
     */
    public static OperationQuery all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 스냅샷이 필터 조건을 만족하는지 확인 (limit/offset 제외).
     *
     * @param record 검사할 스냅샷
     * @return 모든 필터를 만족하면 true
     */
    public boolean matches(OperationRecord record) {
        if (record == null) {
            return false;
        }
        if (type != null && !type.equals(record.type())) {
            return false;
        }
        if (status != null && status != record.status()) {
            return false;
        }
        if (activeOnly && !record.isActive()) {
            return false;
        }
        if (parentId != null && !parentId.equals(record.parentId())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (!record.metadata().matches(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    public OperationType getType() {
        return type;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public boolean isActiveOnly() {
        return activeOnly;
    }

    public OperationId getParentId() {
        return parentId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationQuery that = (OperationQuery) o;
        return activeOnly == that.activeOnly
            && limit == that.limit
            && offset == that.offset
            && Objects.equals(type, that.type)
            && status == that.status
            && Objects.equals(parentId, that.parentId)
            && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, status, activeOnly, parentId, metadata, limit, offset);
    }

    @Override
    public String toString() {
        return "OperationQuery{" +
            "type=" + type +
            ", status=" + status +
            ", activeOnly=" + activeOnly +
            ", parentId=" + parentId +
            ", metadata=" + metadata +
            ", limit=" + limit +
            ", offset=" + offset +
            '}';
    }

    public static final class Builder {

        private OperationType type;
        private OperationStatus status;
        private boolean activeOnly;
        private OperationId parentId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private int limit = DEFAULT_LIMIT;
        private int offset;

        private Builder() {
        }

        public Builder type(OperationType type) {
            this.type = type;
            return this;
        }

        public Builder status(OperationStatus status) {
            this.status = status;
            return this;
        }

        public Builder activeOnly(boolean activeOnly) {
            this.activeOnly = activeOnly;
            return this;
        }

        public Builder parentId(OperationId parentId) {
            this.parentId = parentId;
            return this;
        }

        /**
         * 메타데이터 동등 조건 추가.
         *
         * @param key 메타데이터 키
         * @param expected 기대 값 (키가 존재하고 값이 같아야 일치)
         * @return this
         */
        public Builder metadata(String key, Object expected) {
            if (key == null) {
                throw new IllegalArgumentException("metadata key cannot be null");
            }
            this.metadata.put(key, expected);
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public OperationQuery build() {
            return new OperationQuery(this);
        }
    }
}
