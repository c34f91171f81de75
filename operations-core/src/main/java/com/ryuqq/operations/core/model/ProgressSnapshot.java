package com.ryuqq.operations.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Operation 진행률 스냅샷.
 *
 * <p>진행률은 갱신 시마다 통째로 교체됩니다. 읽는 쪽은 항상 완결된 스냅샷만 보게 되며,
 * {@code context}도 키 단위 병합 없이 교체됩니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>percentage: 0~100 (범위를 벗어나면 경계값으로 보정, 감소 여부는 검증하지 않음)</li>
 *   <li>currentStep: 현재 단계 설명 (null 가능)</li>
 *   <li>stepsCompleted / stepsTotal: 이산 단계 수 (null 가능)</li>
 *   <li>itemsProcessed / itemsTotal / currentItem: 처리 항목 수 (itemsTotal, currentItem은 null 가능)</li>
 *   <li>context: 도메인별 상세 (예: epoch, batch) - {@link StructuredValues} 규칙 적용</li>
 * </ul>
 *
 * <p>단계 수와 percentage가 일치하지 않아도 거부하지 않고 주어진 값을 그대로 저장합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProgressSnapshot progress = ProgressSnapshot.builder()
 *     .percentage(55.0)
 *     .currentStep("Epoch 11/20")
 *     .steps(11, 20)
 *     .context(Map.of("epoch", 11, "batch", 340))
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressSnapshot {

    private static final ProgressSnapshot INITIAL = builder().build();

    private final double percentage;
    private final String currentStep;
    private final Integer stepsCompleted;
    private final Integer stepsTotal;
    private final long itemsProcessed;
    private final Long itemsTotal;
    private final String currentItem;
    private final Map<String, Object> context;

    private ProgressSnapshot(Builder builder) {
        if (Double.isNaN(builder.percentage)) {
            throw new IllegalArgumentException("percentage cannot be NaN");
        }
        if (builder.stepsCompleted != null && builder.stepsCompleted < 0) {
            throw new IllegalArgumentException("stepsCompleted cannot be negative (current: " + builder.stepsCompleted + ")");
        }
        if (builder.stepsTotal != null && builder.stepsTotal < 0) {
            throw new IllegalArgumentException("stepsTotal cannot be negative (current: " + builder.stepsTotal + ")");
        }
        if (builder.itemsProcessed < 0) {
            throw new IllegalArgumentException("itemsProcessed cannot be negative (current: " + builder.itemsProcessed + ")");
        }
        if (builder.itemsTotal != null && builder.itemsTotal < 0) {
            throw new IllegalArgumentException("itemsTotal cannot be negative (current: " + builder.itemsTotal + ")");
        }
        this.percentage = Math.max(0.0, Math.min(100.0, builder.percentage));
        this.currentStep = builder.currentStep;
        this.stepsCompleted = builder.stepsCompleted;
        this.stepsTotal = builder.stepsTotal;
        this.itemsProcessed = builder.itemsProcessed;
        this.itemsTotal = builder.itemsTotal;
        this.currentItem = builder.currentItem;
        this.context = StructuredValues.copyOf(builder.context);
    }

    /**
     * 초기 진행률 (0%, 단계 정보 없음).
     *
     * @return 초기 스냅샷
     */
    public static ProgressSnapshot initial() {
        return INITIAL;
    }

    /**
     * percentage와 단계 설명만으로 스냅샷 생성.
     *
     * @param percentage 진행률 (0~100)
     * @param currentStep 현재 단계 설명
     * @return 스냅샷
     */
    public static ProgressSnapshot of(double percentage, String currentStep) {
        return builder().percentage(percentage).currentStep(currentStep).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 현재 값으로 채워진 빌더 생성.
     *
     * @return 빌더
     */
    public Builder toBuilder() {
        return new Builder()
            .percentage(percentage)
            .currentStep(currentStep)
            .stepsCompleted(stepsCompleted)
            .stepsTotal(stepsTotal)
            .itemsProcessed(itemsProcessed)
            .itemsTotal(itemsTotal)
            .currentItem(currentItem)
            .context(context);
    }

    /**
     * percentage만 변경한 새 인스턴스 생성.
     *
     * @param percentage 새 진행률
     * @return 새 ProgressSnapshot 인스턴스
     */
    public ProgressSnapshot withPercentage(double percentage) {
        return toBuilder().percentage(percentage).build();
    }

    public double getPercentage() {
        return percentage;
    }

    /**
     * @return 현재 단계 설명 (null 가능)
     */
    public String getCurrentStep() {
        return currentStep;
    }

    /**
     * @return 완료 단계 수 (null 가능)
     */
    public Integer getStepsCompleted() {
        return stepsCompleted;
    }

    /**
     * @return 전체 단계 수 (null 가능)
     */
    public Integer getStepsTotal() {
        return stepsTotal;
    }

    public long getItemsProcessed() {
        return itemsProcessed;
    }

    /**
     * @return 전체 항목 수 (null 가능)
     */
    public Long getItemsTotal() {
        return itemsTotal;
    }

    /**
     * @return 현재 처리 중인 항목 (null 가능)
     */
    public String getCurrentItem() {
        return currentItem;
    }

    /**
     * @return 수정 불가 컨텍스트 Map (입력 순서 유지)
     */
    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProgressSnapshot that = (ProgressSnapshot) o;
        return Double.compare(that.percentage, percentage) == 0
            && itemsProcessed == that.itemsProcessed
            && Objects.equals(currentStep, that.currentStep)
            && Objects.equals(stepsCompleted, that.stepsCompleted)
            && Objects.equals(stepsTotal, that.stepsTotal)
            && Objects.equals(itemsTotal, that.itemsTotal)
            && Objects.equals(currentItem, that.currentItem)
            && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(percentage, currentStep, stepsCompleted, stepsTotal,
            itemsProcessed, itemsTotal, currentItem, context);
    }

    @Override
    public String toString() {
        return "ProgressSnapshot{" + String.format("%.1f", percentage) + "%"
            + (currentStep != null ? ", step=" + currentStep : "")
            + (stepsTotal != null ? ", steps=" + stepsCompleted + "/" + stepsTotal : "")
            + '}';
    }

    /**
     * ProgressSnapshot 빌더.
     */
    public static final class Builder {

        private double percentage;
        private String currentStep;
        private Integer stepsCompleted;
        private Integer stepsTotal;
        private long itemsProcessed;
        private Long itemsTotal;
        private String currentItem;
        private Map<String, ?> context;

        private Builder() {
        }

        public Builder percentage(double percentage) {
            this.percentage = percentage;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder stepsCompleted(Integer stepsCompleted) {
            this.stepsCompleted = stepsCompleted;
            return this;
        }

        public Builder stepsTotal(Integer stepsTotal) {
            this.stepsTotal = stepsTotal;
            return this;
        }

        public Builder steps(int completed, int total) {
            this.stepsCompleted = completed;
            this.stepsTotal = total;
            return this;
        }

        public Builder itemsProcessed(long itemsProcessed) {
            this.itemsProcessed = itemsProcessed;
            return this;
        }

        public Builder itemsTotal(Long itemsTotal) {
            this.itemsTotal = itemsTotal;
            return this;
        }

        public Builder currentItem(String currentItem) {
            this.currentItem = currentItem;
            return this;
        }

        public Builder context(Map<String, ?> context) {
            this.context = context;
            return this;
        }

        public ProgressSnapshot build() {
            return new ProgressSnapshot(this);
        }
    }
}
