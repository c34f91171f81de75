package com.ryuqq.operations.core.progress;

import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.statemachine.OperationStatus;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 하위 Operation 진행률을 단계 가중치로 합산하는 유틸리티.
 *
 * <p>상위 Operation(예: 에이전트 세션)은 설계 → 학습 → 백테스트 단계를 하위 Operation으로 실행합니다.
 * 전체 진행률은 현재 단계의 진행률을 그 단계의 가중치 구간에 투영해 계산합니다.</p>
 *
 * <p><strong>단계 가중치:</strong></p>
 * <pre>
 * AGENT_DESIGN   0 ~   5 %
 * TRAINING       5 ~  80 %
 * BACKTESTING   80 ~ 100 %
 * 그 외          0 ~ 100 %
 * </pre>
 *
 * <p><strong>현재 단계 선택:</strong> 가장 최근의 PENDING/RUNNING 하위 Operation,
 * 없으면 가장 최근 하위 Operation. 완료된 단계는 구간의 끝 값으로 계산합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressAggregator {

    public static final int TOTAL_PHASES = 3;

    public static final String CONTEXT_CURRENT_PHASE = "current_phase";
    public static final String CONTEXT_PHASE_PROGRESS = "phase_progress";
    public static final String CONTEXT_CHILD_OPERATION_ID = "child_operation_id";

    private static final Map<OperationType, double[]> PHASE_WEIGHTS = Map.of(
        OperationType.AGENT_DESIGN, new double[]{0.0, 5.0},
        OperationType.TRAINING, new double[]{5.0, 80.0},
        OperationType.BACKTESTING, new double[]{80.0, 100.0}
    );

    private static final double[] DEFAULT_WEIGHT = {0.0, 100.0};

    private static final Comparator<OperationRecord> CREATION_ORDER =
        Comparator.comparing(OperationRecord::createdAt).thenComparingLong(OperationRecord::sequence);

    private ProgressAggregator() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * 하위 Operation 목록으로 전체 진행률 계산.
     *
     * @param children 하위 Operation 스냅샷 (순서 무관)
     * @return 합산 진행률 (하위가 없으면 0%, "No phases started")
     * @throws IllegalArgumentException children이 null인 경우
     */
    public static ProgressSnapshot aggregate(List<OperationRecord> children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        if (children.isEmpty()) {
            return ProgressSnapshot.builder()
                .percentage(0.0)
                .currentStep("No phases started")
                .steps(0, TOTAL_PHASES)
                .build();
        }

        OperationRecord current = children.stream()
            .filter(OperationRecord::isActive)
            .max(CREATION_ORDER)
            .orElseGet(() -> children.stream().max(CREATION_ORDER).orElseThrow());

        double[] weight = weightOf(current.type());
        double phaseProgress = current.status() == OperationStatus.COMPLETED
            ? 100.0
            : current.progress().getPercentage();
        double overall = weight[0] + (weight[1] - weight[0]) * phaseProgress / 100.0;

        int completedPhases = (int) children.stream()
            .filter(child -> child.status() == OperationStatus.COMPLETED)
            .count();

        String phase = current.type().getValue();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(CONTEXT_CURRENT_PHASE, phase);
        context.put(CONTEXT_PHASE_PROGRESS, phaseProgress);
        context.put(CONTEXT_CHILD_OPERATION_ID, current.id().getValue());

        return ProgressSnapshot.builder()
            .percentage(overall)
            .currentStep(String.format(Locale.ROOT, "%s (%.0f%%)", phase, phaseProgress))
            .steps(completedPhases, TOTAL_PHASES)
            .context(context)
            .build();
    }

    /**
     * 단계의 가중치 구간.
     *
     * @param type Operation 종류
     * @return {시작, 끝} 퍼센트
     */
    public static double[] weightOf(OperationType type) {
        double[] weight = PHASE_WEIGHTS.getOrDefault(type, DEFAULT_WEIGHT);
        return new double[]{weight[0], weight[1]};
    }
}
