package com.ryuqq.operations.core.statemachine;

import com.ryuqq.operations.core.exception.InvalidTransitionException;
import com.ryuqq.operations.core.model.OperationId;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 Operation의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING</li>
 *   <li>PENDING → CANCELLED</li>
 *   <li>RUNNING → COMPLETED</li>
 *   <li>RUNNING → FAILED</li>
 *   <li>RUNNING → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: COMPLETED → RUNNING)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * <p>허용되지 않은 전이를 시도하면 {@link InvalidTransitionException}을 발생시킵니다.</p>
     *
     * @param operationId 대상 Operation ID
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidTransitionException 유효하지 않은 전이인 경우
     */
    public static void validate(OperationId operationId, OperationStatus from, OperationStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new InvalidTransitionException(operationId, from, to,
                String.format("Cannot transition from terminal status: %s → %s", from, to));
        }

        if (!from.canTransitionTo(to)) {
            throw new InvalidTransitionException(operationId, from, to,
                String.format("Invalid status transition: %s → %s", from, to));
        }
    }
}
