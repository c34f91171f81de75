package com.ryuqq.operations.core.statemachine;

/**
 * Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (실행 시작)</li>
 *   <li>PENDING → CANCELLED (실행 전 취소)</li>
 *   <li>RUNNING → COMPLETED (성공)</li>
 *   <li>RUNNING → FAILED (실패)</li>
 *   <li>RUNNING → CANCELLED (취소 요청 후 작업이 확인)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ─────────────┐
 *    │                 │ (실행 전 취소)
 *    ▼ (실행 시작)      │
 * RUNNING              │
 *    │                 │
 *    ├─► COMPLETED     │
 *    ├─► FAILED        │
 *    └─► CANCELLED ◄───┘
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OperationStatus {

    /**
     * 대기 중 (아직 실행 시작 안 됨).
     */
    PENDING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, FAILED, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return COMPLETED, FAILED 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 활성 상태인지 확인.
     *
     * @return PENDING 또는 RUNNING인 경우 true
     */
    public boolean isActive() {
        return !isTerminal();
    }

    /**
     * 주어진 상태로 전이할 수 있는지 확인.
     *
     * @param next 전이할 상태
     * @return 허용된 전이인 경우 true
     */
    public boolean canTransitionTo(OperationStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
