package com.ryuqq.operations.core.model;

import java.time.Instant;

/**
 * {@link CancellationSignal}의 불변 스냅샷.
 *
 * @param requested 취소 요청 여부
 * @param reason 취소 사유 (null 가능)
 * @param acknowledged 작업의 취소 확인 여부
 * @param requestedAt 최초 요청 시각 (요청 전이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CancellationState(
    boolean requested,
    String reason,
    boolean acknowledged,
    Instant requestedAt
) {

    private static final CancellationState NONE = new CancellationState(false, null, false, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 요청 없이 확인된 상태인 경우
     */
    public CancellationState {
        if (acknowledged && !requested) {
            throw new IllegalArgumentException("acknowledged requires requested");
        }
    }

    /**
     * 취소 요청이 없는 상태.
     *
     * @return 요청 없음 상태
     */
    public static CancellationState none() {
        return NONE;
    }
}
