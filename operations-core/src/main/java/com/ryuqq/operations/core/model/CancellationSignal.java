package com.ryuqq.operations.core.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Operation별 협력적 취소 신호.
 *
 * <p>취소는 선점형이 아닙니다. 요청자는 플래그를 세우고, 작업은 체크포인트마다 플래그를 확인한 뒤
 * 스스로 정리하고 확인(acknowledge)합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>requested는 false에서 true로 정확히 한 번만 바뀌며 되돌아가지 않음</li>
 *   <li>reason은 비어 있지 않은 첫 사유만 보존 (이후 요청은 사유가 없을 때만 설정)</li>
 *   <li>acknowledged는 requested 이후에만 true가 될 수 있음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 모든 필드는 원자적 참조로 관리되어 잠금 없이 읽을 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicBoolean requested = new AtomicBoolean(false);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final AtomicReference<Instant> requestedAt = new AtomicReference<>();
    private final AtomicBoolean acknowledged = new AtomicBoolean(false);

    /**
     * 취소 요청.
     *
     * <p>이미 요청된 경우에도 예외 없이 무시하며, 사유가 아직 없으면 사유만 채웁니다.</p>
     *
     * @param reason 취소 사유 (null 가능)
     * @param now 요청 시각
     * @return 최초 요청이면 true, 이미 요청된 상태였으면 false
     */
    public boolean request(String reason, Instant now) {
        // reason을 먼저 기록해야 requested=true를 본 스레드가 사유도 볼 수 있음
        if (reason != null && !reason.isBlank()) {
            this.reason.compareAndSet(null, reason);
        }
        boolean first = requested.compareAndSet(false, true);
        if (first) {
            requestedAt.set(now);
        }
        return first;
    }

    /**
     * 작업이 취소 신호를 관찰하고 정리를 마쳤음을 기록.
     *
     * @return 최초 확인이면 true
     * @throws IllegalStateException 취소가 요청되지 않은 경우
     */
    public boolean acknowledge() {
        if (!requested.get()) {
            throw new IllegalStateException("Cannot acknowledge cancellation that was never requested");
        }
        return acknowledged.compareAndSet(false, true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    /**
     * @return 취소 사유 (없으면 null)
     */
    public String getReason() {
        return reason.get();
    }

    public boolean isAcknowledged() {
        return acknowledged.get();
    }

    /**
     * 현재 상태의 불변 스냅샷.
     *
     * @return CancellationState
     */
    public CancellationState snapshot() {
        if (!requested.get()) {
            return CancellationState.none();
        }
        return new CancellationState(true, reason.get(), acknowledged.get(), requestedAt.get());
    }
}
