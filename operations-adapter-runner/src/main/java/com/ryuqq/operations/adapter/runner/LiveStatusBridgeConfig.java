package com.ryuqq.operations.adapter.runner;

/**
 * LiveStatusBridge 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: 폴링 주기 (기본 1000ms)</li>
 *   <li>maxConsecutiveFailures: 연결 실패로 판정하기까지의 연속 실패 횟수 (기본 3)</li>
 *   <li>initialDelayMs: 첫 폴링까지의 지연 (기본 0ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollIntervalMs 폴링 주기 (밀리초, 양수여야 함)
 * @param maxConsecutiveFailures 최대 연속 실패 횟수 (1 이상이어야 함)
 * @param initialDelayMs 첫 폴링 지연 (밀리초, 0 이상이어야 함)
 */
public record LiveStatusBridgeConfig(
    long pollIntervalMs,
    int maxConsecutiveFailures,
    long initialDelayMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=1000ms, maxConsecutiveFailures=3, initialDelayMs=0ms</p>
     */
    public LiveStatusBridgeConfig() {
        this(1000, 3, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LiveStatusBridgeConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException(
                "maxConsecutiveFailures must be positive (current: " + maxConsecutiveFailures + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs cannot be negative (current: " + initialDelayMs + ")"
            );
        }
    }

    public LiveStatusBridgeConfig withPollIntervalMs(long pollIntervalMs) {
        return new LiveStatusBridgeConfig(pollIntervalMs, maxConsecutiveFailures, initialDelayMs);
    }

    public LiveStatusBridgeConfig withMaxConsecutiveFailures(int maxConsecutiveFailures) {
        return new LiveStatusBridgeConfig(pollIntervalMs, maxConsecutiveFailures, initialDelayMs);
    }

    public LiveStatusBridgeConfig withInitialDelayMs(long initialDelayMs) {
        return new LiveStatusBridgeConfig(pollIntervalMs, maxConsecutiveFailures, initialDelayMs);
    }
}
