package com.ryuqq.operations.adapter.runner;

/**
 * OperationRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 실행할 작업 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: 종료 시 실행 중인 작업을 기다리는 최대 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 워커 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record OperationRunnerConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, shutdownTimeoutMs=60000ms (1분)</p>
     */
    public OperationRunnerConfig() {
        this(4, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OperationRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public OperationRunnerConfig withConcurrency(int concurrency) {
        return new OperationRunnerConfig(concurrency, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OperationRunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new OperationRunnerConfig(concurrency, shutdownTimeoutMs);
    }
}
