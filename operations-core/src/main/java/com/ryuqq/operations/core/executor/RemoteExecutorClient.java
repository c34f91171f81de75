package com.ryuqq.operations.core.executor;

/**
 * 외부 실행기(원격 워커, 호스트 서비스) 상태 조회 클라이언트.
 *
 * <p>실제 작업이 다른 프로세스에서 실행될 때, LiveStatusBridge가 이 클라이언트로
 * 원격 상태를 주기적으로 가져와 로컬 레지스트리에 반영합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>thread-safe해야 합니다.</li>
 *   <li>연결 실패, 타임아웃 등은 예외로 전달합니다. 브리지는 예외를 연속 실패로 집계합니다.</li>
 *   <li>레지스트리 잠금을 잡은 상태에서 호출되지 않으므로 블로킹 I/O를 사용해도 됩니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteExecutorClient {

    /**
     * 원격 상태 조회.
     *
     * @param remoteReference 원격 실행기에서의 작업 식별자
     * @return 현재 원격 상태
     * @throws RuntimeException 원격 실행기에 도달할 수 없는 경우
     */
    RemoteStatus fetchStatus(String remoteReference);

    /**
     * 원격 작업에 취소 요청 전달.
     *
     * <p>기본 구현은 아무것도 하지 않습니다. 취소를 지원하지 않는 실행기는
     * 자연 종료 후 상태 조회로만 반영됩니다.</p>
     *
     * @param remoteReference 원격 실행기에서의 작업 식별자
     * @param reason 취소 사유 (null 가능)
     */
    default void cancel(String remoteReference, String reason) {
    }
}
