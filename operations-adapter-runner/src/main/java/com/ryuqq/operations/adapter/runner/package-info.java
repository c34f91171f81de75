/**
 * Runner Adapter Layer - 레지스트리 위에서 동작하는 실행 컴포넌트.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.operations.adapter.runner.LiveStatusBridge} - 원격 실행기 상태를 주기적으로 레지스트리에 반영</li>
 *   <li>{@link com.ryuqq.operations.adapter.runner.OperationRunner} - 작업을 워커 풀에서 실행하고 결과에 따라 종료</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (LiveStatusBridge, OperationRunner)
 *   ↓ depends on
 * core/spi (OperationRegistry, OperationHandle)
 *   ↓
 * core/executor (RemoteExecutorClient)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.operations.adapter.runner;
