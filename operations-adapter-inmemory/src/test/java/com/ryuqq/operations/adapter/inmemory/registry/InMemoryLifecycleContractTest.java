package com.ryuqq.operations.adapter.inmemory.registry;

import com.ryuqq.operations.core.spi.OperationRegistry;
import com.ryuqq.operations.testkit.contract.AbstractLifecycleContractTest;

import java.time.Clock;

/**
 * InMemoryOperationRegistry 계약 테스트 (생성, 시작, 진행률, 종료, 결과 조회, 재시도, 정리).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryLifecycleContractTest extends AbstractLifecycleContractTest {

    @Override
    protected OperationRegistry createRegistry(Clock clock) {
        return new InMemoryOperationRegistry(clock);
    }
}
