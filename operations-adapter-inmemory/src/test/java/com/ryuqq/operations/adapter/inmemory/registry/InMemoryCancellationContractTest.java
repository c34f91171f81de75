package com.ryuqq.operations.adapter.inmemory.registry;

import com.ryuqq.operations.core.spi.OperationRegistry;
import com.ryuqq.operations.testkit.contract.AbstractCancellationContractTest;

import java.time.Clock;

/**
 * InMemoryOperationRegistry 계약 테스트 (협조적 취소, PENDING 즉시 취소, 하위 전파, 전체 취소).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryCancellationContractTest extends AbstractCancellationContractTest {

    @Override
    protected OperationRegistry createRegistry(Clock clock) {
        return new InMemoryOperationRegistry(clock);
    }
}
