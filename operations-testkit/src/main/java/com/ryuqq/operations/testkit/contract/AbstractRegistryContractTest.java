package com.ryuqq.operations.testkit.contract;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationMetadata;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.spi.OperationHandle;
import com.ryuqq.operations.core.spi.OperationRegistry;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import com.ryuqq.operations.testkit.fixture.MutableClock;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Abstract base class for {@link OperationRegistry} contract tests.
 *
 * <p>Implementations extend one of the contract classes in this package and provide
 * {@link #createRegistry(Clock)}. Every test gets a fresh registry driven by a
 * {@link MutableClock}, so timestamps are deterministic.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryLifecycleContractTest extends AbstractLifecycleContractTest {
 *     {@literal @}Override
 *     protected OperationRegistry createRegistry(Clock clock) {
 *         return new InMemoryOperationRegistry(clock);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractRegistryContractTest {

    protected static final Instant START = Instant.parse("2025-01-15T09:30:00Z");

    protected MutableClock clock;
    protected OperationRegistry registry;

    /**
     * Creates the registry under test.
     *
     * @param clock the clock every timestamp must come from
     * @return a new, empty registry
     */
    protected abstract OperationRegistry createRegistry(Clock clock);

    @BeforeEach
    protected void setUpRegistry() {
        clock = new MutableClock(START);
        registry = createRegistry(clock);
    }

    protected OperationId createOperation(OperationType type) {
        return registry.create(type, OperationMetadata.empty());
    }

    protected OperationId createOperation(OperationType type, String symbol) {
        return registry.create(type, OperationMetadata.builder().symbol(symbol).build());
    }

    /**
     * Creates an operation and moves it to RUNNING.
     *
     * @param type the operation type
     * @return the handle of the running operation
     */
    protected OperationHandle startOperation(OperationType type) {
        return registry.markStarted(createOperation(type));
    }

    protected OperationHandle startChild(OperationType type, OperationId parentId) {
        return registry.markStarted(registry.create(type, OperationMetadata.empty(), parentId));
    }

    protected ProgressSnapshot progress(double percentage, String step) {
        return ProgressSnapshot.of(percentage, step);
    }

    protected void tick() {
        clock.advance(Duration.ofSeconds(1));
    }

    /**
     * Asserts that the operation is in the expected status.
     *
     * @param id the operation ID
     * @param expected the expected status
     */
    protected void assertStatus(OperationId id, OperationStatus expected) {
        OperationStatus actual = registry.get(id).status();
        assertEquals(expected, actual,
            String.format("Expected status %s but was %s for operation: %s", expected, actual, id));
    }
}
