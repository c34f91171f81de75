/**
 * Contract tests for {@link com.ryuqq.operations.core.spi.OperationRegistry} implementations.
 *
 * <p>Each abstract class groups one area of the registry contract. An implementation module
 * extends them in its test tree and supplies the registry through
 * {@link com.ryuqq.operations.testkit.contract.AbstractRegistryContractTest#createRegistry(java.time.Clock)}.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.operations.testkit.contract.AbstractLifecycleContractTest} - state machine and terminal fields</li>
 *   <li>{@link com.ryuqq.operations.testkit.contract.AbstractCancellationContractTest} - cooperative cancellation</li>
 *   <li>{@link com.ryuqq.operations.testkit.contract.AbstractQueryContractTest} - listing and pagination</li>
 *   <li>{@link com.ryuqq.operations.testkit.contract.AbstractConcurrencyContractTest} - concurrent access</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.testkit.contract;
