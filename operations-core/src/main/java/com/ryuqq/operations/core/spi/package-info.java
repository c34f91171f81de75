/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement to provide
 * concrete operation tracking for the core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.spi.OperationRegistry} - lifecycle, cancellation and query of operations</li>
 *   <li>{@link com.ryuqq.operations.core.spi.OperationHandle} - task-facing view issued when an operation starts</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., operations-adapter-inmemory) provide the implementations.
 * The contract tests in operations-testkit verify any implementation.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.spi;
