/**
 * In-memory operation registry.
 *
 * <ul>
 *   <li>{@link com.ryuqq.operations.adapter.inmemory.registry.InMemoryOperationRegistry} - per-operation locking, lock-free snapshot reads</li>
 *   <li>{@code InMemoryOperationHandle} - task handle backed by the shared cancellation signal</li>
 * </ul>
 *
 * <p>Suitable for single-process deployments and tests. Records are lost on restart.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.adapter.inmemory.registry;
