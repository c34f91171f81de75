/**
 * Remote executor abstraction.
 *
 * <p>Operations that run outside this process expose their state through a
 * {@link com.ryuqq.operations.core.executor.RemoteExecutorClient}. The runner module's
 * LiveStatusBridge polls it and mirrors the remote state into the registry.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.executor;
