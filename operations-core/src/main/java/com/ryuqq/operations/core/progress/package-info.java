/**
 * Progress aggregation across parent/child operations.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.progress;
