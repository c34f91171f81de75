/**
 * Listing and pagination types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.operations.core.query.OperationQuery} - filter, limit and offset</li>
 *   <li>{@link com.ryuqq.operations.core.query.OperationPage} - point-in-time page with total and active counts</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.core.query;
