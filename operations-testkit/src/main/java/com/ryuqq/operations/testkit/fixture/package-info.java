/**
 * Test fixtures shared by registry and runner tests.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.operations.testkit.fixture;
