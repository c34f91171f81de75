package com.ryuqq.operations.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationId Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OperationIdTest {

    private static final Instant NOW = Instant.parse("2025-01-15T09:30:05Z");

    @Test
    void of_ValidValue_CreatesOperationId() {
        // Given
        String value = "op_data_load_20250115_093005_a1b2c3d4";

        // When
        OperationId id = OperationId.of(value);

        // Then
        assertEquals(value, id.getValue());
        assertEquals(value, id.toString());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OperationId.of("   "));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of("op/../secret")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OperationId.of("a".repeat(256)));
        assertDoesNotThrow(() -> OperationId.of("a".repeat(255)));
    }

    @Test
    void generate_UsesTypeTimestampAndRandomSuffix() {
        // When
        OperationId id = OperationId.generate(OperationType.DATA_LOAD, NOW);

        // Then
        assertTrue(id.getValue().matches("op_data_load_20250115_093005_[0-9a-f]{8}"), id.getValue());
    }

    @Test
    void generate_WithPrefix_InsertsPrefixBeforeType() {
        OperationId id = OperationId.generate("retry", OperationType.TRAINING, NOW);

        assertTrue(id.getValue().matches("op_retry_training_20250115_093005_[0-9a-f]{8}"), id.getValue());
    }

    @Test
    void generate_SameInstant_ProducesDistinctIds() {
        OperationId first = OperationId.generate(OperationType.BACKTESTING, NOW);
        OperationId second = OperationId.generate(OperationType.BACKTESTING, NOW);

        assertNotEquals(first, second);
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        OperationId a = OperationId.of("op_1");
        OperationId b = OperationId.of("op_1");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
