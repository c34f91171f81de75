package com.ryuqq.operations.core.query;

import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationMetadata;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OperationQuery / OperationPage 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OperationQueryTest {

    private static final Instant T0 = Instant.parse("2025-01-15T09:30:00Z");

    private OperationRecord record(OperationType type, String symbol, OperationId parentId) {
        return OperationRecord.pending(OperationId.generate(type, T0), parentId, type,
            OperationMetadata.builder().symbol(symbol).build(), T0, 1L);
    }

    @Test
    void all_MatchesEverythingWithDefaultLimit() {
        OperationQuery query = OperationQuery.all();

        assertThat(query.getLimit()).isEqualTo(OperationQuery.DEFAULT_LIMIT);
        assertThat(query.getOffset()).isZero();
        assertThat(query.matches(record(OperationType.TRAINING, "AAPL", null))).isTrue();
    }

    @Test
    void matches_CombinesFiltersWithAnd() {
        OperationQuery query = OperationQuery.builder()
            .type(OperationType.DATA_LOAD)
            .status(OperationStatus.PENDING)
            .metadata(OperationMetadata.SYMBOL, "AAPL")
            .build();

        assertThat(query.matches(record(OperationType.DATA_LOAD, "AAPL", null))).isTrue();
        assertThat(query.matches(record(OperationType.DATA_LOAD, "MSFT", null))).isFalse();
        assertThat(query.matches(record(OperationType.TRAINING, "AAPL", null))).isFalse();
    }

    @Test
    void matches_ActiveOnlyExcludesTerminal() {
        OperationRecord running = record(OperationType.DATA_LOAD, "AAPL", null).started(T0);
        OperationRecord completed = running.completed(null, T0.plusSeconds(1));
        OperationQuery query = OperationQuery.builder().activeOnly(true).build();

        assertThat(query.matches(running)).isTrue();
        assertThat(query.matches(completed)).isFalse();
    }

    @Test
    void matches_ParentFilter() {
        OperationId parent = OperationId.of("op_parent");
        OperationQuery query = OperationQuery.builder().parentId(parent).build();

        assertThat(query.matches(record(OperationType.TRAINING, "AAPL", parent))).isTrue();
        assertThat(query.matches(record(OperationType.TRAINING, "AAPL", null))).isFalse();
    }

    @Test
    void build_InvalidPaging_ThrowsException() {
        assertThatThrownBy(() -> OperationQuery.builder().limit(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("limit");
        assertThatThrownBy(() -> OperationQuery.builder().offset(-1).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("offset");
    }

    @Test
    void page_HasMoreWhenRecordsRemain() {
        OperationRecord only = record(OperationType.DATA_LOAD, "AAPL", null);
        OperationPage page = new OperationPage(List.of(only), 3, 3);

        assertThat(page.returnedCount()).isEqualTo(1);
        assertThat(page.hasMore(OperationQuery.builder().limit(1).build())).isTrue();
        assertThat(page.hasMore(OperationQuery.builder().limit(1).offset(2).build())).isFalse();
    }

    @Test
    void page_TotalSmallerThanPage_ThrowsException() {
        OperationRecord only = record(OperationType.DATA_LOAD, "AAPL", null);

        assertThatThrownBy(() -> new OperationPage(List.of(only), 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
