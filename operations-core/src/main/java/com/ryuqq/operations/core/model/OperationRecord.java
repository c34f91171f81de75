package com.ryuqq.operations.core.model;

import com.ryuqq.operations.core.exception.InvalidTransitionException;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import com.ryuqq.operations.core.statemachine.StatusTransition;

import java.time.Instant;

/**
 * 추적 중인 Operation 하나의 불변 스냅샷.
 *
 * <p>레지스트리는 상태가 바뀔 때마다 새 스냅샷을 만들어 교체합니다.
 * 조회자는 항상 "조회 시점의 상태"를 받으며, 레지스트리 내부 상태에 대한 참조는 받지 않습니다.</p>
 *
 * <p><strong>상태 전이 메서드</strong>({@link #started}, {@link #completed}, {@link #failed},
 * {@link #cancelled})는 {@link StatusTransition}으로 검증한 뒤 새 스냅샷을 반환하며,
 * 허용되지 않은 전이는 {@link InvalidTransitionException}을 던집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>startedAt: RUNNING 진입 시 설정 (PENDING에서 바로 취소되면 null)</li>
 *   <li>completedAt: 종료 상태 진입 시 설정</li>
 *   <li>errorMessage: FAILED 상태에서만 존재</li>
 *   <li>resultSummary: 종료 상태이고 작업이 제공한 경우에만 존재</li>
 * </ul>
 *
 * @param id Operation ID
 * @param parentId 상위 Operation ID (null 가능)
 * @param type Operation 종류
 * @param status 현재 상태
 * @param createdAt 생성 시각
 * @param startedAt 실행 시작 시각 (null 가능)
 * @param completedAt 종료 시각 (null 가능)
 * @param progress 진행률
 * @param cancellation 취소 상태
 * @param errorMessage 오류 메시지 (FAILED일 때만)
 * @param resultSummary 결과 요약 (null 가능)
 * @param metadata 호출자 메타데이터
 * @param sequence 생성 순번 (정렬 안정성을 위한 보조 키)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OperationRecord(
    OperationId id,
    OperationId parentId,
    OperationType type,
    OperationStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    ProgressSnapshot progress,
    CancellationState cancellation,
    String errorMessage,
    ResultSummary resultSummary,
    OperationMetadata metadata,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 불변식을 위반한 경우
     */
    public OperationRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (status.isTerminal() && completedAt == null) {
            throw new IllegalArgumentException("completedAt is required for terminal status: " + status);
        }
        if (errorMessage != null && status != OperationStatus.FAILED) {
            throw new IllegalArgumentException("errorMessage is only allowed for FAILED (current: " + status + ")");
        }
        if (resultSummary != null && status != OperationStatus.COMPLETED && status != OperationStatus.FAILED) {
            throw new IllegalArgumentException("resultSummary is only allowed for COMPLETED or FAILED (current: " + status + ")");
        }
        progress = progress == null ? ProgressSnapshot.initial() : progress;
        cancellation = cancellation == null ? CancellationState.none() : cancellation;
        metadata = metadata == null ? OperationMetadata.empty() : metadata;
    }

    /**
     * 새 PENDING 스냅샷 생성.
     *
     * @param id Operation ID
     * @param parentId 상위 Operation ID (null 가능)
     * @param type Operation 종류
     * @param metadata 메타데이터
     * @param createdAt 생성 시각
     * @param sequence 생성 순번
     * @return PENDING 상태의 OperationRecord
     */
    public static OperationRecord pending(OperationId id, OperationId parentId, OperationType type,
                                          OperationMetadata metadata, Instant createdAt, long sequence) {
        return new OperationRecord(id, parentId, type, OperationStatus.PENDING, createdAt, null, null,
            ProgressSnapshot.initial(), CancellationState.none(), null, null, metadata, sequence);
    }

    /**
     * PENDING → RUNNING.
     *
     * @param now 시작 시각
     * @return RUNNING 스냅샷
     * @throws InvalidTransitionException PENDING이 아닌 경우
     */
    public OperationRecord started(Instant now) {
        StatusTransition.validate(id, status, OperationStatus.RUNNING);
        return new OperationRecord(id, parentId, type, OperationStatus.RUNNING, createdAt, now, null,
            progress, cancellation, null, null, metadata, sequence);
    }

    /**
     * 진행률 교체.
     *
     * @param next 새 진행률
     * @return 진행률이 교체된 스냅샷
     * @throws IllegalArgumentException next가 null인 경우
     * @throws InvalidTransitionException RUNNING이 아닌 경우
     */
    public OperationRecord withProgress(ProgressSnapshot next) {
        if (next == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (status != OperationStatus.RUNNING) {
            throw new InvalidTransitionException(id, status, null,
                "Cannot report progress for operation " + id + " while " + status
                    + (status == OperationStatus.PENDING ? " (mark it started first)" : ""));
        }
        return new OperationRecord(id, parentId, type, status, createdAt, startedAt, completedAt,
            next, cancellation, errorMessage, resultSummary, metadata, sequence);
    }

    /**
     * 취소 상태만 교체 (상태 전이 없음).
     *
     * @param next 새 취소 상태
     * @return 취소 상태가 교체된 스냅샷
     */
    public OperationRecord withCancellation(CancellationState next) {
        return new OperationRecord(id, parentId, type, status, createdAt, startedAt, completedAt,
            progress, next, errorMessage, resultSummary, metadata, sequence);
    }

    /**
     * RUNNING → COMPLETED. 진행률은 100%로 맞춥니다.
     *
     * @param result 결과 요약 (null 가능)
     * @param now 종료 시각
     * @return COMPLETED 스냅샷
     * @throws InvalidTransitionException RUNNING이 아닌 경우
     */
    public OperationRecord completed(ResultSummary result, Instant now) {
        StatusTransition.validate(id, status, OperationStatus.COMPLETED);
        return new OperationRecord(id, parentId, type, OperationStatus.COMPLETED, createdAt, startedAt, now,
            progress.withPercentage(100.0), cancellation, null, result, metadata, sequence);
    }

    /**
     * RUNNING → FAILED.
     *
     * @param message 오류 메시지
     * @param partialResult 부분 결과 (null 가능)
     * @param now 종료 시각
     * @return FAILED 스냅샷
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     * @throws InvalidTransitionException RUNNING이 아닌 경우
     */
    public OperationRecord failed(String message, ResultSummary partialResult, Instant now) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank");
        }
        StatusTransition.validate(id, status, OperationStatus.FAILED);
        return new OperationRecord(id, parentId, type, OperationStatus.FAILED, createdAt, startedAt, now,
            progress, cancellation, message, partialResult, metadata, sequence);
    }

    /**
     * PENDING 또는 RUNNING → CANCELLED.
     *
     * @param finalCancellation 종료 시점의 취소 상태
     * @param now 종료 시각
     * @return CANCELLED 스냅샷
     * @throws InvalidTransitionException 이미 종료된 경우
     */
    public OperationRecord cancelled(CancellationState finalCancellation, Instant now) {
        StatusTransition.validate(id, status, OperationStatus.CANCELLED);
        return new OperationRecord(id, parentId, type, OperationStatus.CANCELLED, createdAt, startedAt, now,
            progress, finalCancellation, null, null, metadata, sequence);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isActive() {
        return status.isActive();
    }
}
