package com.ryuqq.operations.adapter.runner;

import com.ryuqq.operations.core.exception.InvalidTransitionException;
import com.ryuqq.operations.core.exception.OperationCancelledException;
import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationMetadata;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.spi.OperationHandle;
import com.ryuqq.operations.core.spi.OperationRegistry;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operation Runner 구현체.
 *
 * <p>작업을 워커 스레드 풀에서 실행하고, 작업 결과에 따라 Operation을 종료합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * launch() 호출
 *   ↓
 * registry.create() → PENDING (호출자에게 ID 즉시 반환)
 *   ↓ (워커 스레드)
 * registry.markStarted() → RUNNING, OperationHandle 발급
 *   ↓
 * task.execute(handle):
 *   - 정상 반환                    → complete(result)
 *   - 정상 반환 + 취소 요청됨       → acknowledgeCancellation()
 *   - OperationCancelledException → acknowledgeCancellation()
 *   - 종료 중 인터럽트              → requestCancellation() + acknowledgeCancellation()
 *   - 그 외 예외 / Error           → fail(exception message)
 * </pre>
 *
 * <p>작업이 핸들로 직접 종료한 경우 Runner는 추가 종료 처리를 하지 않습니다.
 * 시작 전에 취소된 Operation은 실행하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationRunner {

    private static final Logger log = LoggerFactory.getLogger(OperationRunner.class);

    static final String SHUTDOWN_REASON = "Runner shut down";

    private final OperationRegistry registry;
    private final OperationRunnerConfig config;
    private final ExecutorService workerExecutor;

    private volatile boolean shuttingDown;

    /**
     * 생성자.
     *
     * @param registry 레지스트리
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OperationRunner(OperationRegistry registry, OperationRunnerConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(),
            runnable -> new Thread(runnable, "operation-runner-" + threadIndex.incrementAndGet()));
    }

    /**
     * 작업 시작.
     *
     * @param type Operation 종류
     * @param metadata 메타데이터
     * @param task 작업 본문
     * @return 시작된 작업
     * @throws IllegalStateException Runner가 종료된 경우
     */
    public RunningOperation launch(OperationType type, OperationMetadata metadata, OperationTask task) {
        return launch(type, metadata, null, task);
    }

    /**
     * 하위 작업 시작.
     *
     * @param type Operation 종류
     * @param metadata 메타데이터
     * @param parentId 상위 Operation ID (null 가능)
     * @param task 작업 본문
     * @return 시작된 작업
     * @throws IllegalStateException Runner가 종료된 경우
     */
    public RunningOperation launch(OperationType type, OperationMetadata metadata, OperationId parentId,
                                   OperationTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("OperationRunner is shut down");
        }

        OperationId operationId = registry.create(type, metadata, parentId);
        LaunchedTask launched = new LaunchedTask(operationId, task);
        try {
            workerExecutor.execute(launched);
        } catch (RejectedExecutionException e) {
            registry.requestCancellation(operationId, SHUTDOWN_REASON);
            throw new IllegalStateException("OperationRunner is shut down", e);
        }
        return new RunningOperation(operationId, launched.completion);
    }

    /**
     * 워커 스레드에서 작업 실행.
     *
     * @param operationId Operation ID
     * @param task 작업 본문
     * @return 최종 스냅샷
     */
    private OperationRecord run(OperationId operationId, OperationTask task) {
        OperationHandle handle;
        try {
            handle = registry.markStarted(operationId);
        } catch (InvalidTransitionException e) {
            log.info("Operation {} not started: {}", operationId, e.getMessage());
            return registry.get(operationId);
        }

        try {
            ResultSummary result = task.execute(handle);
            finishNormally(operationId, handle, result);
        } catch (OperationCancelledException e) {
            log.info("Operation {} observed cancellation: {}", operationId, e.getMessage());
            acknowledge(operationId, handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (shuttingDown) {
                log.info("Operation {} interrupted by runner shutdown", operationId);
                registry.requestCancellation(operationId, SHUTDOWN_REASON);
                acknowledge(operationId, handle);
            } else {
                log.error("Operation {} task interrupted", operationId, e);
                failWith(operationId, handle, e);
            }
        } catch (Throwable e) {
            log.error("Operation {} task threw exception", operationId, e);
            failWith(operationId, handle, e);
        }
        return registry.get(operationId);
    }

    private void finishNormally(OperationId operationId, OperationHandle handle, ResultSummary result) {
        if (alreadyFinalized(operationId)) {
            return;
        }
        if (handle.isCancellationRequested()) {
            acknowledge(operationId, handle);
            return;
        }
        try {
            handle.complete(result);
        } catch (InvalidTransitionException e) {
            log.warn("Operation {} finalized concurrently, result discarded: {}", operationId, e.getMessage());
        }
    }

    private void acknowledge(OperationId operationId, OperationHandle handle) {
        if (alreadyFinalized(operationId)) {
            return;
        }
        if (!handle.isCancellationRequested()) {
            failWith(operationId, handle, new IllegalStateException(
                "Task aborted with cancellation although none was requested"));
            return;
        }
        try {
            handle.acknowledgeCancellation();
        } catch (InvalidTransitionException e) {
            log.warn("Operation {} finalized concurrently, acknowledgement discarded: {}",
                operationId, e.getMessage());
        }
    }

    private void failWith(OperationId operationId, OperationHandle handle, Throwable cause) {
        if (alreadyFinalized(operationId)) {
            return;
        }
        String message = cause.getMessage() != null && !cause.getMessage().isBlank()
            ? cause.getMessage()
            : cause.getClass().getSimpleName();
        try {
            handle.fail(message);
        } catch (InvalidTransitionException e) {
            log.warn("Operation {} finalized concurrently, failure discarded: {}", operationId, e.getMessage());
        }
    }

    private boolean alreadyFinalized(OperationId operationId) {
        OperationStatus status = registry.get(operationId).status();
        if (status.isTerminal()) {
            log.debug("Operation {} already finalized by task as {}", operationId, status);
            return true;
        }
        return false;
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>새 작업은 더 이상 받지 않고, 진행 중인 작업이
     * 완료되도록 shutdownTimeoutMs까지 대기합니다.</p>
     *
     * <p>제한 시간을 넘기면 워커를 인터럽트하고, 큐에서 시작하지 못한 작업은
     * "Runner shut down" 사유로 취소한 뒤 결과 Future를 완료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            return;
        }
        log.warn("OperationRunner did not terminate within {}ms, interrupting workers", config.shutdownTimeoutMs());
        shuttingDown = true;
        List<Runnable> neverStarted = workerExecutor.shutdownNow();
        for (Runnable runnable : neverStarted) {
            if (runnable instanceof LaunchedTask launched) {
                launched.cancelBeforeStart();
            }
        }
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    /**
     * 워커 큐에 들어간 작업. 시작되지 못한 채 종료되면 취소로 마무리합니다.
     */
    private final class LaunchedTask implements Runnable {
        private final OperationId operationId;
        private final OperationTask task;
        private final CompletableFuture<OperationRecord> completion = new CompletableFuture<>();

        LaunchedTask(OperationId operationId, OperationTask task) {
            this.operationId = operationId;
            this.task = task;
        }

        @Override
        public void run() {
            try {
                completion.complete(OperationRunner.this.run(operationId, task));
            } catch (RuntimeException e) {
                log.error("Operation {} could not be finalized", operationId, e);
                completion.completeExceptionally(e);
            }
        }

        void cancelBeforeStart() {
            try {
                registry.requestCancellation(operationId, SHUTDOWN_REASON);
                completion.complete(registry.get(operationId));
                log.info("Operation {} cancelled: runner shut down before start", operationId);
            } catch (RuntimeException e) {
                log.error("Operation {} could not be cancelled on shutdown", operationId, e);
                completion.completeExceptionally(e);
            }
        }
    }
}
