package com.ryuqq.operations.adapter.runner;

import com.ryuqq.operations.core.exception.ConnectivityException;
import com.ryuqq.operations.core.exception.OperationNotFoundException;
import com.ryuqq.operations.core.executor.RemoteExecutorClient;
import com.ryuqq.operations.core.executor.RemoteStatus;
import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.spi.OperationRegistry;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * LiveStatusBridge 컴포넌트.
 *
 * <p>외부 실행기에서 돌아가는 작업의 상태를 주기적으로 조회해 로컬 레지스트리에 반영합니다.</p>
 *
 * <p><strong>폴링 시나리오:</strong></p>
 * <pre>
 * 1. 작업을 원격 워커에 제출 → remoteReference 수신
 * 2. register(operationId, remoteReference)
 * 3. 매 주기마다 fetchStatus(remoteReference) (레지스트리 잠금 밖에서 호출)
 * 4. 원격 상태 반영:
 *    - RUNNING   → markStarted (로컬이 PENDING이면) + reportProgress
 *    - COMPLETED → complete, 추적 해제
 *    - FAILED    → fail, 추적 해제
 *    - CANCELLED → requestCancellation + acknowledgeCancellation, 추적 해제
 * 5. 조회 실패가 maxConsecutiveFailures회 연속되면 연결 오류 메시지로 fail, 추적 해제
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>로컬에서 요청된 취소를 원격 실행기에 한 번 전달</li>
 *   <li>로컬 기록이 이미 종료되었거나 사라졌으면 추적 해제</li>
 *   <li>개별 Operation 처리 중 예외가 나도 다른 Operation 처리는 계속 진행</li>
 * </ul>
 *
 * <p>레지스트리에는 {@link OperationRegistry}의 공개 메서드로만 접근합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LiveStatusBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveStatusBridge.class);

    private static final long CLOSE_TIMEOUT_MS = 5000;
    private static final String REMOTE_CANCEL_REASON = "Cancelled by remote executor";
    private static final String REMOTE_FAILURE_MESSAGE = "Remote operation failed";

    private final OperationRegistry registry;
    private final RemoteExecutorClient client;
    private final LiveStatusBridgeConfig config;
    private final Map<OperationId, TrackedOperation> tracked;

    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param registry 로컬 레지스트리
     * @param client 원격 실행기 클라이언트
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LiveStatusBridge(OperationRegistry registry, RemoteExecutorClient client, LiveStatusBridgeConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.client = client;
        this.config = config;
        this.tracked = new ConcurrentHashMap<>();
    }

    /**
     * 원격 실행 중인 Operation 추적 시작.
     *
     * <p>이미 추적 중이면 새 remoteReference로 교체하고 실패 횟수를 초기화합니다.</p>
     *
     * @param operationId 로컬 Operation ID
     * @param remoteReference 원격 실행기에서의 작업 식별자
     * @throws IllegalArgumentException 인자가 null이거나 remoteReference가 빈 문자열인 경우
     */
    public void register(OperationId operationId, String remoteReference) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (remoteReference == null || remoteReference.isBlank()) {
            throw new IllegalArgumentException("remoteReference cannot be null or blank");
        }
        tracked.put(operationId, new TrackedOperation(remoteReference));
        log.info("LiveStatusBridge tracking {} (ref: {})", operationId, remoteReference);
    }

    /**
     * 추적 중단.
     *
     * @param operationId 로컬 Operation ID
     * @return 추적 중이었으면 true
     */
    public boolean unregister(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        boolean removed = tracked.remove(operationId) != null;
        if (removed) {
            log.info("LiveStatusBridge stopped tracking {}", operationId);
        }
        return removed;
    }

    public Set<OperationId> trackedOperations() {
        return Set.copyOf(tracked.keySet());
    }

    public boolean isTracking(OperationId operationId) {
        return tracked.containsKey(operationId);
    }

    /**
     * 추적 중인 모든 Operation을 한 번 폴링.
     *
     * <p>스케줄러가 주기적으로 호출하며, 테스트에서 직접 호출할 수도 있습니다.
     * 동시에 두 번 실행되지 않습니다.</p>
     *
     * @return 이번 폴링에서 추적 해제된 Operation 수
     */
    public synchronized int pollOnce() {
        List<Map.Entry<OperationId, TrackedOperation>> snapshot = new ArrayList<>(tracked.entrySet());
        int pruned = 0;
        for (Map.Entry<OperationId, TrackedOperation> entry : snapshot) {
            OperationId operationId = entry.getKey();
            try {
                if (pollOperation(operationId, entry.getValue())) {
                    pruned++;
                }
            } catch (Exception e) {
                log.error("LiveStatusBridge failed to sync {}", operationId, e);
            }
        }
        log.debug("LiveStatusBridge poll completed: {} tracked, {} pruned", snapshot.size(), pruned);
        return pruned;
    }

    /**
     * 개별 Operation 동기화.
     *
     * @return 추적 해제했으면 true
     */
    private boolean pollOperation(OperationId operationId, TrackedOperation operation) {
        OperationRecord local;
        try {
            local = registry.get(operationId);
        } catch (OperationNotFoundException e) {
            log.info("LiveStatusBridge pruning {}: no longer in registry", operationId);
            return prune(operationId, operation);
        }
        if (local.isTerminal()) {
            log.info("LiveStatusBridge pruning {}: already {}", operationId, local.status());
            return prune(operationId, operation);
        }

        RemoteStatus remote;
        try {
            remote = client.fetchStatus(operation.remoteReference);
        } catch (RuntimeException e) {
            operation.consecutiveFailures++;
            log.warn("LiveStatusBridge failed to fetch status for {} ({}/{}): {}",
                operationId, operation.consecutiveFailures, config.maxConsecutiveFailures(), e.getMessage());
            if (operation.consecutiveFailures >= config.maxConsecutiveFailures()) {
                prune(operationId, operation);
                failForConnectivity(operationId, local, operation, e);
                return true;
            }
            return false;
        }
        operation.consecutiveFailures = 0;
        if (remote == null) {
            log.warn("LiveStatusBridge received no status for {}", operationId);
            return false;
        }

        forwardCancellation(operationId, local, remote, operation);
        return apply(operationId, local, remote, operation);
    }

    private boolean apply(OperationId operationId, OperationRecord local, RemoteStatus remote, TrackedOperation operation) {
        switch (remote.status()) {
            case PENDING:
                return false;
            case RUNNING:
                ensureStarted(operationId, local);
                if (remote.progress() != null) {
                    registry.reportProgress(operationId, remote.progress());
                }
                return false;
            case COMPLETED:
                ensureStarted(operationId, local);
                prune(operationId, operation);
                registry.complete(operationId, remote.resultSummary());
                log.info("LiveStatusBridge completed {} from remote status", operationId);
                return true;
            case FAILED:
                ensureStarted(operationId, local);
                prune(operationId, operation);
                String message = remote.errorMessage() == null || remote.errorMessage().isBlank()
                    ? REMOTE_FAILURE_MESSAGE
                    : remote.errorMessage();
                registry.fail(operationId, message, remote.resultSummary());
                log.info("LiveStatusBridge failed {} from remote status: {}", operationId, message);
                return true;
            case CANCELLED:
                prune(operationId, operation);
                String reason = local.cancellation().reason() != null
                    ? local.cancellation().reason()
                    : REMOTE_CANCEL_REASON;
                if (registry.requestCancellation(operationId, reason).isAwaitingAcknowledgement()) {
                    registry.acknowledgeCancellation(operationId);
                }
                log.info("LiveStatusBridge cancelled {} from remote status", operationId);
                return true;
            default:
                throw new IllegalStateException("Unknown remote status: " + remote.status());
        }
    }

    private void ensureStarted(OperationId operationId, OperationRecord local) {
        if (local.status() == OperationStatus.PENDING) {
            registry.markStarted(operationId);
        }
    }

    private void forwardCancellation(OperationId operationId, OperationRecord local, RemoteStatus remote,
                                     TrackedOperation operation) {
        if (!local.cancellation().requested() || !remote.status().isActive() || operation.cancelForwarded) {
            return;
        }
        try {
            client.cancel(operation.remoteReference, local.cancellation().reason());
        } catch (RuntimeException e) {
            // 다음 폴링에서 다시 전달
            log.warn("LiveStatusBridge failed to forward cancellation of {} (ref: {}): {}",
                operationId, operation.remoteReference, e.getMessage());
            return;
        }
        operation.cancelForwarded = true;
        log.info("LiveStatusBridge forwarded cancellation of {} to remote executor (ref: {})",
            operationId, operation.remoteReference);
    }

    private void failForConnectivity(OperationId operationId, OperationRecord local, TrackedOperation operation,
                                     RuntimeException cause) {
        ConnectivityException connectivity = new ConnectivityException(
            operationId, operation.remoteReference, operation.consecutiveFailures, cause);
        ensureStarted(operationId, local);
        registry.fail(operationId, connectivity.getMessage());
        log.error("LiveStatusBridge marked {} as FAILED", operationId, connectivity);
    }

    private boolean prune(OperationId operationId, TrackedOperation operation) {
        return tracked.remove(operationId, operation);
    }

    /**
     * 주기적 폴링 시작.
     *
     * <p>이미 실행 중이면 아무것도 하지 않습니다.</p>
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "live-status-bridge");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::safePoll,
            config.initialDelayMs(), config.pollIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("LiveStatusBridge started: interval={}ms", config.pollIntervalMs());
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    /**
     * 주기적 폴링 중단.
     *
     * <p>진행 중인 폴링이 끝날 때까지 잠시 기다립니다. 추적 목록은 유지됩니다.</p>
     */
    @Override
    public void close() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = scheduler;
            scheduler = null;
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("LiveStatusBridge stopped");
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) {
            // 예외가 전파되면 이후 스케줄이 취소됨
            log.error("LiveStatusBridge poll failed", e);
        }
    }

    /**
     * 추적 상태. pollOnce 안에서만 변경됩니다.
     */
    private static final class TrackedOperation {
        private final String remoteReference;
        private int consecutiveFailures;
        private boolean cancelForwarded;

        TrackedOperation(String remoteReference) {
            this.remoteReference = remoteReference;
        }
    }
}
