package com.ryuqq.operations.adapter.inmemory.registry;

import com.ryuqq.operations.core.exception.InvalidTransitionException;
import com.ryuqq.operations.core.exception.OperationNotFoundException;
import com.ryuqq.operations.core.exception.OperationNotReadyException;
import com.ryuqq.operations.core.model.CancellationOutcome;
import com.ryuqq.operations.core.model.CancellationSignal;
import com.ryuqq.operations.core.model.OperationId;
import com.ryuqq.operations.core.model.OperationMetadata;
import com.ryuqq.operations.core.model.OperationRecord;
import com.ryuqq.operations.core.model.OperationType;
import com.ryuqq.operations.core.model.ProgressSnapshot;
import com.ryuqq.operations.core.model.ResultSummary;
import com.ryuqq.operations.core.progress.ProgressAggregator;
import com.ryuqq.operations.core.query.OperationPage;
import com.ryuqq.operations.core.query.OperationQuery;
import com.ryuqq.operations.core.spi.OperationHandle;
import com.ryuqq.operations.core.spi.OperationRegistry;
import com.ryuqq.operations.core.statemachine.OperationStatus;
import com.ryuqq.operations.core.statemachine.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link OperationRegistry} SPI.
 *
 * <p>This implementation keeps every operation in a {@link ConcurrentHashMap} and serializes
 * writes per operation, so unrelated operations never contend with each other.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;OperationId, OperationEntry&gt; - one entry per operation (O(1) access)</li>
 *   <li><strong>OperationEntry.lock:</strong> ReentrantLock - serializes mutations of a single operation</li>
 *   <li><strong>OperationEntry.snapshot:</strong> volatile OperationRecord - immutable snapshot replaced under the lock</li>
 *   <li><strong>OperationEntry.signal:</strong> CancellationSignal - lock-free cancellation flag shared with the task handle</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>Writers of the same id are serialized by the entry lock</li>
 *   <li>Readers ({@code get}, {@code list}, handle cancellation checks) take no lock</li>
 *   <li>Cascade cancellation of children runs after the parent's lock is released</li>
 *   <li>Cleanup removes only terminal entries, whose snapshots never change</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Terminal records are kept until {@link #cleanup(Duration)} is called</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * OperationRegistry registry = new InMemoryOperationRegistry();
 * OperationId id = registry.create(OperationType.DATA_LOAD, OperationMetadata.builder().symbol("AAPL").build());
 *
 * OperationHandle handle = registry.markStarted(id);
 * handle.reportProgress(ProgressSnapshot.of(50.0, "Loading segment 5/10"));
 * handle.complete(ResultSummary.of(Map.of("bars", 1200)));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryOperationRegistry implements OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationRegistry.class);

    static final String RETRY_PREFIX = "retry";

    private static final Comparator<OperationRecord> NEWEST_FIRST =
        Comparator.comparing(OperationRecord::createdAt)
            .thenComparingLong(OperationRecord::sequence)
            .reversed();

    private static final Comparator<OperationRecord> OLDEST_FIRST =
        Comparator.comparing(OperationRecord::createdAt)
            .thenComparingLong(OperationRecord::sequence);

    private final ConcurrentHashMap<OperationId, OperationEntry> entries;
    private final AtomicLong sequence;
    private final Clock clock;

    /**
     * Creates a new registry using the system UTC clock.
     */
    public InMemoryOperationRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a new registry using the given clock for every timestamp.
     *
     * @param clock time source
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryOperationRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
        this.clock = clock;
    }

    @Override
    public OperationId create(OperationType type, OperationMetadata metadata) {
        return create(type, metadata, null);
    }

    @Override
    public OperationId create(OperationType type, OperationMetadata metadata, OperationId parentId) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (parentId != null && !entries.containsKey(parentId)) {
            throw new OperationNotFoundException(parentId, "Parent operation not found: " + parentId);
        }
        return register(null, type, metadata, parentId);
    }

    private OperationId register(String prefix, OperationType type, OperationMetadata metadata, OperationId parentId) {
        Instant now = clock.instant();
        while (true) {
            OperationId id = prefix == null
                ? OperationId.generate(type, now)
                : OperationId.generate(prefix, type, now);
            OperationRecord pending = OperationRecord.pending(id, parentId, type, metadata, now, sequence.incrementAndGet());
            if (entries.putIfAbsent(id, new OperationEntry(pending)) == null) {
                log.info("Operation created: id={}, type={}, parent={}", id, type, parentId);
                return id;
            }
            log.debug("Operation id collision, regenerating: {}", id);
        }
    }

    @Override
    public OperationHandle markStarted(OperationId id) {
        OperationEntry entry = require(id);
        mutate(entry, record -> record.started(clock.instant()));
        log.info("Operation started: id={}", id);
        return new InMemoryOperationHandle(this, id, entry.signal);
    }

    @Override
    public void reportProgress(OperationId id, ProgressSnapshot progress) {
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        OperationEntry entry = require(id);
        mutate(entry, record -> record.withProgress(progress));
        log.debug("Operation progress: id={}, percentage={}, step={}",
            id, progress.getPercentage(), progress.getCurrentStep());
    }

    @Override
    public void complete(OperationId id, ResultSummary resultSummary) {
        OperationEntry entry = require(id);
        mutate(entry, record -> record.completed(resultSummary, clock.instant()));
        log.info("Operation completed: id={}", id);
    }

    @Override
    public void fail(OperationId id, String errorMessage, ResultSummary partialResult) {
        OperationEntry entry = require(id);
        mutate(entry, record -> record.failed(errorMessage, partialResult, clock.instant()));
        log.error("Operation failed: id={}, error={}", id, errorMessage);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The parent's own transition happens under its lock</li>
     *   <li>Active children are then cancelled one by one with reason {@code "Parent cancelled: <reason>"}</li>
     *   <li>Cascade is recursive (grandchildren follow their parent)</li>
     * </ul>
     */
    @Override
    public CancellationOutcome requestCancellation(OperationId id, String reason) {
        OperationEntry entry = require(id);
        OperationRecord after;
        boolean first;

        entry.lock.lock();
        try {
            OperationRecord current = entry.snapshot;
            if (current.isTerminal()) {
                log.debug("Cancellation ignored, operation already finished: id={}, status={}", id, current.status());
                return CancellationOutcome.alreadyFinished(id, current.status());
            }
            Instant now = clock.instant();
            first = entry.signal.request(reason, now);
            if (current.status() == OperationStatus.PENDING) {
                after = current.cancelled(entry.signal.snapshot(), now);
            } else {
                after = current.withCancellation(entry.signal.snapshot());
            }
            entry.snapshot = after;
        } finally {
            entry.lock.unlock();
        }

        if (after.status() == OperationStatus.CANCELLED) {
            log.info("Operation cancelled before start: id={}, reason={}", id, reason);
        } else if (first) {
            log.info("Cancellation requested: id={}, reason={}", id, reason);
        }

        List<OperationId> childrenCancelled = cancelChildren(id, reason);
        return new CancellationOutcome(id, after.status(), first, false, childrenCancelled);
    }

    private List<OperationId> cancelChildren(OperationId parentId, String reason) {
        String childReason = reason == null || reason.isBlank()
            ? "Parent cancelled"
            : "Parent cancelled: " + reason;
        List<OperationId> cancelled = new ArrayList<>();
        for (OperationEntry child : entries.values()) {
            OperationRecord snapshot = child.snapshot;
            if (!parentId.equals(snapshot.parentId()) || !snapshot.isActive()) {
                continue;
            }
            try {
                CancellationOutcome outcome = requestCancellation(snapshot.id(), childReason);
                if (!outcome.alreadyFinished()) {
                    cancelled.add(snapshot.id());
                    log.info("Cascade-cancelled child operation: parent={}, child={}", parentId, snapshot.id());
                }
            } catch (OperationNotFoundException e) {
                log.debug("Child operation removed during cascade: parent={}, child={}", parentId, snapshot.id());
            }
        }
        return cancelled;
    }

    @Override
    public void acknowledgeCancellation(OperationId id) {
        OperationEntry entry = require(id);
        entry.lock.lock();
        try {
            OperationRecord current = entry.snapshot;
            StatusTransition.validate(id, current.status(), OperationStatus.CANCELLED);
            if (!entry.signal.isRequested()) {
                throw new InvalidTransitionException(id, current.status(), OperationStatus.CANCELLED,
                    "Cannot acknowledge cancellation for " + id + ": cancellation was never requested");
            }
            entry.signal.acknowledge();
            entry.snapshot = current.cancelled(entry.signal.snapshot(), clock.instant());
        } finally {
            entry.lock.unlock();
        }
        log.info("Operation cancelled: id={}, reason={}", id, entry.signal.getReason());
    }

    @Override
    public OperationRecord get(OperationId id) {
        return require(id).snapshot;
    }

    @Override
    public OperationPage list(OperationQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        List<OperationRecord> matched = entries.values().stream()
            .map(entry -> entry.snapshot)
            .filter(query::matches)
            .sorted(NEWEST_FIRST)
            .collect(Collectors.toList());

        int activeCount = (int) matched.stream().filter(OperationRecord::isActive).count();
        int from = Math.min(query.getOffset(), matched.size());
        int to = (int) Math.min((long) from + query.getLimit(), matched.size());
        return new OperationPage(matched.subList(from, to), matched.size(), activeCount);
    }

    @Override
    public Optional<ResultSummary> getResults(OperationId id) {
        OperationRecord record = require(id).snapshot;
        if (!record.isTerminal()) {
            throw new OperationNotReadyException(id, record.status());
        }
        return Optional.ofNullable(record.resultSummary());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Runs only when called; nothing is evicted in the background.</p>
     */
    @Override
    public int cleanup(Duration olderThan) {
        if (olderThan == null) {
            throw new IllegalArgumentException("olderThan cannot be null");
        }
        if (olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan cannot be negative, but was: " + olderThan);
        }
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        for (Map.Entry<OperationId, OperationEntry> e : entries.entrySet()) {
            OperationRecord snapshot = e.getValue().snapshot;
            if (snapshot.isTerminal() && snapshot.completedAt().isBefore(cutoff)
                && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} finished operations older than {}", removed, olderThan);
        }
        return removed;
    }

    @Override
    public List<OperationRecord> children(OperationId parentId) {
        require(parentId);
        return entries.values().stream()
            .map(entry -> entry.snapshot)
            .filter(record -> parentId.equals(record.parentId()))
            .sorted(OLDEST_FIRST)
            .collect(Collectors.toList());
    }

    @Override
    public ProgressSnapshot aggregatedProgress(OperationId parentId) {
        return ProgressAggregator.aggregate(children(parentId));
    }

    @Override
    public OperationId retry(OperationId id) {
        OperationRecord failed = require(id).snapshot;
        if (failed.status() != OperationStatus.FAILED) {
            throw new InvalidTransitionException(id, failed.status(), null,
                "Only FAILED operations can be retried: " + id + " is " + failed.status());
        }
        OperationId retried = register(RETRY_PREFIX, failed.type(), failed.metadata(), failed.parentId());
        log.info("Operation retried: original={}, retry={}", id, retried);
        return retried;
    }

    @Override
    public int requestCancellationForAll(String reason) {
        int requested = 0;
        for (OperationEntry entry : entries.values()) {
            OperationRecord snapshot = entry.snapshot;
            if (!snapshot.isActive()) {
                continue;
            }
            if (requestCancellation(snapshot.id(), reason).firstRequest()) {
                requested++;
            }
        }
        log.info("Global cancellation requested for {} operations, reason={}", requested, reason);
        return requested;
    }

    /**
     * Returns the number of tracked operations.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return number of entries, terminal ones included
     */
    public int size() {
        return entries.size();
    }

    private OperationEntry require(OperationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        OperationEntry entry = entries.get(id);
        if (entry == null) {
            throw new OperationNotFoundException(id);
        }
        return entry;
    }

    private void mutate(OperationEntry entry, UnaryOperator<OperationRecord> transition) {
        entry.lock.lock();
        try {
            entry.snapshot = transition.apply(entry.snapshot);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * One tracked operation: write lock, published snapshot and cancellation signal.
     */
    private static final class OperationEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private final CancellationSignal signal = new CancellationSignal();
        private volatile OperationRecord snapshot;

        OperationEntry(OperationRecord initial) {
            this.snapshot = initial;
        }
    }
}
