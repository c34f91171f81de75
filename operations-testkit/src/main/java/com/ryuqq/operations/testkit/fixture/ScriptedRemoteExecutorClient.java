package com.ryuqq.operations.testkit.fixture;

import com.ryuqq.operations.core.executor.RemoteExecutorClient;
import com.ryuqq.operations.core.executor.RemoteStatus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RemoteExecutorClient} that replays scripted responses per remote reference.
 *
 * <p>Each reference has a queue of responses (a {@link RemoteStatus} or an exception to throw).
 * Responses are consumed in order; the last one repeats for every later fetch.
 * A reference with no script throws {@link IllegalStateException}.</p>
 *
 * <pre>
 * ScriptedRemoteExecutorClient client = new ScriptedRemoteExecutorClient()
 *     .script("worker-1", RemoteStatus.running(ProgressSnapshot.of(30.0, "epoch 3")),
 *                         RemoteStatus.completed(ResultSummary.of(Map.of("accuracy", 0.91))));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedRemoteExecutorClient implements RemoteExecutorClient {

    private final Map<String, Deque<Object>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private final List<CancelRequest> cancelRequests = new CopyOnWriteArrayList<>();

    /**
     * Appends status responses for a reference.
     *
     * @param remoteReference remote reference
     * @param statuses responses in the order they should be returned
     * @return this
     */
    public ScriptedRemoteExecutorClient script(String remoteReference, RemoteStatus... statuses) {
        Deque<Object> queue = queueOf(remoteReference);
        synchronized (queue) {
            for (RemoteStatus status : statuses) {
                queue.addLast(status);
            }
        }
        return this;
    }

    /**
     * Appends a failing response for a reference.
     *
     * @param remoteReference remote reference
     * @param failure exception thrown by the matching fetch
     * @return this
     */
    public ScriptedRemoteExecutorClient fail(String remoteReference, RuntimeException failure) {
        Deque<Object> queue = queueOf(remoteReference);
        synchronized (queue) {
            queue.addLast(failure);
        }
        return this;
    }

    @Override
    public RemoteStatus fetchStatus(String remoteReference) {
        fetchCounts.computeIfAbsent(remoteReference, key -> new AtomicInteger()).incrementAndGet();
        Deque<Object> queue = scripts.get(remoteReference);
        if (queue == null) {
            throw new IllegalStateException("No script for remote reference: " + remoteReference);
        }
        Object next;
        synchronized (queue) {
            next = queue.size() > 1 ? queue.pollFirst() : queue.peekFirst();
        }
        if (next == null) {
            throw new IllegalStateException("Script exhausted for remote reference: " + remoteReference);
        }
        if (next instanceof RuntimeException failure) {
            throw failure;
        }
        return (RemoteStatus) next;
    }

    @Override
    public void cancel(String remoteReference, String reason) {
        cancelRequests.add(new CancelRequest(remoteReference, reason));
    }

    public int fetchCount(String remoteReference) {
        AtomicInteger count = fetchCounts.get(remoteReference);
        return count == null ? 0 : count.get();
    }

    public List<CancelRequest> cancelRequests() {
        return List.copyOf(cancelRequests);
    }

    private Deque<Object> queueOf(String remoteReference) {
        if (remoteReference == null) {
            throw new IllegalArgumentException("remoteReference cannot be null");
        }
        return scripts.computeIfAbsent(remoteReference, key -> new ArrayDeque<>());
    }

    /**
     * A cancellation forwarded to the remote executor.
     *
     * @param remoteReference remote reference
     * @param reason cancellation reason (nullable)
     */
    public record CancelRequest(String remoteReference, String reason) {
    }
}
