package com.purchasingpower.researchflow.graph.engine;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.purchasingpower.researchflow.exception.ErrorType;
import com.purchasingpower.researchflow.exception.GraphException;
import com.purchasingpower.researchflow.exception.NodeInvocationException;
import com.purchasingpower.researchflow.exception.ResumeMismatchException;
import com.purchasingpower.researchflow.exception.RunConflictException;
import com.purchasingpower.researchflow.exception.StepLimitExceededException;
import com.purchasingpower.researchflow.exception.StoreUnavailableException;
import com.purchasingpower.researchflow.graph.GraphDefinition;
import com.purchasingpower.researchflow.graph.Node;
import com.purchasingpower.researchflow.graph.NodeContext;
import com.purchasingpower.researchflow.graph.NodeResult;
import com.purchasingpower.researchflow.graph.StateGraph;
import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointError;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointStore;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.graph.state.StateCodec;
import com.purchasingpower.researchflow.model.RunStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Drives the superstep loop of a {@link GraphDefinition} for one thread at a time.
 *
 * <p>Each superstep invokes one node, merges its partial update through the graph's
 * reducers, persists a checkpoint, and routes to the next node. A node may instead
 * suspend: the checkpoint then records the interrupt and {@link #resume} later
 * re-invokes that same node with the caller's decision.
 *
 * <p><b>Concurrency:</b> supersteps of one thread never overlap. Checkpoint
 * read-modify-write is serialized per thread id with a striped lock, so unrelated
 * threads do not block each other. The checkpoint, not this object, is
 * authoritative: a new engine over the same store resumes where an old one stopped.
 *
 * <p><b>Errors:</b> node, reducer and routing failures end the invocation with
 * {@link RunResult.Failed} after recording the error next to the last good state.
 * Nothing is retried. A store failure aborts the superstep and leaves the previous
 * checkpoint untouched.
 */
@Slf4j
public class GraphEngine {

    public static final int DEFAULT_MAX_SUPERSTEPS = 25;

    private static final int LOCK_STRIPES = 64;

    private final CheckpointStore store;
    private final StateCodec stateCodec;
    private final StepListener listener;
    private final int maxSupersteps;

    private final Striped<Lock> threadLocks = Striped.lock(LOCK_STRIPES);
    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();
    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    public GraphEngine(CheckpointStore store, StateCodec stateCodec) {
        this(store, stateCodec, StepListener.NONE, DEFAULT_MAX_SUPERSTEPS);
    }

    public GraphEngine(CheckpointStore store, StateCodec stateCodec, StepListener listener, int maxSupersteps) {
        Preconditions.checkArgument(maxSupersteps >= 1, "maxSupersteps must be positive: %s", maxSupersteps);
        this.store = Preconditions.checkNotNull(store, "store");
        this.stateCodec = Preconditions.checkNotNull(stateCodec, "stateCodec");
        this.listener = listener != null ? listener : StepListener.NONE;
        this.maxSupersteps = maxSupersteps;
    }

    /**
     * Starts a run at the graph's entry node.
     *
     * <p>The input is merged through the reducers into the thread's current state (or
     * into a fresh state for a new thread). A thread that completed or failed before
     * starts a new run on top of its last state.
     *
     * @throws RunConflictException    if the thread is suspended and must be resumed instead
     * @throws IllegalArgumentException if the input cannot be merged into the state
     */
    public RunResult run(GraphDefinition graph, String threadId, Map<String, Object> input) {
        Lock lock = threadLocks.get(threadId);
        lock.lock();
        activeRuns.add(threadId);
        try {
            Optional<Checkpoint> existing;
            try {
                existing = store.get(threadId);
            } catch (RuntimeException e) {
                return storeFailure(threadId, 0L, null, e);
            }

            Checkpoint base = existing.orElse(null);
            if (base != null && base.getStatus() == RunStatus.SUSPENDED) {
                throw new RunConflictException(threadId,
                        "suspended at node '" + base.getNextNode() + "', resume it instead");
            }
            if (base != null && base.getStatus() == RunStatus.RUNNING) {
                log.warn("⚠️ Thread {} has an unfinished run stopped before node '{}' - starting a new run",
                        threadId, base.getNextNode());
            }

            SessionState state = base != null ? base.getState() : graph.initialState();
            long step = base != null ? base.getStepSequence() : 0L;
            String lastCompleted = base != null ? base.getLastCompletedNode() : null;

            log.info("🚀 Starting run: thread={}, entry={}, step={}", threadId, graph.getEntryNode(), step);

            SessionState merged;
            try {
                merged = graph.merge(state, stateCodec.normalize(input));
            } catch (GraphException e) {
                return fail(threadId, step, state, lastCompleted, null, e);
            }

            return execute(graph, threadId, merged, step, graph.getEntryNode(), lastCompleted, null, null);

        } finally {
            cancelRequests.remove(threadId);
            activeRuns.remove(threadId);
            lock.unlock();
        }
    }

    /**
     * Re-enters the node recorded in the thread's pending interrupt, passing the
     * decision alongside the unchanged state.
     *
     * @throws ResumeMismatchException if the thread has no pending interrupt, or the
     *                                 suspended node is not part of {@code graph}
     */
    public RunResult resume(GraphDefinition graph, String threadId, Map<String, Object> decision) {
        Lock lock = threadLocks.get(threadId);
        lock.lock();
        activeRuns.add(threadId);
        try {
            Checkpoint checkpoint;
            try {
                checkpoint = store.get(threadId).orElse(null);
            } catch (RuntimeException e) {
                return storeFailure(threadId, 0L, null, e);
            }

            if (checkpoint == null) {
                throw new ResumeMismatchException(threadId, "no checkpoint exists");
            }
            InterruptPayload interrupt = checkpoint.getPendingInterrupt();
            if (interrupt == null) {
                throw new ResumeMismatchException(threadId,
                        "no pending interrupt (status " + checkpoint.getStatus() + ")");
            }
            if (!graph.hasNode(interrupt.getNode())) {
                throw new ResumeMismatchException(threadId,
                        "suspended node '" + interrupt.getNode() + "' does not exist in the graph");
            }

            // a cancelled run continues normally: the node did not ask for a decision
            Map<String, Object> injected = interrupt.isCancellation()
                    ? null
                    : stateCodec.normalize(decision != null ? decision : Map.of());

            log.info("▶️ Resuming run: thread={}, node={}, reason={}",
                    threadId, interrupt.getNode(), interrupt.getReason());

            return execute(graph, threadId, checkpoint.getState(), checkpoint.getStepSequence(),
                    interrupt.getNode(), checkpoint.getLastCompletedNode(), injected, interrupt);

        } finally {
            cancelRequests.remove(threadId);
            activeRuns.remove(threadId);
            lock.unlock();
        }
    }

    /**
     * Requests cancellation of an active run. It takes effect at the next checkpoint
     * boundary: the thread is left suspended before the node that would have run next.
     *
     * @return false if no run is active for the thread
     */
    public boolean cancel(String threadId) {
        if (!activeRuns.contains(threadId)) {
            return false;
        }
        cancelRequests.add(threadId);
        log.info("🛑 Cancellation requested: thread={}", threadId);
        return true;
    }

    // ================================================================
    // SUPERSTEP LOOP
    // ================================================================

    private RunResult execute(GraphDefinition graph, String threadId, SessionState state, long step,
                              String startNode, String lastCompleted, Map<String, Object> decision,
                              InterruptPayload resumedFrom) {
        String current = startNode;
        int executed = 0;

        while (true) {
            if (executed >= maxSupersteps) {
                return fail(threadId, step, state, lastCompleted, current,
                        new StepLimitExceededException(threadId, maxSupersteps));
            }

            String nodeName = current;
            Node node = graph.node(nodeName)
                    .orElseThrow(() -> new IllegalStateException("Node '" + nodeName + "' missing from graph"));

            NodeContext context = NodeContext.builder()
                    .threadId(threadId)
                    .nodeName(nodeName)
                    .stepSequence(step)
                    .resumedFrom(resumedFrom)
                    .decision(decision)
                    .build();

            log.info("⚙️ Executing node: thread={}, node={}, step={}", threadId, nodeName, step + 1);

            NodeResult result;
            try {
                result = node.execute(state, context);
            } catch (GraphException e) {
                return fail(threadId, step, state, lastCompleted, nodeName, e);
            } catch (RuntimeException e) {
                return fail(threadId, step, state, lastCompleted, nodeName, new NodeInvocationException(nodeName, e));
            }
            if (result == null) {
                return fail(threadId, step, state, lastCompleted, nodeName,
                        new NodeInvocationException(nodeName, "returned no result"));
            }

            if (result instanceof NodeResult.Suspend suspend) {
                return suspend(threadId, step, state, lastCompleted, nodeName, suspend);
            }

            NodeResult.Update update = (NodeResult.Update) result;
            SessionState merged;
            try {
                merged = graph.merge(state, stateCodec.normalize(update.fields()));
            } catch (GraphException e) {
                return fail(threadId, step, state, lastCompleted, nodeName, e);
            } catch (RuntimeException e) {
                return fail(threadId, step, state, lastCompleted, nodeName,
                        new NodeInvocationException(nodeName, "update could not be merged: " + e.getMessage()));
            }
            log.debug("Merged update: thread={}, node={}, fields={}", threadId, nodeName, update.fields().keySet());

            String next;
            try {
                next = graph.next(nodeName, merged);
            } catch (GraphException e) {
                return fail(threadId, step, merged, nodeName, nodeName, e);
            } catch (RuntimeException e) {
                return fail(threadId, step, merged, nodeName, nodeName, new GraphException(
                        ErrorType.UNKNOWN_ROUTING_LABEL, "Router of node '" + nodeName + "' failed: " + e.getMessage(), e));
            }
            log.debug("Routed: thread={}, {} → {}", threadId, nodeName, next);

            Checkpoint.CheckpointBuilder builder = Checkpoint.builder()
                    .threadId(threadId)
                    .stepSequence(step + 1)
                    .state(merged)
                    .lastCompletedNode(nodeName);

            InterruptPayload cancellation = null;
            if (StateGraph.END.equals(next)) {
                builder.status(RunStatus.COMPLETED);
            } else if (cancelRequests.remove(threadId)) {
                cancellation = InterruptPayload.builder()
                        .node(next)
                        .reason(InterruptPayload.REASON_CANCELLED)
                        .data(Map.of("message", "Run cancelled before node '" + next + "'"))
                        .build();
                builder.status(RunStatus.SUSPENDED).nextNode(next).pendingInterrupt(cancellation);
            } else {
                builder.status(RunStatus.RUNNING).nextNode(next);
            }

            Checkpoint checkpoint = builder.build();
            try {
                store.put(threadId, checkpoint);
            } catch (RuntimeException e) {
                return storeFailure(threadId, step, lastCompleted, e);
            }
            publish(checkpoint, nodeName);

            step = checkpoint.getStepSequence();
            executed++;
            decision = null;
            resumedFrom = null;

            if (checkpoint.getStatus() == RunStatus.COMPLETED) {
                log.info("✅ Run completed: thread={}, step={}, last node={}", threadId, step, nodeName);
                return new RunResult.Completed(threadId, step, merged);
            }
            if (cancellation != null) {
                log.info("🛑 Run cancelled: thread={}, step={}, resumable at node={}", threadId, step, next);
                return new RunResult.Suspended(threadId, step, cancellation, merged);
            }

            state = merged;
            lastCompleted = nodeName;
            current = next;
        }
    }

    private RunResult suspend(String threadId, long step, SessionState state, String lastCompleted,
                              String nodeName, NodeResult.Suspend suspend) {
        InterruptPayload interrupt = InterruptPayload.builder()
                .node(nodeName)
                .reason(suspend.reason())
                .data(stateCodec.normalize(suspend.data()))
                .build();

        Checkpoint checkpoint = Checkpoint.builder()
                .threadId(threadId)
                .stepSequence(step + 1)
                .state(state)
                .status(RunStatus.SUSPENDED)
                .lastCompletedNode(lastCompleted)
                .nextNode(nodeName)
                .pendingInterrupt(interrupt)
                .build();
        try {
            store.put(threadId, checkpoint);
        } catch (RuntimeException e) {
            return storeFailure(threadId, step, lastCompleted, e);
        }
        publish(checkpoint, nodeName);

        log.info("⏸️ Run suspended: thread={}, node={}, reason={}", threadId, nodeName, suspend.reason());
        return new RunResult.Suspended(threadId, checkpoint.getStepSequence(), interrupt, state);
    }

    /**
     * Records the error next to the last good state. If even that write fails the
     * previous checkpoint stays as it was.
     */
    private RunResult fail(String threadId, long step, SessionState lastGoodState, String lastCompleted,
                           String failedNode, GraphException error) {
        log.error("❌ Run failed: thread={}, node={}, type={}: {}",
                threadId, failedNode, error.getErrorType(), error.getMessage(), error);

        Checkpoint checkpoint = Checkpoint.builder()
                .threadId(threadId)
                .stepSequence(step + 1)
                .state(lastGoodState)
                .status(RunStatus.FAILED)
                .lastCompletedNode(lastCompleted)
                .error(CheckpointError.builder()
                        .type(error.getErrorType())
                        .message(error.getMessage())
                        .node(failedNode)
                        .build())
                .build();

        long persistedStep = step;
        try {
            store.put(threadId, checkpoint);
            persistedStep = checkpoint.getStepSequence();
            publish(checkpoint, failedNode);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of thread {}", threadId, e);
        }

        return new RunResult.Failed(threadId, persistedStep, error.getErrorType(), error.getMessage(), lastCompleted);
    }

    private RunResult storeFailure(String threadId, long step, String lastCompleted, RuntimeException e) {
        StoreUnavailableException error = e instanceof StoreUnavailableException
                ? (StoreUnavailableException) e
                : new StoreUnavailableException(threadId, e);
        log.error("❌ Superstep aborted, checkpoint store unavailable: thread={}", threadId, error);
        return new RunResult.Failed(threadId, step, ErrorType.STORE_UNAVAILABLE, error.getMessage(), lastCompleted);
    }

    private void publish(Checkpoint checkpoint, String node) {
        try {
            listener.onStep(StepEvent.builder()
                    .threadId(checkpoint.getThreadId())
                    .stepSequence(checkpoint.getStepSequence())
                    .status(checkpoint.getStatus())
                    .node(node)
                    .nextNode(checkpoint.getNextNode())
                    .state(checkpoint.getState())
                    .interrupt(checkpoint.getPendingInterrupt())
                    .error(checkpoint.getError())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Step listener failed for thread {}", checkpoint.getThreadId(), e);
        }
    }
}
