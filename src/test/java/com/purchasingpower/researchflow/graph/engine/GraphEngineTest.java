package com.purchasingpower.researchflow.graph.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.researchflow.exception.ErrorType;
import com.purchasingpower.researchflow.exception.ResumeMismatchException;
import com.purchasingpower.researchflow.exception.RunConflictException;
import com.purchasingpower.researchflow.graph.GraphDefinition;
import com.purchasingpower.researchflow.graph.NodeResult;
import com.purchasingpower.researchflow.graph.StateGraph;
import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointStore;
import com.purchasingpower.researchflow.graph.checkpoint.InMemoryCheckpointStore;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.graph.state.Reducers;
import com.purchasingpower.researchflow.graph.state.SessionState;
import com.purchasingpower.researchflow.graph.state.StateCodec;
import com.purchasingpower.researchflow.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphEngineTest {

    private static final String THREAD = "thread-1";

    private final StateCodec codec = new StateCodec(new ObjectMapper());

    private InMemoryCheckpointStore store;
    private List<StepEvent> events;
    private GraphEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore();
        events = new CopyOnWriteArrayList<>();
        engine = new GraphEngine(store, codec, events::add, 10);
    }

    private static StateGraph withLog() {
        return new StateGraph()
                .reducer("log", Reducers.appendSequence())
                .reducer("flag", Reducers.overwrite(false));
    }

    private static NodeResult log(String entry) {
        return NodeResult.update(Map.of("log", List.of(entry)));
    }

    private static GraphDefinition linearGraph() {
        return withLog()
                .addNode("a", (state, context) -> log("a"))
                .addNode("b", (state, context) -> log("b"))
                .addEdge(StateGraph.START, "a")
                .addEdge("a", "b")
                .addEdge("b", StateGraph.END)
                .compile();
    }

    /**
     * ask suspends until a decision arrives, then records it; done runs afterwards.
     */
    private static GraphDefinition approvalGraph() {
        return withLog()
                .addNode("ask", (state, context) -> {
                    if (!context.isResuming()) {
                        return NodeResult.suspend("approval_request", Map.of("topic", "elections"));
                    }
                    Object approved = context.getDecision().orElseThrow().get("approved");
                    return NodeResult.update(Map.of("log", List.of("decision:" + approved), "flag", approved));
                })
                .addNode("done", (state, context) -> log("done"))
                .addEdge(StateGraph.START, "ask")
                .addEdge("ask", "done")
                .addEdge("done", StateGraph.END)
                .compile();
    }

    @Test
    @DisplayName("runs to END and persists the final state as COMPLETED")
    void runsToCompletion() {
        // When
        RunResult result = engine.run(linearGraph(), THREAD, Map.of("log", List.of("start")));

        // Then
        assertThat(result).isInstanceOf(RunResult.Completed.class);
        RunResult.Completed completed = (RunResult.Completed) result;
        assertThat(completed.finalState().<List<String>>value("log")).contains(List.of("start", "a", "b"));
        assertThat(completed.stepSequence()).isEqualTo(2);

        Checkpoint checkpoint = store.get(THREAD).orElseThrow();
        assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(checkpoint.getStepSequence()).isEqualTo(2);
        assertThat(checkpoint.getLastCompletedNode()).isEqualTo("b");
        assertThat(checkpoint.hasPendingInterrupt()).isFalse();
        assertThat(checkpoint.getState()).isEqualTo(completed.finalState());
    }

    @Test
    @DisplayName("checkpoint step numbers strictly increase across run and resume")
    void stepsStrictlyIncrease() {
        // Given
        GraphDefinition graph = approvalGraph();

        // When
        engine.run(graph, THREAD, Map.of());
        engine.resume(graph, THREAD, Map.of("approved", true));

        // Then
        assertThat(events).extracting(StepEvent::getStepSequence).containsExactly(1L, 2L, 3L);
        assertThat(events).extracting(StepEvent::getStatus)
                .containsExactly(RunStatus.SUSPENDED, RunStatus.RUNNING, RunStatus.COMPLETED);
    }

    @Test
    @DisplayName("suspends without merging, then resume re-enters the node with the decision")
    void suspendAndResume() {
        // Given
        GraphDefinition graph = approvalGraph();

        // When
        RunResult first = engine.run(graph, THREAD, Map.of("log", List.of("start")));

        // Then
        assertThat(first).isInstanceOf(RunResult.Suspended.class);
        InterruptPayload interrupt = ((RunResult.Suspended) first).interrupt();
        assertThat(interrupt.getNode()).isEqualTo("ask");
        assertThat(interrupt.getReason()).isEqualTo("approval_request");
        assertThat(interrupt.getData()).containsEntry("topic", "elections");

        Checkpoint suspended = store.get(THREAD).orElseThrow();
        assertThat(suspended.getStatus()).isEqualTo(RunStatus.SUSPENDED);
        assertThat(suspended.getPendingInterrupt()).isEqualTo(interrupt);
        assertThat(suspended.getState().<List<String>>value("log")).contains(List.of("start"));

        // When
        RunResult second = engine.resume(graph, THREAD, Map.of("approved", true));

        // Then
        assertThat(second).isInstanceOf(RunResult.Completed.class);
        SessionState finalState = ((RunResult.Completed) second).finalState();
        assertThat(finalState.<List<String>>value("log")).contains(List.of("start", "decision:true", "done"));
        assertThat(finalState.<Boolean>value("flag")).contains(true);
        assertThat(store.get(THREAD).orElseThrow().hasPendingInterrupt()).isFalse();
    }

    @Test
    @DisplayName("resume without a pending interrupt fails with ResumeMismatch and leaves the checkpoint unchanged")
    void resumeWithoutInterrupt() {
        // Given
        GraphDefinition graph = linearGraph();
        engine.run(graph, THREAD, Map.of());
        Checkpoint before = store.get(THREAD).orElseThrow();

        // When / Then
        assertThatThrownBy(() -> engine.resume(graph, THREAD, Map.of("approved", true)))
                .isInstanceOf(ResumeMismatchException.class);
        assertThat(store.get(THREAD)).contains(before);

        assertThatThrownBy(() -> engine.resume(graph, "unknown-thread", Map.of()))
                .isInstanceOf(ResumeMismatchException.class);
        assertThat(store.get("unknown-thread")).isEmpty();
    }

    @Test
    @DisplayName("resume fails with ResumeMismatch when the suspended node is gone from the graph")
    void resumeIntoMissingNode() {
        // Given
        engine.run(approvalGraph(), THREAD, Map.of());
        Checkpoint before = store.get(THREAD).orElseThrow();

        // When / Then
        assertThatThrownBy(() -> engine.resume(linearGraph(), THREAD, Map.of("approved", true)))
                .isInstanceOf(ResumeMismatchException.class)
                .hasMessageContaining("ask");
        assertThat(store.get(THREAD)).contains(before);
    }

    @Test
    @DisplayName("a new engine over the same store resumes a run suspended by another")
    void resumeAfterRestart() {
        // Given
        GraphDefinition graph = approvalGraph();
        engine.run(graph, THREAD, Map.of());

        // When
        GraphEngine restarted = new GraphEngine(store, codec);
        RunResult result = restarted.resume(graph, THREAD, Map.of("approved", false));

        // Then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(((RunResult.Completed) result).finalState().<List<String>>value("log"))
                .contains(List.of("decision:false", "done"));
    }

    @Test
    @DisplayName("run on a suspended thread raises RunConflict")
    void runOnSuspendedThread() {
        // Given
        GraphDefinition graph = approvalGraph();
        engine.run(graph, THREAD, Map.of());
        Checkpoint before = store.get(THREAD).orElseThrow();

        // When / Then
        assertThatThrownBy(() -> engine.run(graph, THREAD, Map.of()))
                .isInstanceOf(RunConflictException.class);
        assertThat(store.get(THREAD)).contains(before);
    }

    @Test
    @DisplayName("run on a completed thread continues from its last state")
    void rerunCompletedThread() {
        // Given
        GraphDefinition graph = linearGraph();
        engine.run(graph, THREAD, Map.of("log", List.of("first")));

        // When
        RunResult result = engine.run(graph, THREAD, Map.of("log", List.of("second")));

        // Then
        assertThat(result.stepSequence()).isEqualTo(4);
        assertThat(((RunResult.Completed) result).finalState().<List<String>>value("log"))
                .contains(List.of("first", "a", "b", "second", "a", "b"));
    }

    @Test
    @DisplayName("a throwing node fails the run and keeps the last good state")
    void nodeFailure() {
        // Given
        GraphDefinition graph = withLog()
                .addNode("a", (state, context) -> log("a"))
                .addNode("b", (state, context) -> {
                    throw new IllegalStateException("boom");
                })
                .addEdge(StateGraph.START, "a")
                .addEdge("a", "b")
                .addEdge("b", StateGraph.END)
                .compile();

        // When
        RunResult result = engine.run(graph, THREAD, Map.of());

        // Then
        assertThat(result).isInstanceOf(RunResult.Failed.class);
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.errorType()).isEqualTo(ErrorType.NODE_INVOCATION);
        assertThat(failed.message()).contains("boom");
        assertThat(failed.lastCompletedNode()).isEqualTo("a");

        Checkpoint checkpoint = store.get(THREAD).orElseThrow();
        assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(checkpoint.getState().<List<String>>value("log")).contains(List.of("a"));
        assertThat(checkpoint.getError().getNode()).isEqualTo("b");
        assertThat(checkpoint.getError().getType()).isEqualTo(ErrorType.NODE_INVOCATION);
    }

    @Test
    @DisplayName("an update to an unregistered field fails with UnknownField naming the field")
    void unknownField() {
        // Given
        GraphDefinition graph = withLog()
                .addNode("a", (state, context) -> NodeResult.update(Map.of("bogus", 1)))
                .addEdge(StateGraph.START, "a")
                .addEdge("a", StateGraph.END)
                .compile();

        // When
        RunResult result = engine.run(graph, THREAD, Map.of());

        // Then
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.errorType()).isEqualTo(ErrorType.UNKNOWN_FIELD);
        assertThat(failed.message()).contains("bogus");
        assertThat(store.get(THREAD).orElseThrow().getState().has("bogus")).isFalse();
    }

    @Test
    @DisplayName("an unmapped routing label fails with UnknownRoutingLabel after the merge")
    void unknownRoutingLabel() {
        // Given
        GraphDefinition graph = withLog()
                .addNode("a", (state, context) -> log("a"))
                .addEdge(StateGraph.START, "a")
                .addConditionalEdges("a", state -> "nowhere", Map.of("done", StateGraph.END))
                .compile();

        // When
        RunResult result = engine.run(graph, THREAD, Map.of());

        // Then
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.errorType()).isEqualTo(ErrorType.UNKNOWN_ROUTING_LABEL);
        assertThat(failed.message()).contains("nowhere");
        assertThat(failed.lastCompletedNode()).isEqualTo("a");
    }

    @Test
    @DisplayName("stops a run that exceeds the superstep limit")
    void stepLimit() {
        // Given
        GraphDefinition graph = withLog()
                .addNode("loop", (state, context) -> log("tick"))
                .addEdge(StateGraph.START, "loop")
                .addConditionalEdges("loop", state -> "again", Map.of("again", "loop"))
                .compile();
        GraphEngine limited = new GraphEngine(store, codec, StepListener.NONE, 5);

        // When
        RunResult result = limited.run(graph, THREAD, Map.of());

        // Then
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.errorType()).isEqualTo(ErrorType.STEP_LIMIT_EXCEEDED);
        Checkpoint checkpoint = store.get(THREAD).orElseThrow();
        assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(checkpoint.getState().<List<String>>value("log").orElseThrow()).hasSize(5);
    }

    @Test
    @DisplayName("a store failure aborts the superstep and keeps the previous checkpoint")
    void storeUnavailable() {
        // Given
        FlakyStore flaky = new FlakyStore(store, 1);
        GraphEngine flakyEngine = new GraphEngine(flaky, codec);

        // When
        RunResult result = flakyEngine.run(linearGraph(), THREAD, Map.of());

        // Then
        RunResult.Failed failed = (RunResult.Failed) result;
        assertThat(failed.errorType()).isEqualTo(ErrorType.STORE_UNAVAILABLE);
        assertThat(failed.lastCompletedNode()).isEqualTo("a");

        Checkpoint checkpoint = store.get(THREAD).orElseThrow();
        assertThat(checkpoint.getStepSequence()).isEqualTo(1);
        assertThat(checkpoint.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(checkpoint.getNextNode()).isEqualTo("b");
    }

    @Test
    @DisplayName("cancellation suspends at the next checkpoint boundary and resume continues")
    void cancellation() {
        // Given
        AtomicReference<GraphEngine> engineRef = new AtomicReference<>();
        List<Boolean> resumingFlags = new ArrayList<>();
        GraphDefinition graph = withLog()
                .addNode("a", (state, context) -> {
                    assertThat(engineRef.get().cancel(context.getThreadId())).isTrue();
                    return log("a");
                })
                .addNode("b", (state, context) -> {
                    resumingFlags.add(context.isResuming());
                    return log("b");
                })
                .addEdge(StateGraph.START, "a")
                .addEdge("a", "b")
                .addEdge("b", StateGraph.END)
                .compile();
        engineRef.set(engine);

        // When
        RunResult cancelled = engine.run(graph, THREAD, Map.of());

        // Then
        assertThat(cancelled).isInstanceOf(RunResult.Suspended.class);
        InterruptPayload interrupt = ((RunResult.Suspended) cancelled).interrupt();
        assertThat(interrupt.isCancellation()).isTrue();
        assertThat(interrupt.getNode()).isEqualTo("b");
        assertThat(store.get(THREAD).orElseThrow().getState().<List<String>>value("log")).contains(List.of("a"));

        // When
        RunResult resumed = engine.resume(graph, THREAD, Map.of());

        // Then
        assertThat(resumed.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(resumingFlags).containsExactly(false);
        assertThat(engine.cancel(THREAD)).isFalse();
    }

    @Test
    @DisplayName("concurrent resumes of one thread: one completes, the other gets ResumeMismatch")
    void concurrentResumes() throws Exception {
        // Given
        GraphDefinition graph = approvalGraph();
        engine.run(graph, THREAD, Map.of());
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger mismatches = new AtomicInteger();
        Callable<RunResult> resume = () -> {
            start.await();
            try {
                return engine.resume(graph, THREAD, Map.of("approved", true));
            } catch (ResumeMismatchException e) {
                mismatches.incrementAndGet();
                return null;
            }
        };
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            // When
            Future<RunResult> first = pool.submit(resume);
            Future<RunResult> second = pool.submit(resume);
            start.countDown();
            List<RunResult> results = new ArrayList<>();
            results.add(first.get(10, TimeUnit.SECONDS));
            results.add(second.get(10, TimeUnit.SECONDS));

            // Then
            assertThat(mismatches.get()).isEqualTo(1);
            assertThat(results).filteredOn(r -> r != null)
                    .singleElement()
                    .extracting(RunResult::status)
                    .isEqualTo(RunStatus.COMPLETED);
            assertThat(store.get(THREAD).orElseThrow().getState()
                    .<List<String>>value("log")).contains(List.of("decision:true", "done"));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("a failing listener does not affect the run")
    void listenerFailureIgnored() {
        // Given
        GraphEngine noisy = new GraphEngine(store, codec, event -> {
            throw new IllegalStateException("listener down");
        }, 10);

        // When
        RunResult result = noisy.run(linearGraph(), THREAD, Map.of());

        // Then
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
    }

    /**
     * Delegates to a real store but fails every put after the first {@code allowedPuts}.
     */
    private static final class FlakyStore implements CheckpointStore {

        private final CheckpointStore delegate;
        private final int allowedPuts;
        private int puts;

        FlakyStore(CheckpointStore delegate, int allowedPuts) {
            this.delegate = delegate;
            this.allowedPuts = allowedPuts;
        }

        @Override
        public Optional<Checkpoint> get(String threadId) {
            return delegate.get(threadId);
        }

        @Override
        public void put(String threadId, Checkpoint checkpoint) {
            if (++puts > allowedPuts) {
                throw new IllegalStateException("disk full");
            }
            delegate.put(threadId, checkpoint);
        }

        @Override
        public List<Checkpoint> findByStatus(RunStatus status) {
            return delegate.findByStatus(status);
        }
    }
}
