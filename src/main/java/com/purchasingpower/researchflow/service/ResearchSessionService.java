package com.purchasingpower.researchflow.service;

import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.engine.RunResult;
import com.purchasingpower.researchflow.model.RunStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing operations on research threads.
 */
public interface ResearchSessionService {

    /**
     * Starts a run with raw state fields as input.
     */
    RunResult run(String threadId, Map<String, Object> fields);

    RunResult resume(String threadId, Map<String, Object> decision);

    /**
     * Validates the thread synchronously, then runs on the workflow executor.
     *
     * @throws com.purchasingpower.researchflow.exception.RunConflictException if the thread is suspended
     */
    CompletableFuture<RunResult> runAsync(String threadId, Map<String, Object> fields);

    /**
     * @throws com.purchasingpower.researchflow.exception.ResumeMismatchException if nothing is pending
     */
    CompletableFuture<RunResult> resumeAsync(String threadId, Map<String, Object> decision);

    boolean cancel(String threadId);

    Optional<Checkpoint> getCheckpoint(String threadId);

    List<Checkpoint> findThreads(RunStatus status);
}
