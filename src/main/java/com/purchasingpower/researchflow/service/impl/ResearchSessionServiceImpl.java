package com.purchasingpower.researchflow.service.impl;

import com.purchasingpower.researchflow.exception.ResumeMismatchException;
import com.purchasingpower.researchflow.exception.RunConflictException;
import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointStore;
import com.purchasingpower.researchflow.graph.engine.GraphEngine;
import com.purchasingpower.researchflow.graph.engine.RunResult;
import com.purchasingpower.researchflow.model.RunStatus;
import com.purchasingpower.researchflow.service.ResearchSessionService;
import com.purchasingpower.researchflow.service.RunStreamService;
import com.purchasingpower.researchflow.workflow.ResearchWorkflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class ResearchSessionServiceImpl implements ResearchSessionService {

    private final GraphEngine graphEngine;
    private final ResearchWorkflow workflow;
    private final CheckpointStore checkpointStore;
    private final RunStreamService runStreamService;
    private final Executor workflowExecutor;

    public ResearchSessionServiceImpl(GraphEngine graphEngine,
                                      ResearchWorkflow workflow,
                                      CheckpointStore checkpointStore,
                                      RunStreamService runStreamService,
                                      @Qualifier("workflowExecutor") Executor workflowExecutor) {
        this.graphEngine = graphEngine;
        this.workflow = workflow;
        this.checkpointStore = checkpointStore;
        this.runStreamService = runStreamService;
        this.workflowExecutor = workflowExecutor;
    }

    @Override
    public RunResult run(String threadId, Map<String, Object> fields) {
        log.info("📋 Run requested: thread={}, fields={}", threadId, fields.keySet());
        runStreamService.clearBuffer(threadId);
        return logOutcome(graphEngine.run(workflow.getGraph(), threadId, fields));
    }

    @Override
    public RunResult resume(String threadId, Map<String, Object> decision) {
        log.info("📋 Resume requested: thread={}, decision={}", threadId, decision);
        runStreamService.clearBuffer(threadId);
        return logOutcome(graphEngine.resume(workflow.getGraph(), threadId, decision));
    }

    @Override
    public CompletableFuture<RunResult> runAsync(String threadId, Map<String, Object> fields) {
        checkpointStore.get(threadId)
                .filter(checkpoint -> checkpoint.getStatus() == RunStatus.SUSPENDED)
                .ifPresent(checkpoint -> {
                    throw new RunConflictException(threadId,
                            "suspended at node '" + checkpoint.getNextNode() + "', resume it instead");
                });
        return CompletableFuture.supplyAsync(() -> run(threadId, fields), workflowExecutor)
                .whenComplete((result, error) -> logAsyncError(threadId, error));
    }

    @Override
    public CompletableFuture<RunResult> resumeAsync(String threadId, Map<String, Object> decision) {
        Checkpoint checkpoint = checkpointStore.get(threadId)
                .orElseThrow(() -> new ResumeMismatchException(threadId, "no checkpoint exists"));
        if (!checkpoint.hasPendingInterrupt()) {
            throw new ResumeMismatchException(threadId, "no pending interrupt (status " + checkpoint.getStatus() + ")");
        }
        return CompletableFuture.supplyAsync(() -> resume(threadId, decision), workflowExecutor)
                .whenComplete((result, error) -> logAsyncError(threadId, error));
    }

    @Override
    public boolean cancel(String threadId) {
        return graphEngine.cancel(threadId);
    }

    @Override
    public Optional<Checkpoint> getCheckpoint(String threadId) {
        return checkpointStore.get(threadId);
    }

    @Override
    public List<Checkpoint> findThreads(RunStatus status) {
        return checkpointStore.findByStatus(status);
    }

    private RunResult logOutcome(RunResult result) {
        if (result instanceof RunResult.Failed failed) {
            log.warn("⚠️ Run ended in failure: thread={}, type={}, last node={}",
                    failed.threadId(), failed.errorType(), failed.lastCompletedNode());
        } else {
            log.info("📋 Run returned: thread={}, status={}, step={}",
                    result.threadId(), result.status(), result.stepSequence());
        }
        return result;
    }

    private void logAsyncError(String threadId, Throwable error) {
        if (error != null) {
            log.error("❌ Async research call failed: thread={}", threadId, error);
        }
    }
}
