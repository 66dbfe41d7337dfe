package com.purchasingpower.researchflow.repository;

import com.purchasingpower.researchflow.exception.ErrorType;
import com.purchasingpower.researchflow.exception.StoreUnavailableException;
import com.purchasingpower.researchflow.graph.checkpoint.Checkpoint;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointError;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointStore;
import com.purchasingpower.researchflow.graph.checkpoint.InterruptPayload;
import com.purchasingpower.researchflow.graph.state.StateCodec;
import com.purchasingpower.researchflow.model.CheckpointEntity;
import com.purchasingpower.researchflow.model.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint store backed by the GRAPH_CHECKPOINTS table.
 *
 * <p>Each {@link #put} runs in its own transaction and updates the single row of the
 * thread, so a failure rolls back to the previous checkpoint instead of leaving a
 * partially written one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaCheckpointStore implements CheckpointStore {

    private static final int MAX_ERROR_MESSAGE = 2000;

    private final CheckpointRepository repository;
    private final StateCodec stateCodec;

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> get(String threadId) {
        try {
            return repository.findByThreadId(threadId).map(this::toCheckpoint);
        } catch (RuntimeException e) {
            log.error("Failed to load checkpoint for thread {}", threadId, e);
            throw new StoreUnavailableException(threadId, e);
        }
    }

    @Override
    @Transactional
    public void put(String threadId, Checkpoint checkpoint) {
        try {
            CheckpointEntity entity = repository.findByThreadId(threadId).orElseGet(CheckpointEntity::new);

            entity.setThreadId(threadId);
            entity.setStepSequence(checkpoint.getStepSequence());
            entity.setStatus(checkpoint.getStatus().name());
            entity.setLastCompletedNode(checkpoint.getLastCompletedNode());
            entity.setNextNode(checkpoint.getNextNode());
            entity.setStateJson(stateCodec.writeState(checkpoint.getState()));
            entity.setInterruptJson(checkpoint.hasPendingInterrupt()
                    ? stateCodec.write(checkpoint.getPendingInterrupt())
                    : null);

            CheckpointError error = checkpoint.getError();
            entity.setErrorType(error != null && error.getType() != null ? error.getType().name() : null);
            entity.setErrorMessage(error != null ? truncate(error.getMessage()) : null);
            entity.setErrorNode(error != null ? error.getNode() : null);

            repository.saveAndFlush(entity);
            log.debug("Saved checkpoint: thread={}, step={}, status={}",
                    threadId, checkpoint.getStepSequence(), checkpoint.getStatus());

        } catch (RuntimeException e) {
            log.error("Failed to save checkpoint for thread {}", threadId, e);
            throw new StoreUnavailableException(threadId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Checkpoint> findByStatus(RunStatus status) {
        try {
            return repository.findByStatusOrderByUpdatedAtDesc(status.name()).stream()
                    .map(this::toCheckpoint)
                    .toList();
        } catch (RuntimeException e) {
            log.error("Failed to query checkpoints with status {}", status, e);
            throw new StoreUnavailableException("*", e);
        }
    }

    private Checkpoint toCheckpoint(CheckpointEntity entity) {
        CheckpointError error = null;
        if (entity.getErrorType() != null) {
            error = CheckpointError.builder()
                    .type(ErrorType.valueOf(entity.getErrorType()))
                    .message(entity.getErrorMessage())
                    .node(entity.getErrorNode())
                    .build();
        }

        InterruptPayload interrupt = entity.getInterruptJson() != null
                ? stateCodec.read(entity.getInterruptJson(), InterruptPayload.class)
                : null;

        return Checkpoint.builder()
                .threadId(entity.getThreadId())
                .stepSequence(entity.getStepSequence())
                .status(RunStatus.valueOf(entity.getStatus()))
                .lastCompletedNode(entity.getLastCompletedNode())
                .nextNode(entity.getNextNode())
                .state(stateCodec.readState(entity.getStateJson()))
                .pendingInterrupt(interrupt)
                .error(error)
                .build();
    }

    private String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE);
    }
}
