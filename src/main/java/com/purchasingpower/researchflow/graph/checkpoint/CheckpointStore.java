package com.purchasingpower.researchflow.graph.checkpoint;

import com.purchasingpower.researchflow.exception.StoreUnavailableException;
import com.purchasingpower.researchflow.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping from thread id to its latest checkpoint.
 *
 * <p>Implementations must make {@link #put} atomic per thread: a reader sees either
 * the previous checkpoint or the new one, never a mix. Failures surface as
 * {@link StoreUnavailableException}.
 */
public interface CheckpointStore {

    Optional<Checkpoint> get(String threadId);

    void put(String threadId, Checkpoint checkpoint);

    /**
     * Latest checkpoints currently in the given status.
     */
    List<Checkpoint> findByStatus(RunStatus status);
}
