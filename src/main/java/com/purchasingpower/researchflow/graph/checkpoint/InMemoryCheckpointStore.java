package com.purchasingpower.researchflow.graph.checkpoint;

import com.purchasingpower.researchflow.model.RunStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for tests and embedded use. Checkpoints are immutable, so a
 * map replace is the atomic swap.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, Checkpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Checkpoint> get(String threadId) {
        return Optional.ofNullable(checkpoints.get(threadId));
    }

    @Override
    public void put(String threadId, Checkpoint checkpoint) {
        checkpoints.put(threadId, checkpoint);
    }

    @Override
    public List<Checkpoint> findByStatus(RunStatus status) {
        List<Checkpoint> matches = new ArrayList<>();
        for (Checkpoint checkpoint : checkpoints.values()) {
            if (checkpoint.getStatus() == status) {
                matches.add(checkpoint);
            }
        }
        matches.sort((a, b) -> a.getThreadId().compareTo(b.getThreadId()));
        return Collections.unmodifiableList(matches);
    }
}
