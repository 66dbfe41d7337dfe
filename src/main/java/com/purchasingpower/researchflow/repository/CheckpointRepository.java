package com.purchasingpower.researchflow.repository;

import com.purchasingpower.researchflow.model.CheckpointEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for thread checkpoints.
 */
@Repository
public interface CheckpointRepository extends JpaRepository<CheckpointEntity, Long> {

    Optional<CheckpointEntity> findByThreadId(String threadId);

    /**
     * Threads in a given status, most recently updated first.
     *
     * @param status RunStatus name (RUNNING, SUSPENDED, ...)
     */
    List<CheckpointEntity> findByStatusOrderByUpdatedAtDesc(String status);
}
