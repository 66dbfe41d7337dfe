package com.purchasingpower.researchflow.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA entity holding the latest checkpoint of a thread.
 *
 * <p>One row per thread id. The session state and the pending interrupt are stored
 * as JSON in CLOB columns; the scalar columns mirror what is needed for lookups.
 *
 * Table: GRAPH_CHECKPOINTS
 */
@Entity
@Table(name = "GRAPH_CHECKPOINTS", indexes = {
        @Index(name = "idx_checkpoint_thread", columnList = "thread_id", unique = true),
        @Index(name = "idx_checkpoint_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "thread_id", nullable = false, unique = true, length = 100)
    private String threadId;

    @Column(name = "step_sequence", nullable = false)
    private long stepSequence;

    /**
     * Values of {@link RunStatus}.
     */
    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "last_completed_node", length = 100)
    private String lastCompletedNode;

    @Column(name = "next_node", length = 100)
    private String nextNode;

    @Lob
    @Column(name = "state_json", nullable = false)
    private String stateJson;

    @Lob
    @Column(name = "interrupt_json")
    private String interruptJson;

    @Column(name = "error_type", length = 40)
    private String errorType;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "error_node", length = 100)
    private String errorNode;

    /**
     * Optimistic lock: two processes writing the same thread cannot both win.
     */
    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
