package com.purchasingpower.researchflow.graph.checkpoint;

import com.purchasingpower.researchflow.exception.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error recorded next to the last good state of a failed run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointError {

    private ErrorType type;

    private String message;

    /**
     * Node that was executing when the run failed, if any.
     */
    private String node;
}
