package com.purchasingpower.researchflow.graph.engine;

/**
 * Observer of superstep boundaries. Called on the run's worker thread after the
 * checkpoint is persisted; exceptions thrown here are logged and ignored by the engine.
 */
@FunctionalInterface
public interface StepListener {

    StepListener NONE = event -> {
    };

    void onStep(StepEvent event);
}
