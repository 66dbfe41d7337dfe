package com.purchasingpower.researchflow.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.researchflow.graph.checkpoint.CheckpointStore;
import com.purchasingpower.researchflow.graph.engine.GraphEngine;
import com.purchasingpower.researchflow.graph.state.StateCodec;
import com.purchasingpower.researchflow.service.RunStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the graph engine to the JPA checkpoint store and the SSE stream.
 */
@Slf4j
@Configuration
public class GraphConfiguration {

    @Bean
    public StateCodec stateCodec(ObjectMapper objectMapper) {
        return new StateCodec(objectMapper);
    }

    @Bean
    public GraphEngine graphEngine(CheckpointStore checkpointStore,
                                   StateCodec stateCodec,
                                   RunStreamService runStreamService,
                                   ResearchProperties properties) {
        log.info("✅ Graph engine configured: store={}, max supersteps={}",
                checkpointStore.getClass().getSimpleName(), properties.getMaxSupersteps());
        return new GraphEngine(checkpointStore, stateCodec, runStreamService, properties.getMaxSupersteps());
    }
}
