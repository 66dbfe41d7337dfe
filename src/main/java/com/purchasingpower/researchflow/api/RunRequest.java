package com.purchasingpower.researchflow.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/research/{threadId}/run}.
 *
 * Either {@code query} (starts research on a question) or {@code fields}
 * (raw state fields merged through the reducers) must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    private String query;

    private Map<String, Object> fields;
}
