package com.purchasingpower.researchflow.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/research/{threadId}/resume}.
 *
 * <pre>
 * {"approved": true}
 * {"decision": {"approved": false, "note": "out of scope"}}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeRequest {

    /**
     * Shortcut for {@code decision.approved}.
     */
    private Boolean approved;

    private Map<String, Object> decision;

    public Map<String, Object> toDecision() {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (decision != null) {
            merged.putAll(decision);
        }
        if (approved != null) {
            merged.put("approved", approved);
        }
        return merged;
    }
}
