package com.purchasingpower.researchflow.workflow.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool invocation requested by the model in an assistant message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /**
     * Call id, echoed back by the matching tool-result message.
     */
    private String id;

    private String name;

    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();

    /**
     * Argument as text, or {@code defaultValue} when absent.
     */
    public String stringArgument(String key, String defaultValue) {
        if (arguments == null) {
            return defaultValue;
        }
        Object value = arguments.get(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }
}
