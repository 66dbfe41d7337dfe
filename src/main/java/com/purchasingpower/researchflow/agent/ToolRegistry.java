package com.purchasingpower.researchflow.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the tools offered to the model, keyed by tool name.
 *
 * <p>{@link #invoke} never throws: unknown tools and tool exceptions come back
 * as failed results whose text is handed to the model.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            Tool previous = this.tools.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        }
        log.info("🧰 Registered {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    public List<Tool> getTools() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }

    public ToolResult invoke(String name, Map<String, Object> arguments) {
        Tool tool = tools.get(name);
        if (tool == null) {
            log.warn("⚠️ Model requested unknown tool: {}", name);
            return ToolResult.failure("Error: unknown tool '" + name + "'");
        }

        try {
            ToolResult result = tool.execute(arguments != null ? arguments : Map.of());
            if (result == null) {
                return ToolResult.failure("Error: tool '" + name + "' returned no result");
            }
            if (!result.success()) {
                log.warn("⚠️ Tool {} reported failure: {}", name, result.output());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("⚠️ Tool {} threw an exception", name, e);
            return ToolResult.failure("Error: " + name + " failed: " + e.getMessage());
        }
    }
}
