package com.purchasingpower.researchflow.agent.tools;

import com.purchasingpower.researchflow.agent.Tool;
import com.purchasingpower.researchflow.agent.ToolResult;
import com.purchasingpower.researchflow.util.ExpressionEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Evaluates arithmetic expressions for the agent.
 */
@Slf4j
@Component
public class CalculateStatsTool implements Tool {

    public static final String NAME = "calculate_stats";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Perform calculations and statistical analysis. Supports + - * / % ^ and parentheses.";
    }

    @Override
    public Map<String, String> getParameters() {
        return Map.of("expression", "arithmetic expression, e.g. '(40 + 60) / 2'");
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ANALYSIS;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments) {
        Object raw = arguments.get("expression");
        if (raw == null || raw.toString().isBlank()) {
            return ToolResult.failure("Error in calculation: expression parameter is required");
        }
        String expression = raw.toString();

        try {
            String result = ExpressionEvaluator.format(ExpressionEvaluator.evaluate(expression));
            log.debug("Calculated {} = {}", expression, result);
            return ToolResult.success("Calculation result: " + expression + " = " + result);
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.warn("⚠️ Calculation failed for '{}': {}", expression, e.getMessage());
            return ToolResult.failure("Error in calculation: " + e.getMessage());
        }
    }
}
