package com.purchasingpower.researchflow.agent.tools;

import com.purchasingpower.researchflow.agent.Tool;
import com.purchasingpower.researchflow.agent.ToolResult;
import com.purchasingpower.researchflow.configuration.ResearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Searches the configured result corpus for the first keyword contained in the query.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSearchTool implements Tool {

    public static final String NAME = "web_search";

    private final ResearchProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Search the web for information on a research topic. " +
               "Returns a short digest of the best matching results.";
    }

    @Override
    public Map<String, String> getParameters() {
        return Map.of("query", "search query, e.g. 'latest climate change studies'");
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.KNOWLEDGE;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments) {
        Object raw = arguments.get("query");
        if (raw == null || raw.toString().isBlank()) {
            return ToolResult.failure("query parameter is required");
        }
        String query = raw.toString();
        String normalized = query.toLowerCase(Locale.ROOT);

        log.info("🔍 Web search: {}", query);

        for (ResearchProperties.SearchResult result : properties.getSearchResults()) {
            if (normalized.contains(result.getKeyword().toLowerCase(Locale.ROOT))) {
                return ToolResult.success(
                        String.format("Search results for '%s':%n%s", query, result.getText()),
                        "web:" + result.getKeyword());
            }
        }

        log.debug("No search result matched query: {}", query);
        return ToolResult.success(
                String.format("No specific results found for '%s'. General information available.", query));
    }
}
