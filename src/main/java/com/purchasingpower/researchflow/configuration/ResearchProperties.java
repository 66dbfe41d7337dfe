package com.purchasingpower.researchflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the research workflow, loaded from the {@code app.research} namespace.
 *
 * <pre>
 * app:
 *   research:
 *     progress-threshold: 3
 *     max-supersteps: 25
 *     max-history-messages: 40
 *     search-results:
 *       - keyword: climate change
 *         text: Recent studies show ...
 *     documents:
 *       - id: DOC-001
 *         content: Internal research on ...
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.research")
public class ResearchProperties {

    /**
     * The agent routes to summarize once the progress log holds more entries than this.
     */
    @Min(0)
    private int progressThreshold = 3;

    /**
     * Supersteps allowed per run or resume call.
     */
    @Min(1)
    private int maxSupersteps = 25;

    /**
     * Messages (besides the system prompt) sent to the model per call.
     */
    @Min(2)
    private int maxHistoryMessages = 40;

    @Valid
    private List<SearchResult> searchResults = new ArrayList<>();

    @Valid
    private List<Document> documents = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SearchResult {

        /**
         * Matched case-insensitively as a substring of the query.
         */
        @NotBlank
        private String keyword;

        @NotBlank
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Document {

        @NotBlank
        private String id;

        @NotBlank
        private String content;
    }
}
