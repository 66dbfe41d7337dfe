package com.purchasingpower.researchflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: research-agent
 * version: 1.0
 * systemPrompt: |
 *   You are an advanced research assistant...
 * userPrompt: |
 *   ...
 * </pre>
 *
 * Either prompt part may be absent; present parts are rendered with Mustache.
 *
 * @see com.purchasingpower.researchflow.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {

    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;
}
