package com.purchasingpower.researchflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.researchflow.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompts from YAML files and renders them with variables.
 *
 * Usage:
 * String prompt = promptLibrary.render("research-summary", Map.of(
 *     "query", "climate change",
 *     "progress", "Research started, Agent response generated"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            for (Resource resource : resolver.getResources(PROMPT_LOCATION)) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }
            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Renders the template's system and user parts, separated by a blank line.
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = getTemplate(templateName);

        StringBuilder fullPrompt = new StringBuilder();
        if (template.getSystemPrompt() != null) {
            fullPrompt.append(template.getSystemPrompt());
        }
        if (template.getUserPrompt() != null) {
            if (fullPrompt.length() > 0) {
                fullPrompt.append("\n\n");
            }
            fullPrompt.append(template.getUserPrompt());
        }

        Mustache mustache = mustacheFactory.compile(new StringReader(fullPrompt.toString()), templateName);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString().trim();
    }

    public PromptTemplate getTemplate(String name) {
        PromptTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + name);
        }
        return template;
    }
}
