package com.purchasingpower.researchflow.agent.tools;

import com.purchasingpower.researchflow.agent.Tool;
import com.purchasingpower.researchflow.agent.ToolResult;
import com.purchasingpower.researchflow.configuration.ResearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Looks up an internal document by its exact id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentLookupTool implements Tool {

    public static final String NAME = "document_lookup";

    private final ResearchProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Look up information from internal documents by document id (e.g. DOC-001).";
    }

    @Override
    public Map<String, String> getParameters() {
        return Map.of("document_id", "internal document id, e.g. 'DOC-001'");
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.KNOWLEDGE;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments) {
        Object raw = arguments.get("document_id");
        if (raw == null || raw.toString().isBlank()) {
            return ToolResult.failure("document_id parameter is required");
        }
        String documentId = raw.toString().trim();

        log.info("📄 Document lookup: {}", documentId);

        return properties.getDocuments().stream()
                .filter(document -> document.getId().equals(documentId))
                .findFirst()
                .map(document -> ToolResult.success(document.getContent(), "doc:" + document.getId()))
                .orElseGet(() -> ToolResult.failure("Document " + documentId + " not found in database"));
    }
}
