package com.purchasingpower.researchflow.agent;

import java.util.Map;

/**
 * Capability the research agent can invoke.
 *
 * <p>Each tool has a clear contract: named string parameters, a textual result,
 * and a description for the model to understand when to use it.
 *
 * <pre>
 * public class DocumentLookupTool implements Tool {
 *     public String getName() { return "document_lookup"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; arguments) {
 *         String id = (String) arguments.get("doc_id");
 *         // look the document up and return its text
 *     }
 * }
 * </pre>
 */
public interface Tool {

    /**
     * Unique name used by the model to invoke the tool (e.g. "web_search").
     */
    String getName();

    /**
     * Human-readable description for the model.
     */
    String getDescription();

    /**
     * Parameter name to description, in declaration order. Every parameter is a
     * required string.
     */
    Map<String, String> getParameters();

    ToolCategory getCategory();

    /**
     * Executes the tool. Implementations report domain failures through
     * {@link ToolResult#failure(String)} rather than by throwing.
     */
    ToolResult execute(Map<String, Object> arguments);

    enum ToolCategory {
        /**
         * Tools that retrieve information; successful calls record a source.
         */
        KNOWLEDGE,

        /**
         * Tools that compute over information already at hand.
         */
        ANALYSIS,

        /**
         * Tools that steer the run itself, e.g. asking a human.
         */
        CONTROL
    }
}
