package com.purchasingpower.researchflow.workflow.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.researchflow.graph.StateGraph;
import com.purchasingpower.researchflow.graph.state.Reducers;
import com.purchasingpower.researchflow.graph.state.SessionState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed read view over the research session state.
 *
 * All list getters handle the LinkedHashMap elements that appear once state
 * has been normalized to JSON structures or reloaded from the checkpoint store.
 */
public class ResearchState {

    public static final String MESSAGES = "messages";
    public static final String RESEARCH_QUERY = "researchQuery";
    public static final String RESEARCH_PROGRESS = "researchProgress";
    public static final String SOURCES_FOUND = "sourcesFound";
    public static final String REQUIRES_APPROVAL = "requiresApproval";
    public static final String APPROVED_BY_HUMAN = "approvedByHuman";
    public static final String SUMMARY = "summary";

    public static final String DEFAULT_QUERY = "General research";

    private static final ObjectMapper objectMapper = createObjectMapper();

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private final SessionState state;

    public ResearchState(SessionState state) {
        this.state = state;
    }

    /**
     * Registers the reducer of every research field on a graph under construction.
     */
    public static StateGraph registerReducers(StateGraph graph) {
        return graph
                .reducer(MESSAGES, Reducers.appendSequence())
                .reducer(RESEARCH_QUERY, Reducers.overwrite())
                .reducer(RESEARCH_PROGRESS, Reducers.appendSequence())
                .reducer(SOURCES_FOUND, Reducers.appendSequence())
                .reducer(REQUIRES_APPROVAL, Reducers.overwrite(false))
                .reducer(APPROVED_BY_HUMAN, Reducers.overwrite(false))
                .reducer(SUMMARY, Reducers.overwrite());
    }

    /**
     * Input for a new research run on a thread.
     */
    public static Map<String, Object> initialInput(String query) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put(MESSAGES, List.of(Message.human(query)));
        input.put(RESEARCH_QUERY, query);
        input.put(RESEARCH_PROGRESS, List.of("Research started"));
        input.put(SOURCES_FOUND, List.of());
        input.put(REQUIRES_APPROVAL, false);
        input.put(APPROVED_BY_HUMAN, false);
        input.put(SUMMARY, null);
        return input;
    }

    // ================================================================
    // GETTERS
    // ================================================================

    public List<Message> getMessages() {
        return convertList(MESSAGES, Message.class);
    }

    public String getResearchQuery() {
        return state.<String>value(RESEARCH_QUERY).orElse(null);
    }

    public String getResearchQueryOrDefault() {
        String query = getResearchQuery();
        return query == null || query.isBlank() ? DEFAULT_QUERY : query;
    }

    public List<String> getResearchProgress() {
        return convertList(RESEARCH_PROGRESS, String.class);
    }

    public List<String> getSourcesFound() {
        return convertList(SOURCES_FOUND, String.class);
    }

    public boolean isRequiresApproval() {
        return state.<Boolean>value(REQUIRES_APPROVAL).orElse(false);
    }

    public boolean isApprovedByHuman() {
        return state.<Boolean>value(APPROVED_BY_HUMAN).orElse(false);
    }

    public String getSummary() {
        return state.<String>value(SUMMARY).orElse(null);
    }

    public Message getLastMessage() {
        List<Message> messages = getMessages();
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    // ================================================================
    // HELPER METHODS FOR SAFE DESERIALIZATION
    // ================================================================

    /**
     * Converts a stored sequence to typed elements. Elements that are already
     * of the right type pass through; maps are converted with Jackson.
     */
    private <T> List<T> convertList(String key, Class<T> elementType) {
        Object obj = state.value(key).orElse(null);
        if (!(obj instanceof List)) {
            return new ArrayList<>();
        }

        List<T> result = new ArrayList<>();
        for (Object item : (List<?>) obj) {
            if (item == null) {
                continue;
            }
            if (elementType.isInstance(item)) {
                result.add(elementType.cast(item));
            } else {
                try {
                    result.add(objectMapper.convertValue(item, elementType));
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException(
                            "Field '" + key + "' holds an element that is not a " + elementType.getSimpleName(), e);
                }
            }
        }
        return result;
    }
}
