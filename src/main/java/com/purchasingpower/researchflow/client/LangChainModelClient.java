package com.purchasingpower.researchflow.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.researchflow.agent.Tool;
import com.purchasingpower.researchflow.workflow.state.Message;
import com.purchasingpower.researchflow.workflow.state.ToolCall;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link ModelClient} backed by a LangChain4j {@link ChatLanguageModel}.
 *
 * <p>Converts the session's messages to LangChain4j chat messages, advertises the
 * tools as tool specifications, and maps tool execution requests back to
 * {@link ToolCall}s. Tool arguments travel as JSON objects.
 */
@Slf4j
public class LangChainModelClient implements ModelClient {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ChatLanguageModel chatModel;
    private final ObjectMapper objectMapper;

    public LangChainModelClient(ChatLanguageModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public Message complete(List<Message> history, List<Tool> tools) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message message : history) {
            messages.add(toChatMessage(message));
        }

        log.debug("Calling chat model: {} messages, {} tools", messages.size(), tools.size());

        Response<AiMessage> response = tools.isEmpty()
                ? chatModel.generate(messages)
                : chatModel.generate(messages, toSpecifications(tools));

        AiMessage aiMessage = response.content();
        if (response.tokenUsage() != null) {
            log.debug("Chat model token usage: {}", response.tokenUsage());
        }
        return fromAiMessage(aiMessage);
    }

    // ================================================================
    // CONVERSIONS
    // ================================================================

    List<ToolSpecification> toSpecifications(List<Tool> tools) {
        List<ToolSpecification> specifications = new ArrayList<>();
        for (Tool tool : tools) {
            JsonObjectSchema.Builder schema = JsonObjectSchema.builder();
            tool.getParameters().forEach(schema::addStringProperty);
            schema.required(new ArrayList<>(tool.getParameters().keySet()));

            specifications.add(ToolSpecification.builder()
                    .name(tool.getName())
                    .description(tool.getDescription())
                    .parameters(schema.build())
                    .build());
        }
        return specifications;
    }

    ChatMessage toChatMessage(Message message) {
        String content = message.getContent() != null ? message.getContent() : "";
        switch (message.getRole()) {
            case SYSTEM:
                return SystemMessage.from(content);
            case HUMAN:
                return UserMessage.from(content);
            case TOOL_RESULT:
                return ToolExecutionResultMessage.from(message.getToolCallId(), message.getToolName(), content);
            case ASSISTANT:
            default:
                if (!message.hasPendingToolCalls()) {
                    return AiMessage.from(content);
                }
                List<ToolExecutionRequest> requests = new ArrayList<>();
                for (ToolCall call : message.getToolCalls()) {
                    requests.add(ToolExecutionRequest.builder()
                            .id(call.getId())
                            .name(call.getName())
                            .arguments(writeArguments(call.getArguments()))
                            .build());
                }
                return content.isEmpty() ? AiMessage.from(requests) : AiMessage.from(content, requests);
        }
    }

    Message fromAiMessage(AiMessage aiMessage) {
        String text = aiMessage.text() != null ? aiMessage.text() : "";
        if (!aiMessage.hasToolExecutionRequests()) {
            return Message.assistant(text);
        }

        List<ToolCall> calls = new ArrayList<>();
        for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
            calls.add(ToolCall.builder()
                    .id(request.id() != null ? request.id() : "call-" + UUID.randomUUID())
                    .name(request.name())
                    .arguments(readArguments(request.arguments()))
                    .build());
        }
        return Message.assistant(text, calls);
    }

    private String writeArguments(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool arguments", e);
        }
    }

    private Map<String, Object> readArguments(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Model returned malformed tool arguments: " + json, e);
        }
    }
}
