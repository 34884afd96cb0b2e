package me.golemcore.courseqa.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.ContentBlock;
import me.golemcore.courseqa.domain.model.LlmRequest;
import me.golemcore.courseqa.domain.model.LlmResponse;
import me.golemcore.courseqa.domain.model.Message;
import me.golemcore.courseqa.domain.model.StopReason;
import me.golemcore.courseqa.domain.model.ToolDefinition;
import me.golemcore.courseqa.infrastructure.config.CourseQaProperties;
import me.golemcore.courseqa.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * LLM adapter for Anthropic Claude models using the langchain4j library.
 *
 * <p>
 * Translates the domain's block-structured messages into langchain4j chat
 * messages: assistant turns become {@link AiMessage}s carrying text and
 * {@link ToolExecutionRequest}s, tool results become
 * {@link ToolExecutionResultMessage}s. Tool definitions are offered with
 * automatic tool choice.
 *
 * <p>
 * The model is created lazily on the first call. langchain4j retries are
 * disabled and failures propagate unchanged; the caller decides what to do.
 *
 * <p>
 * Provider ID: {@code "anthropic"}. Configuration via {@code courseqa.llm.*}.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ID = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CourseQaProperties.LlmProperties llmProperties;
    private final ObjectMapper objectMapper;

    private volatile ChatModel chatModel;

    @Autowired
    public Langchain4jAdapter(CourseQaProperties properties, ObjectMapper objectMapper) {
        this.llmProperties = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    Langchain4jAdapter(CourseQaProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = getChatModel();
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                log.trace("[LLM] Calling with {} tools", tools.size());
                chatRequest.toolSpecifications(tools);
                if (request.getToolChoice() == LlmRequest.ToolChoice.AUTO) {
                    chatRequest.toolChoice(ToolChoice.AUTO);
                }
            }

            try {
                return convertResponse(model.chat(chatRequest.build()));
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed: {}", e.getMessage());
                throw e;
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return llmProperties.getModel();
    }

    @Override
    public boolean isAvailable() {
        if (chatModel != null) {
            return true;
        }
        String apiKey = llmProperties.getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (chatModel == null) {
                chatModel = createAnthropicModel();
                log.info("[LLM] Anthropic model initialized: {}", llmProperties.getModel());
            }
            return chatModel;
        }
    }

    private ChatModel createAnthropicModel() {
        if (!isAvailable()) {
            throw new IllegalStateException("Anthropic API key not configured. Set courseqa.llm.api-key");
        }
        var builder = AnthropicChatModel.builder()
                .apiKey(llmProperties.getApiKey())
                .modelName(llmProperties.getModel())
                .maxRetries(0)
                .temperature(llmProperties.getTemperature())
                .maxTokens(llmProperties.getMaxTokens())
                .timeout(Duration.ofSeconds(llmProperties.getTimeoutSeconds()));

        if (llmProperties.getBaseUrl() != null && !llmProperties.getBaseUrl().isBlank()) {
            builder.baseUrl(llmProperties.getBaseUrl());
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        // Tool results only carry the request id; langchain4j also wants the name
        Map<String, String> toolNamesById = new HashMap<>();

        for (Message msg : request.getMessages()) {
            if (msg.isAssistantMessage()) {
                messages.add(toAiMessage(msg, toolNamesById));
            } else if (msg.hasToolResults()) {
                for (ContentBlock block : msg.getContent()) {
                    if (block instanceof ContentBlock.ToolResult result) {
                        messages.add(ToolExecutionResultMessage.from(
                                result.toolUseId(),
                                toolNamesById.get(result.toolUseId()),
                                result.content()));
                    }
                }
            } else {
                if (!msg.isUserMessage()) {
                    log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                }
                messages.add(UserMessage.from(joinText(msg.getContent())));
            }
        }

        return messages;
    }

    private AiMessage toAiMessage(Message msg, Map<String, String> toolNamesById) {
        List<ToolExecutionRequest> toolRequests = new ArrayList<>();
        for (ContentBlock block : msg.getContent()) {
            if (block instanceof ContentBlock.ToolUse toolUse) {
                toolNamesById.put(toolUse.id(), toolUse.name());
                toolRequests.add(ToolExecutionRequest.builder()
                        .id(toolUse.id())
                        .name(toolUse.name())
                        .arguments(convertArgsToJson(toolUse.input()))
                        .build());
            }
        }

        String text = joinText(msg.getContent());
        if (toolRequests.isEmpty()) {
            return AiMessage.from(text);
        }
        return text.isEmpty() ? AiMessage.from(toolRequests) : AiMessage.from(text, toolRequests);
    }

    private static String joinText(List<ContentBlock> blocks) {
        return blocks.stream()
                .filter(ContentBlock.Text.class::isInstance)
                .map(block -> ((ContentBlock.Text) block).text())
                .collect(Collectors.joining("\n"));
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }

        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        boolean hasDescription = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        default -> {
            // "string" and anything unrecognised
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (hasDescription) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        List<ContentBlock> content = new ArrayList<>();

        if (aiMessage.text() != null) {
            content.add(new ContentBlock.Text(aiMessage.text()));
        }
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest ter : aiMessage.toolExecutionRequests()) {
                content.add(new ContentBlock.ToolUse(ter.id(), ter.name(), parseJsonArgs(ter.arguments())));
            }
            log.trace("[LLM] Parsed {} tool requests from response", aiMessage.toolExecutionRequests().size());
        }

        return LlmResponse.builder()
                .stopReason(toStopReason(response.finishReason(), aiMessage))
                .content(content)
                .model(llmProperties.getModel())
                .build();
    }

    private static StopReason toStopReason(FinishReason finishReason, AiMessage aiMessage) {
        if (finishReason == null) {
            return aiMessage.hasToolExecutionRequests() ? StopReason.TOOL_USE : StopReason.TERMINAL;
        }
        return switch (finishReason) {
        case TOOL_EXECUTION -> StopReason.TOOL_USE;
        case STOP -> StopReason.TERMINAL;
        default -> StopReason.OTHER;
        };
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
