package me.golemcore.agent.adapter.outbound.backend;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.BackendException;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.model.ToolCallInfo;
import me.golemcore.agent.domain.model.ToolExecutionResult;
import me.golemcore.agent.domain.model.ToolResultInfo;
import me.golemcore.agent.domain.service.TokenEstimator;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.AgentTool;
import me.golemcore.agent.port.outbound.BackendAgent;
import me.golemcore.agent.port.outbound.BackendPort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Backend streaming through a langchain4j {@link StreamingChatModel}.
 *
 * <p>
 * Each call reports a {@link BackendEvent.Type#CALL_START} with the estimated
 * prompt size, running {@link BackendEvent.Type#STREAM_DELTA} estimates while
 * text arrives, and the provider's exact counts once the call completes.
 *
 * <p>
 * When the model asks for tools, every request is surfaced as a
 * {@link BackendEvent.Type#TOOL_CALL}, executed through the matching
 * {@link AgentTool} and surfaced as a {@link BackendEvent.Type#TOOL_RESULT};
 * the conversation is then sent again under the next call index. Only the call
 * that answers without tool requests ends with
 * {@link BackendEvent.Type#FINAL_RESPONSE}.
 */
@Slf4j
public class Langchain4jBackend implements BackendPort {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String name;
    private final AgentProperties.ProviderProperties config;
    private final StreamingChatModel model;
    private final TokenEstimator tokenEstimator;
    private final ObjectMapper objectMapper;
    private final Map<String, AgentTool> tools;
    private final List<ToolSpecification> toolSpecifications;
    private final int maxCallsPerTurn;

    public Langchain4jBackend(String name, AgentProperties.ProviderProperties config, StreamingChatModel model,
            TokenEstimator tokenEstimator, ObjectMapper objectMapper, List<AgentTool> tools, int maxCallsPerTurn) {
        this.name = name;
        this.config = config;
        this.model = model;
        this.tokenEstimator = tokenEstimator;
        this.objectMapper = objectMapper;
        this.tools = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            this.tools.put(tool.getToolName(), tool);
        }
        this.toolSpecifications = ToolSpecificationConverter.convert(
                tools.stream().map(AgentTool::getDefinition).toList());
        this.maxCallsPerTurn = Math.max(1, maxCallsPerTurn);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getContextWindow() {
        return config.getContextWindow();
    }

    @Override
    public boolean isAvailable() {
        return model != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public BackendAgent createAgent() {
        return history -> Flux.create(sink -> {
            AtomicBoolean cancelled = new AtomicBoolean(false);
            sink.onDispose(() -> cancelled.set(true));
            streamCall(new Exchange(new ArrayList<>(history), sink, cancelled), 0);
        });
    }

    private void streamCall(Exchange exchange, int callIndex) {
        FluxSink<BackendEvent> sink = exchange.sink();
        long estimatedInput = tokenEstimator.estimateMessages(exchange.history());
        sink.next(BackendEvent.callStart(callIndex, TokenUsage.of(estimatedInput, 0)));
        if (exchange.cancelled().get()) {
            return;
        }

        StringBuilder streamed = new StringBuilder();
        ChatRequest.Builder request = ChatRequest.builder()
                .messages(convertMessages(exchange.history()));
        if (!toolSpecifications.isEmpty()) {
            request.toolSpecifications(toolSpecifications);
        }

        model.chat(request.build(), new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
                if (exchange.cancelled().get() || partialResponse == null || partialResponse.isEmpty()) {
                    return;
                }
                streamed.append(partialResponse);
                sink.next(BackendEvent.text(partialResponse));
                sink.next(BackendEvent.streamDelta(callIndex,
                        TokenUsage.of(estimatedInput, tokenEstimator.estimate(streamed.toString()))));
            }

            @Override
            public void onCompleteResponse(ChatResponse response) {
                if (exchange.cancelled().get()) {
                    return;
                }
                TokenUsage usage = toUsage(response, estimatedInput, streamed);
                AiMessage aiMessage = response != null ? response.aiMessage() : null;
                if (aiMessage == null || !aiMessage.hasToolExecutionRequests()) {
                    sink.next(BackendEvent.finalResponse(callIndex, usage));
                    sink.complete();
                    return;
                }
                sink.next(BackendEvent.streamDelta(callIndex, usage));
                if (callIndex + 1 >= maxCallsPerTurn) {
                    log.warn("[Backend] {} reached {} calls in one turn", name, maxCallsPerTurn);
                    sink.error(new BackendException(name + ": model kept calling tools after "
                            + maxCallsPerTurn + " calls"));
                    return;
                }
                runTools(exchange, aiMessage, streamed.toString(), callIndex);
                if (!exchange.cancelled().get()) {
                    streamCall(exchange, callIndex + 1);
                }
            }

            @Override
            public void onError(Throwable error) {
                if (exchange.cancelled().get()) {
                    log.debug("[Backend] {} error after cancellation ignored: {}", name, error.getMessage());
                    return;
                }
                log.error("[Backend] {} stream failed: {}", name, error.getMessage());
                sink.error(new BackendException(name + ": " + error.getMessage(), error));
            }
        });
    }

    private void runTools(Exchange exchange, AiMessage aiMessage, String streamedText, int callIndex) {
        List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
        List<Message.ToolCall> calls = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            ToolExecutionRequest request = requests.get(i);
            calls.add(Message.ToolCall.builder()
                    .id(callId(request, callIndex, i))
                    .name(request.name())
                    .arguments(parseJsonArgs(request.arguments()))
                    .build());
        }
        String text = aiMessage.text() != null ? aiMessage.text() : streamedText;
        exchange.history().add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(text)
                .toolCalls(calls)
                .timestamp(Instant.now())
                .build());

        for (int i = 0; i < calls.size(); i++) {
            if (exchange.cancelled().get()) {
                return;
            }
            Message.ToolCall call = calls.get(i);
            exchange.sink().next(BackendEvent.toolCall(new ToolCallInfo(call.getId(), call.getName(),
                    requests.get(i).arguments())));

            ToolExecutionResult result = execute(call);
            String content = result.toContent();
            exchange.sink().next(BackendEvent.toolResult(ToolResultInfo.builder()
                    .toolCallId(call.getId())
                    .toolName(call.getName())
                    .content(content)
                    .error(!result.isSuccess())
                    .build()));
            exchange.history().add(Message.builder()
                    .role(Message.ROLE_TOOL)
                    .toolCallId(call.getId())
                    .toolName(call.getName())
                    .content(content)
                    .toolError(!result.isSuccess())
                    .timestamp(Instant.now())
                    .build());
        }
    }

    private ToolExecutionResult execute(Message.ToolCall call) {
        AgentTool tool = tools.get(call.getName());
        if (tool == null) {
            log.warn("[Backend] {} requested unknown tool '{}'", name, call.getName());
            return ToolExecutionResult.failure("Unknown tool: " + call.getName());
        }
        try {
            ToolExecutionResult result = tool.execute(call.getArguments()).join();
            return result != null ? result : ToolExecutionResult.failure("Tool returned no result");
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Backend] Tool '{}' failed: {}", call.getName(), cause.getMessage());
            return ToolExecutionResult.failure(cause.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Backend] Tool '{}' failed: {}", call.getName(), e.getMessage());
            return ToolExecutionResult.failure(e.getMessage());
        }
    }

    private static String callId(ToolExecutionRequest request, int callIndex, int position) {
        if (request.id() != null && !request.id().isBlank()) {
            return request.id();
        }
        return "call_" + callIndex + "_" + position;
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[Backend] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    private TokenUsage toUsage(ChatResponse response, long estimatedInput, StringBuilder streamed) {
        dev.langchain4j.model.output.TokenUsage reported = response != null ? response.tokenUsage() : null;
        long input = reported != null && reported.inputTokenCount() != null
                ? reported.inputTokenCount()
                : estimatedInput;
        long output = reported != null && reported.outputTokenCount() != null
                ? reported.outputTokenCount()
                : tokenEstimator.estimate(streamed.toString());
        return TokenUsage.of(input, output);
    }

    List<ChatMessage> convertMessages(List<Message> history) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message msg : history) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank() ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(), msg.getToolName(), content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> log.warn("[Backend] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[Backend] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    /**
     * State of one prompt across the calls of its tool loop.
     */
    private record Exchange(List<Message> history, FluxSink<BackendEvent> sink, AtomicBoolean cancelled) {
    }
}
