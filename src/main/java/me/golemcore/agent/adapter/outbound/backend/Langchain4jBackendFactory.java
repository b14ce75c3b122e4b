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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import me.golemcore.agent.domain.service.TokenEstimator;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.AgentTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Langchain4jBackend} for every provider configured under
 * {@code agent.backend.providers.<name>}. Every {@link AgentTool} bean is
 * offered to each backend.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jBackendFactory {

    private static final String API_ANTHROPIC = "anthropic";

    private final AgentProperties properties;
    private final TokenEstimator tokenEstimator;
    private final ObjectMapper objectMapper;
    private final List<AgentTool> tools;

    public List<Langchain4jBackend> createBackends() {
        List<Langchain4jBackend> backends = new ArrayList<>();
        for (Map.Entry<String, AgentProperties.ProviderProperties> entry : properties.getBackend().getProviders()
                .entrySet()) {
            String name = entry.getKey();
            AgentProperties.ProviderProperties config = entry.getValue();
            try {
                backends.add(new Langchain4jBackend(name, config, createModel(config), tokenEstimator,
                        objectMapper, tools, properties.getBackend().getMaxCallsPerTurn()));
                log.debug("[Backend] Configured backend '{}' ({}, {})", name, config.getApi(),
                        config.getModelName());
            } catch (RuntimeException e) {
                log.warn("[Backend] Failed to configure backend '{}': {}", name, e.getMessage());
            }
        }
        return backends;
    }

    StreamingChatModel createModel(AgentProperties.ProviderProperties config) {
        if (API_ANTHROPIC.equalsIgnoreCase(config.getApi())) {
            return createAnthropicModel(config);
        }
        // Everything else speaks the OpenAI-compatible API
        return createOpenAiModel(config);
    }

    private StreamingChatModel createAnthropicModel(AgentProperties.ProviderProperties config) {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .maxTokens(config.getMaxOutputTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private StreamingChatModel createOpenAiModel(AgentProperties.ProviderProperties config) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModelName())
                .maxTokens(config.getMaxOutputTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()));

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
