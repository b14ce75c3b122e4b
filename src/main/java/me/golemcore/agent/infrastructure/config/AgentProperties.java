package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of the agent runtime, bound from {@code application.properties}
 * under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link BackendProperties} - selectable model backends</li>
 * <li>{@link CompactionProperties} - threshold and anchor tuning</li>
 * <li>{@link StreamProperties} - output batching and previews</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private BackendProperties backend = new BackendProperties();
    private CompactionProperties compaction = new CompactionProperties();
    private StreamProperties stream = new StreamProperties();

    @Data
    public static class BackendProperties {
        private String defaultBackend = "none";
        /** Backend calls one prompt may issue while the model keeps calling tools. */
        private int maxCallsPerTurn = 25;
        private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    }

    @Data
    public static class ProviderProperties {
        /** Wire protocol: {@code openai} (and compatible endpoints) or {@code anthropic}. */
        private String api = "openai";
        private String apiKey;
        private String baseUrl;
        private String modelName;
        private int contextWindow = 128_000;
        private int maxOutputTokens = 4096;
        private long timeoutMs = 300_000;
    }

    @Data
    public static class CompactionProperties {
        private double thresholdRatio = 0.9;
        private double anchorConfidenceThreshold = 0.9;
        private int keepRecentTurns = 3;
        private double minCompressionRatio = 0.6;
        private int charsPerToken = 4;
    }

    @Data
    public static class StreamProperties {
        private int textBatchChars = 64;
        private long textBatchIntervalMs = 50;
        private int toolResultPreviewChars = 500;
        private long statusTickMs = 1000;
    }
}
