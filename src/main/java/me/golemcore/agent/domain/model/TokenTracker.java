package me.golemcore.agent.domain.model;

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

import lombok.Builder;

/**
 * Cumulative token counters of a session. Instances are immutable snapshots.
 */
@Builder(toBuilder = true)
public record TokenTracker(
        long inputTokens,
        long outputTokens,
        long cacheReadInputTokens,
        long cacheCreationInputTokens) {

    public static TokenTracker empty() {
        return new TokenTracker(0, 0, 0, 0);
    }

    public TokenTracker plus(TokenUsage usage) {
        if (usage == null) {
            return this;
        }
        return new TokenTracker(
                inputTokens + usage.inputTokens(),
                outputTokens + usage.outputTokens(),
                cacheReadInputTokens + usage.cacheReadInputTokens(),
                cacheCreationInputTokens + usage.cacheCreationInputTokens());
    }

    /**
     * Input side of the context, cache reads and writes included.
     */
    public long totalInput() {
        return inputTokens + cacheReadInputTokens + cacheCreationInputTokens;
    }

    public long totalContext() {
        return totalInput() + outputTokens;
    }
}
