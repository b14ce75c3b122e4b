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

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.service.TokenEstimator;
import me.golemcore.agent.port.outbound.BackendAgent;
import me.golemcore.agent.port.outbound.BackendPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Backend used when nothing is configured. Answers every prompt with a fixed
 * placeholder and reports estimated usage.
 *
 * <p>
 * Backend name: {@code "none"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NoOpBackend implements BackendPort {

    public static final String NAME = "none";
    static final String PLACEHOLDER = "[No backend configured]";
    private static final int CONTEXT_WINDOW = 128_000;

    private final TokenEstimator tokenEstimator;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getContextWindow() {
        return CONTEXT_WINDOW;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public BackendAgent createAgent() {
        return history -> {
            log.warn("[Backend] NoOpBackend: prompt received - no backend configured");
            long input = tokenEstimator.estimateMessages(history);
            long output = tokenEstimator.estimate(PLACEHOLDER);
            return Flux.just(
                    BackendEvent.callStart(0, TokenUsage.of(input, 0)),
                    BackendEvent.text(PLACEHOLDER),
                    BackendEvent.finalResponse(0, TokenUsage.of(input, output)));
        };
    }
}
