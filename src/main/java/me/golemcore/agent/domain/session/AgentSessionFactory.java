package me.golemcore.agent.domain.session;

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
import me.golemcore.agent.adapter.outbound.backend.BackendRegistry;
import me.golemcore.agent.domain.loop.HostWakeInterruptSource;
import me.golemcore.agent.domain.loop.InterruptSource;
import me.golemcore.agent.domain.loop.KeyEvent;
import me.golemcore.agent.domain.loop.KeyboardInterruptSource;
import me.golemcore.agent.domain.service.CompactionOrchestrationService;
import me.golemcore.agent.domain.service.TokenEstimator;
import me.golemcore.agent.domain.service.TurnConverter;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;

/**
 * Creates sessions wired to the configured default backend. The interrupt
 * source is chosen here and never changes for the life of a session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentSessionFactory {

    private final BackendRegistry backendRegistry;
    private final CompactionOrchestrationService compactionService;
    private final TurnConverter turnConverter;
    private final TokenEstimator tokenEstimator;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Session for an embedding host that cancels through
     * {@link AgentSession#interrupt()}.
     */
    public AgentSession createHostSession() {
        return create(new HostWakeInterruptSource());
    }

    /**
     * Session for a terminal front end; Escape or Ctrl+C in {@code keyEvents}
     * interrupts the running prompt.
     */
    public AgentSession createInteractiveSession(Flux<KeyEvent> keyEvents) {
        Duration tick = Duration.ofMillis(properties.getStream().getStatusTickMs());
        return create(new KeyboardInterruptSource(keyEvents, tick));
    }

    public AgentSession create(InterruptSource interruptSource) {
        AgentSession session = new AgentSession(backendRegistry.getDefaultBackend(), backendRegistry,
                compactionService, turnConverter, tokenEstimator, interruptSource, properties, objectMapper, clock);
        log.info("[Session] New session on backend '{}'", session.currentBackendName());
        return session;
    }
}
