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

import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.BackendPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index of the backends a session can switch between.
 *
 * <p>
 * Backend beans (such as {@link NoOpBackend}) are registered together with the
 * langchain4j backends built from {@code agent.backend.providers}. The default
 * backend is taken from {@code agent.backend.default-backend} and falls back to
 * {@value NoOpBackend#NAME} when it is not registered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackendRegistry {

    private final AgentProperties properties;
    private final List<BackendPort> backendBeans;
    private final Langchain4jBackendFactory langchain4jBackendFactory;

    private final Map<String, BackendPort> backendsByName = new LinkedHashMap<>();

    @PostConstruct
    public void init() {
        List<BackendPort> all = new ArrayList<>(backendBeans);
        all.addAll(langchain4jBackendFactory.createBackends());
        for (BackendPort backend : all) {
            backendsByName.put(backend.getName(), backend);
            log.debug("[Backend] Registered backend: {}", backend.getName());
        }
        log.info("[Backend] Available backends: {}, default: {}", backendsByName.keySet(),
                getDefaultBackend().getName());
    }

    /**
     * Returns the backend with the given name.
     *
     * @throws IllegalArgumentException
     *             if no backend is registered under that name
     */
    public BackendPort getBackend(String name) {
        BackendPort backend = backendsByName.get(name);
        if (backend == null) {
            throw new IllegalArgumentException("Unknown backend: " + name + ". Available: " + getNames());
        }
        return backend;
    }

    public BackendPort getDefaultBackend() {
        String configured = properties.getBackend().getDefaultBackend();
        BackendPort backend = backendsByName.get(configured);
        if (backend != null) {
            return backend;
        }
        BackendPort fallback = backendsByName.get(NoOpBackend.NAME);
        if (fallback == null && !backendsByName.isEmpty()) {
            fallback = backendsByName.values().iterator().next();
        }
        if (fallback == null) {
            throw new IllegalStateException("No backends registered");
        }
        log.warn("[Backend] Default backend '{}' not found, using: {}", configured, fallback.getName());
        return fallback;
    }

    public List<String> getNames() {
        return List.copyOf(backendsByName.keySet());
    }

    public boolean isBackendAvailable(String name) {
        BackendPort backend = backendsByName.get(name);
        return backend != null && backend.isAvailable();
    }
}
