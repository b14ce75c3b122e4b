package me.golemcore.agent.port.outbound;

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

/**
 * Model backend selectable by a session. Implementations own their transport,
 * including timeouts and retries.
 */
public interface BackendPort {

    String getName();

    /**
     * Size of the backend's context window in tokens.
     */
    int getContextWindow();

    boolean isAvailable();

    /**
     * Creates the agent that serves one prompt call, including any retry after
     * compaction.
     */
    BackendAgent createAgent();
}
