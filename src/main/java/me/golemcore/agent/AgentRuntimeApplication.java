package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Agent session runtime.
 *
 * <p>
 * Streams model responses to a consumer while tracking token usage against the
 * backend's context window. Sessions can be interrupted mid-stream, and older
 * turns are compacted into a continuation summary before the window
 * overflows.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Session layer      → AgentSession, StreamLoop, interrupt sources
 * Domain services    → anchor detection, context extraction, compaction
 * Outbound adapters  → langchain4j backends, no-op backend
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code agent.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRuntimeApplication.class, args);
    }

}
