package me.golemcore.agent.domain.loop;

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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.StreamOutcome;

import java.util.List;

/**
 * What a single stream produced. {@code messages} holds the assistant and tool
 * messages of the exchange, with every tool call paired with its result.
 */
public record StreamResult(StreamOutcome outcome, List<Message> messages, String errorMessage) {

    public StreamResult {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
