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

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Streams the response to a conversation whose last message is the prompt.
 *
 * <p>
 * The returned stream emits text, tool and usage events and ends with a
 * {@link BackendEvent.Type#FINAL_RESPONSE} followed by completion. Disposing
 * the subscription cancels the in-flight request.
 */
@FunctionalInterface
public interface BackendAgent {

    Flux<BackendEvent> stream(List<Message> history);
}
