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

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolExecutionResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Host-supplied tool the model may call while answering a prompt. Every bean
 * of this type is offered to each langchain4j backend.
 */
public interface AgentTool {

    /**
     * @return name, description and JSON Schema of the parameters
     */
    ToolDefinition getDefinition();

    /**
     * Runs the tool with the arguments the model produced.
     *
     * @param parameters
     *            parsed JSON arguments, empty when the model sent none
     * @return a future containing the tool result
     */
    CompletableFuture<ToolExecutionResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
