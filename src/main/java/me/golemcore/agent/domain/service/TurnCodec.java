package me.golemcore.agent.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.ConversationTurn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON form of conversation turns, handed to whatever persists them.
 */
@Component
@RequiredArgsConstructor
public class TurnCodec {

    private static final TypeReference<List<ConversationTurn>> TURN_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String encode(List<ConversationTurn> turns) {
        try {
            return objectMapper.writeValueAsString(turns);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize turns", e);
        }
    }

    /**
     * @throws IllegalArgumentException
     *             if the JSON does not describe a list of turns
     */
    public List<ConversationTurn> decode(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<ConversationTurn> turns = objectMapper.readValue(json, TURN_LIST);
            return turns != null ? turns : List.of();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid turn data: " + e.getOriginalMessage(), e);
        }
    }
}
