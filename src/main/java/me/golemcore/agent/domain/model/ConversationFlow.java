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

import java.util.List;

/**
 * Working set of a single compaction pass.
 */
@Builder
public record ConversationFlow(
        List<ConversationTurn> turns,
        List<AnchorPoint> anchorPoints,
        long totalTokens,
        PreservationContext preservationContext,
        MigrationStrategy migrationStrategy,
        AnchorPoint syntheticAnchor) {

    public ConversationFlow {
        turns = turns != null ? List.copyOf(turns) : List.of();
        anchorPoints = anchorPoints != null ? List.copyOf(anchorPoints) : List.of();
    }

    public boolean hasSyntheticAnchor() {
        return syntheticAnchor != null;
    }
}
