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

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.TokenUsage;

/**
 * Token totals of the backend calls made within one user turn.
 *
 * <p>
 * The call in progress is tracked separately from the calls already committed.
 * A call is committed when a usage event for a different call index arrives or
 * when its {@link BackendEvent.Type#FINAL_RESPONSE} is applied. Within a call,
 * counters only grow, so a late or repeated event never lowers the total.
 *
 * <p>
 * Not thread-safe; {@link TokenAccountant} guards access.
 */
public class TurnTokenAccumulator {

    private TokenUsage committed = TokenUsage.of(0, 0);
    private TokenUsage current;
    private int currentCallIndex = -1;
    private int committedCalls;

    public void apply(BackendEvent event) {
        TokenUsage usage = event.getUsage();
        if (usage == null) {
            return;
        }
        if (current != null && event.getCallIndex() != currentCallIndex) {
            commitCurrent();
        }
        if (current == null) {
            current = usage;
            currentCallIndex = event.getCallIndex();
        } else {
            current = new TokenUsage(
                    Math.max(current.inputTokens(), usage.inputTokens()),
                    Math.max(current.outputTokens(), usage.outputTokens()),
                    Math.max(current.cacheReadInputTokens(), usage.cacheReadInputTokens()),
                    Math.max(current.cacheCreationInputTokens(), usage.cacheCreationInputTokens()));
        }
        if (event.getType() == BackendEvent.Type.FINAL_RESPONSE) {
            commitCurrent();
        }
    }

    /**
     * Commits the call in progress, if any. Called when the turn finalizes.
     */
    public void finish() {
        commitCurrent();
    }

    public TokenUsage total() {
        return current == null ? committed : sum(committed, current);
    }

    public int getCommittedCalls() {
        return committedCalls;
    }

    private void commitCurrent() {
        if (current == null) {
            return;
        }
        committed = sum(committed, current);
        committedCalls++;
        current = null;
        currentCallIndex = -1;
    }

    private static TokenUsage sum(TokenUsage a, TokenUsage b) {
        return new TokenUsage(
                a.inputTokens() + b.inputTokens(),
                a.outputTokens() + b.outputTokens(),
                a.cacheReadInputTokens() + b.cacheReadInputTokens(),
                a.cacheCreationInputTokens() + b.cacheCreationInputTokens());
    }
}
