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
import me.golemcore.agent.domain.model.TokenTracker;
import me.golemcore.agent.domain.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Token state of one session, shared between the streaming loop and the
 * compaction hook that observes the backend stream on the transport thread.
 *
 * <p>
 * Two figures are kept:
 * <ul>
 * <li>the cumulative {@link TokenTracker} over every call of the session, plus
 * the turn in progress</li>
 * <li>the size of the current context window, taken from the most recent call
 * (input, cache and output), which the compaction threshold is checked
 * against</li>
 * </ul>
 *
 * <p>
 * Every method holds the monitor only for a read-compute-write and never
 * across a wait.
 */
@Slf4j
public class TokenAccountant {

    private final Object lock = new Object();

    private TokenTracker tracker = TokenTracker.empty();
    private TurnTokenAccumulator turn = new TurnTokenAccumulator();
    private long contextTokens;
    private long callInputTokens;

    /**
     * Compaction threshold for a backend's context window.
     */
    public static long threshold(int contextWindow, double ratio) {
        return (long) Math.floor(contextWindow * ratio);
    }

    public void beginTurn() {
        synchronized (lock) {
            turn = new TurnTokenAccumulator();
        }
    }

    /**
     * Applies a usage event and returns the cumulative totals including the turn
     * in progress.
     */
    public TokenTracker apply(BackendEvent event) {
        synchronized (lock) {
            turn.apply(event);
            updateContext(event);
            return tracker.plus(turn.total());
        }
    }

    /**
     * Folds the turn in progress into the session totals.
     */
    public TokenTracker commitTurn() {
        synchronized (lock) {
            turn.finish();
            tracker = tracker.plus(turn.total());
            log.debug("[Tokens] Turn committed after {} call(s): {}", turn.getCommittedCalls(), tracker);
            turn = new TurnTokenAccumulator();
            return tracker;
        }
    }

    /**
     * Replaces the token state, e.g. after compaction or a history restore.
     */
    public void reset(TokenTracker newTracker, long newContextTokens) {
        synchronized (lock) {
            tracker = newTracker;
            turn = new TurnTokenAccumulator();
            contextTokens = newContextTokens;
            callInputTokens = 0;
        }
    }

    public TokenTracker snapshot() {
        synchronized (lock) {
            return tracker.plus(turn.total());
        }
    }

    public long contextTokens() {
        synchronized (lock) {
            return contextTokens;
        }
    }

    private void updateContext(BackendEvent event) {
        TokenUsage usage = event.getUsage();
        if (usage == null) {
            return;
        }
        long input = usage.inputTokens() + usage.cacheReadInputTokens() + usage.cacheCreationInputTokens();
        switch (event.getType()) {
        case CALL_START -> {
            callInputTokens = input;
            contextTokens = Math.max(contextTokens, input);
        }
        case STREAM_DELTA -> contextTokens = Math.max(contextTokens,
                Math.max(callInputTokens, input) + usage.outputTokens());
        case FINAL_RESPONSE -> contextTokens = input + usage.outputTokens();
        default -> {
            // not a usage event
        }
        }
    }
}
