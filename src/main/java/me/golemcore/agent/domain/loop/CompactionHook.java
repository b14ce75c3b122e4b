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

import me.golemcore.agent.domain.model.BackendEvent;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.service.TokenAccountant;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observer attached to a live backend stream. Records every usage event and,
 * when a call starts with a projected context at or above the threshold,
 * cancels the stream so the session can compact before the request grows.
 *
 * <p>
 * The projection is the larger of the last known context size and the
 * estimated size of the payload sent with this stream.
 */
@Slf4j
public class CompactionHook {

    private final TokenAccountant accountant;
    private final long threshold;
    private final long estimatedPayload;
    private final CancelSignal cancelSignal;
    private final AtomicBoolean compactionNeeded = new AtomicBoolean(false);

    public CompactionHook(TokenAccountant accountant, long threshold, long estimatedPayload,
            CancelSignal cancelSignal) {
        this.accountant = accountant;
        this.threshold = threshold;
        this.estimatedPayload = estimatedPayload;
        this.cancelSignal = cancelSignal;
    }

    public void observe(BackendEvent event) {
        if (!event.isUsage()) {
            return;
        }
        accountant.apply(event);
        if (event.getType() != BackendEvent.Type.CALL_START || compactionNeeded.get()) {
            return;
        }
        long projected = Math.max(accountant.contextTokens(), estimatedPayload);
        log.debug("[AutoCompact] Call {} projected {} tokens, threshold {}", event.getCallIndex(), projected,
                threshold);
        if (projected >= threshold) {
            compactionNeeded.set(true);
            log.info("[AutoCompact] Compaction triggered: {} tokens >= {} threshold", projected, threshold);
            cancelSignal.cancel(CancellationReason.COMPACTION);
        }
    }

    public boolean isCompactionNeeded() {
        return compactionNeeded.get();
    }

    public long getThreshold() {
        return threshold;
    }
}
