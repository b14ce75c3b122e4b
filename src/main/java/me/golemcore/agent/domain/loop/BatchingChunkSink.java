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

import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.port.outbound.ChunkSink;

import java.time.Clock;

/**
 * Coalesces text chunks before they reach the consumer. Pending text is
 * flushed once it reaches the batch size or age, and always before any other
 * chunk so ordering is preserved.
 */
public class BatchingChunkSink implements ChunkSink {

    private final ChunkSink delegate;
    private final int batchChars;
    private final long batchIntervalMs;
    private final Clock clock;

    private final StringBuilder pending = new StringBuilder();
    private long pendingSince;

    public BatchingChunkSink(ChunkSink delegate, int batchChars, long batchIntervalMs, Clock clock) {
        this.delegate = delegate;
        this.batchChars = Math.max(1, batchChars);
        this.batchIntervalMs = batchIntervalMs;
        this.clock = clock;
    }

    @Override
    public void accept(StreamChunk chunk) {
        if (chunk.getType() == StreamChunk.ChunkType.TEXT) {
            if (chunk.getText() == null || chunk.getText().isEmpty()) {
                return;
            }
            if (pending.length() == 0) {
                pendingSince = clock.millis();
            }
            pending.append(chunk.getText());
            flushIfDue();
            return;
        }
        flush();
        delegate.accept(chunk);
    }

    /**
     * Flushes pending text when the batch is full or has waited long enough.
     */
    public void flushIfDue() {
        if (pending.length() == 0) {
            return;
        }
        if (pending.length() >= batchChars || clock.millis() - pendingSince >= batchIntervalMs) {
            flush();
        }
    }

    public void flush() {
        if (pending.length() == 0) {
            return;
        }
        String text = pending.toString();
        pending.setLength(0);
        delegate.accept(StreamChunk.text(text));
    }
}
