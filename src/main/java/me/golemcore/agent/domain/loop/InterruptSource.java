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

import reactor.core.publisher.Flux;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External signals raced against the backend stream while the loop waits for
 * the next chunk. The loop checks the interrupt flag after every signal, so a
 * cancel takes effect even while the transport is silent.
 */
public interface InterruptSource {

    /**
     * Signals for one stream. Implementations that detect a cancel request set
     * {@code interruptFlag} before emitting.
     */
    Flux<LoopSignal> signals(AtomicBoolean interruptFlag);

    /**
     * Wakes a loop that is currently waiting.
     */
    void wake();
}
