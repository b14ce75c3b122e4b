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
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interrupt source for embedding hosts: the host cancels through the session,
 * which sets the flag and calls {@link #wake()}.
 */
public class HostWakeInterruptSource implements InterruptSource {

    private final Sinks.Many<LoopSignal> wakeups = Sinks.many().multicast().directBestEffort();

    @Override
    public Flux<LoopSignal> signals(AtomicBoolean interruptFlag) {
        return wakeups.asFlux();
    }

    @Override
    public void wake() {
        wakeups.tryEmitNext(LoopSignal.WAKE);
    }
}
