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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Interrupt source for interactive terminals. Escape or Ctrl+C sets the
 * interrupt flag; a periodic tick lets the loop flush batched output and
 * refresh status while the backend is quiet.
 */
@Slf4j
public class KeyboardInterruptSource implements InterruptSource {

    private final Flux<KeyEvent> keyEvents;
    private final Duration statusTick;
    private final Sinks.Many<LoopSignal> wakeups = Sinks.many().multicast().directBestEffort();

    public KeyboardInterruptSource(Flux<KeyEvent> keyEvents, Duration statusTick) {
        this.keyEvents = keyEvents;
        this.statusTick = statusTick;
    }

    @Override
    public Flux<LoopSignal> signals(AtomicBoolean interruptFlag) {
        Flux<LoopSignal> keys = keyEvents
                .filter(KeyEvent::isCancel)
                .doOnNext(key -> {
                    log.info("[Stream] Interrupt requested by key {}", key.key());
                    interruptFlag.set(true);
                })
                .map(key -> LoopSignal.WAKE);
        Flux<LoopSignal> ticks = Flux.interval(statusTick).map(tick -> LoopSignal.TICK);
        return Flux.merge(keys, ticks, wakeups.asFlux());
    }

    @Override
    public void wake() {
        wakeups.tryEmitNext(LoopSignal.WAKE);
    }
}
