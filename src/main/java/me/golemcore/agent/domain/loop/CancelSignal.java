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

import me.golemcore.agent.domain.model.CancellationReason;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One-shot cancellation of an in-flight backend stream. The first reason wins;
 * later calls are ignored.
 */
public class CancelSignal {

    private final AtomicReference<CancellationReason> reason = new AtomicReference<>();
    private final List<Consumer<CancellationReason>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return {@code true} if this call cancelled the stream
     */
    public boolean cancel(CancellationReason cancellationReason) {
        if (!reason.compareAndSet(null, cancellationReason)) {
            return false;
        }
        for (Consumer<CancellationReason> listener : listeners) {
            listener.accept(cancellationReason);
        }
        return true;
    }

    /**
     * Registers a listener. A listener added after cancellation is invoked
     * immediately.
     */
    public void onCancel(Consumer<CancellationReason> listener) {
        listeners.add(listener);
        CancellationReason current = reason.get();
        if (current != null) {
            listener.accept(current);
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<CancellationReason> getReason() {
        return Optional.ofNullable(reason.get());
    }
}
