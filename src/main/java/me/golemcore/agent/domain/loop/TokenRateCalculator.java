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

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Output rate of a stream in tokens per second.
 *
 * <p>
 * The raw rate is measured over the samples of the last second and smoothed
 * exponentially. The smoothing weight follows the relative change of the raw
 * rate, so a steady stream keeps a stable figure while a real speed change
 * shows up within a few samples. No rate is reported until the samples span at
 * least {@value #MIN_SPAN_MS} ms.
 */
public class TokenRateCalculator {

    static final long WINDOW_MS = 1000;
    static final long MIN_SPAN_MS = 50;

    private static final double MIN_ALPHA = 0.1;
    private static final double MAX_ALPHA = 0.9;

    private final Clock clock;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private long totalTokens;
    private double smoothedRate = -1;

    public TokenRateCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records {@code tokens} produced now.
     *
     * @return the smoothed rate, empty while there is not enough data
     */
    public OptionalDouble record(long tokens) {
        long now = clock.millis();
        totalTokens += Math.max(0, tokens);
        samples.addLast(new Sample(now, totalTokens));
        while (samples.size() > 1 && samples.peekFirst().atMillis() < now - WINDOW_MS) {
            samples.removeFirst();
        }
        return calculate();
    }

    public OptionalDouble currentRate() {
        return smoothedRate < 0 ? OptionalDouble.empty() : OptionalDouble.of(smoothedRate);
    }

    public long getTotalTokens() {
        return totalTokens;
    }

    private OptionalDouble calculate() {
        if (samples.size() < 2) {
            return OptionalDouble.empty();
        }
        Sample oldest = samples.peekFirst();
        Sample newest = samples.peekLast();
        long spanMillis = newest.atMillis() - oldest.atMillis();
        if (spanMillis < MIN_SPAN_MS) {
            return OptionalDouble.empty();
        }
        double rawRate = (newest.total() - oldest.total()) * 1000.0 / spanMillis;
        if (smoothedRate <= 0) {
            smoothedRate = rawRate;
        } else {
            double alpha = Math.min(MAX_ALPHA, Math.max(MIN_ALPHA,
                    Math.abs(rawRate - smoothedRate) / smoothedRate * 2));
            smoothedRate = alpha * rawRate + (1 - alpha) * smoothedRate;
        }
        return OptionalDouble.of(smoothedRate);
    }

    private record Sample(long atMillis, long total) {
    }
}
