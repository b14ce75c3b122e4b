package me.golemcore.agent.domain.loop;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

final class MutableClock extends Clock {

    private Instant now;
    private long stepMillis;

    MutableClock(Instant start) {
        this.now = start;
    }

    void advance(long millis) {
        now = now.plusMillis(millis);
    }

    /**
     * Moves the clock forward by {@code millis} after every read.
     */
    void stepOnRead(long millis) {
        this.stepMillis = millis;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        Instant current = now;
        now = now.plusMillis(stepMillis);
        return current;
    }
}
