package com.phillippitts.streamwatch.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock helpers for deterministic weekday/hour scenarios. All clocks run in UTC.
 */
public final class TestClocks {

    /** Tuesday 2024-01-02 20:15 UTC. */
    public static final LocalDateTime TUESDAY_EVENING = LocalDateTime.of(2024, 1, 2, 20, 15);

    private TestClocks() {}

    public static Clock at(LocalDateTime time) {
        return Clock.fixed(time.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    public static MutableClock mutableAt(LocalDateTime time) {
        return new MutableClock(time.toInstant(ZoneOffset.UTC));
    }

    /**
     * Clock whose time only moves when the test advances it.
     */
    public static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
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
            return now;
        }
    }
}
