package com.ryuqq.registry.testkit.contract;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually advanced clock with one-second resolution.
 *
 * <p>Starts at a fixed epoch second and moves only when {@link #advance(long)} is called,
 * so timestamps written by the registry are predictable in assertions.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class SteppingClock extends Clock {

    private final AtomicLong epochSecond;
    private final ZoneId zone;

    public SteppingClock(long startEpochSecond) {
        this(new AtomicLong(startEpochSecond), ZoneOffset.UTC);
    }

    private SteppingClock(AtomicLong epochSecond, ZoneId zone) {
        this.epochSecond = epochSecond;
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param seconds seconds to add (must be non-negative)
     * @return the new epoch second
     */
    public long advance(long seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("seconds must be non-negative (current: " + seconds + ")");
        }
        return epochSecond.addAndGet(seconds);
    }

    public long currentSecond() {
        return epochSecond.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new SteppingClock(epochSecond, zone);
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochSecond(epochSecond.get());
    }
}
