package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.TokenGenerator;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-based {@link TokenGenerator}: epoch microseconds, bumped to stay strictly increasing,
 * encoded as fixed-width base-36 so string order matches numeric order.
 */
public final class LexiLongTokenGenerator implements TokenGenerator {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public LexiLongTokenGenerator() {
        this(Clock.systemUTC());
    }

    public LexiLongTokenGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public DirtyToken next() {
        long now = clock.millis() * 1000L;
        long value = last.updateAndGet(prev -> Math.max(prev + 1, now));
        return new DirtyToken(LexiLong.encode(value));
    }
}
