package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.DirtyTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fallback when no push broker is reachable: sleeps one tick at a time and, once per check
 * interval, reads the dirty token of every provider.
 *
 * <p>A store read failure counts as "no signal" for that provider; it is still swept.
 */
final class PollTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(PollTransport.class);

    private final DirtyTokenStore store;
    private final String userId;
    private final List<String> slugs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration tick;
    private final Duration checkInterval;
    private Instant lastCheck;
    private volatile boolean closed;

    PollTransport(DirtyTokenStore store, String userId, List<String> slugs, Clock clock, Sleeper sleeper,
                  Duration tick, Duration checkInterval) {
        this.store = Objects.requireNonNull(store, "store");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.slugs = List.copyOf(slugs);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.tick = Objects.requireNonNull(tick, "tick");
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval");
        this.lastCheck = clock.instant();
    }

    @Override
    public String name() {
        return "poll";
    }

    @Override
    public Wake await(Duration maxWait) throws InterruptedException {
        if (closed) return Wake.idle();
        sleeper.sleep(maxWait.compareTo(tick) < 0 ? maxWait : tick);
        if (closed) return Wake.idle();

        Instant now = clock.instant();
        if (Duration.between(lastCheck, now).compareTo(checkInterval) < 0) {
            return Wake.idle();
        }
        lastCheck = now;

        Map<String, DirtyToken> tokens = new LinkedHashMap<>();
        for (String slug : slugs) {
            try {
                Optional<DirtyToken> token = store.get(slug, userId);
                token.ifPresent(t -> tokens.put(slug, t));
            } catch (Exception e) {
                log.warn("Dirty token read failed (provider={}, user={}), treating as no signal", slug, userId, e);
            }
        }
        return new Wake(tokens, true);
    }

    @Override
    public void close() {
        closed = true;
    }
}
