package io.eventfanout.providers;

import io.eventfanout.core.Event;
import io.eventfanout.server.core.SnapshotCache;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.ProviderFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Sends a process-wide view (who is online, ...) when the connection opens, then re-reads the
 * shared {@link SnapshotCache} every interval and sends it again only when it changed.
 * Dirty signals are ignored.
 */
public final class SnapshotProvider<T> implements EventProvider {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);

    private final String slug;
    private final String eventName;
    private final SnapshotCache<T> cache;
    private final Duration interval;
    private final Clock clock;
    private T last;
    private Instant lastCheck;

    private SnapshotProvider(Builder<T> b) {
        this.slug = b.slug;
        this.eventName = b.eventName;
        this.cache = b.cache;
        this.interval = b.interval;
        this.clock = b.clock;
    }

    public static <T> Builder<T> builder(String slug, String eventName, SnapshotCache<T> cache) {
        return new Builder<>(slug, eventName, cache);
    }

    @Override
    public List<Event> initialEvents() throws Exception {
        lastCheck = clock.instant();
        last = cache.get();
        return List.of(Event.of(slug, eventName, last));
    }

    @Override
    public List<Event> poll(DirtyToken dirtyToken) throws Exception {
        Instant now = clock.instant();
        if (lastCheck != null && now.isBefore(lastCheck.plus(interval))) return List.of();
        lastCheck = now;

        T current = cache.get();
        if (Objects.equals(current, last)) return List.of();
        last = current;
        return List.of(Event.of(slug, eventName, current));
    }

    public static final class Builder<T> {
        private final String slug;
        private final String eventName;
        private final SnapshotCache<T> cache;
        private Duration interval = DEFAULT_INTERVAL;
        private Clock clock = Clock.systemUTC();

        private Builder(String slug, String eventName, SnapshotCache<T> cache) {
            this.slug = Objects.requireNonNull(slug, "slug");
            this.eventName = Objects.requireNonNull(eventName, "eventName");
            this.cache = Objects.requireNonNull(cache, "cache");
        }

        /** Minimum time between two reads of the cache. Default: 10 seconds. */
        public Builder<T> interval(Duration interval) {
            this.interval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ProviderFactory factory() {
            return (user, resumeId) -> new SnapshotProvider<>(this);
        }
    }
}
