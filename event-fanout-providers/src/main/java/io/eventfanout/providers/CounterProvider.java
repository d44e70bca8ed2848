package io.eventfanout.providers;

import io.eventfanout.core.Event;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.ProviderFactory;
import io.eventfanout.server.spi.StreamUser;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Emits a freshly computed count (unread notifications, unread messages per conversation, ...)
 * when the connection opens, on every dirty signal, and optionally every refresh interval.
 */
public final class CounterProvider implements EventProvider {

    /** Computes the payload sent to the user, typically a number or a small map. */
    @FunctionalInterface
    public interface Source {
        Object count(StreamUser user) throws Exception;
    }

    private final String slug;
    private final String eventName;
    private final Source source;
    private final StreamUser user;
    private final Duration refreshInterval;
    private final Clock clock;
    private Instant lastPush;

    private CounterProvider(Builder b, StreamUser user) {
        this.slug = b.slug;
        this.eventName = b.eventName;
        this.source = b.source;
        this.refreshInterval = b.refreshInterval;
        this.clock = b.clock;
        this.user = user;
    }

    public static Builder builder(String slug, String eventName, Source source) {
        return new Builder(slug, eventName, source);
    }

    @Override
    public List<Event> initialEvents() throws Exception {
        return List.of(count());
    }

    @Override
    public List<Event> poll(DirtyToken dirtyToken) throws Exception {
        if (dirtyToken != null || refreshDue()) {
            return List.of(count());
        }
        return List.of();
    }

    private boolean refreshDue() {
        if (refreshInterval == null || lastPush == null) return false;
        return !clock.instant().isBefore(lastPush.plus(refreshInterval));
    }

    private Event count() throws Exception {
        lastPush = clock.instant();
        return Event.of(slug, eventName, source.count(user));
    }

    public static final class Builder {
        private final String slug;
        private final String eventName;
        private final Source source;
        private Duration refreshInterval;
        private Clock clock = Clock.systemUTC();

        private Builder(String slug, String eventName, Source source) {
            this.slug = Objects.requireNonNull(slug, "slug");
            this.eventName = Objects.requireNonNull(eventName, "eventName");
            this.source = Objects.requireNonNull(source, "source");
        }

        /** Also recompute on untargeted polls once this much time passed. Default: never. */
        public Builder refreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ProviderFactory factory() {
            return (user, resumeId) -> new CounterProvider(this, user);
        }
    }
}
