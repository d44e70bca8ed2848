package io.eventfanout.providers;

import io.eventfanout.core.Event;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.ProviderFactory;
import io.eventfanout.server.spi.StreamUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Streams new {@link ChangeFeed} items to one connection.
 *
 * <p>The cursor starts at the item named by the client's resume id (the connection then catches
 * up on everything after it in {@link #initialEvents()}), or at connection time minus the
 * configured lookback. Items sharing the resume item's position are read again, and only those the
 * feed orders after it are sent. Each dirty signal reads the items after the cursor, and also
 * re-reads an overlap window behind it so items committed late with an earlier position are not
 * missed; ids already sent on this connection are skipped. While a read comes back full, untargeted
 * polls keep reading until the backlog is drained.
 *
 * <pre>{@code
 * registry.register("chat", ChangeFeedProvider.builder("chat", "message", messages)
 *     .overlap(Duration.ofSeconds(5))
 *     .limit(50)
 *     .factory());
 * }</pre>
 */
public final class ChangeFeedProvider<T> implements EventProvider {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeedProvider.class);

    public static final Duration DEFAULT_OVERLAP = Duration.ofSeconds(5);
    public static final int DEFAULT_LIMIT = 50;
    static final int MAX_REMEMBERED_IDS = 10_000;

    private final String slug;
    private final String eventName;
    private final ChangeFeed<T> feed;
    private final StreamUser user;
    private final Duration overlap;
    private final int limit;
    private final Instant floor;
    private final Instant start;
    private final boolean resumed;
    private final Set<String> seen = new LinkedHashSet<>();
    private Instant cursor;
    private String anchorId;
    private boolean backlog;

    private ChangeFeedProvider(Builder<T> b, StreamUser user, String resumeId) throws Exception {
        this.slug = b.slug;
        this.eventName = b.eventName;
        this.feed = b.feed;
        this.user = user;
        this.overlap = b.overlap;
        this.limit = b.limit;

        Optional<Instant> resumeAt = resumeId == null ? Optional.empty() : feed.positionOf(user, resumeId);
        if (resumeId != null && resumeAt.isEmpty()) {
            log.debug("Unknown resume id '{}' for provider {} (user {}), starting from now", resumeId, slug, user.id());
        }
        this.resumed = resumeAt.isPresent();
        this.floor = resumeAt.orElseGet(() -> b.clock.instant().minus(b.lookback));
        // the feed reads strictly after its bound; items at the floor itself must be read
        this.start = floor.minusNanos(1);
        this.cursor = start;
        if (resumed) {
            anchorId = resumeId;
            remember(resumeId);
        }
    }

    public static <T> Builder<T> builder(String slug, String eventName, ChangeFeed<T> feed) {
        return new Builder<>(slug, eventName, feed);
    }

    @Override
    public List<Event> initialEvents() throws Exception {
        return resumed ? fetch() : List.of();
    }

    @Override
    public List<Event> poll(DirtyToken dirtyToken) throws Exception {
        if (dirtyToken == null && !backlog) return List.of();
        return fetch();
    }

    private List<Event> fetch() throws Exception {
        List<Event> events = new ArrayList<>();
        Instant from = cursor;
        if (!overlap.isZero() && from.isAfter(start)) {
            Instant lateFrom = from.minus(overlap);
            for (ChangeFeed.Item<T> item : feed.after(user, lateFrom.isBefore(start) ? start : lateFrom, limit)) {
                if (item.position().isAfter(from)) break;
                collect(item, events);
            }
        }
        List<ChangeFeed.Item<T>> batch = feed.after(user, from, limit);
        backlog = batch.size() >= limit;
        for (ChangeFeed.Item<T> item : skipThroughAnchor(batch)) {
            collect(item, events);
        }
        return events;
    }

    /**
     * On the first read after a resume, drops the resume item and the items the feed orders before
     * it at the same position; the previous connection already sent them. If the resume item is not
     * in the batch nothing is dropped.
     */
    private List<ChangeFeed.Item<T>> skipThroughAnchor(List<ChangeFeed.Item<T>> batch) {
        if (anchorId == null) return batch;
        String anchor = anchorId;
        anchorId = null;
        for (int i = 0; i < batch.size(); i++) {
            if (!batch.get(i).id().equals(anchor)) continue;
            for (ChangeFeed.Item<T> sent : batch.subList(0, i + 1)) {
                remember(sent.id());
                advance(sent.position());
            }
            return batch.subList(i + 1, batch.size());
        }
        return batch;
    }

    private void collect(ChangeFeed.Item<T> item, List<Event> events) {
        if (item.position().isBefore(floor) || !remember(item.id())) return;
        events.add(Event.of(slug, eventName, item.payload(), item.id()));
        advance(item.position());
    }

    private void advance(Instant position) {
        if (position.isAfter(cursor)) cursor = position;
    }

    private boolean remember(String id) {
        if (!seen.add(id)) return false;
        if (seen.size() > MAX_REMEMBERED_IDS) {
            Iterator<String> oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    /**
     * Builder for {@link ChangeFeedProvider} factories.
     */
    public static final class Builder<T> {
        private final String slug;
        private final String eventName;
        private final ChangeFeed<T> feed;
        private Duration overlap = DEFAULT_OVERLAP;
        private Duration lookback = Duration.ZERO;
        private int limit = DEFAULT_LIMIT;
        private Clock clock = Clock.systemUTC();

        private Builder(String slug, String eventName, ChangeFeed<T> feed) {
            this.slug = Objects.requireNonNull(slug, "slug");
            this.eventName = Objects.requireNonNull(eventName, "eventName");
            this.feed = Objects.requireNonNull(feed, "feed");
        }

        /** Re-query window behind the cursor for late commits. Default: 5 seconds. */
        public Builder<T> overlap(Duration overlap) {
            this.overlap = Objects.requireNonNull(overlap, "overlap");
            return this;
        }

        /** How far before connection time a fresh (non-resumed) connection starts. Default: zero. */
        public Builder<T> lookback(Duration lookback) {
            this.lookback = Objects.requireNonNull(lookback, "lookback");
            return this;
        }

        /** Maximum items fetched per query. Default: 50. */
        public Builder<T> limit(int limit) {
            if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
            this.limit = limit;
            return this;
        }

        public Builder<T> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ProviderFactory factory() {
            return (user, resumeId) -> new ChangeFeedProvider<>(this, user, resumeId);
        }
    }
}
