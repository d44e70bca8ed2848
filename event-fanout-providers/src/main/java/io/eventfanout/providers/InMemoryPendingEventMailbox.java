package io.eventfanout.providers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference in-memory {@link PendingEventMailbox}. Each append extends the mailbox's expiry to
 * the TTL; an expired mailbox is dropped unread.
 */
public final class InMemoryPendingEventMailbox implements PendingEventMailbox {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Map<Key, Box> boxes = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryPendingEventMailbox() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    public InMemoryPendingEventMailbox(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void append(String slug, String userId, Entry entry) {
        Objects.requireNonNull(entry, "entry");
        Instant now = clock.instant();
        boxes.compute(new Key(slug, userId), (k, box) -> {
            List<Entry> entries = box == null || box.expired(now) ? new ArrayList<>() : box.entries;
            entries.add(entry);
            return new Box(entries, now.plus(ttl));
        });
    }

    @Override
    public List<Entry> drain(String slug, String userId) {
        Box box = boxes.remove(new Key(slug, userId));
        if (box == null || box.expired(clock.instant())) return List.of();
        return List.copyOf(box.entries);
    }

    private record Key(String slug, String userId) {
        Key {
            Objects.requireNonNull(slug, "slug");
            Objects.requireNonNull(userId, "userId");
        }
    }

    private record Box(List<Entry> entries, Instant expiresAt) {
        boolean expired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
