package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.DirtyTokenStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference in-memory {@link DirtyTokenStore}.
 *
 * <p>Good for single-node deployments, unit tests and examples. Multi-node deployments need a
 * shared store so producers and connections on different nodes see the same tokens.
 *
 * <p>Expired entries are reclaimed when read, and by a full purge every
 * {@value #PURGE_EVERY_WRITES} writes, so tokens for users who never connect do not accumulate.
 */
public final class InMemoryDirtyTokenStore implements DirtyTokenStore {

    static final int PURGE_EVERY_WRITES = 1024;

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();
    private final Clock clock;

    public InMemoryDirtyTokenStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDirtyTokenStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void set(String slug, String userId, DirtyToken token, Duration ttl) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be > 0");
        entries.put(new Key(slug, userId), new Entry(token, clock.instant().plus(ttl)));
        if (writes.incrementAndGet() % PURGE_EVERY_WRITES == 0) {
            purgeExpired();
        }
    }

    @Override
    public Optional<DirtyToken> get(String slug, String userId) {
        Key key = new Key(slug, userId);
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (!clock.instant().isBefore(e.expiresAt)) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.token);
    }

    /**
     * Drops expired entries. Reads already ignore them; this only reclaims memory.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int[] removed = {0};
        entries.entrySet().removeIf(en -> {
            boolean expired = !now.isBefore(en.getValue().expiresAt);
            if (expired) removed[0]++;
            return expired;
        });
        return removed[0];
    }

    int size() {
        return entries.size();
    }

    private record Key(String slug, String userId) {
        Key {
            Objects.requireNonNull(slug, "slug");
            Objects.requireNonNull(userId, "userId");
        }
    }

    private record Entry(DirtyToken token, Instant expiresAt) {}
}
