package io.eventfanout.server.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide memoized view of an expensive computation, shared by every connection.
 *
 * <p>Reads of a fresh value take no lock. When the value is stale, at most one caller rebuilds it;
 * callers arriving meanwhile wait for the lock, see the republished value and reuse it.
 *
 * <pre>{@code
 * SnapshotCache<Set<String>> online = new SnapshotCache<>(Duration.ofSeconds(10), presence::onlineUserIds);
 * Set<String> ids = online.get();
 * }</pre>
 *
 * @param <T> value type; should be immutable
 */
public final class SnapshotCache<T> {

    /** Computes a fresh value. */
    @FunctionalInterface
    public interface Loader<T> {
        T load() throws Exception;
    }

    private record Entry<T>(T value, Instant loadedAt) {}

    private final Duration ttl;
    private final Loader<T> loader;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Entry<T> entry;

    public SnapshotCache(Duration ttl, Loader<T> loader) {
        this(ttl, loader, Clock.systemUTC());
    }

    public SnapshotCache(Duration ttl, Loader<T> loader, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the current value, rebuilding it first when missing or older than the TTL.
     *
     * @throws Exception when the rebuild fails; the previous value, if any, stays published
     */
    public T get() throws Exception {
        Entry<T> e = entry;
        if (isFresh(e)) return e.value();

        lock.lock();
        try {
            e = entry;
            if (isFresh(e)) return e.value();
            T value = loader.load();
            entry = new Entry<>(value, clock.instant());
            return value;
        } finally {
            lock.unlock();
        }
    }

    /** Forces the next {@link #get()} to rebuild. */
    public void invalidate() {
        entry = null;
    }

    private boolean isFresh(Entry<T> e) {
        return e != null && clock.instant().isBefore(e.loadedAt().plus(ttl));
    }
}
