package io.eventfanout.server.core;

import io.eventfanout.server.spi.PushBroker;
import io.eventfanout.server.spi.PushMessage;
import io.eventfanout.server.spi.PushSubscription;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reference in-process {@link PushBroker}: one queue per subscription, channels keyed by user id.
 *
 * <p>Good for single-node deployments and tests. Availability can be toggled to exercise the
 * polling fallback.
 */
public final class InMemoryPushBroker implements PushBroker {

    private static final Object CLOSED = new Object();

    private final Map<String, Set<Sub>> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean available = new AtomicBoolean(true);

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    public void setAvailable(boolean available) {
        this.available.set(available);
    }

    @Override
    public void publish(String userId, PushMessage message) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(message, "message");
        if (!available.get()) throw new IllegalStateException("broker unavailable");
        Set<Sub> subs = channels.get(userId);
        if (subs == null) return;
        for (Sub s : subs) {
            s.queue.offer(message);
        }
    }

    @Override
    public PushSubscription subscribe(String userId) {
        Objects.requireNonNull(userId, "userId");
        if (!available.get()) throw new IllegalStateException("broker unavailable");
        Sub sub = new Sub(userId);
        channels.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(sub);
        return sub;
    }

    /** Number of open subscriptions on a user's channel. */
    public int subscriberCount(String userId) {
        Set<Sub> subs = channels.get(userId);
        return subs == null ? 0 : subs.size();
    }

    private final class Sub implements PushSubscription {
        private final String userId;
        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean open = new AtomicBoolean(true);

        private Sub(String userId) {
            this.userId = userId;
        }

        @Override
        public Optional<PushMessage> await(Duration timeout) throws InterruptedException {
            if (!open.get()) return Optional.empty();
            Object next = queue.poll(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
            if (next == null || next == CLOSED) return Optional.empty();
            return Optional.of((PushMessage) next);
        }

        @Override
        public void close() {
            if (!open.compareAndSet(true, false)) return;
            channels.computeIfPresent(userId, (k, subs) -> {
                subs.remove(this);
                return subs.isEmpty() ? null : subs;
            });
            queue.offer(CLOSED);
        }
    }
}
