package io.eventfanout.server.core;

import io.eventfanout.core.Event;
import io.eventfanout.core.EventFanoutException;
import io.eventfanout.core.SseFrame;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.ProviderDescriptor;
import io.eventfanout.server.spi.StreamUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client connection: instantiates the registered providers, emits their initial events,
 * then waits on its {@link Transport} and polls providers until the client leaves or the
 * lifetime cap is reached.
 *
 * <p>{@link #run(FrameSink)} executes on the connection's own task. {@link #cancel()} may be
 * called from any thread.
 */
final class ConnectionSession {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    enum State { CONNECTING, STREAMING, CLOSED }

    private final StreamUser user;
    private final String resumeId;
    private final List<ProviderDescriptor> descriptors;
    private final TransportSelector selector;
    private final EventFrames frames;
    private final EventStreamSettings settings;
    private final Clock clock;

    private final Map<String, EventProvider> providers = new LinkedHashMap<>();
    private final Map<String, DirtyToken> lastObserved = new HashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Object runnerLock = new Object();

    private volatile State state = State.CONNECTING;
    private volatile Transport transport;
    private Thread runner;
    private FrameSink sink;
    private Instant lastWrite;
    private Instant deadline;

    ConnectionSession(StreamUser user, String resumeId, List<ProviderDescriptor> descriptors,
                      TransportSelector selector, EventFrames frames, EventStreamSettings settings, Clock clock) {
        this.user = Objects.requireNonNull(user, "user");
        this.resumeId = resumeId;
        this.descriptors = List.copyOf(descriptors);
        this.selector = Objects.requireNonNull(selector, "selector");
        this.frames = Objects.requireNonNull(frames, "frames");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    State state() {
        return state;
    }

    /**
     * Streams until cancelled or the lifetime cap. Cleanup always runs before returning.
     *
     * @throws RuntimeException on unexpected engine failures; provider failures never escape
     */
    void run(FrameSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
        synchronized (runnerLock) {
            runner = Thread.currentThread();
        }
        Instant started = clock.instant();
        lastWrite = started;
        deadline = started.plus(settings.maxLifetime());
        log.debug("Event stream opened for user {} (resumeId={})", user.id(), resumeId);
        try {
            open();
            if (cancelled.get()) return;
            state = State.STREAMING;
            emitInitialEvents();
            loop();
        } catch (InterruptedException e) {
            log.debug("Event stream for user {} interrupted", user.id());
        } catch (IOException e) {
            log.debug("Client of user {} went away: {}", user.id(), e.toString());
            cancel();
        } finally {
            synchronized (runnerLock) {
                runner = null;
            }
            boolean interrupted = Thread.interrupted();
            close();
            if (interrupted && !cancelled.get()) {
                Thread.currentThread().interrupt();
            }
            log.debug("Event stream closed for user {} after {}", user.id(), Duration.between(started, clock.instant()));
        }
    }

    /**
     * Stops the session promptly: releases the transport so a pending wait returns, and
     * interrupts the running task. Idempotent.
     */
    void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        Transport t = transport;
        if (t != null) t.close();
        synchronized (runnerLock) {
            if (runner != null && runner != Thread.currentThread()) {
                runner.interrupt();
            }
        }
    }

    private void open() {
        for (ProviderDescriptor d : descriptors) {
            if (cancelled.get()) return;
            try {
                EventProvider provider = d.factory().create(user, resumeId);
                if (provider != null) {
                    providers.put(d.slug(), provider);
                }
            } catch (Exception e) {
                log.warn("Provider {} failed to start for user {}, skipping it", d.slug(), user.id(), e);
            }
        }
        Transport t = selector.select(user, List.copyOf(providers.keySet()));
        transport = t;
        if (cancelled.get()) {
            t.close();
        } else {
            log.debug("User {} streaming {} provider(s) over {} transport", user.id(), providers.size(), t.name());
        }
    }

    private void emitInitialEvents() throws IOException, InterruptedException {
        for (Map.Entry<String, EventProvider> e : providers.entrySet()) {
            if (stopped()) return;
            EventProvider provider = e.getValue();
            emit(e.getKey(), call(e.getKey(), "initialEvents", provider::initialEvents));
        }
    }

    private void loop() throws IOException, InterruptedException {
        Duration keepalive = settings.keepaliveInterval();
        while (!cancelled.get()) {
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                log.debug("Lifetime cap reached for user {}", user.id());
                return;
            }
            Instant keepaliveDue = lastWrite.plus(keepalive);
            if (!now.isBefore(keepaliveDue)) {
                send(SseFrame.keepalive());
                continue;
            }

            Duration untilDeadline = Duration.between(now, deadline);
            Duration untilKeepalive = Duration.between(now, keepaliveDue);
            Wake wake = transport.await(untilDeadline.compareTo(untilKeepalive) < 0 ? untilDeadline : untilKeepalive);

            if (stopped()) {
                return;
            }
            if (!wake.isIdle()) {
                handle(wake);
            }
        }
    }

    private void handle(Wake wake) throws IOException, InterruptedException {
        Set<String> polled = new HashSet<>();
        for (Map.Entry<String, DirtyToken> signal : wake.signals().entrySet()) {
            String slug = signal.getKey();
            DirtyToken token = signal.getValue();
            EventProvider provider = providers.get(slug);
            if (provider == null || token.equals(lastObserved.get(slug))) continue;

            lastObserved.put(slug, token);
            polled.add(slug);
            emit(slug, call(slug, "poll", () -> provider.poll(token)));
            if (stopped()) return;
        }
        if (!wake.sweep()) return;

        for (Map.Entry<String, EventProvider> e : providers.entrySet()) {
            if (stopped()) return;
            if (polled.contains(e.getKey())) continue;
            EventProvider provider = e.getValue();
            emit(e.getKey(), call(e.getKey(), "poll", () -> provider.poll(null)));
        }
    }

    private List<Event> call(String slug, String operation, ProviderCall call) throws InterruptedException {
        Instant begin = clock.instant();
        try {
            List<Event> events = call.invoke();
            return events == null ? List.of() : events;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Provider {}.{} failed for user {}", slug, operation, user.id(), e);
            return List.of();
        } finally {
            Duration took = Duration.between(begin, clock.instant());
            if (took.compareTo(settings.slowProviderThreshold()) > 0) {
                log.warn("Provider {}.{} took {} for user {}", slug, operation, took, user.id());
            }
        }
    }

    private void emit(String slug, List<Event> events) throws IOException, InterruptedException {
        for (Event event : events) {
            if (stopped()) return;
            if (!slug.equals(event.namespace())) {
                log.debug("Provider {} returned event {} for user {}, sending it under its own slug",
                        slug, event.qualifiedName(), user.id());
            }
            SseFrame frame;
            try {
                frame = frames.encode(slug, event);
            } catch (EventFanoutException.EncodingFailed e) {
                log.warn("Dropping event {}.{} for user {}", slug, event.name(), user.id(), e);
                continue;
            }
            send(frame);
        }
    }

    /** Writes nothing once cancelled or at the lifetime cap, however long the last provider call took. */
    private void send(SseFrame frame) throws IOException, InterruptedException {
        if (stopped()) return;
        sink.send(frame);
        lastWrite = clock.instant();
    }

    private boolean stopped() {
        return cancelled.get() || !clock.instant().isBefore(deadline);
    }

    private void close() {
        state = State.CLOSED;
        Transport t = transport;
        if (t != null) t.close();

        List<Map.Entry<String, EventProvider>> toClose = new ArrayList<>(providers.entrySet());
        providers.clear();
        for (Map.Entry<String, EventProvider> e : toClose) {
            try {
                e.getValue().close();
            } catch (Exception ex) {
                log.warn("Provider {} failed to close for user {}", e.getKey(), user.id(), ex);
            }
        }
    }

    @FunctionalInterface
    private interface ProviderCall {
        List<Event> invoke() throws Exception;
    }
}
