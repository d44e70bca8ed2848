package io.eventfanout.server.core;

import io.eventfanout.core.SseFrame;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Publishes the frames of one {@link ConnectionSession}.
 *
 * <p>Accepts a single subscriber. The session starts on the executor with the first
 * {@link Flow.Subscription#request(long)} and honours demand; cancelling the subscription
 * cancels the session.
 */
final class EventStreamPublisher implements Flow.Publisher<SseFrame> {

    private final ConnectionSession session;
    private final Executor executor;
    private final AtomicInteger activeConnections;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    EventStreamPublisher(ConnectionSession session, Executor executor, AtomicInteger activeConnections) {
        this.session = Objects.requireNonNull(session, "session");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.activeConnections = Objects.requireNonNull(activeConnections, "activeConnections");
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }

                @Override
                public void cancel() {
                }
            });
            subscriber.onError(new IllegalStateException("event stream already has a subscriber"));
            return;
        }
        subscriber.onSubscribe(new Sub(subscriber));
    }

    private final class Sub implements Flow.Subscription, FrameSink {
        private final Flow.Subscriber<? super SseFrame> sub;
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition demandAvailable = lock.newCondition();
        private final AtomicBoolean started = new AtomicBoolean(false);
        private final AtomicBoolean done = new AtomicBoolean(false);
        private long demand;
        private volatile boolean cancelled;

        Sub(Flow.Subscriber<? super SseFrame> sub) {
            this.sub = sub;
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                cancel();
                if (done.compareAndSet(false, true)) {
                    sub.onError(new IllegalArgumentException("request must be positive, was " + n));
                }
                return;
            }
            lock.lock();
            try {
                demand = demand + n < 0 ? Long.MAX_VALUE : demand + n;
                demandAvailable.signalAll();
            } finally {
                lock.unlock();
            }
            if (started.compareAndSet(false, true)) {
                try {
                    executor.execute(this::run);
                } catch (RejectedExecutionException e) {
                    cancelled = true;
                    if (done.compareAndSet(false, true)) {
                        sub.onError(e);
                    }
                }
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            session.cancel();
            lock.lock();
            try {
                demandAvailable.signalAll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void send(SseFrame frame) throws IOException, InterruptedException {
            lock.lock();
            try {
                while (demand == 0 && !cancelled) {
                    demandAvailable.await();
                }
                if (cancelled) return;
                if (demand != Long.MAX_VALUE) demand--;
            } finally {
                lock.unlock();
            }
            try {
                sub.onNext(frame);
            } catch (RuntimeException e) {
                throw new IOException("subscriber failed to take frame", e);
            }
        }

        private void run() {
            activeConnections.incrementAndGet();
            try {
                session.run(this);
                if (!cancelled && done.compareAndSet(false, true)) {
                    sub.onComplete();
                }
            } catch (Throwable t) {
                if (!cancelled && done.compareAndSet(false, true)) {
                    sub.onError(t);
                }
            } finally {
                activeConnections.decrementAndGet();
            }
        }
    }
}
