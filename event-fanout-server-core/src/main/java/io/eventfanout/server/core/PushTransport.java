package io.eventfanout.server.core;

import io.eventfanout.server.spi.PushMessage;
import io.eventfanout.server.spi.PushSubscription;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Waits on the user's push channel. A message names the one provider to poll; a sweep of every
 * provider is requested once per sweep interval for providers that emit on their own timer.
 */
final class PushTransport implements Transport {

    private final PushSubscription subscription;
    private final Clock clock;
    private final Duration pushWait;
    private final Duration sweepInterval;
    private Instant lastSweep;

    PushTransport(PushSubscription subscription, Clock clock, Duration pushWait, Duration sweepInterval) {
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pushWait = Objects.requireNonNull(pushWait, "pushWait");
        this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
        this.lastSweep = clock.instant();
    }

    @Override
    public String name() {
        return "push";
    }

    @Override
    public Wake await(Duration maxWait) throws InterruptedException {
        Duration timeout = maxWait.compareTo(pushWait) < 0 ? maxWait : pushWait;
        Optional<PushMessage> message = subscription.await(timeout);

        Instant now = clock.instant();
        boolean sweep = !Duration.between(lastSweep, now).minus(sweepInterval).isNegative();
        if (sweep) lastSweep = now;

        if (message.isPresent()) {
            return Wake.targeted(message.get().slug(), message.get().token(), sweep);
        }
        return sweep ? new Wake(Map.of(), true) : Wake.idle();
    }

    @Override
    public void close() {
        subscription.close();
    }
}
