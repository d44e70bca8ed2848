package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyTokenStore;
import io.eventfanout.server.spi.PushBroker;
import io.eventfanout.server.spi.PushSubscription;
import io.eventfanout.server.spi.StreamUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Prefers the push transport; falls back to polling the {@link DirtyTokenStore} when no broker is
 * configured, the broker reports itself unavailable, or subscribing fails.
 */
public final class BrokerAwareTransportSelector implements TransportSelector {

    private static final Logger log = LoggerFactory.getLogger(BrokerAwareTransportSelector.class);

    private final PushBroker broker;
    private final DirtyTokenStore store;
    private final EventStreamSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    public BrokerAwareTransportSelector(PushBroker broker, DirtyTokenStore store, EventStreamSettings settings,
                                        Clock clock, Sleeper sleeper) {
        this.broker = broker;
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public Transport select(StreamUser user, List<String> slugs) {
        if (broker != null) {
            try {
                if (broker.isAvailable()) {
                    PushSubscription subscription = broker.subscribe(user.id());
                    return new PushTransport(subscription, clock, settings.pushWait(), settings.sweepInterval());
                }
                log.debug("Push broker unavailable, polling for user {}", user.id());
            } catch (Exception e) {
                log.warn("Push subscribe failed for user {}, falling back to polling", user.id(), e);
            }
        }
        return new PollTransport(store, user.id(), slugs, clock, sleeper,
                settings.pollTick(), settings.pollCheckInterval());
    }
}
