package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.DirtyTokenStore;
import io.eventfanout.server.spi.PushBroker;
import io.eventfanout.server.spi.PushMessage;
import io.eventfanout.server.spi.PushSubscription;
import io.eventfanout.server.spi.StreamUser;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TransportTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final EventStreamSettings settings = EventStreamSettings.defaults();
    private final InMemoryDirtyTokenStore store = new InMemoryDirtyTokenStore(clock);

    @Test
    void selectsPushWhenBrokerAvailable() {
        InMemoryPushBroker broker = new InMemoryPushBroker();

        Transport transport = selector(broker).select(StreamUser.of("42"), List.of("chat"));

        assertThat(transport.name()).isEqualTo("push");
        assertThat(broker.subscriberCount("42")).isEqualTo(1);
        transport.close();
        assertThat(broker.subscriberCount("42")).isZero();
    }

    @Test
    void fallsBackToPollingWhenBrokerUnavailableOrMissing() {
        InMemoryPushBroker broker = new InMemoryPushBroker();
        broker.setAvailable(false);

        assertThat(selector(broker).select(StreamUser.of("42"), List.of("chat")).name()).isEqualTo("poll");
        assertThat(selector(null).select(StreamUser.of("42"), List.of("chat")).name()).isEqualTo("poll");
    }

    @Test
    void fallsBackToPollingWhenSubscribeFails() {
        PushBroker broken = new PushBroker() {
            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public void publish(String userId, PushMessage message) {
            }

            @Override
            public PushSubscription subscribe(String userId) throws Exception {
                throw new IllegalStateException("connection refused");
            }
        };

        assertThat(selector(broken).select(StreamUser.of("42"), List.of("chat")).name()).isEqualTo("poll");
    }

    @Test
    void pushTransportTargetsTheMessageSlugAndSweepsOnInterval() throws Exception {
        InMemoryPushBroker broker = new InMemoryPushBroker();
        PushTransport transport = new PushTransport(broker.subscribe("42"), clock, Duration.ofSeconds(5), Duration.ofSeconds(2));

        broker.publish("42", new PushMessage("files", new DirtyToken("t1")));
        Wake first = transport.await(Duration.ofSeconds(1));
        assertThat(first.signals()).containsEntry("files", new DirtyToken("t1")).hasSize(1);
        assertThat(first.sweep()).isFalse();

        clock.advance(Duration.ofSeconds(2));
        Wake second = transport.await(Duration.ofMillis(10));
        assertThat(second.signals()).isEmpty();
        assertThat(second.sweep()).isTrue();

        Wake third = transport.await(Duration.ofMillis(10));
        assertThat(third.isIdle()).isTrue();
    }

    @Test
    void pushTransportCloseUnblocksWait() throws Exception {
        InMemoryPushBroker broker = new InMemoryPushBroker();
        PushTransport transport = new PushTransport(broker.subscribe("42"), clock, Duration.ofSeconds(30), Duration.ofSeconds(2));

        Thread closer = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            transport.close();
        });
        closer.start();
        long begin = System.nanoTime();
        Wake wake = transport.await(Duration.ofSeconds(30));

        assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofSeconds(10));
        assertThat(wake.signals()).isEmpty();
        assertThat(broker.subscriberCount("42")).isZero();
        closer.join();
    }

    @Test
    void pollTransportReadsTokensOnlyWhenCheckIntervalElapsed() throws Exception {
        List<Duration> slept = new ArrayList<>();
        Sleeper sleeper = d -> {
            slept.add(d);
            clock.advance(d);
        };
        PollTransport transport = new PollTransport(store, "42", List.of("chat", "files"), clock, sleeper,
                Duration.ofSeconds(1), Duration.ofSeconds(2));
        store.set("chat", "42", new DirtyToken("c1"), Duration.ofMinutes(2));

        assertThat(transport.await(Duration.ofSeconds(15)).isIdle()).isTrue();
        Wake check = transport.await(Duration.ofSeconds(15));

        assertThat(check.signals()).containsOnlyKeys("chat");
        assertThat(check.sweep()).isTrue();
        assertThat(slept).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void pollTransportNeverSleepsPastMaxWait() throws Exception {
        List<Duration> slept = new ArrayList<>();
        PollTransport transport = new PollTransport(store, "42", List.of("chat"), clock, slept::add,
                Duration.ofSeconds(1), Duration.ofSeconds(2));

        transport.await(Duration.ofMillis(300));

        assertThat(slept).containsExactly(Duration.ofMillis(300));
    }

    @Test
    void storeReadFailureCountsAsNoSignal() throws Exception {
        DirtyTokenStore failing = new DirtyTokenStore() {
            @Override
            public void set(String slug, String userId, DirtyToken token, Duration ttl) {
            }

            @Override
            public Optional<DirtyToken> get(String slug, String userId) throws Exception {
                if (slug.equals("chat")) throw new IllegalStateException("cache down");
                return Optional.of(new DirtyToken("f1"));
            }
        };
        PollTransport transport = new PollTransport(failing, "42", List.of("chat", "files"), clock, clock::advance,
                Duration.ofSeconds(2), Duration.ofSeconds(2));

        Wake wake = transport.await(Duration.ofSeconds(15));

        assertThat(wake.signals()).containsOnlyKeys("files");
        assertThat(wake.sweep()).isTrue();
    }

    private BrokerAwareTransportSelector selector(PushBroker broker) {
        return new BrokerAwareTransportSelector(broker, store, settings, clock, Sleeper.SYSTEM);
    }
}
