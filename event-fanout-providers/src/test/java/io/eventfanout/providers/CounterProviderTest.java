package io.eventfanout.providers;

import io.eventfanout.core.Event;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.StreamUser;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CounterProviderTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final AtomicInteger unread = new AtomicInteger(3);

    @Test
    void emitsCountOnOpenAndOnEverySignal() throws Exception {
        EventProvider provider = CounterProvider.builder("notifications", "count", user -> Map.of("unread", unread.get()))
                .clock(clock)
                .factory()
                .create(StreamUser.of("42"), null);

        assertThat(provider.initialEvents()).containsExactly(Event.of("notifications", "count", Map.of("unread", 3)));
        assertThat(provider.poll(null)).isEmpty();

        unread.set(4);
        assertThat(provider.poll(new DirtyToken("t1"))).extracting(Event::payload).containsExactly(Map.of("unread", 4));
    }

    @Test
    void refreshesOnItsOwnIntervalWithoutSignal() throws Exception {
        EventProvider provider = CounterProvider.builder("chat-unread", "unread", user -> unread.get())
                .refreshInterval(Duration.ofSeconds(10))
                .clock(clock)
                .factory()
                .create(StreamUser.of("42"), null);
        provider.initialEvents();

        clock.advance(Duration.ofSeconds(9));
        assertThat(provider.poll(null)).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        assertThat(provider.poll(null)).extracting(Event::payload).containsExactly(3);

        clock.advance(Duration.ofSeconds(2));
        assertThat(provider.poll(null)).isEmpty();
    }

    @Test
    void countIsComputedForTheConnectionOwner() throws Exception {
        EventProvider provider = CounterProvider.builder("notifications", "count", user -> "count for " + user.id())
                .factory()
                .create(StreamUser.of("7"), null);

        assertThat(provider.initialEvents()).extracting(Event::payload).containsExactly("count for 7");
    }
}
