package io.eventfanout.providers;

import io.eventfanout.core.Event;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.ProviderFactory;
import io.eventfanout.server.spi.StreamUser;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeFeedProviderTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");
    private static final StreamUser USER = StreamUser.of("42");

    private final MutableClock clock = new MutableClock(T0);
    private final ListFeed feed = new ListFeed();

    @Test
    void resumingFromEventKYieldsExactlyTheEventsAfterIt() throws Exception {
        for (int i = 1; i <= 10; i++) {
            feed.add("m-" + i, T0.plusSeconds(i));
        }
        clock.advance(Duration.ofSeconds(30));

        EventProvider provider = factory().create(USER, "m-4");

        assertThat(provider.initialEvents()).extracting(Event::resumeId)
                .containsExactly("m-5", "m-6", "m-7", "m-8", "m-9", "m-10");
    }

    @Test
    void freshConnectionStartsAtConnectTime() throws Exception {
        feed.add("old", T0.minusSeconds(1));
        EventProvider provider = factory().create(USER, null);

        assertThat(provider.initialEvents()).isEmpty();

        feed.add("new", T0.plusSeconds(1));
        assertThat(provider.poll(new DirtyToken("t1"))).extracting(Event::resumeId).containsExactly("new");
    }

    @Test
    void unknownResumeIdIsTreatedAsFreshConnection() throws Exception {
        feed.add("m-1", T0.minusSeconds(5));

        EventProvider provider = factory().create(USER, "not-a-message");

        assertThat(provider.initialEvents()).isEmpty();
        assertThat(provider.poll(new DirtyToken("t1"))).isEmpty();
    }

    @Test
    void pollingTwiceWithSameTokenDoesNotReEmit() throws Exception {
        EventProvider provider = factory().create(USER, null);
        feed.add("m-1", T0.plusSeconds(1));
        DirtyToken token = new DirtyToken("t1");

        List<Event> first = provider.poll(token);
        List<Event> second = provider.poll(token);

        assertThat(first).hasSize(1);
        assertThat(first.get(0).qualifiedName()).isEqualTo("chat.message");
        assertThat(first.get(0).payload()).isEqualTo("payload of m-1");
        assertThat(second).isEmpty();
    }

    @Test
    void lateCommitInsideOverlapWindowIsDeliveredOnce() throws Exception {
        EventProvider provider = factory().create(USER, null);
        feed.add("m-2", T0.plusSeconds(10));
        assertThat(provider.poll(new DirtyToken("t1"))).extracting(Event::resumeId).containsExactly("m-2");

        // committed after m-2 was read, stamped earlier
        feed.add("m-1", T0.plusSeconds(7));

        assertThat(provider.poll(new DirtyToken("t2"))).extracting(Event::resumeId).containsExactly("m-1");
        assertThat(provider.poll(new DirtyToken("t3"))).isEmpty();
    }

    @Test
    void untargetedPollDoesNotQueryTheFeed() throws Exception {
        EventProvider provider = factory().create(USER, null);
        feed.add("m-1", T0.plusSeconds(1));

        assertThat(provider.poll(null)).isEmpty();
        assertThat(feed.queries).isEmpty();
    }

    @Test
    void catchUpBacklogDrainsOnUntargetedPolls() throws Exception {
        feed.add("anchor", T0);
        for (int i = 1; i <= 60; i++) {
            feed.add("m-" + i, T0.plusMillis(i));
        }

        EventProvider provider = factory().create(USER, "anchor");

        List<Event> initial = provider.initialEvents();
        assertThat(initial).hasSize(49);
        assertThat(initial.get(48).resumeId()).isEqualTo("m-49");
        assertThat(provider.poll(null)).extracting(Event::resumeId)
                .containsExactly("m-50", "m-51", "m-52", "m-53", "m-54", "m-55", "m-56", "m-57", "m-58", "m-59", "m-60");

        int queries = feed.queries.size();
        assertThat(provider.poll(null)).isEmpty();
        assertThat(feed.queries).hasSize(queries);
    }

    @Test
    void resumeKeepsItemsSharingTheResumePosition() throws Exception {
        feed.add("m-1", T0);
        feed.add("m-2", T0);
        feed.add("m-3", T0.plusMillis(1));
        clock.advance(Duration.ofSeconds(1));

        EventProvider provider = factory().create(USER, "m-1");

        assertThat(provider.initialEvents()).extracting(Event::resumeId).containsExactly("m-2", "m-3");
        assertThat(provider.poll(new DirtyToken("t1"))).isEmpty();
        assertThat(provider.poll(new DirtyToken("t2"))).isEmpty();
    }

    @Test
    void resumeDoesNotResendItemsOrderedBeforeTheResumeItem() throws Exception {
        feed.add("m-0", T0);
        feed.add("m-1", T0);
        feed.add("m-2", T0);

        EventProvider provider = factory().create(USER, "m-1");

        assertThat(provider.initialEvents()).extracting(Event::resumeId).containsExactly("m-2");
        feed.add("m-3", T0.plusSeconds(1));
        assertThat(provider.poll(new DirtyToken("t1"))).extracting(Event::resumeId).containsExactly("m-3");
    }

    @Test
    void lookbackIncludesRecentlyCompletedItems() throws Exception {
        feed.add("task-1", T0.minusSeconds(20));
        feed.add("task-0", T0.minusSeconds(40));
        ProviderFactory ai = ChangeFeedProvider.builder("ai", "task_completed", feed)
                .lookback(Duration.ofSeconds(30))
                .clock(clock)
                .factory();

        EventProvider provider = ai.create(USER, null);

        assertThat(provider.poll(new DirtyToken("t1"))).extracting(Event::resumeId).containsExactly("task-1");
    }

    private ProviderFactory factory() {
        return ChangeFeedProvider.builder("chat", "message", feed).clock(clock).factory();
    }

    private static final class ListFeed implements ChangeFeed<String> {
        private final List<Item<String>> items = new CopyOnWriteArrayList<>();
        final List<Instant> queries = new CopyOnWriteArrayList<>();

        void add(String id, Instant position) {
            items.add(new Item<>(id, position, "payload of " + id));
        }

        @Override
        public Optional<Instant> positionOf(StreamUser user, String id) {
            return items.stream().filter(i -> i.id().equals(id)).map(Item::position).findFirst();
        }

        @Override
        public List<Item<String>> after(StreamUser user, Instant after, int limit) {
            queries.add(after);
            return items.stream()
                    .filter(i -> i.position().isAfter(after))
                    .sorted(Comparator.comparing(Item::position))
                    .limit(limit)
                    .toList();
        }
    }
}
