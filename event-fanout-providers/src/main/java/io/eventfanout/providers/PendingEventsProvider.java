package io.eventfanout.providers;

import io.eventfanout.core.Event;
import io.eventfanout.server.core.DirtyNotifier;
import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.EventProvider;
import io.eventfanout.server.spi.ProviderFactory;
import io.eventfanout.server.spi.StreamUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Delivers events that producers queued in a {@link PendingEventMailbox}. The mailbox is drained
 * only on a dirty signal; nothing is sent when the connection opens.
 *
 * <p>Producers use {@link #push(PendingEventMailbox, DirtyNotifier, String, Collection, PendingEventMailbox.Entry)}
 * so the queue write and the signal stay together.
 */
public final class PendingEventsProvider implements EventProvider {

    private static final Logger log = LoggerFactory.getLogger(PendingEventsProvider.class);

    private final String slug;
    private final PendingEventMailbox mailbox;
    private final StreamUser user;

    private PendingEventsProvider(String slug, PendingEventMailbox mailbox, StreamUser user) {
        this.slug = slug;
        this.mailbox = mailbox;
        this.user = user;
    }

    public static ProviderFactory factory(String slug, PendingEventMailbox mailbox) {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(mailbox, "mailbox");
        return (user, resumeId) -> new PendingEventsProvider(slug, mailbox, user);
    }

    /**
     * Queues {@code entry} for each user and marks the provider dirty for them. A user whose
     * queue write fails is not signalled.
     */
    public static void push(PendingEventMailbox mailbox, DirtyNotifier notifier, String slug,
                            Collection<String> userIds, PendingEventMailbox.Entry entry) {
        for (String userId : userIds) {
            try {
                mailbox.append(slug, userId, entry);
            } catch (Exception e) {
                log.warn("Pending event {} not queued for user {} (provider={})", entry.name(), userId, slug, e);
                continue;
            }
            notifier.markDirty(slug, userId);
        }
    }

    @Override
    public List<Event> initialEvents() {
        return List.of();
    }

    @Override
    public List<Event> poll(DirtyToken dirtyToken) throws Exception {
        if (dirtyToken == null) return List.of();
        List<Event> events = new ArrayList<>();
        for (PendingEventMailbox.Entry entry : mailbox.drain(slug, user.id())) {
            events.add(Event.of(slug, entry.name(), entry.payload()));
        }
        return events;
    }
}
