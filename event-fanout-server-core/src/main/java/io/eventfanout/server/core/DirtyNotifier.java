package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyToken;
import io.eventfanout.server.spi.DirtyTokenStore;
import io.eventfanout.server.spi.PushBroker;
import io.eventfanout.server.spi.PushMessage;
import io.eventfanout.server.spi.TokenGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;

/**
 * Producer-facing entry point: every write path that creates a user-visible change calls
 * {@link #markDirty(String, String)} for each affected user.
 *
 * <p>The fresh token is always written to the {@link DirtyTokenStore}, which polling connections
 * read. When a {@link PushBroker} is configured and available, the token is also published on the
 * user's channel so pushing connections wake immediately. A failure on one path is logged and
 * does not prevent the other.
 */
public final class DirtyNotifier {

    private static final Logger log = LoggerFactory.getLogger(DirtyNotifier.class);

    private final DirtyTokenStore store;
    private final PushBroker broker;
    private final TokenGenerator tokens;
    private final Duration ttl;

    public DirtyNotifier(DirtyTokenStore store, PushBroker broker, TokenGenerator tokens, Duration ttl) {
        this.store = Objects.requireNonNull(store, "store");
        this.broker = broker;
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    public DirtyNotifier(DirtyTokenStore store, PushBroker broker, EventStreamSettings settings) {
        this(store, broker, new LexiLongTokenGenerator(), settings.dirtyTokenTtl());
    }

    /**
     * Signals that provider {@code slug} has something new for {@code userId}.
     *
     * @return the token that was written
     */
    public DirtyToken markDirty(String slug, String userId) {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(userId, "userId");
        DirtyToken token = tokens.next();

        try {
            store.set(slug, userId, token, ttl);
        } catch (Exception e) {
            log.warn("Dirty token write failed (provider={}, user={})", slug, userId, e);
        }

        if (broker != null) {
            try {
                if (broker.isAvailable()) {
                    broker.publish(userId, new PushMessage(slug, token));
                }
            } catch (Exception e) {
                log.warn("Push publish failed (provider={}, user={}), polling connections still see the token",
                        slug, userId, e);
            }
        }
        return token;
    }

    public void markDirty(String slug, Collection<String> userIds) {
        for (String userId : userIds) {
            markDirty(slug, userId);
        }
    }
}
