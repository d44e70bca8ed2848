package io.eventfanout.providers;

import io.eventfanout.server.spi.StreamUser;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side of an append-mostly feature table (chat messages, finished AI tasks, ...) as seen by
 * one user.
 *
 * @param <T> payload type sent to clients
 */
public interface ChangeFeed<T> {

    /**
     * One feed entry.
     *
     * @param id stable, unique id; sent as the frame id and echoed back as {@code Last-Event-ID}
     * @param position commit time used as the feed cursor
     */
    record Item<T>(String id, Instant position, T payload) {
        public Item {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(position, "position");
        }
    }

    /**
     * Resolves a client-supplied resume id.
     *
     * @return the item's position, or empty when the id is unknown to this feed
     */
    Optional<Instant> positionOf(StreamUser user, String id) throws Exception;

    /**
     * Items visible to {@code user} positioned strictly after {@code after}, oldest first.
     */
    List<Item<T>> after(StreamUser user, Instant after, int limit) throws Exception;
}
