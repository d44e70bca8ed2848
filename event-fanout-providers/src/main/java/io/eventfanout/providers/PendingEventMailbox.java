package io.eventfanout.providers;

import java.util.List;
import java.util.Objects;

/**
 * Short-lived per-user queue of ready-made events, filled by producers and drained by the
 * user's connection when it is signalled.
 *
 * <p>Implementations are typically backed by the same shared cache as the dirty-token store.
 */
public interface PendingEventMailbox {

    /**
     * A queued event.
     *
     * @param name event name, sent as {@code <slug>.<name>}
     */
    record Entry(String name, Object payload) {
        public Entry {
            Objects.requireNonNull(name, "name");
        }
    }

    void append(String slug, String userId, Entry entry) throws Exception;

    /**
     * Removes and returns every queued entry, oldest first.
     */
    List<Entry> drain(String slug, String userId) throws Exception;
}
