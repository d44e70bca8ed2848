package io.eventfanout.server.spi;

import io.eventfanout.core.Event;

import java.util.List;

/**
 * A source of events for one feature, scoped to one user on one connection.
 *
 * <p>An instance is created per connection by its {@link ProviderFactory} and is only ever called
 * from that connection's task, so implementations may keep unsynchronized cursor state.
 * {@link #initialEvents()} is called exactly once, before the first {@link #poll(DirtyToken)}.
 *
 * <p>Exceptions thrown from either method are caught by the engine, logged, and treated as an
 * empty result for that call only.
 */
public interface EventProvider extends AutoCloseable {

    /**
     * Events sent immediately when the connection opens.
     *
     * <p>Must not have side effects beyond reading the feature's own data.
     */
    List<Event> initialEvents() throws Exception;

    /**
     * Called on wake cycles that concern this provider.
     *
     * @param dirtyToken the freshly observed token when a producer marked this provider dirty for
     *                   the user since the last call, or {@code null} when no signal arrived; the
     *                   token is a hint, providers may still emit on their own cadence
     * @return events in the provider's own source order; never {@code null}
     */
    List<Event> poll(DirtyToken dirtyToken) throws Exception;

    /**
     * Releases per-connection state. Called once when the connection closes.
     */
    @Override
    default void close() throws Exception {
    }
}
