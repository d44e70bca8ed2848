package io.eventfanout.server.spi;

/**
 * Publish/subscribe broker delivering near-instant wake-ups keyed by user id.
 *
 * <p>When no broker is reachable, connections fall back to polling the {@link DirtyTokenStore}.
 */
public interface PushBroker {

    /**
     * Cheap reachability check consulted when a connection opens.
     */
    boolean isAvailable();

    void publish(String userId, PushMessage message) throws Exception;

    PushSubscription subscribe(String userId) throws Exception;
}
