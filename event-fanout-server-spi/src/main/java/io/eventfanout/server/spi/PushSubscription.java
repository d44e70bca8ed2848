package io.eventfanout.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Subscription to one user's push channel. Owned by a single connection.
 */
public interface PushSubscription extends AutoCloseable {

    /**
     * Waits for the next message.
     *
     * @return the message, or empty when the timeout elapsed or the subscription was closed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<PushMessage> await(Duration timeout) throws InterruptedException;

    /**
     * Unsubscribes. Idempotent; unblocks a concurrent {@link #await(Duration)}.
     */
    @Override
    void close();
}
