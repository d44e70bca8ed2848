package io.eventfanout.server.core;

import java.time.Duration;

/**
 * Wake-up source of one connection. Selected when the connection opens and fixed for its
 * lifetime; only ever used from the connection's own task, except {@link #close()}.
 */
public interface Transport extends AutoCloseable {

    /** Short name for logs. */
    String name();

    /**
     * Blocks until something may have changed, or until {@code maxWait} elapsed.
     *
     * @param maxWait upper bound chosen by the session so keepalive and lifetime checks run on time
     */
    Wake await(Duration maxWait) throws InterruptedException;

    /**
     * Releases transport handles. Idempotent and callable from any thread; unblocks a pending
     * {@link #await(Duration)} where the underlying handle allows it.
     */
    @Override
    void close();
}
