package io.eventfanout.server.core;

import java.time.Duration;

/**
 * Interruptible sleep used by the polling loop.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> {
        long nanos = d.toNanos();
        if (nanos > 0) {
            Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
