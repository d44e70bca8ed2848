package io.eventfanout.server.core;

import io.eventfanout.core.SseFrame;

import java.io.IOException;

/**
 * Destination of a session's frames.
 */
@FunctionalInterface
interface FrameSink {

    /**
     * Writes one frame, blocking until the downstream can take it.
     *
     * @throws IOException when the client is gone; the session then stops
     */
    void send(SseFrame frame) throws IOException, InterruptedException;
}
