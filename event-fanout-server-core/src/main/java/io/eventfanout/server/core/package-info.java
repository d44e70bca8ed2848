/**
 * Framework-neutral event fan-out engine.
 *
 * <p>{@link io.eventfanout.server.core.EventStreamHandler} turns an authenticated request into a
 * stream of frames; {@link io.eventfanout.server.core.DirtyNotifier} is what producers call when
 * something changed. HTTP adapters only translate requests and subscribe to the returned
 * {@link java.util.concurrent.Flow.Publisher}.
 */
package io.eventfanout.server.core;
