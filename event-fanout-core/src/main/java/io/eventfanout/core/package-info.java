/**
 * Protocol-level types shared by the event stream server and its clients.
 *
 * <p>Contains the {@link io.eventfanout.core.Event} model, {@link io.eventfanout.core.SseFrame}
 * rendering and a small {@link io.eventfanout.core.SseParser}.
 */
package io.eventfanout.core;
