/**
 * Reusable {@link io.eventfanout.server.spi.EventProvider} building blocks for common feature
 * shapes: append-only feeds, counters, producer-filled mailboxes and shared snapshots.
 */
package io.eventfanout.providers;
