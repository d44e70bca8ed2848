/**
 * Server-side SPI for the event fan-out engine.
 *
 * <p>The SPI is blocking and minimal: feature modules implement
 * {@link io.eventfanout.server.spi.EventProvider}, infrastructure modules implement
 * {@link io.eventfanout.server.spi.DirtyTokenStore} and {@link io.eventfanout.server.spi.PushBroker}.
 */
package io.eventfanout.server.spi;
