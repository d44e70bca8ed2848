package io.eventfanout.server.core;

import io.eventfanout.server.spi.StreamUser;

import java.util.List;

/**
 * Picks the {@link Transport} of a connection when it opens.
 */
@FunctionalInterface
public interface TransportSelector {

    /**
     * @param user connection owner
     * @param slugs providers instantiated for the connection, in registration order
     */
    Transport select(StreamUser user, List<String> slugs);
}
