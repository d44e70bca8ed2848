package io.eventfanout.server.spi;

/**
 * Produces fresh, strictly increasing {@link DirtyToken}s.
 */
@FunctionalInterface
public interface TokenGenerator {

    DirtyToken next();
}
