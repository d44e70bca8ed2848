package io.eventfanout.server.spi;

/**
 * Creates the per-connection {@link EventProvider} of one feature.
 */
@FunctionalInterface
public interface ProviderFactory {

    /**
     * @param user the connection owner
     * @param resumeId the client's {@code Last-Event-ID}, or {@code null}; the factory translates it
     *                 into its own cursor and ignores ids it does not recognize
     */
    EventProvider create(StreamUser user, String resumeId) throws Exception;
}
