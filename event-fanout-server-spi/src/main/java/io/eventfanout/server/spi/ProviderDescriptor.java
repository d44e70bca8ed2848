package io.eventfanout.server.spi;

import java.util.Objects;

/**
 * Registered provider: its slug and the factory that instantiates it per connection.
 */
public record ProviderDescriptor(String slug, ProviderFactory factory) {

    public ProviderDescriptor {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(factory, "factory");
    }
}
