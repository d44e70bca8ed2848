package io.eventfanout.server.spi;

import java.util.Map;
import java.util.Objects;

/**
 * Authenticated owner of an event stream connection.
 *
 * @param id stable user identifier; keys dirty tokens and push channels
 * @param attributes extra values resolved during authentication (display name, roles, ...)
 */
public record StreamUser(String id, Map<String, Object> attributes) {

    public StreamUser {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static StreamUser of(String id) {
        return new StreamUser(id, Map.of());
    }
}
