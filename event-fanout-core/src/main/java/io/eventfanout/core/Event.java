package io.eventfanout.core;

import java.util.Objects;

/**
 * A single event produced by a provider.
 *
 * <p>{@code namespace} is the slug of the provider that produced the event. {@code payload} is an
 * opaque value encoded as JSON when the event is written. {@code resumeId}, when present, is sent
 * as the frame {@code id} and becomes the client's {@code Last-Event-ID} on reconnect.
 */
public record Event(String namespace, String name, Object payload, String resumeId) {

    public Event {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
        requireSingleLine(namespace, "namespace");
        requireSingleLine(name, "name");
        if (resumeId != null) requireSingleLine(resumeId, "resumeId");
    }

    public static Event of(String namespace, String name, Object payload) {
        return new Event(namespace, name, payload, null);
    }

    public static Event of(String namespace, String name, Object payload, String resumeId) {
        return new Event(namespace, name, payload, resumeId);
    }

    private static void requireSingleLine(String value, String field) {
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException(field + " must not contain line breaks");
        }
    }

    /** Qualified event type as written on the wire: {@code <namespace>.<name>}. */
    public String qualifiedName() {
        return namespace + Protocol.NAMESPACE_SEPARATOR + name;
    }
}
