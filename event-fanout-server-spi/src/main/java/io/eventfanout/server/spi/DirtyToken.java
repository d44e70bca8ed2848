package io.eventfanout.server.spi;

import java.util.Objects;

/**
 * Opaque marker written whenever something user-visible changed for a (provider, user) pair.
 *
 * <p>Values produced by a {@link TokenGenerator} are totally ordered by their string form. The
 * engine itself only ever compares tokens for equality.
 */
public record DirtyToken(String value) implements Comparable<DirtyToken> {

    public DirtyToken {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) throw new IllegalArgumentException("value must not be empty");
    }

    @Override
    public int compareTo(DirtyToken other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
