package io.eventfanout.server.core;

import io.eventfanout.server.spi.DirtyToken;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one transport wait.
 *
 * @param signals latest token per slug seen during the wait; the session polls a slug only when
 *                its token differs from the one it last observed
 * @param sweep whether every provider not signalled should also be polled without a token
 */
public record Wake(Map<String, DirtyToken> signals, boolean sweep) {

    private static final Wake IDLE = new Wake(Map.of(), false);

    public Wake {
        signals = Map.copyOf(Objects.requireNonNull(signals, "signals"));
    }

    public static Wake idle() {
        return IDLE;
    }

    public static Wake targeted(String slug, DirtyToken token, boolean sweep) {
        return new Wake(Map.of(slug, token), sweep);
    }

    public boolean isIdle() {
        return signals.isEmpty() && !sweep;
    }
}
