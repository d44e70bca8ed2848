package io.eventfanout.server.spi;

import java.util.Objects;

/**
 * Wake-up published on a user's channel: which provider changed, and its fresh token.
 */
public record PushMessage(String slug, DirtyToken token) {

    public PushMessage {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(token, "token");
    }
}
