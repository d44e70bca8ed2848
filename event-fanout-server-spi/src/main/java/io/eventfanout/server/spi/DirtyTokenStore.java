package io.eventfanout.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared last-writer-wins register of dirty tokens keyed by {@code (slug, userId)}.
 *
 * <p>Implementations are typically backed by a shared cache so producers and connections on
 * different nodes see the same values. Entries expire after their TTL; an absent entry means
 * nothing is pending.
 *
 * <p>This SPI is intentionally minimal and blocking.
 */
public interface DirtyTokenStore {

    void set(String slug, String userId, DirtyToken token, Duration ttl) throws Exception;

    Optional<DirtyToken> get(String slug, String userId) throws Exception;
}
