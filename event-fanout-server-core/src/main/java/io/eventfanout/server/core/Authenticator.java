package io.eventfanout.server.core;

import io.eventfanout.server.spi.StreamUser;

import java.security.Principal;
import java.util.Optional;

/**
 * Resolves the user a stream request belongs to.
 *
 * <p>Supplied by the host application, which owns sessions and tokens. An empty result or an
 * exception rejects the request with {@code 403}.
 */
@FunctionalInterface
public interface Authenticator {

    Optional<StreamUser> authenticate(ServerRequest request) throws Exception;

    /**
     * Rejects every request; the default until the host configures authentication.
     */
    static Authenticator denyAll() {
        return request -> Optional.empty();
    }

    /**
     * Trusts the principal established by the hosting container, using its name as user id.
     */
    static Authenticator fromPrincipal() {
        return request -> Optional.ofNullable(request.principal())
                .map(Principal::getName)
                .filter(name -> !name.isBlank())
                .map(StreamUser::of);
    }
}
