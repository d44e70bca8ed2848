package io.eventfanout.server.core;

import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final Principal principal; // may be null

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, Principal principal) {
        this.method = method;
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.principal = principal;
    }

    /** @return the method, or {@code null} when the adapter saw a verb outside {@link HttpMethod} */
    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /** @return the container-authenticated principal, or {@code null} */
    public Principal principal() {
        return principal;
    }
}
