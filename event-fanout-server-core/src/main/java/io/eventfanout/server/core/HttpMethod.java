package io.eventfanout.server.core;

import java.util.Locale;

public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS;

    /**
     * @return the method, or {@code null} for verbs this engine does not model
     */
    public static HttpMethod parse(String method) {
        if (method == null) return null;
        try {
            return HttpMethod.valueOf(method.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
