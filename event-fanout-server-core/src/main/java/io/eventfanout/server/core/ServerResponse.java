package io.eventfanout.server.core;

import io.eventfanout.core.Headers;
import io.eventfanout.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Framework-neutral response abstraction.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    /** Bodiless response that must not be cached. */
    public static ServerResponse empty(int status) {
        return new ServerResponse(status, new ResponseBody.Empty())
                .header(Protocol.H_CACHE_CONTROL, Protocol.CACHE_CONTROL_NO_STORE);
    }

    /** Bodiless error response carrying a short machine-readable reason. */
    public static ServerResponse error(int status, String reason) {
        return empty(status).header(Protocol.H_ERROR, reason);
    }

    public boolean isStream() {
        return body instanceof ResponseBody.Sse;
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Optional<String> firstHeader(String name) {
        return Headers.firstValue(headers, name);
    }
}
