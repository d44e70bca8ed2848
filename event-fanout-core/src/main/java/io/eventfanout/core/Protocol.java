package io.eventfanout.core;

/**
 * Event stream protocol constants (header names, content types and well-known frame values).
 *
 * <p>This module intentionally contains no HTTP server bindings and no JSON library dependencies.
 * It only models protocol-level concerns shared by the server engine, its adapters and clients.
 */
public final class Protocol {
    private Protocol() {}

    // Request headers
    public static final String H_LAST_EVENT_ID = "Last-Event-ID";
    public static final String H_ACCEPT = "Accept";

    // Response headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_ACCEL_BUFFERING = "X-Accel-Buffering";
    public static final String H_CONTENT_ENCODING = "Content-Encoding";
    public static final String H_ERROR = "X-Error";
    public static final String H_ALLOW = "Allow";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_EVENT_STREAM_UTF8 = "text/event-stream; charset=utf-8";

    // Header values
    public static final String CACHE_CONTROL_STREAM = "no-cache, no-transform";
    public static final String CACHE_CONTROL_NO_STORE = "no-store";
    public static final String ENCODING_IDENTITY = "identity";
    public static final String ACCEL_BUFFERING_OFF = "no";

    // Frame fields
    public static final String FIELD_EVENT = "event";
    public static final String FIELD_ID = "id";
    public static final String FIELD_DATA = "data";

    /** Comment text written on idle connections. */
    public static final String KEEPALIVE_COMMENT = "keepalive";

    /** Separator between a provider slug and its event name in the {@code event:} field. */
    public static final char NAMESPACE_SEPARATOR = '.';
}
