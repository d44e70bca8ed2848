package io.eventfanout.server.core;

import io.eventfanout.core.SseFrame;

import java.util.concurrent.Flow;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}
