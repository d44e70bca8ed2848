package io.eventfanout.server.core;

import io.eventfanout.core.Event;
import io.eventfanout.core.EventFanoutException;
import io.eventfanout.core.Protocol;
import io.eventfanout.core.SseFrame;
import io.eventfanout.json.spi.JsonCodec;
import io.eventfanout.json.spi.JsonException;

import java.util.Objects;

/**
 * Turns provider events into SSE frames: {@code event: <slug>.<name>}, optional {@code id}, and
 * the payload as JSON in {@code data}. The namespace is always the slug of the provider that
 * produced the event, whatever the event itself claims.
 */
final class EventFrames {

    private final JsonCodec codec;

    EventFrames(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    SseFrame encode(String slug, Event event) {
        String type = slug + Protocol.NAMESPACE_SEPARATOR + event.name();
        String data;
        try {
            data = codec.writeString(event.payload());
        } catch (JsonException e) {
            throw new EventFanoutException.EncodingFailed("cannot encode payload of " + type, e);
        }
        return SseFrame.event(type, event.resumeId(), data);
    }
}
