package io.eventfanout.core;

import java.util.Objects;

/**
 * Server-Sent Events (SSE) frame.
 *
 * <p>Either an event frame ({@code event}, optional {@code id}, {@code data}) or a comment frame
 * used for keepalives.
 */
public final class SseFrame {
    private final String event;
    private final String id;
    private final String data;
    private final String comment;

    private SseFrame(String event, String id, String data, String comment) {
        this.event = event;
        this.id = id;
        this.data = data;
        this.comment = comment;
    }

    public static SseFrame event(String event, String id, String data) {
        Objects.requireNonNull(event, "event");
        return new SseFrame(event, id, data == null ? "" : data, null);
    }

    public static SseFrame comment(String comment) {
        return new SseFrame(null, null, null, Objects.requireNonNull(comment, "comment"));
    }

    public static SseFrame keepalive() {
        return comment(Protocol.KEEPALIVE_COMMENT);
    }

    public boolean isComment() {
        return comment != null;
    }

    public String event() {
        return event;
    }

    /** @return frame id, or {@code null} */
    public String id() {
        return id;
    }

    public String data() {
        return data;
    }

    public String comment() {
        return comment;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (comment != null) {
            sb.append(": ").append(comment).append("\n\n");
            return sb.toString();
        }
        sb.append("event: ").append(event).append("\n");
        if (id != null) {
            sb.append("id: ").append(id).append("\n");
        }
        // data can include newlines; each line must be prefixed with "data:"
        String[] lines = data.split("\r?\n", -1);
        for (String line : lines) {
            sb.append("data: ").append(line).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return isComment() ? "SseFrame[comment=" + comment + "]" : "SseFrame[event=" + event + ", id=" + id + "]";
    }
}
