package io.eventfanout.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal SSE parser for the frames written by the event stream.
 *
 * <p>Comment-only blocks (keepalives) are reported with {@link Frame#isKeepalive()} set.
 */
public final class SseParser implements AutoCloseable {

    public record Frame(String eventType, String id, String data, boolean isKeepalive) {}

    private final BufferedReader in;

    public SseParser(InputStream is) {
        this(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    public SseParser(Reader reader) {
        this.in = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    }

    /** Parses every frame contained in an already rendered stream body. */
    public static List<Frame> parseAll(String body) throws IOException {
        List<Frame> frames = new ArrayList<>();
        try (SseParser parser = new SseParser(new StringReader(body))) {
            Frame f;
            while ((f = parser.next()) != null) {
                frames.add(f);
            }
        }
        return frames;
    }

    /** @return next frame, or {@code null} if EOF */
    public Frame next() throws IOException {
        String eventType = "message";
        String id = null;
        StringBuilder data = new StringBuilder();
        boolean seenAny = false;
        boolean seenField = false;
        boolean seenComment = false;

        String line;
        while ((line = in.readLine()) != null) {
            if (line.isEmpty()) {
                if (!seenAny) continue;
                break;
            }
            seenAny = true;
            if (line.startsWith(":")) {
                seenComment = true;
            } else if (line.startsWith("event:")) {
                eventType = line.substring("event:".length()).trim();
                seenField = true;
            } else if (line.startsWith("id:")) {
                id = line.substring("id:".length()).trim();
                seenField = true;
            } else if (line.startsWith("data:")) {
                data.append(stripOneSpace(line.substring("data:".length()))).append("\n");
                seenField = true;
            }
        }

        if (!seenAny) return null;
        return new Frame(eventType, id, stripTrailingNewline(data.toString()), seenComment && !seenField);
    }

    private static String stripOneSpace(String s) {
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    private static String stripTrailingNewline(String s) {
        int len = s.length();
        while (len > 0 && (s.charAt(len - 1) == '\n' || s.charAt(len - 1) == '\r')) len--;
        return s.substring(0, len);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
