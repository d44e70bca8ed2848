package io.eventfanout.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive protocol header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Last-Event-ID as sent by the client, or empty when absent or blank.
     */
    public static Optional<String> lastEventId(Map<String, ? extends Iterable<String>> headers) {
        return firstValue(headers, Protocol.H_LAST_EVENT_ID)
                .map(String::trim)
                .filter(v -> !v.isEmpty());
    }

    /**
     * Whether an {@code Accept} header admits an event stream. A missing header accepts anything.
     */
    public static boolean acceptsEventStream(Optional<String> accept) {
        if (accept.isEmpty()) return true;
        for (String part : accept.get().split(",")) {
            int semi = part.indexOf(';');
            String type = (semi >= 0 ? part.substring(0, semi) : part).trim().toLowerCase(Locale.ROOT);
            if (type.equals(Protocol.CT_EVENT_STREAM) || type.equals("text/*") || type.equals("*/*")) {
                return true;
            }
        }
        return false;
    }
}
