package io.eventfanout.server.core;

import io.eventfanout.json.spi.JsonCodec;
import io.eventfanout.json.spi.JsonCodecProvider;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Finds the {@link JsonCodec} used for event payloads through {@link ServiceLoader}.
 *
 * <p>When several {@link JsonCodecProvider}s are present, the highest {@link JsonCodecProvider#priority()}
 * wins; ties keep the first one found.
 */
public final class ServiceLoaderJsonCodecs {

    private ServiceLoaderJsonCodecs() {
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        JsonCodecProvider best = null;
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            if (best == null || p.priority() > best.priority()) {
                best = p;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                    + " found; add event-fanout-json-jackson or configure a JsonCodec explicitly");
        }
        return best.codec();
    }

    public static JsonCodec loadDefault() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return load(cl != null ? cl : ServiceLoaderJsonCodecs.class.getClassLoader());
    }
}
