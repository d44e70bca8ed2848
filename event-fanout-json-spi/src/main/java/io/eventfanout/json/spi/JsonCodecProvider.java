package io.eventfanout.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    JsonCodec codec();

    /**
     * Higher wins when several providers are on the class path.
     */
    default int priority() {
        return 0;
    }
}
