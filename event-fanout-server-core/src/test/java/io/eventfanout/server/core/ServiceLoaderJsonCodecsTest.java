package io.eventfanout.server.core;

import io.eventfanout.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceLoaderJsonCodecsTest {

    @Test
    void discoversJacksonCodecOnClassPath() {
        assertThat(ServiceLoaderJsonCodecs.loadDefault()).isInstanceOf(JacksonJsonCodec.class);
    }

    @Test
    void failsClearlyWhenNoCodecIsPresent() throws Exception {
        try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
            assertThatThrownBy(() -> ServiceLoaderJsonCodecs.load(empty))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("JsonCodecProvider");
        }
    }
}
