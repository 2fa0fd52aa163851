package io.objection.core;

import io.objection.json.jackson.JacksonJsonCodecProvider;
import io.objection.json.spi.JsonCodecProvider;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceLoaderCodecsTest {

    @Test
    void findsTheJacksonBinding() {
        JsonCodecProvider provider = ServiceLoaderCodecs.defaultProvider();

        assertThat(provider).isInstanceOf(JacksonJsonCodecProvider.class);
        assertThat(provider.jsonCodec()).isNotNull();
        assertThat(provider.binaryCodec()).isNotNull();
    }

    @Test
    void failsWhenNoBindingIsVisible() {
        ClassLoader empty = new URLClassLoader(new URL[0], null);

        assertThatThrownBy(() -> ServiceLoaderCodecs.load(empty))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("objection-json-jackson");
    }
}
