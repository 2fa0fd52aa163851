package io.objection.core;

import io.objection.json.spi.JsonCodecProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodecProvider} through {@link ServiceLoader}.
 *
 * <p>The first provider found wins. Pass codecs to {@link RequestDispatcher.Builder} explicitly when more
 * than one binding is on the class path, or for environments where service loading is unavailable.
 */
public final class ServiceLoaderCodecs {
    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderCodecs.class);

    private ServiceLoaderCodecs() {}

    public static JsonCodecProvider load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException("no " + JsonCodecProvider.class.getName()
                    + " found; add objection-json-jackson to the class path or configure codecs explicitly");
        }
        JsonCodecProvider provider = providers.next();
        log.debug("Using JSON codec provider {}", provider.getClass().getName());
        return provider;
    }

    public static JsonCodecProvider defaultProvider() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return load(cl != null ? cl : ServiceLoaderCodecs.class.getClassLoader());
    }
}
