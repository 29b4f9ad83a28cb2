package io.streamgateway.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates the installed {@link JsonCodec} via {@link ServiceLoader}.
 *
 * <p>For GraalVM native-image, construct the codec explicitly instead.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    /**
     * Returns the codec of the first {@link JsonCodecProvider} found on the context class loader.
     *
     * @throws IllegalStateException if no JSON module is on the classpath
     */
    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("no JsonCodecProvider installed; add stream-gateway-json-jackson to the classpath");
        }
        return it.next().codec();
    }
}
