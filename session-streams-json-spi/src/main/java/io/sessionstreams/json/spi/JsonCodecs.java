package io.sessionstreams.json.spi;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * @throws IllegalStateException if no provider is on the class path
     */
    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        JsonCodecProvider best = null;
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            if (best == null || p.priority() > best.priority()) {
                best = p;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No JsonCodecProvider found; add session-streams-json-jackson to the class path");
        }
        return best.codec();
    }
}
