package com.libragraph.unwrap.core.options;

import com.libragraph.unwrap.core.error.ConfigException;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.Locale;
import java.util.Optional;

/**
 * Raw {@code unwrap.*} configuration values. Defaults ship in
 * {@code META-INF/microprofile-config.properties}; system properties and
 * environment variables override them.
 */
public record ExtractionSettings(
        String compression,
        String include,
        boolean unique,
        long minSize,
        Optional<Long> maxSize,
        int maxDepth,
        int threads,
        String decodeErrorPolicy,
        Optional<Long> maxExpandedBytesPerInput,
        Optional<Long> maxExpandedBytesPerRun) {

    public static final String PREFIX = "unwrap.";

    /**
     * Reads settings from the application's MicroProfile Config.
     */
    public static ExtractionSettings load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static ExtractionSettings fromConfig(Config config) {
        return new ExtractionSettings(
                value(config, "compression", String.class).orElse("none"),
                value(config, "include", String.class).orElse("all"),
                value(config, "unique", Boolean.class).orElse(false),
                value(config, "min-size", Long.class).orElse(1L),
                value(config, "max-size", Long.class),
                value(config, "max-depth", Integer.class).orElse(64),
                value(config, "threads", Integer.class).orElse(1),
                value(config, "decode-error-policy", String.class).orElse("abort"),
                value(config, "max-expanded-bytes-per-input", Long.class),
                value(config, "max-expanded-bytes-per-run", Long.class));
    }

    private static <T> Optional<T> value(Config config, String name, Class<T> type) {
        String key = PREFIX + name;
        try {
            return config.getOptionalValue(key, type);
        } catch (IllegalArgumentException e) {
            String raw = config.getConfigValue(key).getValue();
            throw new ConfigException(key, String.valueOf(raw), "a " + type.getSimpleName().toLowerCase(Locale.ROOT) + " value");
        }
    }
}
