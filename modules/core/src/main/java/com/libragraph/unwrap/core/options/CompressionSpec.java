package com.libragraph.unwrap.core.options;

import com.libragraph.unwrap.core.error.ConfigException;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Output compression codec with its optional level.
 *
 * <p>Accepts {@code none}, {@code uncompressed}, {@code snappy}, {@code lz4}, {@code lz4_raw},
 * {@code gzip}, {@code gzip(n)} (0..9, default 6), {@code zstd} and {@code zstd(n)}
 * (1..22, default 1), case-insensitively. The canonical forms it prints, such as
 * {@code ZSTD(ZstdLevel(3))}, are accepted back as input.
 */
public record CompressionSpec(CompressionCodecName codec, Integer level) {

    public static final CompressionSpec UNCOMPRESSED = new CompressionSpec(CompressionCodecName.UNCOMPRESSED, null);

    static final String ZSTD_LEVEL_KEY = "parquet.compression.codec.zstd.level";
    static final String ZLIB_LEVEL_KEY = "zlib.compress.level";

    private static final String EXPECTED =
            "one of none, uncompressed, snappy, lz4, lz4_raw, gzip(0..9), zstd(1..22)";
    private static final Pattern PLAIN = Pattern.compile("([a-z0-9_]+)(?:\\((-?\\d+)\\))?");
    private static final Pattern CANONICAL = Pattern.compile("(gzip|zstd)\\(\\1level\\((-?\\d+)\\)\\)");

    // Hadoop ZlibCompressor.CompressionLevel names, indexed by level
    private static final String[] ZLIB_LEVELS = {
            "NO_COMPRESSION", "BEST_SPEED", "TWO", "THREE", "FOUR",
            "FIVE", "SIX", "SEVEN", "EIGHT", "NINE"
    };

    /**
     * @throws ConfigException if the codec is unknown or the level is out of range
     */
    public static CompressionSpec parse(String value) {
        if (value == null) {
            throw new ConfigException("compression", "null", EXPECTED);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);

        String name;
        String param;
        Matcher canonical = CANONICAL.matcher(normalized);
        Matcher plain = PLAIN.matcher(normalized);
        if (canonical.matches()) {
            name = canonical.group(1);
            param = canonical.group(2);
        } else if (plain.matches()) {
            name = plain.group(1);
            param = plain.group(2);
        } else {
            throw new ConfigException("compression", value, EXPECTED);
        }

        return switch (name) {
            case "none", "uncompressed" -> withoutLevel(CompressionCodecName.UNCOMPRESSED, param, value);
            case "snappy" -> withoutLevel(CompressionCodecName.SNAPPY, param, value);
            case "lz4" -> withoutLevel(CompressionCodecName.LZ4, param, value);
            case "lz4_raw" -> withoutLevel(CompressionCodecName.LZ4_RAW, param, value);
            case "gzip" -> withLevel(CompressionCodecName.GZIP, param, 6, 0, 9, value);
            case "zstd" -> withLevel(CompressionCodecName.ZSTD, param, 1, 1, 22, value);
            default -> throw new ConfigException("compression", value, EXPECTED);
        };
    }

    private static CompressionSpec withoutLevel(CompressionCodecName codec, String param, String value) {
        if (param != null) {
            throw new ConfigException("compression", value, codec.name().toLowerCase(Locale.ROOT) + " without a level");
        }
        return new CompressionSpec(codec, null);
    }

    private static CompressionSpec withLevel(CompressionCodecName codec, String param,
                                             int defaultLevel, int min, int max, String value) {
        if (param == null) {
            return new CompressionSpec(codec, defaultLevel);
        }
        int level;
        try {
            level = Integer.parseInt(param);
        } catch (NumberFormatException e) {
            throw new ConfigException("compression", value, "a level in " + min + ".." + max);
        }
        if (level < min || level > max) {
            throw new ConfigException("compression", value, "a level in " + min + ".." + max);
        }
        return new CompressionSpec(codec, level);
    }

    /**
     * Canonical text form, e.g. {@code GZIP(GzipLevel(6))} or {@code SNAPPY}.
     */
    public String canonical() {
        return switch (codec) {
            case GZIP -> "GZIP(GzipLevel(" + level + "))";
            case ZSTD -> "ZSTD(ZstdLevel(" + level + "))";
            default -> codec.name();
        };
    }

    /**
     * Passes the level to the Parquet codec through the Hadoop configuration.
     */
    public void applyTo(Configuration conf) {
        if (codec == CompressionCodecName.ZSTD) {
            conf.setInt(ZSTD_LEVEL_KEY, level);
        } else if (codec == CompressionCodecName.GZIP) {
            conf.set(ZLIB_LEVEL_KEY, ZLIB_LEVELS[level]);
        }
    }

    @Override
    public String toString() {
        return canonical();
    }
}
