package com.libragraph.unwrap.types;

/**
 * Single label reported for a registered input: the outermost archive found,
 * else the outermost compression, else {@link #UNKNOWN}.
 */
public enum FormatKind {
    UNKNOWN("unknown"),
    GZIP("gzip"),
    ZSTD("zstd"),
    BZIP2("bzip2"),
    XZ("xz"),
    ZIP("zip"),
    TAR("tar");

    private final String label;

    FormatKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FormatKind of(ArchiveKind archive) {
        return switch (archive) {
            case ZIP -> ZIP;
            case TAR -> TAR;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public static FormatKind of(CompressionKind compression) {
        return switch (compression) {
            case GZIP -> GZIP;
            case ZSTD -> ZSTD;
            case BZIP2 -> BZIP2;
            case XZ -> XZ;
            case NONE -> UNKNOWN;
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
