package com.libragraph.unwrap.types;

public enum CompressionKind {
    NONE(0, "none"),
    GZIP(1, "gzip"),
    ZSTD(2, "zstd"),
    BZIP2(3, "bzip2"),
    XZ(4, "xz");

    private final int id;
    private final String label;

    CompressionKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isCompressed() {
        return this != NONE;
    }

    public static CompressionKind fromLabel(String label) {
        for (CompressionKind k : values()) {
            if (k.label.equals(label)) return k;
        }
        throw new IllegalArgumentException("Unknown CompressionKind label: " + label);
    }
}
