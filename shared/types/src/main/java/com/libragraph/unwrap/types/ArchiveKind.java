package com.libragraph.unwrap.types;

public enum ArchiveKind {
    UNKNOWN(0, "unknown"),
    ZIP(1, "zip"),
    TAR(2, "tar");

    private final int id;
    private final String label;

    ArchiveKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isContainer() {
        return this != UNKNOWN;
    }

    public static ArchiveKind fromLabel(String label) {
        for (ArchiveKind k : values()) {
            if (k.label.equals(label)) return k;
        }
        throw new IllegalArgumentException("Unknown ArchiveKind label: " + label);
    }
}
