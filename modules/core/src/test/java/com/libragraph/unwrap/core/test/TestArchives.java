package com.libragraph.unwrap.core.test;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Builds in-memory archives and compressed payloads for tests.
 *
 * <pre>
 *   byte[] payload = TestArchives.gzip(TestArchives.zip().add("data", "hello").build());
 * </pre>
 */
public final class TestArchives {

    private static final long FIXED_TIME = 1704067200000L; // 2024-01-01 00:00:00 UTC

    private TestArchives() {
    }

    public static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public static ArchiveBuilder zip() {
        return new ArchiveBuilder(false);
    }

    public static ArchiveBuilder tar() {
        return new ArchiveBuilder(true);
    }

    /**
     * Applies one layer by name: zip and tar wrap the payload as a single member called {@code data},
     * gzip, zstd, bzip2 and xz compress it.
     */
    public static byte[] wrap(String layer, byte[] payload) {
        return switch (layer) {
            case "zip" -> zip().add("data", payload).build();
            case "tar" -> tar().add("data", payload).build();
            case "gzip" -> gzip(payload);
            case "zstd" -> zstd(payload);
            case "bzip2" -> bzip2(payload);
            case "xz" -> xz(payload);
            default -> throw new IllegalArgumentException("Unknown layer: " + layer);
        };
    }

    public static byte[] gzip(byte[] data) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (OutputStream out = new GZIPOutputStream(baos)) {
            out.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    public static byte[] zstd(byte[] data) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (OutputStream out = new ZstdCompressorOutputStream(baos)) {
            out.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    public static byte[] bzip2(byte[] data) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (OutputStream out = new BZip2CompressorOutputStream(baos)) {
            out.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    public static byte[] xz(byte[] data) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (OutputStream out = new XZCompressorOutputStream(baos)) {
            out.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    /**
     * Fluent zip or tar builder. Entries keep insertion order.
     */
    public static final class ArchiveBuilder {

        private record Entry(String name, byte[] data, String linkTarget) {
            boolean isDirectory() {
                return name.endsWith("/");
            }
        }

        private final boolean tar;
        private final List<Entry> entries = new ArrayList<>();

        private ArchiveBuilder(boolean tar) {
            this.tar = tar;
        }

        public ArchiveBuilder add(String name, byte[] data) {
            entries.add(new Entry(name, data, null));
            return this;
        }

        public ArchiveBuilder add(String name, String text) {
            return add(name, bytes(text));
        }

        public ArchiveBuilder addNested(String name, ArchiveBuilder inner) {
            return add(name, inner.build());
        }

        public ArchiveBuilder addDirectory(String name) {
            entries.add(new Entry(name.endsWith("/") ? name : name + "/", new byte[0], null));
            return this;
        }

        /**
         * Adds a symbolic link. Only tar archives carry links.
         */
        public ArchiveBuilder addSymlink(String name, String target) {
            if (!tar) {
                throw new IllegalStateException("Symlinks are only built into tar archives");
            }
            entries.add(new Entry(name, new byte[0], target));
            return this;
        }

        public byte[] build() {
            try {
                return tar ? buildTar() : buildZip();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to build test archive", e);
            }
        }

        private byte[] buildZip() throws IOException {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(baos)) {
                for (Entry entry : entries) {
                    ZipArchiveEntry ze = new ZipArchiveEntry(entry.name());
                    ze.setTime(FIXED_TIME);
                    zos.putArchiveEntry(ze);
                    zos.write(entry.data());
                    zos.closeArchiveEntry();
                }
            }
            return baos.toByteArray();
        }

        private byte[] buildTar() throws IOException {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            try (TarArchiveOutputStream tos = new TarArchiveOutputStream(baos)) {
                tos.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
                for (Entry entry : entries) {
                    TarArchiveEntry te;
                    if (entry.linkTarget() != null) {
                        te = new TarArchiveEntry(entry.name(), TarArchiveEntry.LF_SYMLINK);
                        te.setLinkName(entry.linkTarget());
                    } else {
                        te = new TarArchiveEntry(entry.name());
                        if (!entry.isDirectory()) {
                            te.setSize(entry.data().length);
                        }
                    }
                    te.setModTime(FIXED_TIME);
                    tos.putArchiveEntry(te);
                    if (entry.linkTarget() == null && !entry.isDirectory()) {
                        tos.write(entry.data());
                    }
                    tos.closeArchiveEntry();
                }
            }
            return baos.toByteArray();
        }
    }
}
