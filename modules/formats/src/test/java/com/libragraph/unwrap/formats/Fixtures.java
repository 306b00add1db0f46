package com.libragraph.unwrap.formats;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarUtils;
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
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

/**
 * In-memory payloads for format tests.
 */
public final class Fixtures {

    public static final byte[] HELLO_WORLD = "hello world".getBytes(StandardCharsets.UTF_8);

    private Fixtures() {
    }

    public static byte[] zip(String name, byte[] data) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(baos)) {
            zos.putArchiveEntry(new ZipArchiveEntry("dir/"));
            zos.closeArchiveEntry();
            ZipArchiveEntry entry = new ZipArchiveEntry(name);
            zos.putArchiveEntry(entry);
            zos.write(data);
            zos.closeArchiveEntry();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    public static byte[] tar(String name, byte[] data) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tos = new TarArchiveOutputStream(baos)) {
            tos.putArchiveEntry(new TarArchiveEntry("dir/"));
            tos.closeArchiveEntry();

            TarArchiveEntry link = new TarArchiveEntry("link", TarArchiveEntry.LF_SYMLINK);
            link.setLinkName(name);
            tos.putArchiveEntry(link);
            tos.closeArchiveEntry();

            TarArchiveEntry entry = new TarArchiveEntry(name);
            entry.setSize(data.length);
            tos.putArchiveEntry(entry);
            tos.write(data);
            tos.closeArchiveEntry();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return baos.toByteArray();
    }

    /**
     * Single-member tar whose header carries no "ustar" magic, like a V7 archive.
     */
    public static byte[] v7Tar(String name, byte[] data) {
        byte[] header = new byte[512];
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(data.length);
        entry.writeEntryHeader(header);
        Arrays.fill(header, 257, 265, (byte) 0);
        Arrays.fill(header, 148, 156, (byte) ' ');
        TarUtils.formatCheckSumOctalBytes(TarUtils.computeCheckSum(header), header, 148, 8);

        int padded = (data.length + 511) / 512 * 512;
        byte[] out = new byte[512 + padded + 1024];
        System.arraycopy(header, 0, out, 0, 512);
        System.arraycopy(data, 0, out, 512, data.length);
        return out;
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
}
