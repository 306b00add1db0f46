package com.libragraph.unwrap.formats.handlers;

import com.libragraph.unwrap.formats.api.*;
import com.libragraph.unwrap.types.ArchiveKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.Buffer;
import com.libragraph.unwrap.util.buffer.ByteBudget;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Format handler for ZIP archives.
 * Members are listed from the central directory, which is read straight
 * through the buffer's channel.
 */
public class ZipHandlerFactory implements FormatHandlerFactory {

    private static final byte[] ZIP_MAGIC = new byte[]{0x50, 0x4B, 0x03, 0x04}; // "PK\u0003\u0004"

    private static final DetectionCriteria CRITERIA =
            new DetectionCriteria("zip", ZIP_MAGIC, 0, 200);

    @Override
    public ArchiveKind kind() {
        return ArchiveKind.ZIP;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public Handler createInstance(BinaryData buffer, ByteBudget budget) {
        return new ZipHandler(buffer, budget);
    }

    /**
     * Handler instance for a specific ZIP file.
     */
    private static class ZipHandler implements Handler {
        private final BinaryData buffer;
        private final ByteBudget budget;
        private final List<SkippedMember> skipped = new ArrayList<>();
        private ZipFile zipFile;
        private Enumeration<ZipArchiveEntry> entries;

        ZipHandler(BinaryData buffer, ByteBudget budget) {
            this.buffer = buffer;
            this.budget = budget;
        }

        @Override
        public ArchiveMember nextMember() {
            try {
                if (zipFile == null) {
                    buffer.position(0);
                    zipFile = ZipFile.builder().setSeekableByteChannel(buffer).get();
                    entries = zipFile.getEntries();
                }

                while (entries.hasMoreElements()) {
                    ZipArchiveEntry entry = entries.nextElement();
                    if (entry.isDirectory() || entry.isUnixSymlink()) {
                        skipped.add(new SkippedMember(entry.getName(),
                                entry.isDirectory() ? "directory" : "symlink"));
                        continue;
                    }
                    if (!zipFile.canReadEntryData(entry)) {
                        throw new FormatException("Unsupported ZIP entry " + entry.getName()
                                + " (method " + entry.getMethod() + ")");
                    }

                    Buffer childBuffer = Buffer.allocate(entry.getSize());
                    try (InputStream entryStream = zipFile.getInputStream(entry);
                         OutputStream output = budget.guard(childBuffer.outputStream(0))) {
                        entryStream.transferTo(output);
                    } catch (IOException | RuntimeException e) {
                        childBuffer.close();
                        throw e;
                    }
                    return new ArchiveMember(entry.getName(), childBuffer);
                }
                return null;
            } catch (IOException e) {
                throw new FormatException("Failed to read ZIP archive", e);
            }
        }

        @Override
        public List<SkippedMember> skipped() {
            return Collections.unmodifiableList(skipped);
        }

        @Override
        public void close() {
            try {
                if (zipFile != null) {
                    zipFile.close();
                }
                buffer.close();
            } catch (IOException e) {
                throw new FormatException("Failed to close ZIP archive", e);
            }
        }
    }
}
