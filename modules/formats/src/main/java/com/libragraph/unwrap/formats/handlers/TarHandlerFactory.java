package com.libragraph.unwrap.formats.handlers;

import com.libragraph.unwrap.formats.api.*;
import com.libragraph.unwrap.types.ArchiveKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.Buffer;
import com.libragraph.unwrap.util.buffer.ByteBudget;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Format handler for TAR archives.
 * Detected by the "ustar" magic at offset 257, or for pre-POSIX (V7) archives
 * by a valid header checksum.
 */
public class TarHandlerFactory implements FormatHandlerFactory {

    private static final byte[] TAR_MAGIC = new byte[]{'u', 's', 't', 'a', 'r'};

    /** Size of one tar header block. */
    public static final int BLOCK_SIZE = 512;

    private static final int CHECKSUM_OFFSET = 148;
    private static final int CHECKSUM_LENGTH = 8;

    private static final DetectionCriteria CRITERIA =
            new DetectionCriteria("tar", TAR_MAGIC, 257, 100);

    @Override
    public ArchiveKind kind() {
        return ArchiveKind.TAR;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return CRITERIA;
    }

    @Override
    public boolean matches(byte[] header) {
        if (CRITERIA.matches(header)) {
            return true;
        }
        return header != null
                && header.length >= BLOCK_SIZE
                && header[0] != 0
                && hasValidChecksum(header);
    }

    /**
     * V7 header check. The checksum field must hold octal digits padded with spaces or NULs
     * before it is compared against the header sum.
     */
    static boolean hasValidChecksum(byte[] header) {
        for (int i = CHECKSUM_OFFSET; i < CHECKSUM_OFFSET + CHECKSUM_LENGTH; i++) {
            byte b = header[i];
            if (b != 0 && b != ' ' && (b < '0' || b > '7')) {
                return false;
            }
        }
        try {
            return TarUtils.verifyCheckSum(header);
        } catch (IllegalArgumentException e) {
            // digits split by padding, e.g. "12 34"
            return false;
        }
    }

    @Override
    public Handler createInstance(BinaryData buffer, ByteBudget budget) {
        return new TarHandler(buffer, budget);
    }

    static boolean isRegular(TarArchiveEntry entry) {
        return entry.isFile()
                && !entry.isSymbolicLink()
                && !entry.isLink()
                && !entry.isCharacterDevice()
                && !entry.isBlockDevice()
                && !entry.isFIFO();
    }

    private static String typeOf(TarArchiveEntry entry) {
        if (entry.isDirectory()) return "directory";
        if (entry.isSymbolicLink()) return "symlink";
        if (entry.isLink()) return "hardlink";
        if (entry.isCharacterDevice() || entry.isBlockDevice()) return "device";
        if (entry.isFIFO()) return "fifo";
        return "other";
    }

    private static class TarHandler implements Handler {
        private final BinaryData buffer;
        private final ByteBudget budget;
        private final TarArchiveInputStream tar;
        private final List<SkippedMember> skipped = new ArrayList<>();

        TarHandler(BinaryData buffer, ByteBudget budget) {
            this.buffer = buffer;
            this.budget = budget;
            this.tar = new TarArchiveInputStream(buffer.inputStream(0));
        }

        @Override
        public ArchiveMember nextMember() {
            try {
                TarArchiveEntry entry;
                while ((entry = tar.getNextEntry()) != null) {
                    if (!isRegular(entry)) {
                        skipped.add(new SkippedMember(entry.getName(), typeOf(entry)));
                        continue;
                    }

                    Buffer childBuffer = Buffer.allocate(entry.getSize());
                    try (OutputStream output = budget.guard(childBuffer.outputStream(0))) {
                        tar.transferTo(output);
                    } catch (IOException | RuntimeException e) {
                        childBuffer.close();
                        throw e;
                    }
                    if (childBuffer.size() != entry.getSize()) {
                        childBuffer.close();
                        throw new FormatException("Truncated TAR entry " + entry.getName()
                                + ": expected " + entry.getSize() + " bytes, read " + childBuffer.size());
                    }
                    return new ArchiveMember(entry.getName(), childBuffer);
                }
                return null;
            } catch (IOException e) {
                throw new FormatException("Failed to read TAR entry", e);
            }
        }

        @Override
        public List<SkippedMember> skipped() {
            return Collections.unmodifiableList(skipped);
        }

        @Override
        public void close() {
            try {
                tar.close();
                buffer.close();
            } catch (IOException e) {
                throw new FormatException("Failed to close TAR archive", e);
            }
        }
    }
}
