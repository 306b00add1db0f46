package com.libragraph.unwrap.formats.codecs;

import com.libragraph.unwrap.formats.api.Codec;
import com.libragraph.unwrap.types.CompressionKind;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Codec for BZIP2 compression (.bz2 files).
 * Uses Apache Commons Compress for BZIP2 support.
 */
public class Bzip2Codec implements Codec {
    private static final byte[] BZIP2_MAGIC = new byte[]{'B', 'Z', 'h'};

    @Override
    public CompressionKind kind() {
        return CompressionKind.BZIP2;
    }

    @Override
    public boolean matches(byte[] header) {
        return header.length >= 3
                && header[0] == BZIP2_MAGIC[0]
                && header[1] == BZIP2_MAGIC[1]
                && header[2] == BZIP2_MAGIC[2];
    }

    @Override
    public InputStream openStream(InputStream compressed) throws IOException {
        return new BZip2CompressorInputStream(compressed, true);
    }
}
