package com.libragraph.unwrap.formats.codecs;

import com.libragraph.unwrap.formats.api.Codec;
import com.libragraph.unwrap.types.CompressionKind;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * Codec for GZIP compression (.gz files).
 * Concatenated members are read as one stream.
 */
public class GzipCodec implements Codec {
    private static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};

    @Override
    public CompressionKind kind() {
        return CompressionKind.GZIP;
    }

    @Override
    public boolean matches(byte[] header) {
        return header.length >= 2
                && header[0] == GZIP_MAGIC[0]
                && header[1] == GZIP_MAGIC[1];
    }

    @Override
    public InputStream openStream(InputStream compressed) throws IOException {
        return new GZIPInputStream(compressed, 8192);
    }
}
