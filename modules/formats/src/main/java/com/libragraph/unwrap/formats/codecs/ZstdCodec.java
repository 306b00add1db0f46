package com.libragraph.unwrap.formats.codecs;

import com.libragraph.unwrap.formats.api.Codec;
import com.libragraph.unwrap.types.CompressionKind;
import org.apache.commons.compress.compressors.zstandard.ZstdCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Codec for Zstandard frames (.zst files).
 * Commons Compress delegates to zstd-jni.
 */
public class ZstdCodec implements Codec {
    private static final byte[] ZSTD_MAGIC = new byte[]{0x28, (byte) 0xB5, 0x2F, (byte) 0xFD};

    @Override
    public CompressionKind kind() {
        return CompressionKind.ZSTD;
    }

    @Override
    public boolean matches(byte[] header) {
        if (header.length < ZSTD_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < ZSTD_MAGIC.length; i++) {
            if (header[i] != ZSTD_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public InputStream openStream(InputStream compressed) throws IOException {
        return new ZstdCompressorInputStream(compressed);
    }
}
