package com.libragraph.unwrap.formats.codecs;

import com.libragraph.unwrap.formats.api.Codec;
import com.libragraph.unwrap.types.CompressionKind;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Codec for XZ containers (.xz files), backed by the tukaani xz library.
 */
public class XzCodec implements Codec {
    private static final byte[] XZ_MAGIC = new byte[]{(byte) 0xFD, '7', 'z', 'X', 'Z', 0x00};

    @Override
    public CompressionKind kind() {
        return CompressionKind.XZ;
    }

    @Override
    public boolean matches(byte[] header) {
        if (header.length < XZ_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < XZ_MAGIC.length; i++) {
            if (header[i] != XZ_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public InputStream openStream(InputStream compressed) throws IOException {
        return new XZCompressorInputStream(compressed, true);
    }
}
