package com.libragraph.unwrap.formats.api;

import com.libragraph.unwrap.types.CompressionKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.Buffer;
import com.libragraph.unwrap.util.buffer.ByteBudget;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Single-stream decompressor for one {@link CompressionKind}.
 * Codecs are stateless and can be shared between threads.
 */
public interface Codec {

    CompressionKind kind();

    /**
     * Checks the magic bytes at the start of the payload.
     *
     * @param header first bytes of the payload (may be shorter than the magic)
     */
    boolean matches(byte[] header);

    /**
     * Wraps a compressed stream in the matching decompressor.
     * Closing the returned stream closes {@code compressed}.
     */
    InputStream openStream(InputStream compressed) throws IOException;

    /**
     * Fully inflates {@code input} into a fresh buffer.
     */
    default BinaryData decode(BinaryData input) {
        return decode(input, ByteBudget.unlimited());
    }

    /**
     * Fully inflates {@code input}, charging every produced byte to {@code budget}.
     *
     * @throws FormatException if the compressed data is malformed or truncated
     */
    default BinaryData decode(BinaryData input, ByteBudget budget) {
        Buffer output = Buffer.allocate(Math.max(input.size() * 3, 4096));
        try (InputStream in = openStream(input.inputStream(0));
             OutputStream out = budget.guard(output.outputStream(0))) {
            in.transferTo(out);
            return output;
        } catch (IOException e) {
            closeQuietly(output, e);
            throw new FormatException("Failed to decompress " + kind().label(), e);
        } catch (RuntimeException e) {
            closeQuietly(output, e);
            throw e;
        }
    }

    private static void closeQuietly(Buffer output, Exception failure) {
        try {
            output.close();
        } catch (IOException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }
}
