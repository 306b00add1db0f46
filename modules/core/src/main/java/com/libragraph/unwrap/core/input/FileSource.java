package com.libragraph.unwrap.core.input;

import com.libragraph.unwrap.core.error.SourceReadException;
import com.libragraph.unwrap.util.buffer.BinaryData;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Input backed by a file, read through a seekable channel.
 */
public record FileSource(Path path, long rawSize) implements SourceInput {

    /**
     * @throws SourceReadException if the file does not exist or cannot be stat'ed
     */
    public static FileSource of(Path path) {
        try {
            if (!Files.isRegularFile(path)) {
                throw new SourceReadException(path.toString(),
                        new NoSuchFileException(path.toString(), null, "not a regular file"));
            }
            return new FileSource(path, Files.size(path));
        } catch (IOException e) {
            throw new SourceReadException(path.toString(), e);
        }
    }

    @Override
    public String identity() {
        return path.toString();
    }

    @Override
    public BinaryData open() {
        try {
            return BinaryData.wrap(Files.newByteChannel(path));
        } catch (IOException e) {
            throw new SourceReadException(identity(), e);
        }
    }
}
