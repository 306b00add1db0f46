package com.libragraph.unwrap.formats.tika;

import org.apache.tika.detect.TextDetector;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Separates text from binary payloads with Tika's byte-statistics {@link TextDetector}.
 * Only the first {@value #BYTES_TO_TEST} bytes are examined.
 */
public class ContentClassifier {

    public static final int BYTES_TO_TEST = 512;

    private final TextDetector detector = new TextDetector(BYTES_TO_TEST);

    public ContentClass classify(byte[] content) {
        int length = Math.min(content.length, BYTES_TO_TEST);
        try (ByteArrayInputStream in = new ByteArrayInputStream(content, 0, length)) {
            MediaType type = detector.detect(in, new Metadata());
            return MediaType.TEXT_PLAIN.equals(type) ? ContentClass.TEXT : ContentClass.BINARY;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to classify content", e);
        }
    }
}
