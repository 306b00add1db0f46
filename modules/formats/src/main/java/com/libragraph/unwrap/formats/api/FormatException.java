package com.libragraph.unwrap.formats.api;

/**
 * Wraps checked I/O failures from decoding a compressed stream or reading an archive.
 * Callers add source and path context when they rethrow.
 */
public class FormatException extends RuntimeException {

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public FormatException(String message) {
        super(message);
    }
}
