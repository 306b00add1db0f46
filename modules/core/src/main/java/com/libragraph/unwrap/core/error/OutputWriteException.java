package com.libragraph.unwrap.core.error;

/**
 * Wraps checked I/O exceptions from writing the destination. Always fatal for the run.
 */
public class OutputWriteException extends ConversionException {

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
