package com.libragraph.unwrap.core.error;

/**
 * Base of every failure raised by a conversion or extraction run.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConversionException(String message) {
        super(message);
    }
}
