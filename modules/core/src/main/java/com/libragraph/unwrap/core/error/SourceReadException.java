package com.libragraph.unwrap.core.error;

/**
 * A registered source could not be opened or read.
 */
public class SourceReadException extends ConversionException {

    private final String source;

    public SourceReadException(String source, Throwable cause) {
        super("Failed to read source " + source, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
