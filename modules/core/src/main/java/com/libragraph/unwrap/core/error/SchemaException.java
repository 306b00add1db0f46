package com.libragraph.unwrap.core.error;

/**
 * A leaf could not be turned into an output row without breaking the row invariants.
 */
public class SchemaException extends ConversionException {

    public SchemaException(String message) {
        super(message);
    }
}
