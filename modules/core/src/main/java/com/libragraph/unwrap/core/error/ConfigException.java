package com.libragraph.unwrap.core.error;

/**
 * An option was assigned a value outside its accepted set or range.
 * Always raised at assignment time, before any input is touched.
 */
public class ConfigException extends ConversionException {

    private final String value;

    public ConfigException(String option, String value, String expected) {
        super("Invalid value \"" + value + "\" for " + option + ", expected " + expected);
        this.value = value;
    }

    public String value() {
        return value;
    }
}
