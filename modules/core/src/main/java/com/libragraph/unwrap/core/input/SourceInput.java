package com.libragraph.unwrap.core.input;

import com.libragraph.unwrap.util.buffer.BinaryData;

/**
 * A registered input. Each call to {@link #open()} returns independent data, so one
 * input can be read by the registration sniff and again by the run.
 */
public interface SourceInput {

    /** Root of every logical path produced from this input. */
    String identity();

    /** Undecoded length in bytes. */
    long rawSize();

    /**
     * Opens the raw bytes.
     *
     * @throws com.libragraph.unwrap.core.error.SourceReadException if the input cannot be read
     */
    BinaryData open();
}
