package com.libragraph.unwrap.core.output;

import com.libragraph.unwrap.core.collect.LeafEntry;

/**
 * Sink for output rows. A single writer owns its destination.
 */
public interface TableWriter extends AutoCloseable {

    /**
     * Appends one row.
     *
     * @throws com.libragraph.unwrap.core.error.SchemaException if the entry breaks the row invariants
     * @throws com.libragraph.unwrap.core.error.OutputWriteException if the destination cannot be written
     */
    void write(LeafEntry entry);

    long rowCount();

    /**
     * Flushes every row to the destination.
     */
    @Override
    void close();
}
