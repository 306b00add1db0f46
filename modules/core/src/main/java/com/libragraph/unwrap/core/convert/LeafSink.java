package com.libragraph.unwrap.core.convert;

import com.libragraph.unwrap.core.collect.LeafEntry;

/**
 * Terminal action applied to every leaf that survives filtering, in output order.
 */
@FunctionalInterface
public interface LeafSink {

    void accept(LeafEntry entry);
}
