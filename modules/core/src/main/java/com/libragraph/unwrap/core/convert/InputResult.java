package com.libragraph.unwrap.core.convert;

import com.libragraph.unwrap.core.collect.LeafEntry;
import com.libragraph.unwrap.core.error.DecodeException;
import com.libragraph.unwrap.core.input.SourceInput;

import java.util.List;

/**
 * Leaves buffered from one input, or the decode failure that dropped it.
 */
record InputResult(SourceInput input, List<LeafEntry> entries, DecodeException failure) {

    static InputResult success(SourceInput input, List<LeafEntry> entries) {
        return new InputResult(input, entries, null);
    }

    static InputResult failed(SourceInput input, DecodeException failure) {
        return new InputResult(input, List.of(), failure);
    }

    boolean isFailed() {
        return failure != null;
    }
}
