package com.libragraph.unwrap.core.error;

import com.libragraph.unwrap.core.walk.DecodeLayer;
import com.libragraph.unwrap.util.buffer.BudgetExceededException;

import java.util.List;

/**
 * Decoding produced more bytes than the configured expansion cap allows.
 */
public class ExpansionLimitExceededException extends DecodeException {

    public ExpansionLimitExceededException(BudgetExceededException cause, String source,
                                           String pathPrefix, List<DecodeLayer> layers) {
        super(cause.getMessage(), source, pathPrefix, layers, cause);
    }
}
