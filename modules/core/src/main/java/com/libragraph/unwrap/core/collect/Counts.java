package com.libragraph.unwrap.core.collect;

import java.util.List;

/**
 * Summary of one run.
 *
 * @param read         leaves reached by the walk
 * @param skipped      leaves dropped by the size or content filter, plus non-regular container entries
 * @param deduplicated leaves dropped because their content was already emitted
 * @param written      leaves emitted
 * @param failures     inputs dropped under the skip policy
 */
public record Counts(long read, long skipped, long deduplicated, long written, List<InputFailure> failures) {

    public Counts {
        failures = List.copyOf(failures);
    }
}
