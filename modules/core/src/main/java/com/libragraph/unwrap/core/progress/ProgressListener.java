package com.libragraph.unwrap.core.progress;

/**
 * Per-leaf progress callback.
 *
 * <p>{@code WRITTEN}, {@code EXTRACTED}, {@code DUPLICATE} and {@code INPUT_FAILED} arrive on the
 * thread that drains results, in output order. {@code SKIPPED} arrives from the thread walking the
 * input, so with several threads it may interleave with other inputs.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (path, event) -> { };

    void onProgress(String path, ProgressEvent event);
}
