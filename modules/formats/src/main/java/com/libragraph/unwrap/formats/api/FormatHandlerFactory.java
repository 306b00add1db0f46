package com.libragraph.unwrap.formats.api;

import com.libragraph.unwrap.types.ArchiveKind;
import com.libragraph.unwrap.util.buffer.BinaryData;
import com.libragraph.unwrap.util.buffer.ByteBudget;

/**
 * Factory for container handlers of one {@link ArchiveKind}.
 */
public interface FormatHandlerFactory {

    ArchiveKind kind();

    /**
     * Returns criteria for detecting when this handler should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Checks whether the header belongs to this container format.
     * Factories with structural checks beyond magic bytes override this.
     */
    default boolean matches(byte[] header) {
        return getDetectionCriteria().matches(header);
    }

    /**
     * Creates a handler over the given container bytes.
     *
     * @param buffer the container bytes
     * @param budget charged for every member byte materialized
     */
    Handler createInstance(BinaryData buffer, ByteBudget budget);
}
