/**
 * Shared utilities for all unwrap modules.
 *
 * <p>Contains {@link com.libragraph.unwrap.util.ContentHash} (SHA-256) and the
 * {@link com.libragraph.unwrap.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer, ByteBudget).
 * No framework dependencies, only commons-codec for digests.
 */
package com.libragraph.unwrap.util;
