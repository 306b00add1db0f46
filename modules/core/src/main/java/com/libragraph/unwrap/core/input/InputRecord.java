package com.libragraph.unwrap.core.input;

import com.libragraph.unwrap.types.FormatKind;

/**
 * What registration saw of one input.
 *
 * @param kind     top-level format label
 * @param identity source identity
 * @param rawSize  undecoded length in bytes
 */
public record InputRecord(FormatKind kind, String identity, long rawSize) {
}
