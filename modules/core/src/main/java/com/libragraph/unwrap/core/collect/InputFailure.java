package com.libragraph.unwrap.core.collect;

/**
 * An input dropped from a run because it could not be decoded.
 *
 * @param source identity of the input
 * @param path   logical path where decoding failed
 * @param reason failure message
 */
public record InputFailure(String source, String path, String reason) {
}
