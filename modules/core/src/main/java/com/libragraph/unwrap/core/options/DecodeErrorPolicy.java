package com.libragraph.unwrap.core.options;

import com.libragraph.unwrap.core.error.ConfigException;

import java.util.Locale;

/**
 * What a multi-input run does when one input cannot be decoded.
 */
public enum DecodeErrorPolicy {
    /** Fail the whole run on the first decode error. */
    ABORT,
    /** Drop the failing input's leaves, record the failure and carry on. */
    SKIP;

    public static DecodeErrorPolicy fromToken(String token) {
        if (token != null) {
            String name = token.trim().toUpperCase(Locale.ROOT);
            for (DecodeErrorPolicy policy : values()) {
                if (policy.name().equals(name)) {
                    return policy;
                }
            }
        }
        throw new ConfigException("decode-error-policy", String.valueOf(token), "one of abort, skip");
    }
}
