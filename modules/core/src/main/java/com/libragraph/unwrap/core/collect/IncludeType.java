package com.libragraph.unwrap.core.collect;

import com.libragraph.unwrap.core.error.ConfigException;
import com.libragraph.unwrap.formats.tika.ContentClass;

/**
 * Which leaves a run keeps, by content class.
 */
public enum IncludeType {
    ALL("all"),
    TEXT("text"),
    BINARY("binary");

    private final String token;

    IncludeType(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public boolean accepts(ContentClass contentClass) {
        return switch (this) {
            case ALL -> true;
            case TEXT -> contentClass == ContentClass.TEXT;
            case BINARY -> contentClass == ContentClass.BINARY;
        };
    }

    /**
     * Parses an include token; only the exact lowercase tokens are accepted.
     *
     * @throws ConfigException if the token is not one of all, text, binary
     */
    public static IncludeType fromToken(String token) {
        for (IncludeType type : values()) {
            if (type.token.equals(token)) {
                return type;
            }
        }
        throw new ConfigException("include", String.valueOf(token), "one of all, text, binary");
    }
}
