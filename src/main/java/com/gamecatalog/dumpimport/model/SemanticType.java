package com.gamecatalog.dumpimport.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Value category of a dump column, independent of how the dump spells it.
 */
public enum SemanticType {
    INTEGER("int"),
    TEXT("text"),
    TIMESTAMP("timestamp"),
    INTEGER_ARRAY("int_array"),
    FLOAT("float"),
    UUID("uuid"),
    BOOLEAN("bool");

    private final String token;

    SemanticType(String token) {
        this.token = token;
    }

    /**
     * Token used for this type in the catalog schema file.
     */
    public String token() {
        return token;
    }

    /**
     * Resolves a schema token; empty when no parser is registered for it.
     */
    public static Optional<SemanticType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.token.equals(token))
                .findFirst();
    }
}
