package com.pineparser.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that know how to write Pine Script ASTs.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PineJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(script);
 * </pre>
 */
public final class PineJackson {

    private PineJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper:
     * - Writes every node as an object with "node" (its type), an optional "loc" and its fields in declared order
     * - Keeps null field values, so every node of a kind has the same keys
     * - Binds records through their constructor parameter names
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
