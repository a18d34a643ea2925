package com.pineparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pineparser.ast.Node;

/**
 * Serializes AST nodes to JSON.
 */
public class AstJsonSerializer {

    private final ObjectMapper mapper;

    public AstJsonSerializer() {
        this(PineJackson.createObjectMapper());
    }

    public AstJsonSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serializes an AST node to a JSON string.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    public String serialize(Node node) throws AstJsonException {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to serialize AST node", e);
        }
    }

    /**
     * Serializes an AST node to a pretty-printed JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    public String serializePretty(Node node) throws AstJsonException {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to serialize AST node", e);
        }
    }
}
