package com.pineparser.ast;

import java.util.List;

/**
 * Literal value. {@code value} is a {@code Long}, {@code Double}, {@code String} or {@code Boolean};
 * {@code kind} is {@code "color"} for color literals and null otherwise.
 */
public record Constant(
    SourceLocation loc,
    Object value,
    String kind
) implements Expression {

    public Constant(Object value) {
        this(SourceLocation.NONE, value, null);
    }

    public Constant(Object value, String kind) {
        this(SourceLocation.NONE, value, kind);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("value", value), Node.field("kind", kind));
    }

    @Override
    public String type() {
        return "Constant";
    }
}
