package com.pineparser.ast;

import java.util.List;

/**
 * History reference {@code value[slice]}.
 */
public record Subscript(
    SourceLocation loc,
    Expression value,
    Expression slice
) implements Expression {

    public Subscript(Expression value, Expression slice) {
        this(SourceLocation.NONE, value, slice);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("value", value), Node.field("slice", slice));
    }

    @Override
    public String type() {
        return "Subscript";
    }
}
