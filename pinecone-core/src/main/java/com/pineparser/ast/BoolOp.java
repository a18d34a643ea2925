package com.pineparser.ast;

import java.util.List;

/**
 * Chain of operands joined by the same boolean operator ({@code and} or {@code or}).
 */
public record BoolOp(
    SourceLocation loc,
    String op,
    List<Expression> values
) implements Expression {

    public BoolOp(String op, List<Expression> values) {
        this(SourceLocation.NONE, op, values);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("op", op), Node.field("values", values));
    }

    @Override
    public String type() {
        return "BoolOp";
    }
}
