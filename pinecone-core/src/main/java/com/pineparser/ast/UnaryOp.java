package com.pineparser.ast;

import java.util.List;

/**
 * Prefix operation; {@code op} is {@code +}, {@code -} or {@code not}.
 */
public record UnaryOp(
    SourceLocation loc,
    String op,
    Expression operand
) implements Expression {

    public UnaryOp(String op, Expression operand) {
        this(SourceLocation.NONE, op, operand);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("op", op), Node.field("operand", operand));
    }

    @Override
    public String type() {
        return "UnaryOp";
    }
}
