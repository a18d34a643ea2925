package com.pineparser.ast;

import java.util.List;

/**
 * Compound assignment such as {@code x += 1}. {@code op} is the arithmetic operator without '='.
 */
public record AugAssign(
    SourceLocation loc,
    Expression target,
    String op,
    Expression value
) implements Statement {

    public AugAssign(Expression target, String op, Expression value) {
        this(SourceLocation.NONE, target, op, value);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("target", target), Node.field("op", op), Node.field("value", value));
    }

    @Override
    public String type() {
        return "AugAssign";
    }
}
