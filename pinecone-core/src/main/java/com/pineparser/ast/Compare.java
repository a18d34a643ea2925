package com.pineparser.ast;

import java.util.List;

public record Compare(
    SourceLocation loc,
    Expression left,
    String op,
    Expression right
) implements Expression {

    public Compare(Expression left, String op, Expression right) {
        this(SourceLocation.NONE, left, op, right);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("left", left), Node.field("op", op), Node.field("right", right));
    }

    @Override
    public String type() {
        return "Compare";
    }
}
