package com.pineparser.ast;

import java.util.List;

/**
 * Generic specialization such as {@code array.new<float>}.
 */
public record Specialize(
    SourceLocation loc,
    Expression value,
    List<Expression> args
) implements Expression {

    public Specialize(Expression value, List<Expression> args) {
        this(SourceLocation.NONE, value, args);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("value", value), Node.field("args", args));
    }

    @Override
    public String type() {
        return "Specialize";
    }
}
