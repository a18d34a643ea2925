package com.pineparser.ast;

import java.util.List;

/**
 * An expression used as a statement, e.g. a call to {@code plot(close)}.
 */
public record Expr(
    SourceLocation loc,
    Expression value
) implements Statement {

    public Expr(Expression value) {
        this(SourceLocation.NONE, value);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("value", value));
    }

    @Override
    public String type() {
        return "Expr";
    }
}
