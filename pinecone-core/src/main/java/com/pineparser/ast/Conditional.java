package com.pineparser.ast;

import java.util.List;

/**
 * Ternary {@code test ? body : orelse}.
 */
public record Conditional(
    SourceLocation loc,
    Expression test,
    Expression body,
    Expression orelse
) implements Expression {

    public Conditional(Expression test, Expression body, Expression orelse) {
        this(SourceLocation.NONE, test, body, orelse);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("test", test), Node.field("body", body), Node.field("orelse", orelse));
    }

    @Override
    public String type() {
        return "Conditional";
    }
}
