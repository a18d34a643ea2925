package com.pineparser.ast;

import java.util.List;

/**
 * {@code if} structure. An {@code else if} chain is an {@code orelse} holding a single
 * {@link Expr} that wraps the next {@code If}.
 */
public record If(
    SourceLocation loc,
    Expression test,
    List<Statement> body,
    List<Statement> orelse
) implements Expression {

    public If(Expression test, List<Statement> body, List<Statement> orelse) {
        this(SourceLocation.NONE, test, body, orelse);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("test", test), Node.field("body", body), Node.field("orelse", orelse));
    }

    @Override
    public String type() {
        return "If";
    }
}
