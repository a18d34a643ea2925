package com.pineparser.ast;

import java.util.List;

public record While(
    SourceLocation loc,
    Expression test,
    List<Statement> body
) implements Expression {

    public While(Expression test, List<Statement> body) {
        this(SourceLocation.NONE, test, body);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("test", test), Node.field("body", body));
    }

    @Override
    public String type() {
        return "While";
    }
}
