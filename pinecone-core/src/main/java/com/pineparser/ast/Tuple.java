package com.pineparser.ast;

import java.util.List;

public record Tuple(
    SourceLocation loc,
    List<Expression> elts
) implements Expression {

    public Tuple(List<Expression> elts) {
        this(SourceLocation.NONE, elts);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("elts", elts));
    }

    @Override
    public String type() {
        return "Tuple";
    }
}
