package com.pineparser.ast;

import java.util.List;

public record Name(
    SourceLocation loc,
    String id
) implements Expression {

    public Name(String id) {
        this(SourceLocation.NONE, id);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("id", id));
    }

    @Override
    public String type() {
        return "Name";
    }
}
