package com.pineparser.ast;

import java.util.List;

public record Attribute(
    SourceLocation loc,
    Expression value,
    String attr
) implements Expression {

    public Attribute(Expression value, String attr) {
        this(SourceLocation.NONE, value, attr);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("value", value), Node.field("attr", attr));
    }

    @Override
    public String type() {
        return "Attribute";
    }
}
