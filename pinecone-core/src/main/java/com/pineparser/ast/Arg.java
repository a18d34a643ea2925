package com.pineparser.ast;

import java.util.List;

/**
 * Call argument. {@code name} is null for positional arguments.
 */
public record Arg(
    SourceLocation loc,
    Expression value,
    String name
) implements Node {

    public Arg(Expression value) {
        this(SourceLocation.NONE, value, null);
    }

    public Arg(Expression value, String name) {
        this(SourceLocation.NONE, value, name);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("value", value), Node.field("name", name));
    }

    @Override
    public String type() {
        return "Arg";
    }
}
