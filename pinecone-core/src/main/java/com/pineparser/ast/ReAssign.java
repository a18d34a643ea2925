package com.pineparser.ast;

import java.util.List;

public record ReAssign(
    SourceLocation loc,
    Expression target,
    Expression value
) implements Statement {

    public ReAssign(Expression target, Expression value) {
        this(SourceLocation.NONE, target, value);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("target", target), Node.field("value", value));
    }

    @Override
    public String type() {
        return "ReAssign";
    }
}
