package com.pineparser.ast;

import java.util.List;

public record Call(
    SourceLocation loc,
    Expression func,
    List<Arg> args
) implements Expression {

    public Call(Expression func, List<Arg> args) {
        this(SourceLocation.NONE, func, args);
    }

    @Override
    public List<Field> fields() {
        return List.of(Node.field("func", func), Node.field("args", args));
    }

    @Override
    public String type() {
        return "Call";
    }
}
