package com.pineparser.ast;

import java.util.List;

public record Continue(SourceLocation loc) implements Statement {

    public Continue() {
        this(SourceLocation.NONE);
    }

    @Override
    public List<Field> fields() {
        return List.of();
    }

    @Override
    public String type() {
        return "Continue";
    }
}
