package com.pineparser.ast;

import java.util.List;

public record Break(SourceLocation loc) implements Statement {

    public Break() {
        this(SourceLocation.NONE);
    }

    @Override
    public List<Field> fields() {
        return List.of();
    }

    @Override
    public String type() {
        return "Break";
    }
}
