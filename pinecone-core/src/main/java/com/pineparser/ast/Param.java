package com.pineparser.ast;

import java.util.List;

/**
 * Function parameter: {@code [type] name [= default]}.
 */
public record Param(
    SourceLocation loc,
    String name,
    Expression defaultValue,
    Expression declaredType
) implements Node {

    public Param(String name) {
        this(SourceLocation.NONE, name, null, null);
    }

    public Param(String name, Expression defaultValue, Expression declaredType) {
        this(SourceLocation.NONE, name, defaultValue, declaredType);
    }

    @Override
    public List<Field> fields() {
        return List.of(
            Node.field("name", name),
            Node.field("default", defaultValue),
            Node.field("type", declaredType));
    }

    @Override
    public String type() {
        return "Param";
    }
}
