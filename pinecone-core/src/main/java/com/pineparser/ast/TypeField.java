package com.pineparser.ast;

import java.util.List;

/**
 * Field of a user-defined type: {@code type name [= default]}.
 */
public record TypeField(
    SourceLocation loc,
    Expression declaredType,
    String name,
    Expression defaultValue
) implements Node {

    public TypeField(Expression declaredType, String name, Expression defaultValue) {
        this(SourceLocation.NONE, declaredType, name, defaultValue);
    }

    @Override
    public List<Field> fields() {
        return List.of(
            Node.field("type", declaredType),
            Node.field("name", name),
            Node.field("default", defaultValue));
    }

    @Override
    public String type() {
        return "TypeField";
    }
}
