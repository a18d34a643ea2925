package com.pineparser.ast;

import java.util.List;

/**
 * Variable or tuple declaration: {@code [var|varip] [type] target = value}.
 * {@code type} and {@code mode} are null when not written.
 */
public record Assign(
    SourceLocation loc,
    Expression target,
    Expression value,
    Expression declaredType,
    String mode
) implements Statement {

    public Assign(Expression target, Expression value) {
        this(SourceLocation.NONE, target, value, null, null);
    }

    public Assign(Expression target, Expression value, Expression declaredType, String mode) {
        this(SourceLocation.NONE, target, value, declaredType, mode);
    }

    @Override
    public List<Field> fields() {
        return List.of(
            Node.field("target", target),
            Node.field("value", value),
            Node.field("type", declaredType),
            Node.field("mode", mode));
    }

    @Override
    public String type() {
        return "Assign";
    }
}
