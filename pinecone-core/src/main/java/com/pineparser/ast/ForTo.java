package com.pineparser.ast;

import java.util.List;

/**
 * Counting loop {@code for target = start to end [by step]}. {@code step} may be null.
 */
public record ForTo(
    SourceLocation loc,
    Expression target,
    Expression start,
    Expression end,
    Expression step,
    List<Statement> body
) implements Expression {

    public ForTo(Expression target, Expression start, Expression end, Expression step, List<Statement> body) {
        this(SourceLocation.NONE, target, start, end, step, body);
    }

    @Override
    public List<Field> fields() {
        return List.of(
            Node.field("target", target),
            Node.field("start", start),
            Node.field("end", end),
            Node.field("step", step),
            Node.field("body", body));
    }

    @Override
    public String type() {
        return "ForTo";
    }
}
